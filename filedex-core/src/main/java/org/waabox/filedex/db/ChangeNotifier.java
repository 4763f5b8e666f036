package org.waabox.filedex.db;

/**
 * Receives the watched mutations of a key-value store.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ChangeNotifier {

  /**
   * Signals that a key was written.
   *
   * @param key the key, never null
   * @param value the new value, never null
   */
  void notifyPut(String key, byte[] value);

  /**
   * Signals that a key, or every key under a prefix, was removed.
   *
   * @param key the key or prefix, never null
   * @param withPrefix whether {@code key} is a prefix
   */
  void notifyDelete(String key, boolean withPrefix);
}
