package org.waabox.filedex.db;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;

import org.waabox.filedex.KeyNotExistsException;

/**
 * A generic key-value store with prefix watches.
 *
 * <p>Keys follow {@code /{module}/{key1}/{key2...}}. Every listing is
 * ordered by key. Implementations are thread-safe; all methods block until
 * the engine answers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface Db extends AutoCloseable {

  /** Creates the backing tables if they do not exist yet. */
  void createTable();

  /**
   * Returns size figures of the store.
   *
   * @return the figures, never null
   */
  DbStats stats();

  /**
   * Reads a value.
   *
   * @param key the key, never null
   *
   * @return the value, never null
   *
   * @throws KeyNotExistsException if the key is absent
   */
  byte[] get(String key);

  /**
   * Writes a value, replacing any previous one.
   *
   * @param key the key, never null
   * @param value the value, never null
   * @param needWatch whether watchers are notified
   */
  void put(String key, byte[] value, boolean needWatch);

  /**
   * Removes a key, or every key under a prefix.
   *
   * @param key the key or prefix, never null
   * @param withPrefix whether {@code key} is a prefix
   * @param needWatch whether watchers are notified
   *
   * @throws KeyNotExistsException if nothing was removed
   */
  void delete(String key, boolean withPrefix, boolean needWatch);

  /**
   * Removes a key, treating absence as success.
   *
   * <p>Only {@link KeyNotExistsException} is swallowed; any other failure
   * propagates.
   *
   * @param key the key or prefix, never null
   * @param withPrefix whether {@code key} is a prefix
   * @param needWatch whether watchers are notified
   */
  default void deleteIfExists(final String key, final boolean withPrefix,
      final boolean needWatch) {
    try {
      delete(key, withPrefix, needWatch);
    } catch (final KeyNotExistsException e) {
      // absent is fine.
    }
  }

  /**
   * Lists every entry under a prefix.
   *
   * @param prefix the prefix, never null
   *
   * @return the entries ordered by key, never null
   */
  SortedMap<String, byte[]> list(String prefix);

  /**
   * Lists every key under a prefix.
   *
   * @param prefix the prefix, never null
   *
   * @return the keys in ascending order, never null
   */
  default List<String> listKeys(final String prefix) {
    return new ArrayList<>(list(prefix).keySet());
  }

  /**
   * Lists every value under a prefix, ordered by key.
   *
   * @param prefix the prefix, never null
   *
   * @return the values, never null
   */
  default List<byte[]> listValues(final String prefix) {
    return new ArrayList<>(list(prefix).values());
  }

  /**
   * Counts the keys under a prefix.
   *
   * @param prefix the prefix, never null
   *
   * @return the count
   */
  long count(String prefix);

  /**
   * Watches a prefix.
   *
   * @param prefix the prefix, never null
   *
   * @return an open subscription, never null
   */
  WatchSubscription watch(String prefix);

  /**
   * Tells whether this store is shared by every node of a cluster.
   *
   * @return false for node-local engines
   */
  default boolean distributed() {
    return false;
  }

  /** Releases the engine handle. */
  @Override
  void close();
}
