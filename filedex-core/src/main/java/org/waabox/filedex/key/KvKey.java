package org.waabox.filedex.key;

/**
 * The three columns of a generic key-value key.
 *
 * @param module the module, the first segment
 * @param key1   the second segment, may be empty
 * @param key2   everything after the second segment, may be empty
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record KvKey(String module, String key1, String key2) {

  /**
   * Rebuilds the textual key.
   *
   * @return the key, never null
   */
  public String toKey() {
    return KvKeys.build(module, key1, key2);
  }
}
