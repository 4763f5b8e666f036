package org.waabox.filedex.key;

import java.util.Objects;

/**
 * Codec for generic key-value keys, {@code /{module}/{key1}/{key2...}}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KvKeys {

  /** Private constructor to prevent instantiation. */
  private KvKeys() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Splits a key into module, key1 and key2.
   *
   * <p>The leading {@code /} is optional. Missing parts are empty strings
   * and every segment past the second one stays in {@code key2}.
   *
   * @param key the key, never null
   *
   * @return the columns, never null
   */
  public static KvKey parse(final String key) {
    Objects.requireNonNull(key, "key cannot be null");
    final String trimmed = key.startsWith("/") ? key.substring(1) : key;
    final String[] parts = trimmed.split("/", 3);
    final String module = parts[0];
    final String key1 = parts.length > 1 ? parts[1] : "";
    final String key2 = parts.length > 2 ? parts[2] : "";
    return new KvKey(module, key1, key2);
  }

  /**
   * Builds a key from its columns.
   *
   * @param module the module, never null
   * @param key1 the second segment, never null
   * @param key2 the rest, never null
   *
   * @return {@code /{module}/} when key1 is empty, {@code /{module}/{key1}}
   *     when key2 is empty, else {@code /{module}/{key1}/{key2}}
   */
  public static String build(final String module, final String key1,
      final String key2) {
    if (key1.isEmpty()) {
      return "/" + module + "/";
    }
    if (key2.isEmpty()) {
      return "/" + module + "/" + key1;
    }
    return "/" + module + "/" + key1 + "/" + key2;
  }
}
