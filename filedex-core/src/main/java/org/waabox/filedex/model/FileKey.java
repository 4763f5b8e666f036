package org.waabox.filedex.model;

import java.util.Objects;

/**
 * A catalog entry: the full path of a data file plus its metadata.
 *
 * @param key     the full file path, never null
 * @param meta    the file metadata, never null
 * @param deleted whether the file is marked for removal
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FileKey(String key, FileMeta meta, boolean deleted) {

  /** Validates the components. */
  public FileKey {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(meta, "meta cannot be null");
  }

  /**
   * Creates a live entry.
   *
   * @param key the full file path, never null
   * @param meta the file metadata, never null
   *
   * @return the entry, never null
   */
  public static FileKey of(final String key, final FileMeta meta) {
    return new FileKey(key, meta, false);
  }
}
