package org.waabox.filedex.model;

import java.util.Objects;

/**
 * A tombstone for a data file that is waiting to be purged.
 *
 * @param key       the full file path, never null
 * @param createdAt the deletion time, in microseconds since the epoch
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record DeletedFile(String key, long createdAt) {

  /** Validates the components. */
  public DeletedFile {
    Objects.requireNonNull(key, "key cannot be null");
  }
}
