package org.waabox.filedex.model;

/**
 * Immutable metadata of one data file.
 *
 * <p>Timestamps are microseconds since the epoch and both bounds are
 * inclusive.
 *
 * @param minTs          the earliest record timestamp in the file
 * @param maxTs          the latest record timestamp in the file, never
 *                       lower than {@code minTs}
 * @param records        the number of records, never negative
 * @param originalSize   the uncompressed size in bytes, never negative
 * @param compressedSize the size on storage in bytes, never negative
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FileMeta(
    long minTs,
    long maxTs,
    long records,
    long originalSize,
    long compressedSize
) {

  /** Validates the invariants of the metadata. */
  public FileMeta {
    if (minTs > maxTs) {
      throw new IllegalArgumentException(
          "minTs " + minTs + " is after maxTs " + maxTs);
    }
    if (records < 0 || originalSize < 0 || compressedSize < 0) {
      throw new IllegalArgumentException(
          "records and sizes cannot be negative");
    }
  }

  /**
   * Checks whether this file holds data inside the given window.
   *
   * @param start the inclusive window start, in microseconds
   * @param end the inclusive window end, in microseconds
   *
   * @return true when {@code minTs <= end} and {@code maxTs >= start}
   */
  public boolean overlaps(final long start, final long end) {
    return minTs <= end && maxTs >= start;
  }
}
