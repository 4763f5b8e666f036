package org.waabox.filedex.model;

/**
 * Aggregated statistics of one stream.
 *
 * <p>Instances are immutable: every update returns a new value. Counters
 * and sizes are clamped at zero, so removing more than was added never
 * yields negative figures.
 *
 * @param fileNum        the number of files
 * @param docNum         the number of records
 * @param docTimeMin     the earliest record timestamp, 0 when unknown
 * @param docTimeMax     the latest record timestamp, 0 when unknown
 * @param storageSize    the total uncompressed size in bytes
 * @param compressedSize the total stored size in bytes
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record StreamStats(
    long fileNum,
    long docNum,
    long docTimeMin,
    long docTimeMax,
    double storageSize,
    double compressedSize
) {

  /** Statistics of a stream without files. */
  public static final StreamStats EMPTY = new StreamStats(0, 0, 0, 0, 0, 0);

  /**
   * Returns the statistics after adding one file.
   *
   * @param meta the added file metadata, never null
   *
   * @return the new statistics, never null
   */
  public StreamStats addFile(final FileMeta meta) {
    return merge(new StreamStats(1, meta.records(), meta.minTs(),
        meta.maxTs(), meta.originalSize(), meta.compressedSize()));
  }

  /**
   * Returns the statistics after removing one file.
   *
   * <p>The time bounds are left untouched; they only move on an explicit
   * reset.
   *
   * @param meta the removed file metadata, never null
   *
   * @return the new statistics, never null
   */
  public StreamStats removeFile(final FileMeta meta) {
    return merge(new StreamStats(-1, -meta.records(), 0, 0,
        -meta.originalSize(), -meta.compressedSize()));
  }

  /**
   * Applies a delta to these statistics.
   *
   * <p>Counters and sizes are summed, the minimum time is lowered and the
   * maximum time raised. A zero time in the delta carries no information
   * and is ignored; a zero minimum in these statistics is replaced by the
   * delta's.
   *
   * @param delta the delta, counters may be negative, never null
   *
   * @return the merged statistics, never null
   */
  public StreamStats merge(final StreamStats delta) {
    long timeMin = docTimeMin;
    if (delta.docTimeMin > 0) {
      timeMin = docTimeMin == 0
          ? delta.docTimeMin
          : Math.min(docTimeMin, delta.docTimeMin);
    }
    return new StreamStats(
        Math.max(0, fileNum + delta.fileNum),
        Math.max(0, docNum + delta.docNum),
        timeMin,
        Math.max(docTimeMax, delta.docTimeMax),
        Math.max(0, storageSize + delta.storageSize),
        Math.max(0, compressedSize + delta.compressedSize));
  }

  /**
   * Returns a copy with a new minimum time.
   *
   * @param minTs the new minimum time
   *
   * @return the statistics, never null
   */
  public StreamStats withDocTimeMin(final long minTs) {
    return new StreamStats(fileNum, docNum, minTs, docTimeMax, storageSize,
        compressedSize);
  }
}
