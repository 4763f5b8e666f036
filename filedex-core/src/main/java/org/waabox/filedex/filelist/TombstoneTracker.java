package org.waabox.filedex.filelist;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.model.DeletedFile;
import org.waabox.filedex.model.TimeRange;

/**
 * Drives the soft-delete lifecycle of data files: files are marked with a
 * tombstone when deleted and purged once the retention elapsed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TombstoneTracker {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(TombstoneTracker.class);

  /** The catalog holding the tombstones, never null. */
  private final FileList fileList;

  /** The clock, in microseconds, never null. */
  private final LongSupplier clock;

  /**
   * Creates a tracker on the wall clock.
   *
   * @param theFileList the catalog, never null
   */
  public TombstoneTracker(final FileList theFileList) {
    this(theFileList, TimeRange::nowMicros);
  }

  /**
   * Creates a tracker.
   *
   * @param theFileList the catalog, never null
   * @param theClock the clock in microseconds, never null
   */
  public TombstoneTracker(final FileList theFileList,
      final LongSupplier theClock) {
    fileList = Objects.requireNonNull(theFileList, "fileList cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
  }

  /**
   * Records tombstones stamped with the current time.
   *
   * @param org the organization id, never null
   * @param files the deleted file keys, never null
   */
  public void markDeleted(final String org, final List<String> files) {
    if (files.isEmpty()) {
      return;
    }
    fileList.batchAddDeleted(org, clock.getAsLong(), files);
    log.debug("Marked {} files of org '{}' as deleted", files.size(), org);
  }

  /**
   * Lists the tombstones older than the retention.
   *
   * @param org the organization id, never null
   * @param retention how long tombstones are kept, never null
   * @param limit the maximum number of tombstones
   *
   * @return the tombstones, never null
   */
  public List<DeletedFile> purgeCandidates(final String org,
      final Duration retention, final int limit) {
    final long cutoff = clock.getAsLong() - retention.toNanos() / 1_000L;
    return fileList.queryDeleted(org, cutoff, limit);
  }

  /**
   * Drops tombstones.
   *
   * @param files the tombstones to drop, never null
   */
  public void purge(final List<DeletedFile> files) {
    if (files.isEmpty()) {
      return;
    }
    fileList.batchRemoveDeleted(files.stream().map(DeletedFile::key).toList());
    log.debug("Purged {} tombstones", files.size());
  }
}
