package org.waabox.filedex.filelist;

import java.util.List;
import java.util.Map;

import org.waabox.filedex.DisallowedQueryException;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.model.DeletedFile;
import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.PartitionTimeLevel;
import org.waabox.filedex.model.PkRange;
import org.waabox.filedex.model.StreamStats;
import org.waabox.filedex.model.StreamType;

/**
 * The catalog of data files, their tombstones and per-stream statistics.
 *
 * <p>File keys have the shape
 * {@code files/{org}/{type}/{name}/{YYYY}/{MM}/{DD}/{HH}/{file}}. Stream
 * keys are {@code {org}/{type}/{name}}; every statistics map returned here
 * is keyed by stream key.
 *
 * <p>Writes are idempotent: adding a file that already exists is a no-op
 * and removing a missing one is not an error. Batch operations are split
 * into chunks, each applied atomically; chunks are not atomic with each
 * other.
 *
 * <p>Implementations are thread-safe and every method blocks until the
 * engine answers.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface FileList extends AutoCloseable {

  /** Creates the catalog tables if they do not exist yet. */
  void createTable();

  /** Creates the catalog indexes if they do not exist yet. */
  void createTableIndex();

  /** Marks the catalog as loaded. */
  void setInitialised();

  /**
   * Tells whether the catalog was marked as loaded.
   *
   * @return true after {@link #setInitialised()}
   */
  boolean getInitialised();

  /**
   * Adds one file. An existing entry is left untouched. A new entry is
   * added to its stream's stored statistics.
   *
   * @param file the file key, never null
   * @param meta the file metadata, never null
   */
  void add(String file, FileMeta meta);

  /**
   * Removes one file. A missing entry is not an error. A removed entry is
   * subtracted from its stream's stored statistics.
   *
   * @param file the file key, never null
   */
  void remove(String file);

  /**
   * Adds many files in chunks.
   *
   * @param files the entries, never null
   */
  void batchAdd(List<FileKey> files);

  /**
   * Removes many files in chunks.
   *
   * @param files the file keys, never null
   */
  void batchRemove(List<String> files);

  /**
   * Records tombstones for deleted files.
   *
   * @param org the organization id, never null
   * @param createdAt the deletion time in microseconds
   * @param files the file keys, never null
   */
  void batchAddDeleted(String org, long createdAt, List<String> files);

  /**
   * Drops tombstones.
   *
   * @param files the file keys, never null
   */
  void batchRemoveDeleted(List<String> files);

  /**
   * Reads the metadata of one file.
   *
   * @param file the file key, never null
   *
   * @return the metadata, never null
   *
   * @throws KeyNotExistsException if the file is not in the catalog
   */
  FileMeta get(String file);

  /**
   * Tells whether a file is in the catalog.
   *
   * @param file the file key, never null
   *
   * @return true if present
   */
  boolean contains(String file);

  /**
   * Lists the whole catalog. Meant for administration only; engines that
   * cannot afford a full scan return an empty list.
   *
   * @return every entry, never null
   */
  List<FileKey> list();

  /**
   * Lists the files of a stream that hold data inside a time window.
   *
   * <p>A file matches when {@code min_ts <= end} and {@code max_ts >=
   * start}. A zero start means the epoch floor and a zero end means now.
   *
   * @param org the organization id, never null
   * @param type the stream type, never null
   * @param name the stream name, never null
   * @param level the stream partition level, never null
   * @param start the window start in microseconds, 0 for unbounded
   * @param end the window end in microseconds, 0 for unbounded
   *
   * @return the matching entries, never null
   *
   * @throws DisallowedQueryException if both bounds are zero
   */
  List<FileKey> query(String org, StreamType type, String name,
      PartitionTimeLevel level, long start, long end);

  /**
   * Lists tombstones of an organization created before a given time.
   *
   * @param org the organization id, never null
   * @param timeMax the exclusive upper bound in microseconds; 0 yields an
   *     empty result
   * @param limit the maximum number of tombstones to return
   *
   * @return the tombstones, never null
   */
  List<DeletedFile> queryDeleted(String org, long timeMax, int limit);

  /**
   * Returns the earliest {@code min_ts} of a stream above the epoch floor.
   *
   * @param org the organization id, never null
   * @param type the stream type, never null
   * @param name the stream name, never null
   *
   * @return the timestamp, 0 when the stream has no files
   */
  long getMinTs(String org, StreamType type, String name);

  /**
   * Returns the highest primary key of the catalog, the upper bound for
   * the next incremental {@link #stats} call.
   *
   * @return the key, 0 for an empty catalog
   */
  long getMaxPkValue();

  /**
   * Computes statistics from the file rows.
   *
   * @param org the organization id, never null
   * @param type the stream type, null for the whole organization
   * @param name the stream name, null for the whole organization
   * @param range the primary key window, null or {@link PkRange#ALL} for a
   *     full recompute
   *
   * @return the statistics by stream key, never null
   */
  Map<String, StreamStats> stats(String org, StreamType type, String name,
      PkRange range);

  /**
   * Reads the stored statistics.
   *
   * @param org the organization id, never null
   * @param type the stream type, null for the whole organization
   * @param name the stream name, null for the whole organization
   *
   * @return the statistics by stream key, never null
   */
  Map<String, StreamStats> getStreamStats(String org, StreamType type,
      String name);

  /**
   * Merges statistic deltas into the stored statistics. Streams without a
   * row get a zeroed one first. Each row is merged atomically, so
   * concurrent calls add up.
   *
   * <p>File writes already keep the statistics current; this call is for
   * corrections and rebuilds, such as a {@link #resetStreamStats()}
   * followed by the deltas of a full {@link #stats} recompute.
   *
   * @param org the organization id, never null
   * @param deltas the deltas by stream key, never null
   */
  void setStreamStats(String org, Map<String, StreamStats> deltas);

  /** Zeroes every stored statistics row. */
  void resetStreamStats();

  /**
   * Overwrites the stored minimum time of one stream.
   *
   * @param org the organization id, never null
   * @param streamKey the stream key, never null
   * @param minTs the new minimum time
   */
  void resetStreamStatsMinTs(String org, String streamKey, long minTs);

  /**
   * Drops the stored statistics of one stream.
   *
   * @param org the organization id, never null
   * @param type the stream type, never null
   * @param name the stream name, never null
   */
  void deleteStreamStats(String org, StreamType type, String name);

  /**
   * Counts the files in the catalog.
   *
   * @return the count
   */
  long len();

  /**
   * Tells whether the catalog is empty.
   *
   * @return true when {@link #len()} is 0
   */
  default boolean isEmpty() {
    return len() == 0;
  }

  /** Removes every file entry. */
  void clear();

  /** Releases the engine handle. */
  @Override
  void close();
}
