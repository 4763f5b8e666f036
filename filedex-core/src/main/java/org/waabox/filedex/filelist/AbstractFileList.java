package org.waabox.filedex.filelist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.key.FileKeyColumns;
import org.waabox.filedex.key.FileKeys;
import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.PartitionTimeLevel;
import org.waabox.filedex.model.StreamStats;
import org.waabox.filedex.model.StreamType;
import org.waabox.filedex.model.TimeRange;

/**
 * Base class for storage adapters of the file catalog.
 *
 * <p>Owns everything that does not depend on the engine: chunking of batch
 * writes, the rollback-and-retry path for chunks that hit an existing
 * file, the query time policy, the initialised flag and the upkeep of
 * stream statistics: every file that enters or leaves the catalog through
 * this class is folded into its stream's row.
 *
 * <p>Subclasses only translate single chunks into engine calls and report
 * unique-constraint hits as {@link WriteOutcome#ALREADY_EXISTS}, including
 * a chunk that names the same file twice.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class AbstractFileList implements FileList {

  /** Chunk size for SQL engines. */
  public static final int SQL_CHUNK_SIZE = 100;

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(AbstractFileList.class);

  /** The log tag of the engine, never null. */
  private final String tag;

  /** The maximum number of rows written per chunk. */
  private final int chunkSize;

  /** Whether the catalog was marked as loaded. */
  private final AtomicBoolean initialised = new AtomicBoolean(false);

  /**
   * Creates a new adapter.
   *
   * @param theTag the engine log tag, e.g. {@code MYSQL}, never null
   * @param theChunkSize the rows per chunk, greater than 0
   */
  protected AbstractFileList(final String theTag, final int theChunkSize) {
    Objects.requireNonNull(theTag, "tag cannot be null");
    if (theChunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive");
    }
    tag = theTag;
    chunkSize = theChunkSize;
  }

  /** {@inheritDoc} */
  @Override
  public void add(final String file, final FileMeta meta) {
    Objects.requireNonNull(meta, "meta cannot be null");
    final List<FileKey> entry =
        Collections.singletonList(FileKey.of(file, meta));
    if (insertChunk(entry) == WriteOutcome.ALREADY_EXISTS) {
      log.debug("[{}] file '{}' already exists", tag, file);
      return;
    }
    applyStats(entry, false);
  }

  /** {@inheritDoc} */
  @Override
  public void remove(final String file) {
    applyStats(removeChunk(
        Collections.singletonList(FileKeys.parseColumns(file))), true);
  }

  /** {@inheritDoc} */
  @Override
  public void batchAdd(final List<FileKey> files) {
    Objects.requireNonNull(files, "files cannot be null");
    for (final List<FileKey> chunk : chunks(files)) {
      if (insertChunk(chunk) == WriteOutcome.COMMITTED) {
        applyStats(chunk, false);
        continue;
      }
      log.warn("[{}] chunk of {} files hit existing entries, retrying one"
          + " by one", tag, chunk.size());
      for (final FileKey file : chunk) {
        add(file.key(), file.meta());
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void batchRemove(final List<String> files) {
    Objects.requireNonNull(files, "files cannot be null");
    for (final List<String> chunk : chunks(files)) {
      applyStats(removeChunk(columns(chunk)), true);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void batchAddDeleted(final String org, final long createdAt,
      final List<String> files) {
    Objects.requireNonNull(org, "org cannot be null");
    Objects.requireNonNull(files, "files cannot be null");
    for (final List<String> chunk : chunks(files)) {
      insertDeletedChunk(org, createdAt, columns(chunk));
    }
  }

  /** {@inheritDoc} */
  @Override
  public void batchRemoveDeleted(final List<String> files) {
    Objects.requireNonNull(files, "files cannot be null");
    for (final List<String> chunk : chunks(files)) {
      removeDeletedChunk(columns(chunk));
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<FileKey> query(final String org, final StreamType type,
      final String name, final PartitionTimeLevel level, final long start,
      final long end) {
    final TimeRange range = TimeRange.resolve(start, end);
    final String streamKey = FileKeys.streamKey(org, type, name);
    log.debug("[{}] query '{}' from {} to {}", tag, streamKey,
        range.start(), range.end());
    return queryRange(streamKey, level == null
        ? PartitionTimeLevel.UNSET : level, range);
  }

  /** {@inheritDoc} */
  @Override
  public void setStreamStats(final String org,
      final Map<String, StreamStats> deltas) {
    Objects.requireNonNull(deltas, "deltas cannot be null");
    if (deltas.isEmpty()) {
      return;
    }
    final List<String> newStreams = StreamStatsAggregator.newStreams(
        getStreamStats(org, null, null), deltas);
    if (!newStreams.isEmpty()) {
      insertEmptyStreamStats(org, newStreams);
    }
    addStreamStats(org, deltas);
  }

  /** {@inheritDoc} */
  @Override
  public void setInitialised() {
    initialised.set(true);
  }

  /** {@inheritDoc} */
  @Override
  public boolean getInitialised() {
    return initialised.get();
  }

  /**
   * Returns the engine log tag.
   *
   * @return the tag, never null
   */
  protected String tag() {
    return tag;
  }

  /**
   * Writes one chunk of files atomically.
   *
   * @param chunk the files, never empty
   *
   * @return {@link WriteOutcome#ALREADY_EXISTS} if a file of the chunk was
   *     present and the chunk was rolled back
   */
  protected abstract WriteOutcome insertChunk(List<FileKey> chunk);

  /**
   * Removes one chunk of files; missing ones are ignored.
   *
   * @param chunk the file columns, never empty
   *
   * @return the entries this call actually removed, never null
   */
  protected abstract List<FileKey> removeChunk(List<FileKeyColumns> chunk);

  /**
   * Writes one chunk of tombstones.
   *
   * @param org the organization id, never null
   * @param createdAt the deletion time in microseconds
   * @param chunk the file columns, never empty
   */
  protected abstract void insertDeletedChunk(String org, long createdAt,
      List<FileKeyColumns> chunk);

  /**
   * Removes one chunk of tombstones.
   *
   * @param chunk the file columns, never empty
   */
  protected abstract void removeDeletedChunk(List<FileKeyColumns> chunk);

  /**
   * Lists the files of a stream overlapping a resolved window.
   *
   * @param streamKey the stream key, never null
   * @param level the stream partition level, never null
   * @param range the resolved window, never null
   *
   * @return the matching entries, never null
   */
  protected abstract List<FileKey> queryRange(String streamKey,
      PartitionTimeLevel level, TimeRange range);

  /**
   * Creates zeroed statistics rows, in one transaction where the engine
   * has them.
   *
   * @param org the organization id, never null
   * @param streamKeys the stream keys, never empty
   */
  protected abstract void insertEmptyStreamStats(String org,
      List<String> streamKeys);

  /**
   * Merges deltas into statistics rows that are known to exist.
   *
   * <p>Each row is updated atomically in the engine, as
   * {@link StreamStats#merge} does it, so concurrent callers never lose
   * each other's deltas.
   *
   * @param org the organization id, never null
   * @param deltas the deltas by stream key, never empty
   */
  protected abstract void addStreamStats(String org,
      Map<String, StreamStats> deltas);

  /** Folds added or removed files into the stored statistics.
   *
   * @param files the files, never null.
   * @param removed whether the files left the catalog.
   */
  private void applyStats(final List<FileKey> files, final boolean removed) {
    if (files.isEmpty()) {
      return;
    }
    final List<FileKey> changes = new ArrayList<>(files.size());
    for (final FileKey file : files) {
      changes.add(new FileKey(file.key(), file.meta(), removed));
    }
    final Map<String, Map<String, StreamStats>> byOrg = new TreeMap<>();
    StreamStatsAggregator.deltas(changes).forEach((streamKey, delta) ->
        byOrg.computeIfAbsent(FileKeys.orgOf(streamKey),
            org -> new TreeMap<>()).put(streamKey, delta));
    byOrg.forEach(this::setStreamStats);
  }

  /** Splits a list into chunks of at most {@link #chunkSize} elements.
   *
   * @param items the items, never null.
   * @return the chunks, never null.
   */
  private <T> List<List<T>> chunks(final List<T> items) {
    final List<List<T>> chunks = new ArrayList<>();
    for (int i = 0; i < items.size(); i += chunkSize) {
      chunks.add(items.subList(i, Math.min(items.size(), i + chunkSize)));
    }
    return chunks;
  }

  /** Parses a chunk of file keys.
   *
   * @param files the file keys, never null.
   * @return the columns, never null.
   */
  private static List<FileKeyColumns> columns(final List<String> files) {
    final List<FileKeyColumns> columns = new ArrayList<>(files.size());
    for (final String file : files) {
      columns.add(FileKeys.parseColumns(file));
    }
    return columns;
  }
}
