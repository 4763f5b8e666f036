package org.waabox.filedex.rocksdb;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.LongSupplier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.codec.FileMetaCodec;
import org.waabox.filedex.codec.StreamStatsCodec;
import org.waabox.filedex.filelist.AbstractFileList;
import org.waabox.filedex.filelist.WriteOutcome;
import org.waabox.filedex.key.DateKeys;
import org.waabox.filedex.key.FileKeyColumns;
import org.waabox.filedex.key.FileKeys;
import org.waabox.filedex.model.DeletedFile;
import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.PartitionTimeLevel;
import org.waabox.filedex.model.PkRange;
import org.waabox.filedex.model.StreamStats;
import org.waabox.filedex.model.StreamType;
import org.waabox.filedex.model.TimeRange;

/**
 * A file catalog stored in embedded RocksDB instances.
 *
 * <p>Files are keyed {@code {stream}/{date}/{file}} with a JSON value
 * holding the metadata, the deleted flag and the insertion time in
 * microseconds. The insertion time plays the role of the SQL primary key
 * in incremental {@link #stats} calls.
 *
 * <p>Time range queries scan the hour (or, for windows over two days, the
 * day) partitions of the window and keep the files that overlap it.
 *
 * <p>Writes are per file. A chunk is checked as a whole before anything
 * is written: one that names an existing file, or the same file twice, is
 * reported as {@link WriteOutcome#ALREADY_EXISTS} untouched. Statistics
 * rows are read, merged and written under one lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RocksDbFileList extends AbstractFileList {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RocksDbFileList.class);

  /** Files by stream, date and name. */
  static final String FILE_LIST = "file_list";

  /** Tombstones by stream, date and name. */
  static final String FILE_LIST_DELETED = "file_list_deleted";

  /** Statistics by stream key. */
  static final String STREAM_STATS = "stream_stats";

  /** Persisted flags. */
  static final String STATE = "file_list_state";

  /** The flag set once the catalog is loaded. */
  private static final String INITIALISED = "initialised";

  /** Chunk size of batch calls. */
  private static final int CHUNK_SIZE = 100;

  /** How far behind the clock the insertion-time high mark stays. */
  private static final long MAX_PK_SKEW_MICROS = 1_000_000L;

  /** The RocksDB instances, never null. */
  private final RocksDbTables tables;

  /** Current time in microseconds, never null. */
  private final LongSupplier clock;

  /** Serialises the exists-then-put of inserts and get-then-delete of
   * removals. */
  private final Object fileLock = new Object();

  /** Serialises the read-merge-write of statistics rows. */
  private final Object statsLock = new Object();

  /**
   * Opens the catalog.
   *
   * @param config the configuration, never null
   */
  public RocksDbFileList(final RocksDbConfig config) {
    this(config, TimeRange::nowMicros);
  }

  /** Opens the catalog with a custom clock.
   *
   * @param config the configuration, never null.
   * @param theClock the current time in microseconds, never null.
   */
  RocksDbFileList(final RocksDbConfig config, final LongSupplier theClock) {
    super("ROCKSDB", CHUNK_SIZE);
    Objects.requireNonNull(config, "config cannot be null");
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
    tables = new RocksDbTables(config, List.of(FILE_LIST, FILE_LIST_DELETED,
        STREAM_STATS, STATE));
  }

  /** {@inheritDoc} */
  @Override
  public void createTable() {
    log.debug("[ROCKSDB] file list tables are created on open");
  }

  /** {@inheritDoc} */
  @Override
  public void createTableIndex() {
    log.debug("[ROCKSDB] file list needs no index");
  }

  /** {@inheritDoc} */
  @Override
  public void setInitialised() {
    super.setInitialised();
    tables.put(STATE, INITIALISED, "true".getBytes(StandardCharsets.UTF_8));
  }

  /** {@inheritDoc} */
  @Override
  public boolean getInitialised() {
    return super.getInitialised() || tables.get(STATE, INITIALISED) != null;
  }

  /** {@inheritDoc} */
  @Override
  protected WriteOutcome insertChunk(final List<FileKey> chunk) {
    final long now = clock.getAsLong();
    final Map<String, FileKey> rows = new LinkedHashMap<>();
    synchronized (fileLock) {
      for (final FileKey file : chunk) {
        final String key = rowKey(FileKeys.parseColumns(file.key()));
        if (rows.put(key, file) != null
            || tables.get(FILE_LIST, key) != null) {
          log.debug("[ROCKSDB] file '{}' already exists", file.key());
          return WriteOutcome.ALREADY_EXISTS;
        }
      }
      rows.forEach((key, file) -> {
        final ObjectNode node = FileMetaCodec.toNode(file.meta());
        node.put("deleted", file.deleted());
        node.put("created_at", now);
        tables.put(FILE_LIST, key, json(node));
      });
    }
    return WriteOutcome.COMMITTED;
  }

  /** {@inheritDoc} */
  @Override
  protected List<FileKey> removeChunk(final List<FileKeyColumns> chunk) {
    final List<FileKey> removed = new ArrayList<>();
    synchronized (fileLock) {
      for (final FileKeyColumns columns : chunk) {
        final String key = rowKey(columns);
        final byte[] value = tables.get(FILE_LIST, key);
        if (value != null) {
          tables.delete(FILE_LIST, key);
          removed.add(fileKey(key, node(value)));
        }
      }
    }
    return removed;
  }

  /** {@inheritDoc} */
  @Override
  protected void insertDeletedChunk(final String org, final long createdAt,
      final List<FileKeyColumns> chunk) {
    for (final FileKeyColumns columns : chunk) {
      final ObjectNode node = JsonNodeFactory.instance.objectNode();
      node.put("org", org);
      node.put("created_at", createdAt);
      tables.put(FILE_LIST_DELETED, rowKey(columns), json(node));
    }
  }

  /** {@inheritDoc} */
  @Override
  protected void removeDeletedChunk(final List<FileKeyColumns> chunk) {
    for (final FileKeyColumns columns : chunk) {
      tables.delete(FILE_LIST_DELETED, rowKey(columns));
    }
  }

  /** {@inheritDoc} */
  @Override
  public FileMeta get(final String file) {
    final byte[] value =
        tables.get(FILE_LIST, rowKey(FileKeys.parseColumns(file)));
    if (value == null) {
      throw new KeyNotExistsException(file);
    }
    return FileMetaCodec.fromNode(node(value));
  }

  /** {@inheritDoc} */
  @Override
  public boolean contains(final String file) {
    return tables.get(FILE_LIST, rowKey(FileKeys.parseColumns(file))) != null;
  }

  /** {@inheritDoc} */
  @Override
  public List<FileKey> list() {
    final List<FileKey> files = new ArrayList<>();
    tables.scan(FILE_LIST, "", (key, value) -> {
      files.add(fileKey(key, node(value)));
      return true;
    });
    return files;
  }

  /** {@inheritDoc} */
  @Override
  protected List<FileKey> queryRange(final String streamKey,
      final PartitionTimeLevel level, final TimeRange range) {
    final List<FileKey> files = new ArrayList<>();
    for (final String datePrefix : DateKeys.prefixes(range, level)) {
      tables.scan(FILE_LIST, streamKey + "/" + datePrefix, (key, value) -> {
        final FileKey file = fileKey(key, node(value));
        if (file.meta().overlaps(range.start(), range.end())) {
          files.add(file);
        }
        return true;
      });
    }
    return files;
  }

  /** {@inheritDoc} */
  @Override
  public List<DeletedFile> queryDeleted(final String org, final long timeMax,
      final int limit) {
    final List<DeletedFile> deleted = new ArrayList<>();
    if (timeMax == 0) {
      return deleted;
    }
    tables.scan(FILE_LIST_DELETED, org + "/", (key, value) -> {
      final long createdAt = node(value).path("created_at").asLong();
      if (createdAt < timeMax) {
        deleted.add(new DeletedFile(FileKeys.ROOT + "/" + key, createdAt));
      }
      return true;
    });
    deleted.sort(Comparator.comparingLong(DeletedFile::createdAt));
    return deleted.size() > limit
        ? new ArrayList<>(deleted.subList(0, limit)) : deleted;
  }

  /** {@inheritDoc} */
  @Override
  public long getMinTs(final String org, final StreamType type,
      final String name) {
    final long[] min = {0};
    tables.scan(FILE_LIST, FileKeys.streamKey(org, type, name) + "/",
        (key, value) -> {
          final long minTs = node(value).path("min_ts").asLong();
          if (minTs > TimeRange.BASE_TIME && (min[0] == 0 || minTs < min[0])) {
            min[0] = minTs;
          }
          return true;
        });
    return min[0];
  }

  /** {@inheritDoc} */
  @Override
  public long getMaxPkValue() {
    return clock.getAsLong() - MAX_PK_SKEW_MICROS;
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, StreamStats> stats(final String org,
      final StreamType type, final String name, final PkRange range) {
    final PkRange window = range == null ? PkRange.ALL : range;
    final String prefix = type != null && name != null
        ? FileKeys.streamKey(org, type, name) + "/" : org + "/";
    final Map<String, StreamStats> stats = new TreeMap<>();
    tables.scan(FILE_LIST, prefix, (key, value) -> {
      final JsonNode node = node(value);
      if (window.contains(node.path("created_at").asLong())) {
        final String streamKey = FileKeys.parseColumns(FileKeys.ROOT + "/"
            + key).streamKey();
        stats.merge(streamKey, StreamStats.EMPTY.addFile(
            FileMetaCodec.fromNode(node)), StreamStats::merge);
      }
      return true;
    });
    return stats;
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, StreamStats> getStreamStats(final String org,
      final StreamType type, final String name) {
    final Map<String, StreamStats> stats = new TreeMap<>();
    if (type != null && name != null) {
      final String streamKey = FileKeys.streamKey(org, type, name);
      final byte[] value = tables.get(STREAM_STATS, streamKey);
      if (value != null) {
        stats.put(streamKey, readStats(value));
      }
      return stats;
    }
    tables.scan(STREAM_STATS, org + "/", (key, value) -> {
      stats.put(key, readStats(value));
      return true;
    });
    return stats;
  }

  /** {@inheritDoc} */
  @Override
  protected void insertEmptyStreamStats(final String org,
      final List<String> streamKeys) {
    synchronized (statsLock) {
      for (final String streamKey : streamKeys) {
        if (tables.get(STREAM_STATS, streamKey) == null) {
          putStats(streamKey, StreamStats.EMPTY);
        }
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  protected void addStreamStats(final String org,
      final Map<String, StreamStats> deltas) {
    synchronized (statsLock) {
      deltas.forEach((streamKey, delta) -> {
        final byte[] value = tables.get(STREAM_STATS, streamKey);
        final StreamStats current =
            value == null ? StreamStats.EMPTY : readStats(value);
        putStats(streamKey, current.merge(delta));
      });
    }
  }

  /** {@inheritDoc} */
  @Override
  public void resetStreamStats() {
    synchronized (statsLock) {
      final List<String> keys = new ArrayList<>();
      tables.scan(STREAM_STATS, "", (key, value) -> keys.add(key));
      for (final String key : keys) {
        putStats(key, StreamStats.EMPTY);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void resetStreamStatsMinTs(final String org, final String streamKey,
      final long minTs) {
    synchronized (statsLock) {
      final byte[] value = tables.get(STREAM_STATS, streamKey);
      if (value != null) {
        putStats(streamKey, readStats(value).withDocTimeMin(minTs));
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public void deleteStreamStats(final String org, final StreamType type,
      final String name) {
    synchronized (statsLock) {
      tables.delete(STREAM_STATS, FileKeys.streamKey(org, type, name));
    }
  }

  /** {@inheritDoc} */
  @Override
  public long len() {
    final long[] count = {0};
    tables.scan(FILE_LIST, "", (key, value) -> {
      count[0]++;
      return true;
    });
    return count[0];
  }

  /** {@inheritDoc} */
  @Override
  public void clear() {
    final long removed = tables.deletePrefix(FILE_LIST, "");
    log.info("[ROCKSDB] file list cleared, {} files removed", removed);
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    tables.close();
  }

  /** Writes the statistics of one stream.
   *
   * @param streamKey the stream key.
   * @param stats the statistics.
   */
  private void putStats(final String streamKey, final StreamStats stats) {
    tables.put(STREAM_STATS, streamKey, StreamStatsCodec.serialize(stats)
        .getBytes(StandardCharsets.UTF_8));
  }

  private static StreamStats readStats(final byte[] value) {
    return StreamStatsCodec.deserialize(new String(value,
        StandardCharsets.UTF_8));
  }

  /** Renders the row key of a file, the file key without its root.
   *
   * @param columns the file columns.
   * @return the row key, never null.
   */
  private static String rowKey(final FileKeyColumns columns) {
    return columns.streamKey() + "/" + columns.dateKey() + "/"
        + columns.fileName();
  }

  private static FileKey fileKey(final String rowKey, final JsonNode node) {
    return new FileKey(FileKeys.ROOT + "/" + rowKey,
        FileMetaCodec.fromNode(node), node.path("deleted").asBoolean());
  }

  private static JsonNode node(final byte[] value) {
    return FileMetaCodec.readTree(new String(value, StandardCharsets.UTF_8));
  }

  private static byte[] json(final ObjectNode node) {
    return node.toString().getBytes(StandardCharsets.UTF_8);
  }
}
