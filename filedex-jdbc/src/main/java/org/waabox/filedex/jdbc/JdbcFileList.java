package org.waabox.filedex.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.BackendException;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.filelist.AbstractFileList;
import org.waabox.filedex.filelist.FileHistory;
import org.waabox.filedex.filelist.MergeJobQueue;
import org.waabox.filedex.filelist.WriteOutcome;
import org.waabox.filedex.key.FileKeyColumns;
import org.waabox.filedex.key.FileKeys;
import org.waabox.filedex.model.DeletedFile;
import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.MergeJob;
import org.waabox.filedex.model.MergeJobStatus;
import org.waabox.filedex.model.PartitionTimeLevel;
import org.waabox.filedex.model.PkRange;
import org.waabox.filedex.model.StreamStats;
import org.waabox.filedex.model.StreamType;
import org.waabox.filedex.model.TimeRange;

/**
 * A file catalog stored in SQL tables.
 *
 * <p>Every chunk runs in its own transaction on one connection and is
 * written with a single multi-row statement. A unique-constraint hit rolls
 * the chunk back and is reported as {@link WriteOutcome#ALREADY_EXISTS}.
 * The engine specifics come from the {@link SqlDialect}; the connection
 * handling from the {@link SqlExecutor}.
 *
 * <p>Tables: {@code file_list}, {@code file_list_deleted},
 * {@code file_list_history}, {@code file_list_jobs} and
 * {@code stream_stats}. The {@code id} column of {@code file_list} is the
 * primary key used by incremental {@link #stats} calls. Merge jobs are
 * claimed with a conditional update, so concurrent nodes never share one.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class JdbcFileList extends AbstractFileList
    implements FileHistory, MergeJobQueue {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(JdbcFileList.class);

  /** Columns read back for a file row. */
  private static final String FILE_COLUMNS = "stream, date, file, deleted,"
      + " min_ts, max_ts, records, original_size, compressed_size";

  /** Columns read back for a merge job row. */
  private static final String JOB_COLUMNS = "id, org, stream, offsets,"
      + " status, node, started_at, updated_at";

  /** Adds a delta to one statistics row in place, like
   * {@link StreamStats#merge}: counters are clamped at zero, a zero
   * minimum time takes the delta's, the maximum time only grows. */
  private static final String MERGE_STATS = "UPDATE stream_stats SET"
      + " file_num = " + clampedAdd("file_num") + ","
      + " records = " + clampedAdd("records") + ","
      + " original_size = " + clampedAdd("original_size") + ","
      + " compressed_size = " + clampedAdd("compressed_size") + ","
      + " min_ts = CASE WHEN min_ts = 0 THEN ? WHEN min_ts > ? THEN ?"
      + " ELSE min_ts END,"
      + " max_ts = CASE WHEN max_ts < ? THEN ? ELSE max_ts END"
      + " WHERE stream = ?";

  /** The connection handling, never null. */
  private final SqlExecutor executor;

  /** The engine dialect, never null. */
  private final SqlDialect dialect;

  /**
   * Creates a new SQL file catalog.
   *
   * @param theExecutor the connection handling, never null
   * @param theDialect the engine dialect, never null
   */
  public JdbcFileList(final SqlExecutor theExecutor,
      final SqlDialect theDialect) {
    super(theDialect.tag(), SQL_CHUNK_SIZE);
    executor = Objects.requireNonNull(theExecutor, "executor cannot be null");
    dialect = theDialect;
  }

  /** {@inheritDoc} */
  @Override
  public void createTable() {
    final List<String> ddl = CatalogSchema.fileListTables(dialect);
    write("create table", conn -> {
      try (Statement stmt = conn.createStatement()) {
        for (final String sql : ddl) {
          stmt.execute(sql);
        }
      }
      return null;
    });
    log.info("[{}] file list tables ready", tag());
  }

  /** {@inheritDoc} */
  @Override
  public void createTableIndex() {
    write("create table index", conn -> {
      for (final IndexDef index : CatalogSchema.FILE_LIST_INDEXES) {
        createIndex(conn, index);
      }
      return null;
    });
  }

  /**
   * Creates one index, accepting that it may already exist.
   *
   * @param conn the connection, never null
   * @param index the index, never null
   *
   * @throws SQLException on any other database error
   */
  protected void createIndex(final Connection conn, final IndexDef index)
      throws SQLException {
    try (Statement stmt = conn.createStatement()) {
      stmt.execute(dialect.createIndex(index));
      log.debug("[{}] created index '{}'", tag(), index.name());
    } catch (final SQLException e) {
      if (!dialect.isIndexAlreadyExists(e)) {
        throw e;
      }
      log.debug("[{}] index '{}' already exists", tag(), index.name());
    }
  }

  /** {@inheritDoc} */
  @Override
  protected WriteOutcome insertChunk(final List<FileKey> chunk) {
    try {
      return executor.write(conn -> {
        try {
          return SqlTransactions.run(conn, tag(), "batch add", c -> {
            insertFiles(c, CatalogSchema.FILE_LIST, chunk);
            return WriteOutcome.COMMITTED;
          });
        } catch (final SQLException e) {
          if (dialect.isUniqueViolation(e)) {
            return WriteOutcome.ALREADY_EXISTS;
          }
          throw e;
        }
      });
    } catch (final SQLException e) {
      throw new BackendException("[" + tag() + "] batch add of "
          + chunk.size() + " files failed", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  protected List<FileKey> removeChunk(final List<FileKeyColumns> chunk) {
    return write("batch remove", conn ->
        SqlTransactions.run(conn, tag(), "batch remove", c -> {
          final List<FileKey> removed = new ArrayList<>();
          try (PreparedStatement select = c.prepareStatement("SELECT "
                  + FILE_COLUMNS + " FROM file_list"
                  + " WHERE stream = ? AND date = ? AND file = ?");
              PreparedStatement delete = c.prepareStatement("DELETE FROM"
                  + " file_list WHERE stream = ? AND date = ? AND file = ?")) {
            for (final FileKeyColumns columns : chunk) {
              bindColumns(select, 1, columns);
              final FileKey found;
              try (ResultSet rs = select.executeQuery()) {
                found = rs.next() ? readFile(rs) : null;
              }
              if (found == null) {
                continue;
              }
              bindColumns(delete, 1, columns);
              // zero rows: a concurrent remove got it first
              if (delete.executeUpdate() > 0) {
                removed.add(found);
              }
            }
          }
          return removed;
        }));
  }

  /** {@inheritDoc} */
  @Override
  protected void insertDeletedChunk(final String org, final long createdAt,
      final List<FileKeyColumns> chunk) {
    final StringBuilder sql = new StringBuilder("INSERT INTO file_list_deleted"
        + " (org, stream, date, file, created_at) VALUES ");
    for (int i = 0; i < chunk.size(); i++) {
      sql.append(i == 0 ? "" : ", ").append("(?, ?, ?, ?, ?)");
    }
    write("batch add deleted", conn ->
        SqlTransactions.run(conn, tag(), "batch add deleted", c -> {
          try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int p = 1;
            for (final FileKeyColumns columns : chunk) {
              ps.setString(p++, org);
              ps.setString(p++, columns.streamKey());
              ps.setString(p++, columns.dateKey());
              ps.setString(p++, columns.fileName());
              ps.setLong(p++, createdAt);
            }
            return ps.executeUpdate();
          }
        }));
  }

  /** {@inheritDoc} */
  @Override
  protected void removeDeletedChunk(final List<FileKeyColumns> chunk) {
    deleteByColumns("file_list_deleted", "batch remove deleted", chunk);
  }

  /** {@inheritDoc} */
  @Override
  public FileMeta get(final String file) {
    final FileKeyColumns columns = FileKeys.parseColumns(file);
    final FileMeta meta = read("get", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT "
          + FILE_COLUMNS + " FROM file_list"
          + " WHERE stream = ? AND date = ? AND file = ?")) {
        bindColumns(ps, 1, columns);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next() ? readFile(rs).meta() : null;
        }
      }
    });
    if (meta == null) {
      throw new KeyNotExistsException(file);
    }
    return meta;
  }

  /** {@inheritDoc} */
  @Override
  public boolean contains(final String file) {
    final FileKeyColumns columns = FileKeys.parseColumns(file);
    return read("contains", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT id FROM"
          + " file_list WHERE stream = ? AND date = ? AND file = ?")) {
        bindColumns(ps, 1, columns);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next();
        }
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public List<FileKey> list() {
    return read("list", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT "
          + FILE_COLUMNS + " FROM file_list ORDER BY id")) {
        return readFiles(ps);
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  protected List<FileKey> queryRange(final String streamKey,
      final PartitionTimeLevel level, final TimeRange range) {
    return read("query", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT "
          + FILE_COLUMNS + " FROM file_list"
          + " WHERE stream = ? AND min_ts <= ? AND max_ts >= ?")) {
        ps.setString(1, streamKey);
        ps.setLong(2, range.end());
        ps.setLong(3, range.start());
        return readFiles(ps);
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public List<DeletedFile> queryDeleted(final String org, final long timeMax,
      final int limit) {
    if (timeMax == 0) {
      return Collections.emptyList();
    }
    return read("query deleted", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT stream, date,"
          + " file, created_at FROM file_list_deleted"
          + " WHERE org = ? AND created_at < ? ORDER BY created_at LIMIT ?")) {
        ps.setString(1, org);
        ps.setLong(2, timeMax);
        ps.setInt(3, limit);
        final List<DeletedFile> deleted = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            deleted.add(new DeletedFile(FileKeys.build(rs.getString(1),
                rs.getString(2), rs.getString(3)), rs.getLong(4)));
          }
        }
        return deleted;
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public long getMinTs(final String org, final StreamType type,
      final String name) {
    final String streamKey = FileKeys.streamKey(org, type, name);
    return read("get min ts", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT MIN(min_ts)"
          + " FROM file_list WHERE stream = ? AND min_ts > ?")) {
        ps.setString(1, streamKey);
        ps.setLong(2, TimeRange.BASE_TIME);
        return singleLong(ps);
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public long getMaxPkValue() {
    return read("get max pk value", conn -> {
      try (PreparedStatement ps =
          conn.prepareStatement("SELECT MAX(id) FROM file_list")) {
        return singleLong(ps);
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, StreamStats> stats(final String org,
      final StreamType type, final String name, final PkRange range) {
    final boolean byStream = type != null && name != null;
    final boolean bounded = range != null && range.bounded();
    final String sql = "SELECT stream, MIN(min_ts), MAX(max_ts), COUNT(*), "
        + dialect.sum("records") + ", " + dialect.sum("original_size") + ", "
        + dialect.sum("compressed_size") + " FROM file_list WHERE "
        + (byStream ? "stream" : "org") + " = ?"
        + (bounded ? " AND id > ? AND id <= ?" : "")
        + " GROUP BY stream";
    return read("stats", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(sql)) {
        ps.setString(1, byStream ? FileKeys.streamKey(org, type, name) : org);
        if (bounded) {
          ps.setLong(2, range.min());
          ps.setLong(3, range.max());
        }
        final Map<String, StreamStats> stats = new TreeMap<>();
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            stats.put(rs.getString(1), new StreamStats(rs.getLong(4),
                rs.getLong(5), rs.getLong(2), rs.getLong(3), rs.getLong(6),
                rs.getLong(7)));
          }
        }
        return stats;
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, StreamStats> getStreamStats(final String org,
      final StreamType type, final String name) {
    final boolean byStream = type != null && name != null;
    return read("get stream stats", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT stream,"
          + " file_num, min_ts, max_ts, records, original_size,"
          + " compressed_size FROM stream_stats WHERE "
          + (byStream ? "stream" : "org") + " = ?")) {
        ps.setString(1, byStream ? FileKeys.streamKey(org, type, name) : org);
        final Map<String, StreamStats> stats = new TreeMap<>();
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            stats.put(rs.getString(1), new StreamStats(rs.getLong(2),
                rs.getLong(5), rs.getLong(3), rs.getLong(4), rs.getLong(6),
                rs.getLong(7)));
          }
        }
        return stats;
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  protected void insertEmptyStreamStats(final String org,
      final List<String> streamKeys) {
    write("insert stream stats", conn -> {
      try {
        return SqlTransactions.run(conn, tag(), "insert stream stats", c -> {
          try (PreparedStatement ps = c.prepareStatement("INSERT INTO"
              + " stream_stats (org, stream, file_num, min_ts, max_ts,"
              + " records, original_size, compressed_size)"
              + " VALUES (?, ?, 0, 0, 0, 0, 0, 0)")) {
            for (final String streamKey : streamKeys) {
              ps.setString(1, FileKeys.orgOf(streamKey));
              ps.setString(2, streamKey);
              ps.addBatch();
            }
            ps.executeBatch();
          }
          return null;
        });
      } catch (final SQLException e) {
        if (!dialect.isUniqueViolation(e)) {
          throw e;
        }
        log.warn("[{}] stream stats of org '{}' were created concurrently,"
            + " inserting one by one", tag(), org);
        insertMissingStreamStats(conn, streamKeys);
        return null;
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  protected void addStreamStats(final String org,
      final Map<String, StreamStats> deltas) {
    write("set stream stats", conn ->
        SqlTransactions.run(conn, tag(), "set stream stats", c -> {
          try (PreparedStatement ps = c.prepareStatement(MERGE_STATS)) {
            for (final Map.Entry<String, StreamStats> entry
                : deltas.entrySet()) {
              final StreamStats delta = entry.getValue();
              int p = 1;
              p = bindCounter(ps, p, delta.fileNum());
              p = bindCounter(ps, p, delta.docNum());
              p = bindCounter(ps, p, (long) delta.storageSize());
              p = bindCounter(ps, p, (long) delta.compressedSize());
              final long lower = delta.docTimeMin() > 0
                  ? delta.docTimeMin() : Long.MAX_VALUE;
              ps.setLong(p++, delta.docTimeMin());
              ps.setLong(p++, lower);
              ps.setLong(p++, lower);
              ps.setLong(p++, delta.docTimeMax());
              ps.setLong(p++, delta.docTimeMax());
              ps.setString(p, entry.getKey());
              ps.addBatch();
            }
            return ps.executeBatch();
          }
        }));
  }

  /** {@inheritDoc} */
  @Override
  public void resetStreamStats() {
    update("reset stream stats", "UPDATE stream_stats SET file_num = 0,"
        + " min_ts = 0, max_ts = 0, records = 0, original_size = 0,"
        + " compressed_size = 0");
  }

  /** {@inheritDoc} */
  @Override
  public void resetStreamStatsMinTs(final String org, final String streamKey,
      final long minTs) {
    write("reset stream stats min_ts", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "UPDATE stream_stats SET min_ts = ? WHERE stream = ?")) {
        ps.setLong(1, minTs);
        ps.setString(2, streamKey);
        return ps.executeUpdate();
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public void deleteStreamStats(final String org, final StreamType type,
      final String name) {
    final String streamKey = FileKeys.streamKey(org, type, name);
    write("delete stream stats", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "DELETE FROM stream_stats WHERE stream = ?")) {
        ps.setString(1, streamKey);
        return ps.executeUpdate();
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public void addHistory(final String file, final FileMeta meta) {
    batchAddHistory(List.of(FileKey.of(file, meta)));
  }

  /** {@inheritDoc} */
  @Override
  public void batchAddHistory(final List<FileKey> files) {
    for (int from = 0; from < files.size(); from += SQL_CHUNK_SIZE) {
      final List<FileKey> chunk =
          files.subList(from, Math.min(files.size(), from + SQL_CHUNK_SIZE));
      write("batch add history", conn -> {
        try {
          return SqlTransactions.run(conn, tag(), "batch add history", c ->
              insertFiles(c, CatalogSchema.FILE_LIST_HISTORY, chunk));
        } catch (final SQLException e) {
          if (!dialect.isUniqueViolation(e)) {
            throw e;
          }
          log.debug("[{}] history chunk of {} files has known files,"
              + " inserting one by one", tag(), chunk.size());
          int inserted = 0;
          for (final FileKey file : chunk) {
            try {
              inserted += insertFiles(conn, CatalogSchema.FILE_LIST_HISTORY,
                  List.of(file));
            } catch (final SQLException single) {
              if (!dialect.isUniqueViolation(single)) {
                throw single;
              }
            }
          }
          return inserted;
        }
      });
    }
  }

  /**
   * Returns the lowest primary key of the catalog, the lower bound of a
   * full incremental {@link #stats} pass.
   *
   * @return the key, 0 for an empty catalog
   */
  public long getMinPkValue() {
    return read("get min pk value", conn -> {
      try (PreparedStatement ps =
          conn.prepareStatement("SELECT MIN(id) FROM file_list")) {
        return singleLong(ps);
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public void addJob(final String org, final StreamType type,
      final String name, final long offset) {
    final String streamKey = FileKeys.streamKey(org, type, name);
    write("add job", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("INSERT INTO"
          + " file_list_jobs (org, stream, offsets, status, node,"
          + " started_at, updated_at) VALUES (?, ?, ?, ?, '', 0, 0)")) {
        ps.setString(1, org);
        ps.setString(2, streamKey);
        ps.setLong(3, offset);
        ps.setInt(4, MergeJobStatus.PENDING.code());
        return ps.executeUpdate();
      } catch (final SQLException e) {
        if (!dialect.isUniqueViolation(e)) {
          throw e;
        }
        log.debug("[{}] job '{}' at {} already exists", tag(), streamKey,
            offset);
        return 0;
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public List<MergeJob> getPendingJobs(final String node, final int limit) {
    final long now = TimeRange.nowMicros();
    final List<MergeJob> jobs = write("get pending jobs", conn ->
        SqlTransactions.run(conn, tag(), "get pending jobs", c -> {
          final List<Long> candidates = new ArrayList<>();
          try (PreparedStatement ps = c.prepareStatement("SELECT MAX(id)"
              + " FROM file_list_jobs WHERE status = ? GROUP BY stream"
              + " ORDER BY COUNT(*) DESC LIMIT ?")) {
            ps.setInt(1, MergeJobStatus.PENDING.code());
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
              while (rs.next()) {
                candidates.add(rs.getLong(1));
              }
            }
          }
          // claim in id order so concurrent nodes lock rows alike
          Collections.sort(candidates);
          final List<MergeJob> claimed = new ArrayList<>();
          try (PreparedStatement claim = c.prepareStatement("UPDATE"
                  + " file_list_jobs SET status = ?, node = ?, started_at = ?,"
                  + " updated_at = ? WHERE id = ? AND status = ?");
              PreparedStatement select = c.prepareStatement("SELECT "
                  + JOB_COLUMNS + " FROM file_list_jobs WHERE id = ?")) {
            for (final long id : candidates) {
              claim.setInt(1, MergeJobStatus.RUNNING.code());
              claim.setString(2, node);
              claim.setLong(3, now);
              claim.setLong(4, now);
              claim.setLong(5, id);
              claim.setInt(6, MergeJobStatus.PENDING.code());
              // zero rows: another node claimed it first
              if (claim.executeUpdate() == 0) {
                continue;
              }
              select.setLong(1, id);
              try (ResultSet rs = select.executeQuery()) {
                if (rs.next()) {
                  claimed.add(readJob(rs));
                }
              }
            }
          }
          return claimed;
        }));
    if (!jobs.isEmpty()) {
      log.debug("[{}] node '{}' claimed {} merge jobs", tag(), node,
          jobs.size());
    }
    return jobs;
  }

  /** {@inheritDoc} */
  @Override
  public void setJobPending(final List<Long> ids) {
    if (ids.isEmpty()) {
      return;
    }
    write("set job pending", conn ->
        SqlTransactions.run(conn, tag(), "set job pending", c -> {
          try (PreparedStatement ps = c.prepareStatement(
              "UPDATE file_list_jobs SET status = ? WHERE id = ?")) {
            for (final long id : ids) {
              ps.setInt(1, MergeJobStatus.PENDING.code());
              ps.setLong(2, id);
              ps.addBatch();
            }
            return ps.executeBatch();
          }
        }));
  }

  /** {@inheritDoc} */
  @Override
  public void setJobDone(final long id) {
    write("set job done", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("UPDATE"
          + " file_list_jobs SET status = ?, updated_at = ? WHERE id = ?")) {
        ps.setInt(1, MergeJobStatus.DONE.code());
        ps.setLong(2, TimeRange.nowMicros());
        ps.setLong(3, id);
        return ps.executeUpdate();
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public void updateRunningJobs(final long id) {
    write("update running jobs", conn -> {
      try (PreparedStatement ps = conn.prepareStatement(
          "UPDATE file_list_jobs SET updated_at = ? WHERE id = ?")) {
        ps.setLong(1, TimeRange.nowMicros());
        ps.setLong(2, id);
        return ps.executeUpdate();
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public int checkRunningJobs(final long beforeDate) {
    final int reset = write("check running jobs", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("UPDATE"
          + " file_list_jobs SET status = ? WHERE status = ?"
          + " AND updated_at < ?")) {
        ps.setInt(1, MergeJobStatus.PENDING.code());
        ps.setInt(2, MergeJobStatus.RUNNING.code());
        ps.setLong(3, beforeDate);
        return ps.executeUpdate();
      }
    });
    if (reset > 0) {
      log.warn("[{}] reset {} running jobs to pending", tag(), reset);
    }
    return reset;
  }

  /** {@inheritDoc} */
  @Override
  public int cleanDoneJobs(final long beforeDate) {
    final int deleted = write("clean done jobs", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("DELETE FROM"
          + " file_list_jobs WHERE status = ? AND updated_at < ?")) {
        ps.setInt(1, MergeJobStatus.DONE.code());
        ps.setLong(2, beforeDate);
        return ps.executeUpdate();
      }
    });
    if (deleted > 0) {
      log.info("[{}] cleaned {} done jobs", tag(), deleted);
    }
    return deleted;
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, Map<String, Long>> getPendingJobsCount() {
    return read("get pending jobs count", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT stream,"
          + " COUNT(*) FROM file_list_jobs WHERE status = ?"
          + " GROUP BY stream")) {
        ps.setInt(1, MergeJobStatus.PENDING.code());
        final Map<String, Map<String, Long>> counts = new TreeMap<>();
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            final String[] parts = rs.getString(1).split("/", 3);
            if (parts.length < 2) {
              continue;
            }
            counts.computeIfAbsent(parts[0], org -> new TreeMap<>())
                .merge(parts[1], rs.getLong(2), Long::sum);
          }
        }
        return counts;
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public long len() {
    return read("len", conn -> {
      try (PreparedStatement ps =
          conn.prepareStatement("SELECT COUNT(*) FROM file_list")) {
        return singleLong(ps);
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public void clear() {
    update("clear", "DELETE FROM file_list");
    log.info("[{}] file list cleared", tag());
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    executor.close();
  }

  /**
   * Runs read-only work, wrapping database errors.
   *
   * @param operation the operation name for errors, never null
   * @param work the work, never null
   * @param <T> the result type
   *
   * @return the work result
   */
  protected <T> T read(final String operation, final SqlWork<T> work) {
    try {
      return executor.read(work);
    } catch (final SQLException e) {
      throw new BackendException("[" + tag() + "] " + operation + " failed",
          e);
    }
  }

  /**
   * Runs mutating work, wrapping database errors.
   *
   * @param operation the operation name for errors, never null
   * @param work the work, never null
   * @param <T> the result type
   *
   * @return the work result
   */
  protected <T> T write(final String operation, final SqlWork<T> work) {
    try {
      return executor.write(work);
    } catch (final SQLException e) {
      throw new BackendException("[" + tag() + "] " + operation + " failed",
          e);
    }
  }

  /** Inserts the statistics rows that are still missing, one at a time.
   *
   * @param conn the connection, in auto-commit mode.
   * @param streamKeys the stream keys, never null.
   * @throws SQLException on any error other than a duplicate row.
   */
  private void insertMissingStreamStats(final Connection conn,
      final List<String> streamKeys) throws SQLException {
    for (final String streamKey : streamKeys) {
      try (PreparedStatement ps = conn.prepareStatement("INSERT INTO"
          + " stream_stats (org, stream, file_num, min_ts, max_ts, records,"
          + " original_size, compressed_size)"
          + " VALUES (?, ?, 0, 0, 0, 0, 0, 0)")) {
        ps.setString(1, FileKeys.orgOf(streamKey));
        ps.setString(2, streamKey);
        ps.executeUpdate();
      } catch (final SQLException e) {
        if (!dialect.isUniqueViolation(e)) {
          throw e;
        }
      }
    }
  }

  /** Runs a parameterless update.
   *
   * @param operation the operation name.
   * @param sql the statement.
   */
  private void update(final String operation, final String sql) {
    write(operation, conn -> {
      try (Statement stmt = conn.createStatement()) {
        return stmt.executeUpdate(sql);
      }
    });
  }

  /** Deletes rows by their composite key in one transaction.
   *
   * @param table the table.
   * @param operation the operation name.
   * @param chunk the composite keys.
   */
  private void deleteByColumns(final String table, final String operation,
      final List<FileKeyColumns> chunk) {
    write(operation, conn ->
        SqlTransactions.run(conn, tag(), operation, c -> {
          try (PreparedStatement ps = c.prepareStatement("DELETE FROM "
              + table + " WHERE stream = ? AND date = ? AND file = ?")) {
            for (final FileKeyColumns columns : chunk) {
              bindColumns(ps, 1, columns);
              ps.addBatch();
            }
            return ps.executeBatch();
          }
        }));
  }

  /** Inserts file rows with a single multi-row statement.
   *
   * @param conn the connection.
   * @param table the file table.
   * @param files the files, never empty.
   * @return the inserted rows.
   * @throws SQLException on any error, duplicates included.
   */
  private static int insertFiles(final Connection conn, final String table,
      final List<FileKey> files) throws SQLException {
    final StringBuilder sql = new StringBuilder("INSERT INTO " + table
        + " (org, stream, date, file, deleted, min_ts, max_ts, records,"
        + " original_size, compressed_size) VALUES ");
    for (int i = 0; i < files.size(); i++) {
      sql.append(i == 0 ? "" : ", ").append("(?, ?, ?, ?, ?, ?, ?, ?, ?, ?)");
    }
    try (PreparedStatement ps = conn.prepareStatement(sql.toString())) {
      int p = 1;
      for (final FileKey file : files) {
        final FileKeyColumns columns = FileKeys.parseColumns(file.key());
        final FileMeta meta = file.meta();
        ps.setString(p++, columns.org());
        ps.setString(p++, columns.streamKey());
        ps.setString(p++, columns.dateKey());
        ps.setString(p++, columns.fileName());
        ps.setBoolean(p++, file.deleted());
        ps.setLong(p++, meta.minTs());
        ps.setLong(p++, meta.maxTs());
        ps.setLong(p++, meta.records());
        ps.setLong(p++, meta.originalSize());
        ps.setLong(p++, meta.compressedSize());
      }
      return ps.executeUpdate();
    }
  }

  /** Maps the current row, selected with {@link #JOB_COLUMNS}.
   *
   * @param rs the result set on a row.
   * @return the job, never null.
   * @throws SQLException on read errors.
   */
  private static MergeJob readJob(final ResultSet rs) throws SQLException {
    return new MergeJob(rs.getLong(1), rs.getString(2), rs.getString(3),
        rs.getLong(4), MergeJobStatus.fromCode(rs.getInt(5)),
        rs.getString(6), rs.getLong(7), rs.getLong(8));
  }

  /** Renders {@code column + delta}, floored at zero.
   *
   * @param column the column.
   * @return the expression, taking the delta twice.
   */
  private static String clampedAdd(final String column) {
    return "CASE WHEN " + column + " + ? < 0 THEN 0 ELSE " + column
        + " + ? END";
  }

  /** Binds the two parameters of a {@link #clampedAdd} expression.
   *
   * @param ps the statement.
   * @param index the first parameter index.
   * @param delta the delta.
   * @return the next parameter index.
   * @throws SQLException on binding errors.
   */
  private static int bindCounter(final PreparedStatement ps, final int index,
      final long delta) throws SQLException {
    ps.setLong(index, delta);
    ps.setLong(index + 1, delta);
    return index + 2;
  }

  /** Binds stream, date and file starting at a parameter index.
   *
   * @param ps the statement.
   * @param index the first parameter index.
   * @param columns the composite key.
   * @throws SQLException on binding errors.
   */
  private static void bindColumns(final PreparedStatement ps, final int index,
      final FileKeyColumns columns) throws SQLException {
    ps.setString(index, columns.streamKey());
    ps.setString(index + 1, columns.dateKey());
    ps.setString(index + 2, columns.fileName());
  }

  /** Reads every file row of a query.
   *
   * @param ps the prepared query.
   * @return the entries, never null.
   * @throws SQLException on read errors.
   */
  private static List<FileKey> readFiles(final PreparedStatement ps)
      throws SQLException {
    final List<FileKey> files = new ArrayList<>();
    try (ResultSet rs = ps.executeQuery()) {
      while (rs.next()) {
        files.add(readFile(rs));
      }
    }
    return files;
  }

  /** Maps the current row, selected with {@link #FILE_COLUMNS}.
   *
   * @param rs the result set on a row.
   * @return the entry, never null.
   * @throws SQLException on read errors.
   */
  private static FileKey readFile(final ResultSet rs) throws SQLException {
    final String key = FileKeys.build(rs.getString(1), rs.getString(2),
        rs.getString(3));
    final FileMeta meta = new FileMeta(rs.getLong(5), rs.getLong(6),
        rs.getLong(7), rs.getLong(8), rs.getLong(9));
    return new FileKey(key, meta, rs.getBoolean(4));
  }

  /** Reads the single numeric value of a query, 0 for SQL NULL.
   *
   * @param ps the prepared query.
   * @return the value.
   * @throws SQLException on read errors.
   */
  private static long singleLong(final PreparedStatement ps)
      throws SQLException {
    try (ResultSet rs = ps.executeQuery()) {
      return rs.next() ? rs.getLong(1) : 0L;
    }
  }
}
