package org.waabox.filedex.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * The DDL of the catalog tables, rendered for one dialect.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CatalogSchema {

  /** The file table. */
  public static final String FILE_LIST = "file_list";

  /** The tombstone table. */
  public static final String FILE_LIST_DELETED = "file_list_deleted";

  /** The history table. */
  public static final String FILE_LIST_HISTORY = "file_list_history";

  /** The merge job table. */
  public static final String FILE_LIST_JOBS = "file_list_jobs";

  /** The statistics table. */
  public static final String STREAM_STATS = "stream_stats";

  /** The key-value table. */
  public static final String META = "meta";

  /** Indexes of the file catalog tables. */
  public static final List<IndexDef> FILE_LIST_INDEXES = List.of(
      new IndexDef("file_list_org_idx", FILE_LIST, List.of("org"), false),
      new IndexDef("file_list_stream_ts_idx", FILE_LIST,
          List.of("stream", "min_ts", "max_ts"), false),
      new IndexDef("file_list_stream_file_idx", FILE_LIST,
          List.of("stream", "date", "file"), true),
      new IndexDef("file_list_deleted_stream_idx", FILE_LIST_DELETED,
          List.of("stream"), false),
      new IndexDef("file_list_deleted_created_at_idx", FILE_LIST_DELETED,
          List.of("org", "created_at"), false),
      new IndexDef("file_list_history_org_idx", FILE_LIST_HISTORY,
          List.of("org"), false),
      new IndexDef("file_list_history_stream_file_idx", FILE_LIST_HISTORY,
          List.of("stream", "date", "file"), true),
      new IndexDef("file_list_jobs_stream_status_idx", FILE_LIST_JOBS,
          List.of("status", "stream"), false),
      new IndexDef("file_list_jobs_stream_offsets_idx", FILE_LIST_JOBS,
          List.of("stream", "offsets"), true),
      new IndexDef("stream_stats_org_idx", STREAM_STATS, List.of("org"),
          false),
      new IndexDef("stream_stats_stream_idx", STREAM_STATS,
          List.of("stream"), true));

  /** Indexes of the key-value table. */
  public static final List<IndexDef> META_INDEXES = List.of(
      new IndexDef("meta_module_idx", META, List.of("module"), false),
      new IndexDef("meta_module_key2_idx", META,
          List.of("module", "key1", "key2"), true));

  /** Private constructor to prevent instantiation. */
  private CatalogSchema() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Renders the statements that create the file catalog tables.
   *
   * @param dialect the dialect, never null
   *
   * @return the statements in execution order, never null
   */
  public static List<String> fileListTables(final SqlDialect dialect) {
    final List<String> ddl = new ArrayList<>(dialect.preamble(
        List.of(FILE_LIST, FILE_LIST_DELETED, FILE_LIST_HISTORY,
            FILE_LIST_JOBS, STREAM_STATS)));
    ddl.add(fileTable(dialect, FILE_LIST));
    ddl.add(fileTable(dialect, FILE_LIST_HISTORY));
    ddl.add("CREATE TABLE IF NOT EXISTS " + FILE_LIST_DELETED + " ("
        + "id " + dialect.idColumn(FILE_LIST_DELETED) + ", "
        + "org VARCHAR(100) NOT NULL, "
        + "stream VARCHAR(256) NOT NULL, "
        + "date VARCHAR(16) NOT NULL, "
        + "file VARCHAR(256) NOT NULL, "
        + "created_at BIGINT NOT NULL"
        + ")");
    ddl.add("CREATE TABLE IF NOT EXISTS " + FILE_LIST_JOBS + " ("
        + "id " + dialect.idColumn(FILE_LIST_JOBS) + ", "
        + "org VARCHAR(100) NOT NULL, "
        + "stream VARCHAR(256) NOT NULL, "
        + "offsets BIGINT NOT NULL, "
        + "status INT NOT NULL, "
        + "node VARCHAR(100) NOT NULL, "
        + "started_at BIGINT NOT NULL, "
        + "updated_at BIGINT NOT NULL"
        + ")");
    ddl.add("CREATE TABLE IF NOT EXISTS " + STREAM_STATS + " ("
        + "id " + dialect.idColumn(STREAM_STATS) + ", "
        + "org VARCHAR(100) NOT NULL, "
        + "stream VARCHAR(256) NOT NULL, "
        + "file_num BIGINT NOT NULL, "
        + "min_ts BIGINT NOT NULL, "
        + "max_ts BIGINT NOT NULL, "
        + "records BIGINT NOT NULL, "
        + "original_size BIGINT NOT NULL, "
        + "compressed_size BIGINT NOT NULL"
        + ")");
    return ddl;
  }

  /** Renders a table holding file rows.
   *
   * @param dialect the dialect.
   * @param table the table name.
   * @return the statement, never null.
   */
  private static String fileTable(final SqlDialect dialect,
      final String table) {
    return "CREATE TABLE IF NOT EXISTS " + table + " ("
        + "id " + dialect.idColumn(table) + ", "
        + "org VARCHAR(100) NOT NULL, "
        + "stream VARCHAR(256) NOT NULL, "
        + "date VARCHAR(16) NOT NULL, "
        + "file VARCHAR(256) NOT NULL, "
        + "deleted BOOLEAN DEFAULT FALSE NOT NULL, "
        + "min_ts BIGINT NOT NULL, "
        + "max_ts BIGINT NOT NULL, "
        + "records BIGINT NOT NULL, "
        + "original_size BIGINT NOT NULL, "
        + "compressed_size BIGINT NOT NULL"
        + ")";
  }

  /**
   * Renders the statements that create the key-value table.
   *
   * @param dialect the dialect, never null
   *
   * @return the statements in execution order, never null
   */
  public static List<String> metaTables(final SqlDialect dialect) {
    final List<String> ddl =
        new ArrayList<>(dialect.preamble(List.of(META)));
    ddl.add("CREATE TABLE IF NOT EXISTS " + META + " ("
        + "id " + dialect.idColumn(META) + ", "
        + "module VARCHAR(100) NOT NULL, "
        + "key1 VARCHAR(256) NOT NULL, "
        + "key2 VARCHAR(256) NOT NULL, "
        + "value " + dialect.binaryType() + " NOT NULL"
        + ")");
    return ddl;
  }
}
