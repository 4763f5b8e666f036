package org.waabox.filedex.jdbc;

import java.sql.SQLException;
import java.util.Collections;
import java.util.List;

/**
 * The engine specific parts of the SQL adapters: column types, DDL quirks
 * and the classification of engine errors.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SqlDialect {

  /**
   * Returns the log tag of the engine.
   *
   * @return the tag, e.g. {@code MYSQL}, never null
   */
  String tag();

  /**
   * Returns the column definition of the auto-increment primary key.
   *
   * @param table the table the column belongs to, never null
   *
   * @return the definition after the column name, never null
   */
  String idColumn(String table);

  /**
   * Returns the column type for opaque values.
   *
   * @return the type, never null
   */
  String binaryType();

  /**
   * Returns statements that must run before the tables are created.
   *
   * @param tables the tables about to be created, never null
   *
   * @return the statements, never null
   */
  default List<String> preamble(final List<String> tables) {
    return Collections.emptyList();
  }

  /**
   * Renders the statement that creates an index.
   *
   * @param index the index, never null
   *
   * @return the statement, never null
   */
  default String createIndex(final IndexDef index) {
    return (index.unique() ? "CREATE UNIQUE INDEX IF NOT EXISTS "
        : "CREATE INDEX IF NOT EXISTS ")
        + index.name() + " ON " + index.table()
        + " (" + String.join(", ", index.columns()) + ")";
  }

  /**
   * Renders the sum of a BIGINT column as a value readable with
   * {@code getLong}.
   *
   * @param column the column, never null
   *
   * @return the expression, never null
   */
  default String sum(final String column) {
    return "SUM(" + column + ")";
  }

  /**
   * Tells whether an error is a unique-constraint violation.
   *
   * @param e the error, never null
   *
   * @return true for a duplicate row
   */
  boolean isUniqueViolation(SQLException e);

  /**
   * Tells whether an error reports that an index already exists.
   *
   * @param e the error, never null
   *
   * @return true when the index is already there
   */
  default boolean isIndexAlreadyExists(final SQLException e) {
    return false;
  }
}
