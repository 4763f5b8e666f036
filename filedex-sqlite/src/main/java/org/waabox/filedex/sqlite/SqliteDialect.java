package org.waabox.filedex.sqlite;

import java.sql.SQLException;

import org.waabox.filedex.jdbc.SqlDialect;

/**
 * SQLite dialect.
 *
 * <p>A unique violation is reported as {@code SQLITE_CONSTRAINT}, possibly
 * with an extended code on top, naming the {@code UNIQUE} constraint.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SqliteDialect implements SqlDialect {

  /** The primary result code of a constraint failure. */
  private static final int SQLITE_CONSTRAINT = 19;

  /** {@inheritDoc} */
  @Override
  public String tag() {
    return "SQLITE";
  }

  /** {@inheritDoc} */
  @Override
  public String idColumn(final String table) {
    return "INTEGER PRIMARY KEY AUTOINCREMENT";
  }

  /** {@inheritDoc} */
  @Override
  public String binaryType() {
    return "BLOB";
  }

  /** {@inheritDoc} */
  @Override
  public boolean isUniqueViolation(final SQLException e) {
    final String message = e.getMessage();
    return (e.getErrorCode() & 0xff) == SQLITE_CONSTRAINT
        && message != null && message.contains("UNIQUE");
  }
}
