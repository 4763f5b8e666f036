package org.waabox.filedex.jdbc;

import java.sql.SQLException;

/**
 * MySQL dialect.
 *
 * <p>MySQL has no {@code CREATE INDEX IF NOT EXISTS}; a duplicate index
 * shows up as error 1061 and is treated as success.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MysqlDialect implements SqlDialect {

  /** Duplicate entry for a unique key. */
  private static final int ER_DUP_ENTRY = 1062;

  /** Duplicate index name. */
  private static final int ER_DUP_KEYNAME = 1061;

  /** {@inheritDoc} */
  @Override
  public String tag() {
    return "MYSQL";
  }

  /** {@inheritDoc} */
  @Override
  public String idColumn(final String table) {
    return "BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY";
  }

  /** {@inheritDoc} */
  @Override
  public String binaryType() {
    return "LONGBLOB";
  }

  /** {@inheritDoc} */
  @Override
  public String createIndex(final IndexDef index) {
    return (index.unique() ? "CREATE UNIQUE INDEX " : "CREATE INDEX ")
        + index.name() + " ON " + index.table()
        + " (" + String.join(", ", index.columns()) + ")";
  }

  /** {@inheritDoc} */
  @Override
  public boolean isUniqueViolation(final SQLException e) {
    return e.getErrorCode() == ER_DUP_ENTRY
        || "23505".equals(e.getSQLState());
  }

  /** {@inheritDoc} */
  @Override
  public boolean isIndexAlreadyExists(final SQLException e) {
    return e.getErrorCode() == ER_DUP_KEYNAME
        || "42S11".equals(e.getSQLState());
  }
}
