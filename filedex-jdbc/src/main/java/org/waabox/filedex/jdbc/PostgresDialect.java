package org.waabox.filedex.jdbc;

import java.sql.SQLException;

/**
 * PostgreSQL dialect.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PostgresDialect implements SqlDialect {

  /** {@inheritDoc} */
  @Override
  public String tag() {
    return "POSTGRES";
  }

  /** {@inheritDoc} */
  @Override
  public String idColumn(final String table) {
    return "BIGSERIAL PRIMARY KEY";
  }

  /** {@inheritDoc} */
  @Override
  public String binaryType() {
    return "BYTEA";
  }

  /** {@inheritDoc} */
  @Override
  public boolean isUniqueViolation(final SQLException e) {
    return "23505".equals(e.getSQLState());
  }
}
