package org.waabox.filedex.duckdb;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.waabox.filedex.jdbc.SqlDialect;

/**
 * DuckDB dialect.
 *
 * <p>DuckDB has no auto-increment column; every table draws its ids from a
 * sequence created ahead of it. Sums of BIGINT columns come back as
 * HUGEINT and are cast down.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DuckDbDialect implements SqlDialect {

  /** {@inheritDoc} */
  @Override
  public String tag() {
    return "DUCKDB";
  }

  /** {@inheritDoc} */
  @Override
  public List<String> preamble(final List<String> tables) {
    final List<String> ddl = new ArrayList<>(tables.size());
    for (final String table : tables) {
      ddl.add("CREATE SEQUENCE IF NOT EXISTS " + sequence(table)
          + " START 1");
    }
    return ddl;
  }

  /** {@inheritDoc} */
  @Override
  public String idColumn(final String table) {
    return "BIGINT PRIMARY KEY DEFAULT nextval('" + sequence(table) + "')";
  }

  /** {@inheritDoc} */
  @Override
  public String binaryType() {
    return "BLOB";
  }

  /** {@inheritDoc} */
  @Override
  public String sum(final String column) {
    return "CAST(SUM(" + column + ") AS BIGINT)";
  }

  /** {@inheritDoc} */
  @Override
  public boolean isUniqueViolation(final SQLException e) {
    final String message = e.getMessage();
    return message != null && message.contains("Constraint Error")
        && message.toLowerCase(Locale.ROOT).contains("duplicate key");
  }

  /** Names the id sequence of a table.
   *
   * @param table the table.
   * @return the sequence name, never null.
   */
  private static String sequence(final String table) {
    return "seq_" + table + "_id";
  }
}
