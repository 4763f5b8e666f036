package org.waabox.filedex.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A unit of JDBC work run against a borrowed connection.
 *
 * @param <T> the result type
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SqlWork<T> {

  /**
   * Runs the work.
   *
   * @param connection the connection, never null; the work must not close
   *     it
   *
   * @return the result, may be null
   *
   * @throws SQLException on any database error
   */
  T apply(Connection connection) throws SQLException;
}
