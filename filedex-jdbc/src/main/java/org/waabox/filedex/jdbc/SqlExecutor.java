package org.waabox.filedex.jdbc;

import java.sql.SQLException;

/**
 * Runs JDBC work on the connections of one database.
 *
 * <p>Engines with many concurrent writers hand out pooled connections for
 * both methods. Single-writer engines route {@link #write} through their
 * only writable connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SqlExecutor extends AutoCloseable {

  /**
   * Runs read-only work.
   *
   * @param work the work, never null
   * @param <T> the result type
   *
   * @return the work result
   *
   * @throws SQLException on any database error
   */
  <T> T read(SqlWork<T> work) throws SQLException;

  /**
   * Runs work that mutates the database.
   *
   * @param work the work, never null
   * @param <T> the result type
   *
   * @return the work result
   *
   * @throws SQLException on any database error
   */
  <T> T write(SqlWork<T> work) throws SQLException;

  /** Releases every connection. */
  @Override
  void close();
}
