package org.waabox.filedex.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs work inside an explicit transaction.
 *
 * <p>On failure the transaction is rolled back. A rollback failure is
 * logged and attached to the original error as suppressed; the original
 * error is the one thrown.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SqlTransactions {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SqlTransactions.class);

  /** Private constructor to prevent instantiation. */
  private SqlTransactions() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Runs work in a transaction on the given connection.
   *
   * @param conn the connection, never null
   * @param tag the engine log tag, never null
   * @param operation the operation name for logs, never null
   * @param work the work, never null
   * @param <T> the result type
   *
   * @return the work result
   *
   * @throws SQLException the error raised by the work or by the commit
   */
  public static <T> T run(final Connection conn, final String tag,
      final String operation, final SqlWork<T> work) throws SQLException {
    final boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try {
      final T result = work.apply(conn);
      conn.commit();
      return result;
    } catch (final SQLException | RuntimeException e) {
      try {
        conn.rollback();
      } catch (final SQLException rollbackError) {
        log.error("[{}] rollback {} error", tag, operation, rollbackError);
        e.addSuppressed(rollbackError);
      }
      throw e;
    } finally {
      conn.setAutoCommit(autoCommit);
    }
  }
}
