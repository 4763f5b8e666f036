package org.waabox.filedex.jdbc;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SqlExecutor} that borrows a connection from a
 * {@link DataSource} for every unit of work.
 *
 * <p>When the data source is also {@link AutoCloseable}, as a connection
 * pool is, {@link #close()} closes it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PooledSqlExecutor implements SqlExecutor {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PooledSqlExecutor.class);

  /** The data source, never null. */
  private final DataSource dataSource;

  /**
   * Creates a new executor.
   *
   * @param theDataSource the data source, never null
   */
  public PooledSqlExecutor(final DataSource theDataSource) {
    dataSource = Objects.requireNonNull(theDataSource,
        "dataSource cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public <T> T read(final SqlWork<T> work) throws SQLException {
    return run(work);
  }

  /** {@inheritDoc} */
  @Override
  public <T> T write(final SqlWork<T> work) throws SQLException {
    return run(work);
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    if (dataSource instanceof AutoCloseable closeable) {
      try {
        closeable.close();
        log.info("Closed data source {}", dataSource);
      } catch (final Exception e) {
        throw new IllegalStateException("Failed to close data source", e);
      }
    }
  }

  /** Runs the work on a borrowed connection.
   *
   * @param work the work, never null.
   * @return the work result.
   * @throws SQLException on any database error.
   */
  private <T> T run(final SqlWork<T> work) throws SQLException {
    try (final Connection conn = dataSource.getConnection()) {
      return work.apply(conn);
    }
  }
}
