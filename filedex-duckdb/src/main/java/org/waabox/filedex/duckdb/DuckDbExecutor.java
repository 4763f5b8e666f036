package org.waabox.filedex.duckdb;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.BackendException;
import org.waabox.filedex.jdbc.SqlExecutor;
import org.waabox.filedex.jdbc.SqlWork;

/**
 * A {@link SqlExecutor} over a fixed pool of connections duplicated from
 * one DuckDB database.
 *
 * <p>A DuckDB file can be opened by a single database instance per
 * process; duplicated connections share that instance. Work borrows a
 * connection, blocking while all of them are in use.
 *
 * <p>Writes run one at a time. DuckDB rejects a transaction that updates
 * a row another open transaction changed instead of waiting for it, so
 * concurrent statistics merges would otherwise fail.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DuckDbExecutor implements SqlExecutor {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(DuckDbExecutor.class);

  /** The connection that owns the database, never null. */
  private final DuckDBConnection root;

  /** Every pooled connection, for closing. */
  private final List<Connection> all = new ArrayList<>();

  /** Idle pooled connections. */
  private final BlockingQueue<Connection> idle;

  /** Serialises writes. */
  private final ReentrantLock writeLock = new ReentrantLock();

  /** Whether {@link #close()} was called. */
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Opens the database and fills the pool.
   *
   * @param config the configuration, never null
   *
   * @throws BackendException if the database cannot be opened
   */
  public DuckDbExecutor(final DuckDbConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    idle = new ArrayBlockingQueue<>(config.poolSize());
    try {
      root = (DuckDBConnection) DriverManager.getConnection(config.url());
      for (int i = 0; i < config.poolSize(); i++) {
        final Connection conn = root.duplicate();
        all.add(conn);
        idle.add(conn);
      }
    } catch (final SQLException e) {
      closeAll();
      throw new BackendException("[DUCKDB] failed to open " + config.path(),
          e);
    }
    log.info("[DUCKDB] opened {} with {} connections", config.path(),
        config.poolSize());
  }

  /** {@inheritDoc} */
  @Override
  public <T> T read(final SqlWork<T> work) throws SQLException {
    return run(work);
  }

  /** {@inheritDoc} */
  @Override
  public <T> T write(final SqlWork<T> work) throws SQLException {
    writeLock.lock();
    try {
      return run(work);
    } finally {
      writeLock.unlock();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      closeAll();
      log.info("[DUCKDB] closed");
    }
  }

  /** Runs work on a borrowed connection.
   *
   * @param work the work, never null.
   * @return the work result.
   * @throws SQLException on database errors.
   */
  private <T> T run(final SqlWork<T> work) throws SQLException {
    if (closed.get()) {
      throw new IllegalStateException("[DUCKDB] executor is closed");
    }
    final Connection conn;
    try {
      conn = idle.take();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendException("[DUCKDB] interrupted waiting for a"
          + " connection", e);
    }
    try {
      return work.apply(conn);
    } finally {
      idle.add(conn);
    }
  }

  /** Closes the pooled connections, then the database. */
  private void closeAll() {
    for (final Connection conn : all) {
      closeQuietly(conn);
    }
    if (root != null) {
      closeQuietly(root);
    }
  }

  /** Closes a connection, logging failures.
   *
   * @param conn the connection.
   */
  private static void closeQuietly(final Connection conn) {
    try {
      conn.close();
    } catch (final SQLException e) {
      log.warn("[DUCKDB] failed to close connection: {}", e.getMessage());
    }
  }
}
