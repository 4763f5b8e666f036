package org.waabox.filedex.sqlite;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import org.waabox.filedex.BackendException;
import org.waabox.filedex.jdbc.SqlExecutor;
import org.waabox.filedex.jdbc.SqlWork;

/**
 * A {@link SqlExecutor} that serialises every write of a SQLite database
 * through one thread.
 *
 * <p>The writer thread owns the only writable connection. Callers post
 * their work to a bounded mailbox and block until the writer replies;
 * once the mailbox is full further writers block as well. Reads open a
 * read-only connection of their own, so they never wait for the writer.
 *
 * <p>The database runs in WAL journal mode. Closing the actor lets the
 * writer finish the work already posted; work posted after that fails.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SqliteWriterActor implements SqlExecutor {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(SqliteWriterActor.class);

  /** How long {@link #close()} waits for the writer thread, in millis. */
  private static final long JOIN_TIMEOUT = 5_000;

  /** How long a caller waits on a full mailbox between closed checks. */
  private static final long POST_RETRY = 100;

  /** Tells the writer thread to stop. */
  private static final Command<Void> STOP = new Command<>(null);

  /** Pending writes, never null. */
  private final BlockingQueue<Command<?>> mailbox;

  /** Opens the read-only connections, never null. */
  private final SQLiteDataSource readers;

  /** The only writable connection, used by the writer thread alone. */
  private final Connection writerConnection;

  /** The writer thread, never null. */
  private final Thread writer;

  /** Whether {@link #close()} was called. */
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Opens the database and starts the writer thread.
   *
   * @param config the configuration, never null
   *
   * @throws BackendException if the database cannot be opened
   */
  public SqliteWriterActor(final SqliteConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    final int busyTimeout = (int) config.busyTimeout().toMillis();

    final SQLiteConfig writerConfig = new SQLiteConfig();
    writerConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
    writerConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
    writerConfig.setBusyTimeout(busyTimeout);
    try {
      writerConnection = writerConfig.createConnection(config.url());
    } catch (final SQLException e) {
      throw new BackendException("[SQLITE] failed to open " + config.path(),
          e);
    }

    final SQLiteConfig readerConfig = new SQLiteConfig();
    readerConfig.setReadOnly(true);
    readerConfig.setBusyTimeout(busyTimeout);
    readers = new SQLiteDataSource(readerConfig);
    readers.setUrl(config.url());

    mailbox = new ArrayBlockingQueue<>(config.mailboxCapacity());
    writer = new Thread(this::writeLoop, "filedex-sqlite-writer");
    writer.setDaemon(true);
    writer.start();

    log.info("[SQLITE] opened {} with a mailbox of {} writes", config.path(),
        config.mailboxCapacity());
  }

  /** {@inheritDoc} */
  @Override
  public <T> T read(final SqlWork<T> work) throws SQLException {
    try (Connection conn = readers.getConnection()) {
      return work.apply(conn);
    }
  }

  /** {@inheritDoc} */
  @Override
  public <T> T write(final SqlWork<T> work) throws SQLException {
    Objects.requireNonNull(work, "work cannot be null");
    if (Thread.currentThread() == writer) {
      return work.apply(writerConnection);
    }
    if (closed.get()) {
      throw new IllegalStateException("[SQLITE] writer is closed");
    }
    final Command<T> command = new Command<>(work);
    try {
      post(command);
      return command.reply.get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendException("[SQLITE] interrupted waiting for the"
          + " writer", e);
    } catch (final ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof SQLException sqlError) {
        throw sqlError;
      }
      if (cause instanceof RuntimeException runtimeError) {
        throw runtimeError;
      }
      throw new BackendException("[SQLITE] write failed", cause);
    }
  }

  /**
   * Puts a command in the mailbox, failing once the actor is closed.
   *
   * <p>A command that lands after the writer drained the mailbox would
   * never be answered, so after posting it is taken back if the actor was
   * closed meanwhile. If it cannot be taken back, the writer or its final
   * drain already owns it and will reply.
   *
   * @param command the command, never null
   *
   * @throws InterruptedException if interrupted while the mailbox is full
   */
  private void post(final Command<?> command) throws InterruptedException {
    while (!mailbox.offer(command, POST_RETRY, TimeUnit.MILLISECONDS)) {
      if (closed.get()) {
        throw new IllegalStateException("[SQLITE] writer is closed");
      }
    }
    if (closed.get() && mailbox.remove(command)) {
      throw new IllegalStateException("[SQLITE] writer is closed");
    }
  }

  /**
   * Returns the number of writes waiting in the mailbox.
   *
   * @return the pending writes
   */
  public int pending() {
    return mailbox.size();
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      mailbox.put(STOP);
      writer.join(JOIN_TIMEOUT);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[SQLITE] interrupted while stopping the writer");
    }
    log.info("[SQLITE] writer stopped");
  }

  /** Runs posted writes until told to stop, then fails the leftovers and
   * closes the writable connection.
   */
  private void writeLoop() {
    try {
      while (true) {
        final Command<?> command = mailbox.take();
        if (command == STOP) {
          break;
        }
        command.run(writerConnection);
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[SQLITE] writer interrupted");
    } finally {
      final List<Command<?>> leftovers = new ArrayList<>();
      mailbox.drainTo(leftovers);
      for (final Command<?> command : leftovers) {
        command.reply.completeExceptionally(
            new IllegalStateException("[SQLITE] writer is closed"));
      }
      try {
        writerConnection.close();
      } catch (final SQLException e) {
        log.error("[SQLITE] failed to close the writer connection", e);
      }
    }
  }

  /** A posted write and its reply.
   *
   * @param <T> the result type.
   */
  private static final class Command<T> {

    /** The work, null for {@link #STOP}. */
    private final SqlWork<T> work;

    /** Completed by the writer thread. */
    private final CompletableFuture<T> reply = new CompletableFuture<>();

    /** Creates a command.
     *
     * @param theWork the work.
     */
    private Command(final SqlWork<T> theWork) {
      work = theWork;
    }

    /** Runs the work and completes the reply with its outcome.
     *
     * @param conn the writable connection.
     */
    private void run(final Connection conn) {
      try {
        reply.complete(work.apply(conn));
      } catch (final SQLException | RuntimeException e) {
        reply.completeExceptionally(e);
      }
    }
  }
}
