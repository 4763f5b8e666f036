package org.waabox.filedex.sqlite;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the embedded SQLite backend.
 *
 * <p>Holds the database file, the capacity of the writer mailbox and the
 * time a connection waits on a locked database.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(Path)} and {@link #create(Path, int, Duration)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SqliteConfig {

  /** Default number of pending writes before callers block. */
  private static final int DEFAULT_MAILBOX_CAPACITY = 1024;

  /** Default wait on a locked database (5 seconds). */
  private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(5);

  /** The database file, never null. */
  private final Path path;

  /** The writer mailbox capacity. */
  private final int mailboxCapacity;

  /** The wait on a locked database, never null. */
  private final Duration busyTimeout;

  /** Private constructor; use static factories.
   *
   * @param thePath            the database file
   * @param theMailboxCapacity the writer mailbox capacity
   * @param theBusyTimeout     the wait on a locked database
   */
  private SqliteConfig(final Path thePath, final int theMailboxCapacity,
      final Duration theBusyTimeout) {
    path = thePath;
    mailboxCapacity = theMailboxCapacity;
    busyTimeout = theBusyTimeout;
  }

  /**
   * Creates a configuration with all custom values.
   *
   * @param path            the database file, never null
   * @param mailboxCapacity the pending writes before callers block,
   *                        greater than 0
   * @param busyTimeout     the wait on a locked database, never null
   *
   * @return a new configuration instance, never null
   */
  public static SqliteConfig create(final Path path,
      final int mailboxCapacity, final Duration busyTimeout) {
    Objects.requireNonNull(path, "path cannot be null");
    Objects.requireNonNull(busyTimeout, "busyTimeout cannot be null");

    if (mailboxCapacity <= 0) {
      throw new IllegalArgumentException("mailboxCapacity must be positive");
    }

    return new SqliteConfig(path, mailboxCapacity, busyTimeout);
  }

  /**
   * Creates a configuration with the default mailbox capacity (1024) and
   * busy timeout (5 seconds).
   *
   * @param path the database file, never null
   *
   * @return a new configuration instance, never null
   */
  public static SqliteConfig create(final Path path) {
    return create(path, DEFAULT_MAILBOX_CAPACITY, DEFAULT_BUSY_TIMEOUT);
  }

  /**
   * Returns the database file.
   *
   * @return the path, never null
   */
  public Path path() {
    return path;
  }

  /**
   * Returns the writer mailbox capacity.
   *
   * @return the capacity, greater than 0
   */
  public int mailboxCapacity() {
    return mailboxCapacity;
  }

  /**
   * Returns the wait on a locked database.
   *
   * @return the timeout, never null
   */
  public Duration busyTimeout() {
    return busyTimeout;
  }

  /**
   * Returns the JDBC url of the database.
   *
   * @return the url, never null
   */
  public String url() {
    return "jdbc:sqlite:" + path.toAbsolutePath();
  }
}
