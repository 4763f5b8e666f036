package org.waabox.filedex.duckdb;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration of the embedded DuckDB file catalog.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(Path)} and {@link #create(Path, int)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DuckDbConfig {

  /** Default number of pooled connections. */
  private static final int DEFAULT_POOL_SIZE = 4;

  /** The database file, never null. */
  private final Path path;

  /** The number of pooled connections. */
  private final int poolSize;

  /** Private constructor; use static factories.
   *
   * @param thePath     the database file
   * @param thePoolSize the number of pooled connections
   */
  private DuckDbConfig(final Path thePath, final int thePoolSize) {
    path = thePath;
    poolSize = thePoolSize;
  }

  /**
   * Creates a configuration.
   *
   * @param path     the database file, never null
   * @param poolSize the number of pooled connections, greater than 0
   *
   * @return a new configuration instance, never null
   */
  public static DuckDbConfig create(final Path path, final int poolSize) {
    Objects.requireNonNull(path, "path cannot be null");
    if (poolSize <= 0) {
      throw new IllegalArgumentException("poolSize must be positive");
    }
    return new DuckDbConfig(path, poolSize);
  }

  /**
   * Creates a configuration with a pool of 4 connections.
   *
   * @param path the database file, never null
   *
   * @return a new configuration instance, never null
   */
  public static DuckDbConfig create(final Path path) {
    return create(path, DEFAULT_POOL_SIZE);
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
   * Returns the number of pooled connections.
   *
   * @return the pool size, greater than 0
   */
  public int poolSize() {
    return poolSize;
  }

  /**
   * Returns the JDBC url of the database.
   *
   * @return the url, never null
   */
  public String url() {
    return "jdbc:duckdb:" + path.toAbsolutePath();
  }
}
