package org.waabox.filedex.rocksdb;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration of the embedded RocksDB backend.
 *
 * <p>Every table lives in its own RocksDB instance, in a sub directory of
 * {@link #path()} named after the table.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RocksDbConfig {

  /** The base directory, never null. */
  private final Path path;

  /** Whether every write is synced to disk before returning. */
  private final boolean syncWrites;

  /** Private constructor; use static factories.
   *
   * @param thePath       the base directory
   * @param theSyncWrites whether writes are synced
   */
  private RocksDbConfig(final Path thePath, final boolean theSyncWrites) {
    path = thePath;
    syncWrites = theSyncWrites;
  }

  /**
   * Creates a configuration.
   *
   * @param path       the base directory, never null
   * @param syncWrites whether every write is synced to disk
   *
   * @return a new configuration instance, never null
   */
  public static RocksDbConfig create(final Path path,
      final boolean syncWrites) {
    Objects.requireNonNull(path, "path cannot be null");
    return new RocksDbConfig(path, syncWrites);
  }

  /**
   * Creates a configuration with unsynced writes.
   *
   * @param path the base directory, never null
   *
   * @return a new configuration instance, never null
   */
  public static RocksDbConfig create(final Path path) {
    return create(path, false);
  }

  /**
   * Returns the base directory.
   *
   * @return the path, never null
   */
  public Path path() {
    return path;
  }

  /**
   * Tells whether every write is synced to disk.
   *
   * @return true for synced writes
   */
  public boolean syncWrites() {
    return syncWrites;
  }
}
