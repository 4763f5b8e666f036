package org.waabox.filedex.rocksdb;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiPredicate;

import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.BackendException;

/**
 * A set of named RocksDB instances, one per table, under one directory.
 *
 * <p>Keys are UTF-8 strings, values opaque bytes. Failures surface as
 * {@link BackendException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class RocksDbTables implements AutoCloseable {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RocksDbTables.class);

  static {
    RocksDB.loadLibrary();
  }

  /** The open instances by table name. */
  private final Map<String, RocksDB> tables = new LinkedHashMap<>();

  /** Options shared by the instances. */
  private final Options options;

  /** Options of every write. */
  private final WriteOptions writeOptions;

  /** Opens, creating when missing, one instance per table.
   *
   * @param config the configuration, never null.
   * @param names the table names, never null.
   */
  RocksDbTables(final RocksDbConfig config, final List<String> names) {
    options = new Options().setCreateIfMissing(true);
    writeOptions = new WriteOptions().setSync(config.syncWrites());
    try {
      for (final String name : names) {
        final Path dir = config.path().resolve(name);
        Files.createDirectories(dir);
        tables.put(name, RocksDB.open(options, dir.toString()));
        log.info("[ROCKSDB] opened table '{}' at {}", name, dir);
      }
    } catch (final RocksDBException | IOException e) {
      close();
      throw new BackendException("[ROCKSDB] failed to open "
          + config.path(), e);
    }
  }

  /** Reads a value.
   *
   * @param table the table.
   * @param key the key.
   * @return the value, null when absent.
   */
  byte[] get(final String table, final String key) {
    try {
      return db(table).get(bytes(key));
    } catch (final RocksDBException e) {
      throw failure("get", table, e);
    }
  }

  /** Writes a value.
   *
   * @param table the table.
   * @param key the key.
   * @param value the value.
   */
  void put(final String table, final String key, final byte[] value) {
    try {
      db(table).put(writeOptions, bytes(key), value);
    } catch (final RocksDBException e) {
      throw failure("put", table, e);
    }
  }

  /** Removes a key; absent keys are ignored.
   *
   * @param table the table.
   * @param key the key.
   */
  void delete(final String table, final String key) {
    try {
      db(table).delete(writeOptions, bytes(key));
    } catch (final RocksDBException e) {
      throw failure("delete", table, e);
    }
  }

  /** Visits the entries whose key starts with a prefix, in key order.
   *
   * @param table the table.
   * @param prefix the key prefix, empty for every entry.
   * @param visitor receives key and value; returns false to stop.
   */
  void scan(final String table, final String prefix,
      final BiPredicate<String, byte[]> visitor) {
    try (RocksIterator it = db(table).newIterator()) {
      for (it.seek(bytes(prefix)); it.isValid(); it.next()) {
        final String key = new String(it.key(), StandardCharsets.UTF_8);
        if (!key.startsWith(prefix)) {
          break;
        }
        if (!visitor.test(key, it.value())) {
          break;
        }
      }
    }
  }

  /** Removes the entries whose key starts with a prefix in one batch.
   *
   * @param table the table.
   * @param prefix the key prefix, empty for every entry.
   * @return the number of removed entries.
   */
  long deletePrefix(final String table, final String prefix) {
    try (WriteBatch batch = new WriteBatch()) {
      long count = 0;
      try (RocksIterator it = db(table).newIterator()) {
        for (it.seek(bytes(prefix)); it.isValid(); it.next()) {
          final byte[] key = it.key();
          if (!new String(key, StandardCharsets.UTF_8).startsWith(prefix)) {
            break;
          }
          batch.delete(key);
          count++;
        }
      }
      if (count > 0) {
        db(table).write(writeOptions, batch);
      }
      return count;
    } catch (final RocksDBException e) {
      throw failure("delete prefix", table, e);
    }
  }

  /** Closes every instance. */
  @Override
  public void close() {
    for (final RocksDB db : tables.values()) {
      db.close();
    }
    tables.clear();
    writeOptions.close();
    options.close();
  }

  /** Looks up an open table.
   *
   * @param table the table.
   * @return the instance, never null.
   */
  private RocksDB db(final String table) {
    final RocksDB db = tables.get(table);
    if (db == null) {
      throw new IllegalStateException("[ROCKSDB] table '" + table
          + "' is not open");
    }
    return db;
  }

  private static byte[] bytes(final String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  private static BackendException failure(final String operation,
      final String table, final RocksDBException e) {
    return new BackendException("[ROCKSDB] " + operation + " on '" + table
        + "' failed", e);
  }
}
