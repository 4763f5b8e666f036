package org.waabox.filedex.rocksdb;

import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.db.ChangeNotifier;
import org.waabox.filedex.db.Db;
import org.waabox.filedex.db.DbStats;
import org.waabox.filedex.db.WatchHub;
import org.waabox.filedex.db.WatchSubscription;

/**
 * A {@link Db} stored in an embedded RocksDB instance.
 *
 * <p>Keys are stored as given; prefixes match the raw key string. The
 * store lives on one node only, so it never reports itself as
 * {@link #distributed()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RocksDbDb implements Db {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(RocksDbDb.class);

  /** The key-value table. */
  static final String META = "meta";

  /** The RocksDB instance, never null. */
  private final RocksDbTables tables;

  /** Local watchers. */
  private final WatchHub hub = new WatchHub();

  /** Receives watched mutations, never null. */
  private final ChangeNotifier notifier;

  /**
   * Opens a store that notifies its own watchers.
   *
   * @param config the configuration, never null
   */
  public RocksDbDb(final RocksDbConfig config) {
    this(config, null);
  }

  /**
   * Opens a store.
   *
   * @param config the configuration, never null
   * @param theNotifier receives watched mutations, null for the local hub
   */
  public RocksDbDb(final RocksDbConfig config,
      final ChangeNotifier theNotifier) {
    Objects.requireNonNull(config, "config cannot be null");
    tables = new RocksDbTables(config, List.of(META));
    notifier = theNotifier == null ? hub : theNotifier;
  }

  /** {@inheritDoc} */
  @Override
  public void createTable() {
    log.debug("[ROCKSDB] meta table is created on open");
  }

  /** {@inheritDoc} */
  @Override
  public DbStats stats() {
    final long[] totals = {0, 0};
    tables.scan(META, "", (key, value) -> {
      totals[0] += key.length() + value.length;
      totals[1]++;
      return true;
    });
    return new DbStats(totals[0], totals[1]);
  }

  /** {@inheritDoc} */
  @Override
  public byte[] get(final String key) {
    final byte[] value = tables.get(META, key);
    if (value == null) {
      throw new KeyNotExistsException(key);
    }
    return value;
  }

  /** {@inheritDoc} */
  @Override
  public void put(final String key, final byte[] value,
      final boolean needWatch) {
    Objects.requireNonNull(value, "value cannot be null");
    tables.put(META, key, value);
    if (needWatch) {
      notifier.notifyPut(key, value);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void delete(final String key, final boolean withPrefix,
      final boolean needWatch) {
    final long deleted;
    if (withPrefix) {
      deleted = tables.deletePrefix(META, key);
    } else if (tables.get(META, key) != null) {
      tables.delete(META, key);
      deleted = 1;
    } else {
      deleted = 0;
    }
    if (deleted == 0) {
      throw new KeyNotExistsException(key);
    }
    if (needWatch) {
      notifier.notifyDelete(key, withPrefix);
    }
  }

  /** {@inheritDoc} */
  @Override
  public SortedMap<String, byte[]> list(final String prefix) {
    final SortedMap<String, byte[]> result = new TreeMap<>();
    tables.scan(META, prefix, (key, value) -> {
      result.put(key, value);
      return true;
    });
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public long count(final String prefix) {
    final long[] count = {0};
    tables.scan(META, prefix, (key, value) -> {
      count[0]++;
      return true;
    });
    return count[0];
  }

  /** {@inheritDoc} */
  @Override
  public WatchSubscription watch(final String prefix) {
    return hub.subscribe(prefix);
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    hub.closeAll();
    tables.close();
  }
}
