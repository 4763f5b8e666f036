package org.waabox.filedex.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.BackendException;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.db.ChangeNotifier;
import org.waabox.filedex.db.Db;
import org.waabox.filedex.db.DbStats;
import org.waabox.filedex.db.WatchHub;
import org.waabox.filedex.db.WatchSubscription;
import org.waabox.filedex.key.KvKey;
import org.waabox.filedex.key.KvKeys;

/**
 * A {@link Db} stored in the SQL table {@code meta}.
 *
 * <p>Keys are split into {@code module}, {@code key1} and {@code key2}
 * columns with a unique index over the three. A prefix matches the module
 * exactly, {@code key1} exactly when given and {@code key2} by prefix;
 * {@code %} and {@code _} in a prefix match only themselves.
 *
 * <p>Watches are served in-process by a {@link WatchHub}. Watched
 * mutations go to the configured {@link ChangeNotifier}, the hub itself
 * unless the store runs under a cluster coordinator.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class JdbcDb implements Db {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(JdbcDb.class);

  /** Escapes wildcards in prefix patterns; a backslash is not portable,
   * MySQL reads it as a string escape. */
  private static final char LIKE_ESCAPE = '!';

  /** The connection handling, never null. */
  private final SqlExecutor executor;

  /** The engine dialect, never null. */
  private final SqlDialect dialect;

  /** Local watchers. */
  private final WatchHub hub = new WatchHub();

  /** Receives watched mutations, never null. */
  private final ChangeNotifier notifier;

  /** Whether the engine is shared across nodes. */
  private final boolean distributed;

  /**
   * Creates a store that notifies its own watchers.
   *
   * @param theExecutor the connection handling, never null
   * @param theDialect the engine dialect, never null
   * @param isDistributed whether the engine is shared across nodes
   */
  public JdbcDb(final SqlExecutor theExecutor, final SqlDialect theDialect,
      final boolean isDistributed) {
    this(theExecutor, theDialect, isDistributed, null);
  }

  /**
   * Creates a store.
   *
   * @param theExecutor the connection handling, never null
   * @param theDialect the engine dialect, never null
   * @param isDistributed whether the engine is shared across nodes
   * @param theNotifier receives watched mutations, null for the local hub
   */
  public JdbcDb(final SqlExecutor theExecutor, final SqlDialect theDialect,
      final boolean isDistributed, final ChangeNotifier theNotifier) {
    executor = Objects.requireNonNull(theExecutor, "executor cannot be null");
    dialect = Objects.requireNonNull(theDialect, "dialect cannot be null");
    distributed = isDistributed;
    notifier = theNotifier == null ? hub : theNotifier;
  }

  /** {@inheritDoc} */
  @Override
  public void createTable() {
    final List<String> ddl = CatalogSchema.metaTables(dialect);
    write("create table", conn -> {
      try (Statement stmt = conn.createStatement()) {
        for (final String sql : ddl) {
          stmt.execute(sql);
        }
      }
      for (final IndexDef index : CatalogSchema.META_INDEXES) {
        try (Statement stmt = conn.createStatement()) {
          stmt.execute(dialect.createIndex(index));
        } catch (final SQLException e) {
          if (!dialect.isIndexAlreadyExists(e)) {
            throw e;
          }
        }
      }
      return null;
    });
    log.info("[{}] meta table ready", dialect.tag());
  }

  /** {@inheritDoc} */
  @Override
  public DbStats stats() {
    final long keys = read("stats", conn -> {
      try (PreparedStatement ps =
          conn.prepareStatement("SELECT COUNT(*) FROM meta");
           ResultSet rs = ps.executeQuery()) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    });
    return new DbStats(0, keys);
  }

  /** {@inheritDoc} */
  @Override
  public byte[] get(final String key) {
    final KvKey kv = KvKeys.parse(key);
    final byte[] value = read("get", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT value FROM"
          + " meta WHERE module = ? AND key1 = ? AND key2 = ?")) {
        bind(ps, kv);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next() ? rs.getBytes(1) : null;
        }
      }
    });
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
    final KvKey kv = KvKeys.parse(key);
    write("put", conn -> {
      if (update(conn, kv, value) > 0) {
        return null;
      }
      try (PreparedStatement ps = conn.prepareStatement("INSERT INTO meta"
          + " (module, key1, key2, value) VALUES (?, ?, ?, ?)")) {
        bind(ps, kv);
        ps.setBytes(4, value);
        ps.executeUpdate();
      } catch (final SQLException e) {
        if (!dialect.isUniqueViolation(e)) {
          throw e;
        }
        update(conn, kv, value);
      }
      return null;
    });
    if (needWatch) {
      notifier.notifyPut(key, value);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void delete(final String key, final boolean withPrefix,
      final boolean needWatch) {
    final KvKey kv = KvKeys.parse(key);
    final int deleted = write("delete", conn -> {
      if (withPrefix) {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM meta"
            + " WHERE " + prefixPredicate(kv))) {
          bindPrefix(ps, kv);
          return ps.executeUpdate();
        }
      }
      try (PreparedStatement ps = conn.prepareStatement("DELETE FROM meta"
          + " WHERE module = ? AND key1 = ? AND key2 = ?")) {
        bind(ps, kv);
        return ps.executeUpdate();
      }
    });
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
    final KvKey kv = KvKeys.parse(prefix);
    return read("list", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT module, key1,"
          + " key2, value FROM meta WHERE " + prefixPredicate(kv))) {
        bindPrefix(ps, kv);
        final SortedMap<String, byte[]> result = new TreeMap<>();
        try (ResultSet rs = ps.executeQuery()) {
          while (rs.next()) {
            final String key2 = rs.getString(3);
            if (key2.startsWith(kv.key2())) {
              result.put(KvKeys.build(rs.getString(1), rs.getString(2), key2),
                  rs.getBytes(4));
            }
          }
        }
        return result;
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public long count(final String prefix) {
    final KvKey kv = KvKeys.parse(prefix);
    return read("count", conn -> {
      try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM"
          + " meta WHERE " + prefixPredicate(kv))) {
        bindPrefix(ps, kv);
        try (ResultSet rs = ps.executeQuery()) {
          return rs.next() ? rs.getLong(1) : 0L;
        }
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public WatchSubscription watch(final String prefix) {
    return hub.subscribe(prefix);
  }

  /** {@inheritDoc} */
  @Override
  public boolean distributed() {
    return distributed;
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    hub.closeAll();
    executor.close();
  }

  /** Runs read-only work, wrapping database errors.
   *
   * @param operation the operation name.
   * @param work the work.
   * @return the work result.
   */
  private <T> T read(final String operation, final SqlWork<T> work) {
    try {
      return executor.read(work);
    } catch (final SQLException e) {
      throw new BackendException("[" + dialect.tag() + "] meta " + operation
          + " failed", e);
    }
  }

  /** Runs mutating work, wrapping database errors.
   *
   * @param operation the operation name.
   * @param work the work.
   * @return the work result.
   */
  private <T> T write(final String operation, final SqlWork<T> work) {
    try {
      return executor.write(work);
    } catch (final SQLException e) {
      throw new BackendException("[" + dialect.tag() + "] meta " + operation
          + " failed", e);
    }
  }

  /** Overwrites the value of an existing row.
   *
   * @param conn the connection.
   * @param kv the key columns.
   * @param value the new value.
   * @return the number of updated rows.
   * @throws SQLException on database errors.
   */
  private static int update(final Connection conn, final KvKey kv,
      final byte[] value) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement("UPDATE meta SET"
        + " value = ? WHERE module = ? AND key1 = ? AND key2 = ?")) {
      ps.setBytes(1, value);
      ps.setString(2, kv.module());
      ps.setString(3, kv.key1());
      ps.setString(4, kv.key2());
      return ps.executeUpdate();
    }
  }

  /** Binds the three key columns from the first parameter.
   *
   * @param ps the statement.
   * @param kv the key columns.
   * @throws SQLException on binding errors.
   */
  private static void bind(final PreparedStatement ps, final KvKey kv)
      throws SQLException {
    ps.setString(1, kv.module());
    ps.setString(2, kv.key1());
    ps.setString(3, kv.key2());
  }

  /** Renders the predicate of a prefix match.
   *
   * @param kv the prefix columns.
   * @return the predicate, never null.
   */
  private static String prefixPredicate(final KvKey kv) {
    final StringBuilder sql = new StringBuilder("module = ?");
    if (!kv.key1().isEmpty()) {
      sql.append(" AND key1 = ?");
      if (!kv.key2().isEmpty()) {
        sql.append(" AND key2 LIKE ? ESCAPE '").append(LIKE_ESCAPE)
            .append("'");
      }
    }
    return sql.toString();
  }

  /** Binds the parameters of {@link #prefixPredicate}.
   *
   * @param ps the statement.
   * @param kv the prefix columns.
   * @throws SQLException on binding errors.
   */
  private static void bindPrefix(final PreparedStatement ps, final KvKey kv)
      throws SQLException {
    ps.setString(1, kv.module());
    if (!kv.key1().isEmpty()) {
      ps.setString(2, kv.key1());
      if (!kv.key2().isEmpty()) {
        ps.setString(3, escapeLike(kv.key2()) + "%");
      }
    }
  }

  /** Escapes the {@code LIKE} wildcards of a literal.
   *
   * @param value the literal, never null.
   * @return the pattern matching exactly the literal, never null.
   */
  static String escapeLike(final String value) {
    final StringBuilder pattern = new StringBuilder(value.length() + 8);
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c == LIKE_ESCAPE || c == '%' || c == '_') {
        pattern.append(LIKE_ESCAPE);
      }
      pattern.append(c);
    }
    return pattern.toString();
  }
}
