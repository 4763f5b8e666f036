package org.waabox.filedex.spring;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.Filedex;
import org.waabox.filedex.Mode;
import org.waabox.filedex.cache.DiskFileCache;
import org.waabox.filedex.db.ChangeNotifier;
import org.waabox.filedex.db.CoordinatorNotifier;
import org.waabox.filedex.db.Db;
import org.waabox.filedex.duckdb.DuckDbConfig;
import org.waabox.filedex.duckdb.DuckDbDialect;
import org.waabox.filedex.duckdb.DuckDbExecutor;
import org.waabox.filedex.dynamodb.DynamoDbConfig;
import org.waabox.filedex.dynamodb.DynamoDbDb;
import org.waabox.filedex.dynamodb.DynamoDbFileList;
import org.waabox.filedex.etcd.EtcdConfig;
import org.waabox.filedex.etcd.EtcdDb;
import org.waabox.filedex.filelist.FileList;
import org.waabox.filedex.jdbc.JdbcDb;
import org.waabox.filedex.jdbc.JdbcFileList;
import org.waabox.filedex.jdbc.MysqlDialect;
import org.waabox.filedex.jdbc.PooledSqlExecutor;
import org.waabox.filedex.jdbc.PostgresDialect;
import org.waabox.filedex.jdbc.SqlExecutor;
import org.waabox.filedex.rocksdb.RocksDbConfig;
import org.waabox.filedex.rocksdb.RocksDbDb;
import org.waabox.filedex.rocksdb.RocksDbFileList;
import org.waabox.filedex.spring.FiledexProperties.FileListKind;
import org.waabox.filedex.spring.FiledexProperties.MetaStoreKind;
import org.waabox.filedex.sqlite.SqliteConfig;
import org.waabox.filedex.sqlite.SqliteDialect;
import org.waabox.filedex.sqlite.SqliteWriterActor;

import software.amazon.awssdk.regions.Region;

/**
 * Turns {@link FiledexProperties} into backend handles.
 *
 * <p>The engine choices are resolved once, when the factory is created.
 * Handles of the same SQL engine share one executor, so the meta store and
 * the file list on SQLite go through the same writer thread.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class FiledexBackendFactory {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(FiledexBackendFactory.class);

  /** The configuration, never null. */
  private final FiledexProperties properties;

  /** The deployment mode, never null. */
  private final Mode mode;

  /** The meta store engine, never null. */
  private final MetaStoreKind metaStoreKind;

  /** The file list engine, never null. */
  private final FileListKind fileListKind;

  /** The executors created so far, by engine. */
  private final Map<Engine, SqlExecutor> executors =
      new EnumMap<>(Engine.class);

  /**
   * Creates a factory.
   *
   * @param theProperties the configuration, never null
   *
   * @throws IllegalStateException if cluster mode is requested with an
   *     embedded meta store
   */
  public FiledexBackendFactory(final FiledexProperties theProperties) {
    properties = Objects.requireNonNull(theProperties,
        "properties cannot be null");
    mode = Objects.requireNonNull(theProperties.getMode(),
        "mode cannot be null");
    metaStoreKind = Objects.requireNonNull(theProperties.getMetaStore(),
        "metaStore cannot be null");
    fileListKind = Objects.requireNonNull(theProperties.getFileList(),
        "fileList cannot be null");
    if (mode == Mode.CLUSTER && !metaStoreKind.distributed()) {
      throw new IllegalStateException("Meta store " + metaStoreKind
          + " is node-local and cannot run in cluster mode");
    }
  }

  /**
   * Creates the context from the configured engines.
   *
   * @param fileCache the disk file cache, may be null
   *
   * @return the context, not started, never null
   */
  public Filedex create(final DiskFileCache fileCache) {
    log.info("Creating filedex: mode {}, meta store {}, file list {}", mode,
        metaStoreKind, fileListKind);
    final Filedex.Builder builder = Filedex.builder().mode(mode);
    ChangeNotifier notifier = null;
    if (mode == Mode.CLUSTER) {
      final Db coordinator = coordinator();
      builder.coordinator(coordinator);
      notifier = new CoordinatorNotifier(coordinator);
    }
    return builder
        .metaStore(metaStore(notifier))
        .fileList(fileList())
        .fileCache(fileCache)
        .build();
  }

  /**
   * Creates the etcd coordinator.
   *
   * @return the coordinator, never null
   */
  Db coordinator() {
    final FiledexProperties.Etcd etcd = properties.getEtcd();
    return new EtcdDb(EtcdConfig.create(etcd.getEndpoints(),
        etcd.getPrefix()));
  }

  /**
   * Creates the meta store.
   *
   * @param notifier receives watched mutations, null for local watchers
   *
   * @return the meta store, never null
   */
  Db metaStore(final ChangeNotifier notifier) {
    switch (metaStoreKind) {
      case ROCKSDB:
        return new RocksDbDb(RocksDbConfig.create(dataDir().resolve("meta")),
            notifier);
      case SQLITE:
        return new JdbcDb(executor(Engine.SQLITE), new SqliteDialect(), false,
            notifier);
      case MYSQL:
        return new JdbcDb(executor(Engine.MYSQL), new MysqlDialect(), true,
            notifier);
      case POSTGRES:
        return new JdbcDb(executor(Engine.POSTGRES), new PostgresDialect(),
            true, notifier);
      case DYNAMODB:
        return new DynamoDbDb(dynamoDbConfig(), notifier);
      default:
        throw new IllegalStateException("Unknown meta store "
            + metaStoreKind);
    }
  }

  /**
   * Creates the file list.
   *
   * @return the file list, never null
   */
  FileList fileList() {
    switch (fileListKind) {
      case SQLITE:
        return new JdbcFileList(executor(Engine.SQLITE), new SqliteDialect());
      case MYSQL:
        return new JdbcFileList(executor(Engine.MYSQL), new MysqlDialect());
      case POSTGRES:
        return new JdbcFileList(executor(Engine.POSTGRES),
            new PostgresDialect());
      case DUCKDB:
        return new JdbcFileList(executor(Engine.DUCKDB), new DuckDbDialect());
      case ROCKSDB:
        return new RocksDbFileList(RocksDbConfig.create(
            dataDir().resolve("file_list")));
      case DYNAMODB:
        return new DynamoDbFileList(dynamoDbConfig());
      default:
        throw new IllegalStateException("Unknown file list " + fileListKind);
    }
  }

  /** Returns the executor of an engine, creating it once.
   *
   * @param engine the engine.
   * @return the executor, never null.
   */
  private SqlExecutor executor(final Engine engine) {
    return executors.computeIfAbsent(engine, this::createExecutor);
  }

  private SqlExecutor createExecutor(final Engine engine) {
    switch (engine) {
      case SQLITE:
        return new SqliteWriterActor(SqliteConfig.create(
            dataDir().resolve("filedex.sqlite")));
      case DUCKDB:
        return new DuckDbExecutor(DuckDbConfig.create(
            dataDir().resolve("filedex.duckdb")));
      default:
        return new PooledSqlExecutor(dataSource());
    }
  }

  /** Creates the connection pool of the client-server engines.
   *
   * @return the pool, never null.
   */
  private HikariDataSource dataSource() {
    final FiledexProperties.Jdbc jdbc = properties.getJdbc();
    Objects.requireNonNull(jdbc.getUrl(), "filedex.jdbc.url must be set");
    final HikariConfig config = new HikariConfig();
    config.setJdbcUrl(jdbc.getUrl());
    config.setUsername(jdbc.getUsername());
    config.setPassword(jdbc.getPassword());
    config.setMaximumPoolSize(jdbc.getMaxPoolSize());
    config.setPoolName("filedex");
    log.info("Connecting to {}", jdbc.getUrl());
    return new HikariDataSource(config);
  }

  private DynamoDbConfig dynamoDbConfig() {
    final FiledexProperties.DynamoDb dynamo = properties.getDynamodb();
    return DynamoDbConfig.builder()
        .region(Region.of(dynamo.getRegion()))
        .endpoint(dynamo.getEndpoint() == null
            ? null : URI.create(dynamo.getEndpoint()))
        .tablePrefix(dynamo.getTablePrefix())
        .build();
  }

  /** Returns the data directory, creating it if needed.
   *
   * @return the directory, never null.
   */
  Path dataDir() {
    final Path dir = Paths.get(properties.getDataDir());
    try {
      Files.createDirectories(dir);
    } catch (final IOException e) {
      throw new UncheckedIOException("Cannot create data dir " + dir, e);
    }
    return dir;
  }

  /** The SQL engines, one executor each. */
  private enum Engine {
    SQLITE, MYSQL, POSTGRES, DUCKDB
  }
}
