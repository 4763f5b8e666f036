package org.waabox.filedex.spring;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.waabox.filedex.Mode;

/**
 * Configuration properties for filedex, mapped from the {@code filedex.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code filedex.mode} - {@code local} (default) or
 *       {@code cluster}.</li>
 *   <li>{@code filedex.meta-store} - rocksdb, sqlite (default), mysql,
 *       postgres or dynamodb.</li>
 *   <li>{@code filedex.file-list} - sqlite (default), mysql, postgres,
 *       duckdb, rocksdb or dynamodb.</li>
 *   <li>{@code filedex.data-dir} - the directory of the embedded
 *       engines.</li>
 *   <li>{@code filedex.jdbc.*}, {@code filedex.dynamodb.*},
 *       {@code filedex.etcd.*} and {@code filedex.cache.*} - per backend
 *       settings.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "filedex")
public class FiledexProperties {

  /** The deployment mode. */
  private Mode mode = Mode.LOCAL;

  /** The meta store engine. */
  private MetaStoreKind metaStore = MetaStoreKind.SQLITE;

  /** The file list engine. */
  private FileListKind fileList = FileListKind.SQLITE;

  /** The directory of the embedded engines. */
  private String dataDir = "./data/filedex";

  /** The client-server SQL settings. */
  private final Jdbc jdbc = new Jdbc();

  /** The DynamoDB settings. */
  private final DynamoDb dynamodb = new DynamoDb();

  /** The etcd settings. */
  private final Etcd etcd = new Etcd();

  /** The disk file cache settings. */
  private final Cache cache = new Cache();

  /**
   * Returns the deployment mode.
   *
   * @return the mode, never null
   */
  public Mode getMode() {
    return mode;
  }

  /**
   * Sets the deployment mode.
   *
   * @param theMode the mode, never null
   */
  public void setMode(final Mode theMode) {
    mode = theMode;
  }

  /**
   * Returns the meta store engine.
   *
   * @return the engine, never null
   */
  public MetaStoreKind getMetaStore() {
    return metaStore;
  }

  /**
   * Sets the meta store engine.
   *
   * @param theMetaStore the engine, never null
   */
  public void setMetaStore(final MetaStoreKind theMetaStore) {
    metaStore = theMetaStore;
  }

  /**
   * Returns the file list engine.
   *
   * @return the engine, never null
   */
  public FileListKind getFileList() {
    return fileList;
  }

  /**
   * Sets the file list engine.
   *
   * @param theFileList the engine, never null
   */
  public void setFileList(final FileListKind theFileList) {
    fileList = theFileList;
  }

  /**
   * Returns the directory of the embedded engines.
   *
   * @return the directory, never null
   */
  public String getDataDir() {
    return dataDir;
  }

  /**
   * Sets the directory of the embedded engines.
   *
   * @param theDataDir the directory, never null
   */
  public void setDataDir(final String theDataDir) {
    dataDir = theDataDir;
  }

  /** @return the client-server SQL settings, never null */
  public Jdbc getJdbc() {
    return jdbc;
  }

  /** @return the DynamoDB settings, never null */
  public DynamoDb getDynamodb() {
    return dynamodb;
  }

  /** @return the etcd settings, never null */
  public Etcd getEtcd() {
    return etcd;
  }

  /** @return the disk file cache settings, never null */
  public Cache getCache() {
    return cache;
  }

  /** The meta store engines. */
  public enum MetaStoreKind {

    ROCKSDB(false),
    SQLITE(false),
    MYSQL(true),
    POSTGRES(true),
    DYNAMODB(true);

    /** Whether every node sees the same data. */
    private final boolean distributed;

    MetaStoreKind(final boolean isDistributed) {
      distributed = isDistributed;
    }

    /**
     * Tells whether the engine is shared across nodes.
     *
     * @return false for the embedded engines
     */
    public boolean distributed() {
      return distributed;
    }
  }

  /** The file list engines. */
  public enum FileListKind {
    SQLITE, MYSQL, POSTGRES, DUCKDB, ROCKSDB, DYNAMODB
  }

  /** Settings of the MySQL and PostgreSQL engines. */
  public static class Jdbc {

    /** The JDBC url. */
    private String url;

    /** The user name. */
    private String username;

    /** The password. */
    private String password;

    /** The maximum number of pooled connections. */
    private int maxPoolSize = 10;

    public String getUrl() {
      return url;
    }

    public void setUrl(final String theUrl) {
      url = theUrl;
    }

    public String getUsername() {
      return username;
    }

    public void setUsername(final String theUsername) {
      username = theUsername;
    }

    public String getPassword() {
      return password;
    }

    public void setPassword(final String thePassword) {
      password = thePassword;
    }

    public int getMaxPoolSize() {
      return maxPoolSize;
    }

    public void setMaxPoolSize(final int theMaxPoolSize) {
      maxPoolSize = theMaxPoolSize;
    }
  }

  /** Settings of the DynamoDB engine. */
  public static class DynamoDb {

    /** The AWS region. */
    private String region = "us-east-1";

    /** An endpoint override, e.g. a local DynamoDB. */
    private String endpoint;

    /** The table name prefix. */
    private String tablePrefix = "filedex_";

    public String getRegion() {
      return region;
    }

    public void setRegion(final String theRegion) {
      region = theRegion;
    }

    public String getEndpoint() {
      return endpoint;
    }

    public void setEndpoint(final String theEndpoint) {
      endpoint = theEndpoint;
    }

    public String getTablePrefix() {
      return tablePrefix;
    }

    public void setTablePrefix(final String theTablePrefix) {
      tablePrefix = theTablePrefix;
    }
  }

  /** Settings of the etcd coordinator, used in cluster mode. */
  public static class Etcd {

    /** The etcd endpoints. */
    private List<String> endpoints =
        new ArrayList<>(List.of("http://localhost:2379"));

    /** The key prefix. */
    private String prefix = "/filedex";

    public List<String> getEndpoints() {
      return endpoints;
    }

    public void setEndpoints(final List<String> theEndpoints) {
      endpoints = theEndpoints;
    }

    public String getPrefix() {
      return prefix;
    }

    public void setPrefix(final String thePrefix) {
      prefix = thePrefix;
    }
  }

  /** Settings of the disk file cache. */
  public static class Cache {

    /** Whether a disk file cache bean is created. */
    private boolean enabled = false;

    /** The cache directory, {@code {data-dir}/cache} when unset. */
    private String dir;

    /** The capacity in bytes. */
    private long capacityBytes = 1024L * 1024L * 1024L;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(final boolean isEnabled) {
      enabled = isEnabled;
    }

    public String getDir() {
      return dir;
    }

    public void setDir(final String theDir) {
      dir = theDir;
    }

    public long getCapacityBytes() {
      return capacityBytes;
    }

    public void setCapacityBytes(final long theCapacityBytes) {
      capacityBytes = theCapacityBytes;
    }
  }
}
