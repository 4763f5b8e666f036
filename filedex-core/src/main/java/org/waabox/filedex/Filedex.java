package org.waabox.filedex;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.cache.DiskFileCache;
import org.waabox.filedex.db.Db;
import org.waabox.filedex.filelist.FileList;
import org.waabox.filedex.filelist.TombstoneTracker;

/**
 * The application context of the catalog.
 *
 * <p>Holds the one handle of each backend: the meta store, the cluster
 * coordinator and the file list. Handles are created once, by the caller
 * or the Spring Boot starter, and closed by {@link #stop()}.
 *
 * <p>Usage example:
 * <pre>{@code
 * Filedex filedex = Filedex.builder()
 *     .mode(Mode.CLUSTER)
 *     .metaStore(dynamoDb)
 *     .coordinator(etcdDb)
 *     .fileList(postgresFileList)
 *     .build();
 *
 * filedex.start();
 *
 * List<FileKey> files = filedex.fileList().query("default",
 *     StreamType.LOGS, "olympics", PartitionTimeLevel.HOURLY, start, end);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Filedex {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Filedex.class);

  /** The deployment mode, never null. */
  private final Mode mode;

  /** The durable key-value store, never null. */
  private final Db metaStore;

  /** The watch-capable coordinator; the meta store in local mode. */
  private final Db coordinator;

  /** The file catalog, never null. */
  private final FileList fileList;

  /** The tombstone tracker over the file catalog, never null. */
  private final TombstoneTracker tombstones;

  /** The optional disk cache, may be null. */
  private final DiskFileCache fileCache;

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /**
   * Creates a new context from a validated builder.
   *
   * @param builder the builder, never null
   */
  private Filedex(final Builder builder) {
    mode = builder.mode;
    metaStore = builder.metaStore;
    coordinator = builder.coordinator == null
        ? builder.metaStore : builder.coordinator;
    fileList = builder.fileList;
    fileCache = builder.fileCache;
    tombstones = new TombstoneTracker(fileList);
  }

  /**
   * Creates the backing tables and marks the catalog as loaded.
   *
   * <p>Order: meta store, coordinator, file list tables, file list
   * indexes.
   *
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Filedex has already been started");
    }
    metaStore.createTable();
    if (coordinator != metaStore) {
      coordinator.createTable();
    }
    fileList.createTable();
    fileList.createTableIndex();
    fileList.setInitialised();
    log.info("Filedex started in {} mode", mode);
  }

  /** Closes every backend handle. Calling it twice has no effect. */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    fileList.close();
    if (coordinator != metaStore) {
      coordinator.close();
    }
    metaStore.close();
    log.info("Filedex stopped");
  }

  /**
   * Returns the deployment mode.
   *
   * @return the mode, never null
   */
  public Mode mode() {
    return mode;
  }

  /**
   * Returns the durable key-value store.
   *
   * @return the meta store, never null
   */
  public Db metaStore() {
    return metaStore;
  }

  /**
   * Returns the store that carries cluster-wide watches.
   *
   * @return the coordinator, never null
   */
  public Db coordinator() {
    return coordinator;
  }

  /**
   * Returns the file catalog.
   *
   * @return the file list, never null
   */
  public FileList fileList() {
    return fileList;
  }

  /**
   * Returns the tombstone tracker of the file catalog.
   *
   * @return the tracker, never null
   */
  public TombstoneTracker tombstones() {
    return tombstones;
  }

  /**
   * Returns the disk cache, when one was configured.
   *
   * @return the cache, or empty
   */
  public Optional<DiskFileCache> fileCache() {
    return Optional.ofNullable(fileCache);
  }

  /**
   * Tells whether {@link #start()} completed.
   *
   * @return true once started
   */
  public boolean isStarted() {
    return started.get();
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * A builder for {@link Filedex} instances.
   *
   * <p>Required: {@code metaStore} and {@code fileList}. In cluster mode the
   * meta store must be distributed and a coordinator is required.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The deployment mode. */
    private Mode mode = Mode.LOCAL;

    /** The meta store. */
    private Db metaStore;

    /** The coordinator. */
    private Db coordinator;

    /** The file list. */
    private FileList fileList;

    /** The disk cache. */
    private DiskFileCache fileCache;

    /** Private constructor, use {@link Filedex#builder()}. */
    private Builder() {
    }

    /**
     * Sets the deployment mode, {@link Mode#LOCAL} by default.
     *
     * @param theMode the mode, never null
     * @return this builder for chaining, never null
     */
    public Builder mode(final Mode theMode) {
      mode = Objects.requireNonNull(theMode, "mode cannot be null");
      return this;
    }

    /**
     * Sets the durable key-value store.
     *
     * @param theMetaStore the store, never null
     * @return this builder for chaining, never null
     */
    public Builder metaStore(final Db theMetaStore) {
      metaStore = theMetaStore;
      return this;
    }

    /**
     * Sets the cluster coordinator.
     *
     * @param theCoordinator the coordinator, may be null in local mode
     * @return this builder for chaining, never null
     */
    public Builder coordinator(final Db theCoordinator) {
      coordinator = theCoordinator;
      return this;
    }

    /**
     * Sets the file catalog.
     *
     * @param theFileList the file list, never null
     * @return this builder for chaining, never null
     */
    public Builder fileList(final FileList theFileList) {
      fileList = theFileList;
      return this;
    }

    /**
     * Sets the disk cache.
     *
     * @param theFileCache the cache, may be null
     * @return this builder for chaining, never null
     */
    public Builder fileCache(final DiskFileCache theFileCache) {
      fileCache = theFileCache;
      return this;
    }

    /**
     * Builds the context.
     *
     * @return a new context, never null
     *
     * @throws NullPointerException if the meta store or file list is
     *     missing
     * @throws IllegalStateException if cluster mode is requested with a
     *     node-local meta store or without a coordinator
     */
    public Filedex build() {
      Objects.requireNonNull(metaStore, "metaStore cannot be null");
      Objects.requireNonNull(fileList, "fileList cannot be null");
      if (mode == Mode.CLUSTER) {
        if (!metaStore.distributed()) {
          throw new IllegalStateException("Meta store "
              + metaStore.getClass().getSimpleName()
              + " is node-local and cannot run in cluster mode");
        }
        if (coordinator == null) {
          throw new IllegalStateException(
              "Cluster mode requires a coordinator");
        }
      }
      return new Filedex(this);
    }
  }
}
