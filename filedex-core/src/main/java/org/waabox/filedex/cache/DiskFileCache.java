package org.waabox.filedex.cache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A byte-capacity bounded cache of data files on the local disk.
 *
 * <p>Each entry is a file under the root directory, at the path given by
 * its key. Once the total size goes over the capacity the oldest entries
 * are evicted first, until the cache fits again.
 *
 * <p>Writes use a temporary file followed by an atomic rename, so readers
 * never see a partial file.
 *
 * <p>Thread safety: all methods are synchronized on the cache.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DiskFileCache {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(DiskFileCache.class);

  /** The root directory, never null. */
  private final Path root;

  /** The maximum total size in bytes. */
  private final long capacity;

  /** Cached entries with their size, oldest first. */
  private final Map<String, Long> entries = new LinkedHashMap<>();

  /** The total size of the cached entries, in bytes. */
  private long size;

  /**
   * Creates a new cache.
   *
   * @param theRoot the root directory, created when missing, never null
   * @param theCapacity the maximum total size in bytes, greater than 0
   *
   * @throws UncheckedIOException if the directory cannot be created
   */
  public DiskFileCache(final Path theRoot, final long theCapacity) {
    Objects.requireNonNull(theRoot, "root cannot be null");
    if (theCapacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    root = theRoot;
    capacity = theCapacity;
    try {
      Files.createDirectories(root);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create cache directory: " + root, e);
    }
  }

  /**
   * Stores a file, replacing any previous content under the same key.
   *
   * @param key the file key, never null
   * @param data the content, never null
   *
   * @throws UncheckedIOException if the file cannot be written
   */
  public synchronized void set(final String key, final byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");
    final Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      final Path temp = target.resolveSibling(target.getFileName() + ".tmp");
      Files.write(temp, data);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to cache file: " + key, e);
    }
    final Long previous = entries.remove(key);
    if (previous != null) {
      size -= previous;
    }
    entries.put(key, (long) data.length);
    size += data.length;
    evict();
  }

  /**
   * Reads a cached file.
   *
   * @param key the file key, never null
   *
   * @return the content, empty if the key is not cached
   *
   * @throws UncheckedIOException if the file cannot be read
   */
  public synchronized Optional<byte[]> get(final String key) {
    if (!entries.containsKey(key)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readAllBytes(resolve(key)));
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read cached file: " + key, e);
    }
  }

  /**
   * Tells whether a file is cached.
   *
   * @param key the file key, never null
   *
   * @return true if cached
   */
  public synchronized boolean exist(final String key) {
    return entries.containsKey(key);
  }

  /**
   * Drops a cached file. Missing keys are ignored.
   *
   * @param key the file key, never null
   */
  public synchronized void remove(final String key) {
    final Long length = entries.remove(key);
    if (length != null) {
      size -= length;
      delete(key);
    }
  }

  /**
   * Returns the total cached size.
   *
   * @return the size in bytes
   */
  public synchronized long size() {
    return size;
  }

  /**
   * Returns the number of cached files.
   *
   * @return the count
   */
  public synchronized int len() {
    return entries.size();
  }

  /** Drops the oldest entries until the cache fits its capacity. */
  private void evict() {
    final Iterator<Map.Entry<String, Long>> it = entries.entrySet().iterator();
    while (size > capacity && it.hasNext()) {
      final Map.Entry<String, Long> oldest = it.next();
      it.remove();
      size -= oldest.getValue();
      delete(oldest.getKey());
      log.debug("Evicted '{}' from disk cache", oldest.getKey());
    }
  }

  /** Removes the file of an entry.
   *
   * @param key the file key, never null.
   */
  private void delete(final String key) {
    try {
      Files.deleteIfExists(resolve(key));
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to delete cached file: " + key, e);
    }
  }

  /** Resolves a key under the root, rejecting keys that escape it.
   *
   * @param key the file key, never null.
   * @return the path, never null.
   */
  private Path resolve(final String key) {
    Objects.requireNonNull(key, "key cannot be null");
    final Path path = root.resolve(key).normalize();
    if (!path.startsWith(root.normalize())) {
      throw new IllegalArgumentException("Key escapes cache root: " + key);
    }
    return path;
  }
}
