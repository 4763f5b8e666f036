package org.waabox.filedex.key;

import java.util.Objects;

import org.waabox.filedex.InvalidKeyException;
import org.waabox.filedex.model.StreamType;

/**
 * Codec for file keys.
 *
 * <p>A file key has exactly nine {@code /} separated segments:
 * {@code files/{org}/{type}/{name}/{YYYY}/{MM}/{DD}/{HH}/{file}}. Any extra
 * separator after the eighth one is kept inside the file name.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileKeys {

  /** The first segment of every file key. */
  public static final String ROOT = "files";

  /** The number of segments of a file key. */
  private static final int SEGMENTS = 9;

  /** Private constructor to prevent instantiation. */
  private FileKeys() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Splits a file key into its storage columns.
   *
   * @param key the file key, never null
   *
   * @return the columns, never null
   *
   * @throws InvalidKeyException if the key has fewer than nine segments or
   *     does not start with {@code files}
   */
  public static FileKeyColumns parseColumns(final String key) {
    Objects.requireNonNull(key, "key cannot be null");
    final String[] parts = key.split("/", SEGMENTS);
    if (parts.length < SEGMENTS) {
      throw new InvalidKeyException("Invalid file key: " + key);
    }
    if (!ROOT.equals(parts[0])) {
      throw new InvalidKeyException("File key must start with '" + ROOT
          + "/': " + key);
    }
    final String streamKey = parts[1] + "/" + parts[2] + "/" + parts[3];
    final String dateKey = parts[4] + "/" + parts[5] + "/" + parts[6]
        + "/" + parts[7];
    return new FileKeyColumns(streamKey, dateKey, parts[8]);
  }

  /**
   * Joins storage columns back into a file key.
   *
   * @param streamKey the stream key, never null
   * @param dateKey the hour partition, never null
   * @param fileName the file name, never null
   *
   * @return the file key, never null
   */
  public static String build(final String streamKey, final String dateKey,
      final String fileName) {
    return ROOT + "/" + streamKey + "/" + dateKey + "/" + fileName;
  }

  /**
   * Builds a stream key.
   *
   * @param org the organization id, never null
   * @param type the stream type, never null
   * @param name the stream name, never null
   *
   * @return {@code {org}/{type}/{name}}, never null
   */
  public static String streamKey(final String org, final StreamType type,
      final String name) {
    return org + "/" + type + "/" + name;
  }

  /**
   * Extracts the organization id from a stream key.
   *
   * @param streamKey the stream key, never null
   *
   * @return the first segment, never null
   *
   * @throws InvalidKeyException if the key has no separator
   */
  public static String orgOf(final String streamKey) {
    final int idx = streamKey.indexOf('/');
    if (idx <= 0) {
      throw new InvalidKeyException("Invalid stream key: " + streamKey);
    }
    return streamKey.substring(0, idx);
  }
}
