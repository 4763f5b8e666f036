package org.waabox.filedex.model;

import java.util.Locale;

/**
 * The kind of data a stream holds.
 *
 * <p>The wire name, used inside file keys and stream keys, is the lower
 * case constant name.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum StreamType {

  LOGS,
  METRICS,
  TRACES,
  METADATA,
  ENRICHMENT_TABLES,
  FILE_LIST,
  INDEX;

  /**
   * Resolves a stream type from its wire name.
   *
   * @param name the wire name, case insensitive, never null
   *
   * @return the stream type, never null
   *
   * @throws IllegalArgumentException if the name is unknown
   */
  public static StreamType fromName(final String name) {
    return valueOf(name.toUpperCase(Locale.ROOT));
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
