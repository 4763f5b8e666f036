package org.waabox.filedex.key;

/**
 * The storage columns a file key is split into.
 *
 * @param streamKey the stream key, {@code {org}/{type}/{name}}
 * @param dateKey   the hour partition, {@code YYYY/MM/DD/HH}
 * @param fileName  the file name
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record FileKeyColumns(String streamKey, String dateKey,
    String fileName) {

  /**
   * Returns the organization id, the first segment of the stream key.
   *
   * @return the organization id, never null
   */
  public String org() {
    return FileKeys.orgOf(streamKey);
  }

  /**
   * Returns the full file key these columns were parsed from.
   *
   * @return the file key, never null
   */
  public String toKey() {
    return FileKeys.build(streamKey, dateKey, fileName);
  }
}
