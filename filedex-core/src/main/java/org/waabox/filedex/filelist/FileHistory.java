package org.waabox.filedex.filelist;

import java.util.List;

import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;

/**
 * An append-only record of the files that were ever merged away or
 * dropped from the catalog, kept for audits and replays.
 *
 * <p>History rows never touch the live catalog or its statistics. A file
 * recorded twice is kept once.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface FileHistory {

  /**
   * Records one file.
   *
   * @param file the file key, never null
   * @param meta the file metadata, never null
   */
  void addHistory(String file, FileMeta meta);

  /**
   * Records files in chunks; each chunk is applied atomically.
   *
   * @param files the files, never null
   */
  void batchAddHistory(List<FileKey> files);
}
