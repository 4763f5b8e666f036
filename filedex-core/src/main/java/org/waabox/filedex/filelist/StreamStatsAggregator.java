package org.waabox.filedex.filelist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import org.waabox.filedex.key.FileKeys;
import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.StreamStats;

/**
 * Folds file changes into per-stream statistic deltas.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StreamStatsAggregator {

  /** Private constructor to prevent instantiation. */
  private StreamStatsAggregator() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Computes the statistic deltas of a set of file changes.
   *
   * <p>Entries flagged as deleted count as removals, the others as
   * additions.
   *
   * @param files the changed files, never null
   *
   * @return the deltas by stream key, never null
   */
  public static Map<String, StreamStats> deltas(
      final Collection<FileKey> files) {
    Objects.requireNonNull(files, "files cannot be null");
    final Map<String, StreamStats> deltas = new TreeMap<>();
    for (final FileKey file : files) {
      final String streamKey = FileKeys.parseColumns(file.key()).streamKey();
      final StreamStats current =
          deltas.getOrDefault(streamKey, StreamStats.EMPTY);
      deltas.put(streamKey, accumulate(current, file));
    }
    return deltas;
  }

  /**
   * Lists the streams of a set of deltas that have no stored row yet.
   *
   * @param stored the stored statistics by stream key, never null
   * @param deltas the deltas by stream key, never null
   *
   * @return the stream keys needing a zeroed row, in delta order, never null
   */
  public static List<String> newStreams(final Map<String, StreamStats> stored,
      final Map<String, StreamStats> deltas) {
    final List<String> newStreams = new ArrayList<>();
    for (final String streamKey : deltas.keySet()) {
      if (!stored.containsKey(streamKey)) {
        newStreams.add(streamKey);
      }
    }
    return newStreams;
  }

  /** Adds or subtracts a file without clamping, so a delta can go below
   * zero and still cancel an earlier addition once merged.
   *
   * @param current the delta so far.
   * @param file the changed file.
   * @return the new delta, never null.
   */
  private static StreamStats accumulate(final StreamStats current,
      final FileKey file) {
    final FileMeta meta = file.meta();
    if (file.deleted()) {
      return new StreamStats(
          current.fileNum() - 1,
          current.docNum() - meta.records(),
          current.docTimeMin(),
          current.docTimeMax(),
          current.storageSize() - meta.originalSize(),
          current.compressedSize() - meta.compressedSize());
    }
    final long timeMin = current.docTimeMin() == 0
        ? meta.minTs()
        : Math.min(current.docTimeMin(), meta.minTs());
    return new StreamStats(
        current.fileNum() + 1,
        current.docNum() + meta.records(),
        timeMin,
        Math.max(current.docTimeMax(), meta.maxTs()),
        current.storageSize() + meta.originalSize(),
        current.compressedSize() + meta.compressedSize());
  }
}
