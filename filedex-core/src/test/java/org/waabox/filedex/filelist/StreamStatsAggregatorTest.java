package org.waabox.filedex.filelist;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;
import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.StreamStats;

/**
 * Tests for {@link StreamStatsAggregator}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class StreamStatsAggregatorTest {

  private static final String A =
      "files/default/logs/a/2022/10/03/10/1.parquet";

  private static final String B =
      "files/default/logs/b/2022/10/03/10/1.parquet";

  @Test
  void whenFolding_givenAddsAndRemoves_shouldGroupByStream() {
    final FileMeta meta = new FileMeta(10, 20, 5, 100, 10);

    final Map<String, StreamStats> deltas = StreamStatsAggregator.deltas(
        List.of(FileKey.of(A, meta), FileKey.of(A, meta),
            new FileKey(B, meta, true)));

    assertEquals(new StreamStats(2, 10, 10, 20, 200, 20),
        deltas.get("default/logs/a"));
    assertEquals(new StreamStats(-1, -5, 0, 0, -100, -10),
        deltas.get("default/logs/b"));
  }

  @Test
  void whenConverging_givenDeltasOfAllFiles_shouldEqualFullRecompute() {
    final FileMeta one = new FileMeta(10, 20, 5, 100, 10);
    final FileMeta two = new FileMeta(5, 40, 3, 60, 6);
    final StreamStats stored = StreamStatsAggregator.deltas(
        List.of(FileKey.of(A, one))).get("default/logs/a");

    final StreamStats merged = stored.merge(StreamStatsAggregator.deltas(
        List.of(FileKey.of(A, two))).get("default/logs/a"));

    assertEquals(StreamStatsAggregator.deltas(
        List.of(FileKey.of(A, one), FileKey.of(A, two))).get("default/logs/a"),
        merged);
  }

  @Test
  void whenListingNewStreams_givenStoredRows_shouldReturnOnlyMissingOnes() {
    final Map<String, StreamStats> stored =
        Map.of("default/logs/a", StreamStats.EMPTY);
    final Map<String, StreamStats> deltas = new TreeMap<>();
    deltas.put("default/logs/a", StreamStats.EMPTY);
    deltas.put("default/logs/b", StreamStats.EMPTY);

    assertEquals(List.of("default/logs/b"),
        StreamStatsAggregator.newStreams(stored, deltas));
  }
}
