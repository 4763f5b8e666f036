package org.waabox.filedex.rocksdb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.filelist.StreamStatsAggregator;
import org.waabox.filedex.model.DeletedFile;
import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.PartitionTimeLevel;
import org.waabox.filedex.model.PkRange;
import org.waabox.filedex.model.StreamStats;
import org.waabox.filedex.model.StreamType;

/** Tests for {@link RocksDbFileList}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RocksDbFileListTest {

  /** 2022-10-03T10:15:00Z in microseconds. */
  private static final long T0 = 1664792100L * 1_000_000L;

  /** One hour in microseconds. */
  private static final long HOUR = 3600L * 1_000_000L;

  @TempDir
  Path dir;

  /** The insertion clock, in microseconds. */
  private final AtomicLong clock = new AtomicLong(T0);

  private RocksDbFileList fileList;

  @BeforeEach
  void setUp() {
    fileList = new RocksDbFileList(RocksDbConfig.create(dir), clock::get);
    fileList.createTable();
    fileList.createTableIndex();
  }

  @AfterEach
  void tearDown() {
    fileList.close();
  }

  @Test
  void whenAdding_givenExistingFile_shouldKeepFirstEntry() {
    final FileMeta first = meta(T0, T0 + 10);
    fileList.add(key("10", "a.parquet"), first);
    fileList.add(key("10", "a.parquet"), meta(T0, T0 + 99));

    assertEquals(first, fileList.get(key("10", "a.parquet")));
    assertEquals(1, fileList.len());
  }

  @Test
  void whenGetting_givenMissingFile_shouldFail() {
    assertThrows(KeyNotExistsException.class,
        () -> fileList.get(key("10", "missing.parquet")));
    assertFalse(fileList.contains(key("10", "missing.parquet")));
  }

  @Test
  void whenBatchAdding_givenExistingFile_shouldInsertTheRest() {
    fileList.add(key("10", "f3.parquet"), meta(T0, T0 + 1));
    final List<FileKey> files = new ArrayList<>();
    for (int i = 0; i < 130; i++) {
      files.add(FileKey.of(key("10", "f" + i + ".parquet"),
          meta(T0, T0 + 1)));
    }

    fileList.batchAdd(files);

    assertEquals(130, fileList.len());
  }

  @Test
  void whenQuerying_givenHourPartitions_shouldScanAndFilterOverlap() {
    fileList.add(key("10", "hit.parquet"), meta(T0 + 10, T0 + 20));
    fileList.add(key("10", "miss.parquet"), meta(T0 + 21, T0 + 30));
    fileList.add(key("12", "later.parquet"),
        meta(T0 + 2 * HOUR, T0 + 2 * HOUR + 5));

    final List<FileKey> found = fileList.query("org1", StreamType.LOGS,
        "default", PartitionTimeLevel.HOURLY, T0 + 15, T0 + 20);

    assertEquals(List.of(key("10", "hit.parquet")),
        found.stream().map(FileKey::key).toList());
  }

  @Test
  void whenQuerying_givenWindowOverTwoDays_shouldScanDays() {
    fileList.add(key("10", "a.parquet"), meta(T0, T0 + 10));
    fileList.add(key("12", "b.parquet"),
        meta(T0 + 2 * HOUR, T0 + 2 * HOUR + 5));

    final List<FileKey> found = fileList.query("org1", StreamType.LOGS,
        "default", PartitionTimeLevel.UNSET, T0 - 72 * HOUR, T0 + 72 * HOUR);

    assertEquals(2, found.size());
  }

  @Test
  void whenRemoving_givenFile_shouldDropIt() {
    fileList.add(key("10", "a.parquet"), meta(T0, T0 + 10));

    fileList.remove(key("10", "a.parquet"));
    fileList.remove(key("10", "a.parquet"));

    assertTrue(fileList.isEmpty());
  }

  @Test
  void whenComputingStats_givenInsertionWindow_shouldOnlyCountNewFiles() {
    fileList.add(key("10", "a.parquet"), meta(T0, T0 + 10));
    clock.addAndGet(10_000_000L);
    final long firstMark = fileList.getMaxPkValue();
    fileList.add(key("10", "b.parquet"), meta(T0 + 5, T0 + 50));
    clock.addAndGet(10_000_000L);
    final long secondMark = fileList.getMaxPkValue();

    final StreamStats all = fileList.stats("org1", null, null, PkRange.ALL)
        .get("org1/logs/default");
    final StreamStats delta = fileList.stats("org1", StreamType.LOGS,
        "default", PkRange.of(firstMark, secondMark))
        .get("org1/logs/default");

    assertEquals(2, all.fileNum());
    assertEquals(T0, all.docTimeMin());
    assertEquals(T0 + 50, all.docTimeMax());
    assertEquals(1, delta.fileNum());
    assertEquals(T0 + 5, delta.docTimeMin());
  }

  @Test
  void whenSettingStreamStats_givenDeltas_shouldAccumulateAndReset() {
    final Map<String, StreamStats> deltas = StreamStatsAggregator.deltas(
        List.of(FileKey.of(key("10", "a.parquet"), meta(T0, T0 + 10))));

    fileList.setStreamStats("org1", deltas);
    fileList.setStreamStats("org1", deltas);
    assertEquals(2, fileList.getStreamStats("org1", StreamType.LOGS,
        "default").get("org1/logs/default").fileNum());

    fileList.resetStreamStatsMinTs("org1", "org1/logs/default", T0 - 1);
    assertEquals(T0 - 1, fileList.getStreamStats("org1", null, null)
        .get("org1/logs/default").docTimeMin());

    fileList.resetStreamStats();
    assertEquals(StreamStats.EMPTY, fileList.getStreamStats("org1", null,
        null).get("org1/logs/default"));

    fileList.deleteStreamStats("org1", StreamType.LOGS, "default");
    assertTrue(fileList.getStreamStats("org1", null, null).isEmpty());
  }

  @Test
  void whenAddingAndRemoving_givenFiles_shouldConvergeStreamStats() {
    fileList.add(key("10", "f3.parquet"), meta(T0, T0 + 1));
    final List<FileKey> files = new ArrayList<>();
    for (int i = 0; i < 130; i++) {
      files.add(FileKey.of(key("10", "f" + i + ".parquet"),
          meta(T0, T0 + 1)));
    }
    fileList.batchAdd(files);
    fileList.batchRemove(List.of(key("10", "f0.parquet"),
        key("10", "f1.parquet"), key("10", "missing.parquet")));

    final StreamStats stats = fileList.getStreamStats("org1",
        StreamType.LOGS, "default").get("org1/logs/default");
    assertEquals(128, stats.fileNum());
    assertEquals(1280, stats.docNum());
    assertEquals(fileList.stats("org1", null, null, null)
        .get("org1/logs/default").fileNum(), stats.fileNum());
  }

  @Test
  void whenBatchAdding_givenSameFileTwice_shouldStoreAndCountItOnce() {
    fileList.batchAdd(List.of(FileKey.of(key("10", "a.parquet"),
        meta(T0, T0 + 1)), FileKey.of(key("10", "a.parquet"),
        meta(T0, T0 + 9))));

    assertEquals(1, fileList.len());
    assertEquals(T0 + 1, fileList.get(key("10", "a.parquet")).maxTs());
    assertEquals(1, fileList.getStreamStats("org1", null, null)
        .get("org1/logs/default").fileNum());
  }

  @Test
  void whenSettingStreamStats_givenConcurrentCallers_shouldAddEveryDelta()
      throws Exception {
    final StreamStats one = new StreamStats(1, 1, T0, T0 + 1, 1, 1);
    final ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      final List<Future<?>> calls = new ArrayList<>();
      for (int i = 0; i < 400; i++) {
        calls.add(pool.submit(() -> fileList.setStreamStats("org1",
            Map.of("org1/logs/default", one))));
      }
      for (final Future<?> call : calls) {
        call.get();
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(400, fileList.getStreamStats("org1", null, null)
        .get("org1/logs/default").fileNum());
  }

  @Test
  void whenQueryingDeleted_givenLimit_shouldReturnOldestFirst() {
    fileList.batchAddDeleted("org1", 300, List.of(key("10", "c.parquet")));
    fileList.batchAddDeleted("org1", 100, List.of(key("10", "a.parquet")));
    fileList.batchAddDeleted("org1", 200, List.of(key("10", "b.parquet")));

    final List<DeletedFile> oldest = fileList.queryDeleted("org1", 1000, 2);

    assertEquals(List.of(key("10", "a.parquet"), key("10", "b.parquet")),
        oldest.stream().map(DeletedFile::key).toList());
    assertTrue(fileList.queryDeleted("org1", 0, 10).isEmpty());

    fileList.batchRemoveDeleted(List.of(key("10", "a.parquet")));
    assertEquals(2, fileList.queryDeleted("org1", 1000, 10).size());
  }

  @Test
  void whenGettingMinTs_givenFilesBeforeBaseTime_shouldIgnoreThem() {
    fileList.add(key("10", "old.parquet"), meta(5, 10));
    fileList.add(key("10", "a.parquet"), meta(T0 + 7, T0 + 10));

    assertEquals(T0 + 7, fileList.getMinTs("org1", StreamType.LOGS,
        "default"));
  }

  @Test
  void whenReopening_givenInitialisedCatalog_shouldRememberIt() {
    fileList.add(key("10", "a.parquet"), meta(T0, T0 + 10));
    fileList.setInitialised();
    fileList.close();

    fileList = new RocksDbFileList(RocksDbConfig.create(dir), clock::get);

    assertTrue(fileList.getInitialised());
    assertTrue(fileList.contains(key("10", "a.parquet")));
  }

  @Test
  void whenClearing_shouldRemoveEveryFile() {
    fileList.add(key("10", "a.parquet"), meta(T0, T0 + 10));
    fileList.add(key("11", "b.parquet"), meta(T0, T0 + 10));

    fileList.clear();

    assertTrue(fileList.list().isEmpty());
  }

  private static String key(final String hour, final String file) {
    return "files/org1/logs/default/2022/10/03/" + hour + "/" + file;
  }

  private static FileMeta meta(final long min, final long max) {
    return new FileMeta(min, max, 10, 1000, 100);
  }
}
