package org.waabox.filedex.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.filedex.DisallowedQueryException;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.filelist.StreamStatsAggregator;
import org.waabox.filedex.model.DeletedFile;
import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.MergeJob;
import org.waabox.filedex.model.MergeJobStatus;
import org.waabox.filedex.model.PartitionTimeLevel;
import org.waabox.filedex.model.PkRange;
import org.waabox.filedex.model.StreamStats;
import org.waabox.filedex.model.StreamType;

/** Behaviour shared by every {@link JdbcFileList} engine.
 *
 * <p>Subclasses provide a fresh, empty catalog per test.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
abstract class JdbcFileListContract {

  /** 2022-10-03T10:15:00Z in microseconds. */
  static final long T0 = 1664792100L * 1_000_000L;

  /** One second in microseconds. */
  static final long SECOND = 1_000_000L;

  /** The catalog under test. */
  private JdbcFileList fileList;

  /** Creates the catalog under test, tables not yet created.
   *
   * @return the catalog, never null.
   */
  abstract JdbcFileList createFileList();

  @BeforeEach
  void setUpFileList() {
    fileList = createFileList();
    fileList.createTable();
    fileList.createTableIndex();
  }

  @AfterEach
  void tearDownFileList() {
    fileList.close();
  }

  @Test
  void whenCreatingTables_givenExistingTables_shouldSucceed() {
    fileList.createTable();
    fileList.createTableIndex();

    assertEquals(0, fileList.len());
  }

  @Test
  void whenAdding_givenNewFile_shouldBeReadable() {
    final FileMeta meta = meta(T0, T0 + 10 * SECOND, 100);
    fileList.add(key("logs", "a.parquet"), meta);

    assertTrue(fileList.contains(key("logs", "a.parquet")));
    assertEquals(meta, fileList.get(key("logs", "a.parquet")));
  }

  @Test
  void whenAdding_givenExistingFile_shouldKeepFirstEntry() {
    final FileMeta first = meta(T0, T0 + SECOND, 10);
    fileList.add(key("logs", "a.parquet"), first);

    fileList.add(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 99));

    assertEquals(1, fileList.len());
    assertEquals(first, fileList.get(key("logs", "a.parquet")));
  }

  @Test
  void whenGetting_givenMissingFile_shouldFail() {
    assertThrows(KeyNotExistsException.class,
        () -> fileList.get(key("logs", "missing.parquet")));
    assertFalse(fileList.contains(key("logs", "missing.parquet")));
  }

  @Test
  void whenBatchAdding_givenChunkWithExistingFile_shouldInsertTheRest() {
    final FileMeta existing = meta(T0, T0 + SECOND, 7);
    fileList.add(key("logs", "f150.parquet"), existing);

    final List<FileKey> files = new ArrayList<>();
    for (int i = 0; i < 250; i++) {
      files.add(FileKey.of(key("logs", "f" + i + ".parquet"),
          meta(T0, T0 + SECOND, 1)));
    }
    fileList.batchAdd(files);

    assertEquals(250, fileList.len());
    assertEquals(existing, fileList.get(key("logs", "f150.parquet")));
  }

  @Test
  void whenRemoving_givenMissingAndPresentFiles_shouldIgnoreMissing() {
    fileList.add(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 1));
    fileList.add(key("logs", "b.parquet"), meta(T0, T0 + SECOND, 1));

    fileList.remove(key("logs", "missing.parquet"));
    fileList.batchRemove(List.of(key("logs", "a.parquet")));

    assertEquals(List.of(key("logs", "b.parquet")),
        fileList.list().stream().map(FileKey::key).toList());
  }

  @Test
  void whenQuerying_givenOverlappingWindow_shouldReturnOverlappingFiles() {
    final long hour = 3600 * SECOND;
    fileList.add(key("logs", "a.parquet"), meta(T0, T0 + 10 * SECOND, 1));
    fileList.add(key("logs", "b.parquet"),
        meta(T0 + hour, T0 + hour + 10 * SECOND, 1));
    fileList.add(key("traces", "c.parquet"), meta(T0, T0 + SECOND, 1));

    final List<FileKey> found = fileList.query("org1", StreamType.LOGS,
        "default", PartitionTimeLevel.HOURLY, T0 + 5 * SECOND,
        T0 + 20 * 60 * SECOND);

    assertEquals(List.of(key("logs", "a.parquet")),
        found.stream().map(FileKey::key).toList());
  }

  @Test
  void whenQuerying_givenNoBounds_shouldFail() {
    assertThrows(DisallowedQueryException.class, () -> fileList.query(
        "org1", StreamType.LOGS, "default", null, 0, 0));
  }

  @Test
  void whenQueryingDeleted_givenTimeMax_shouldReturnOlderTombstones() {
    fileList.batchAddDeleted("org1", 100, List.of(key("logs", "a.parquet"),
        key("logs", "b.parquet")));
    fileList.batchAddDeleted("org1", 200, List.of(key("logs", "c.parquet")));
    fileList.batchAddDeleted("org2", 50, List.of(key("logs", "d.parquet")));

    final List<DeletedFile> old = fileList.queryDeleted("org1", 150, 10);

    assertEquals(2, old.size());
    assertEquals(100, old.get(0).createdAt());
    assertEquals(2, fileList.queryDeleted("org1", 1000, 2).size());
    assertTrue(fileList.queryDeleted("org1", 0, 10).isEmpty());
  }

  @Test
  void whenRemovingDeleted_givenTombstone_shouldDropIt() {
    fileList.batchAddDeleted("org1", 100, List.of(key("logs", "a.parquet"),
        key("logs", "b.parquet")));

    fileList.batchRemoveDeleted(List.of(key("logs", "a.parquet")));

    final List<DeletedFile> left = fileList.queryDeleted("org1", 1000, 10);
    assertEquals(1, left.size());
    assertEquals(key("logs", "b.parquet"), left.get(0).key());
  }

  @Test
  void whenGettingMinTs_givenFilesBeforeBaseTime_shouldIgnoreThem() {
    fileList.add(key("logs", "old.parquet"), meta(1000, 2000, 1));
    fileList.add(key("logs", "a.parquet"), meta(T0 + SECOND, T0 + 2 * SECOND,
        1));
    fileList.add(key("logs", "b.parquet"), meta(T0, T0 + SECOND, 1));

    assertEquals(T0, fileList.getMinTs("org1", StreamType.LOGS, "default"));
    assertEquals(0, fileList.getMinTs("org1", StreamType.TRACES,
        "default"));
  }

  @Test
  void whenComputingStats_givenPkRange_shouldOnlyCountNewRows() {
    fileList.add(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 10));
    fileList.add(key("logs", "b.parquet"), meta(T0, T0 + SECOND, 20));
    final long firstPk = fileList.getMaxPkValue();
    fileList.add(key("logs", "c.parquet"), meta(T0, T0 + 5 * SECOND, 30));
    final long secondPk = fileList.getMaxPkValue();

    final Map<String, StreamStats> all =
        fileList.stats("org1", null, null, PkRange.ALL);
    final Map<String, StreamStats> incremental =
        fileList.stats("org1", null, null, PkRange.of(firstPk, secondPk));

    assertEquals(3, all.get(streamKey("logs")).fileNum());
    assertEquals(60, all.get(streamKey("logs")).docNum());
    assertEquals(1, incremental.get(streamKey("logs")).fileNum());
    assertEquals(30, incremental.get(streamKey("logs")).docNum());
    assertEquals(T0 + 5 * SECOND,
        incremental.get(streamKey("logs")).docTimeMax());
  }

  @Test
  void whenComputingStats_givenStream_shouldRestrictToIt() {
    fileList.add(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 10));
    fileList.add(key("traces", "b.parquet"), meta(T0, T0 + SECOND, 20));

    final Map<String, StreamStats> stats =
        fileList.stats("org1", StreamType.TRACES, "default", null);

    assertEquals(1, stats.size());
    assertEquals(20, stats.get(streamKey("traces")).docNum());
  }

  @Test
  void whenSettingStreamStats_givenNewStream_shouldCreateAndAccumulate() {
    final Map<String, StreamStats> deltas = StreamStatsAggregator.deltas(
        List.of(FileKey.of(key("logs", "a.parquet"), meta(T0, T0 + SECOND,
            10))));

    fileList.setStreamStats("org1", deltas);
    fileList.setStreamStats("org1", deltas);

    final StreamStats stored = fileList.getStreamStats("org1",
        StreamType.LOGS, "default").get(streamKey("logs"));
    assertEquals(2, stored.fileNum());
    assertEquals(20, stored.docNum());
    assertEquals(T0, stored.docTimeMin());
    assertEquals(T0 + SECOND, stored.docTimeMax());
  }

  @Test
  void whenSettingStreamStats_givenDeletedFile_shouldSubtract() {
    final FileMeta meta = meta(T0, T0 + SECOND, 10);
    fileList.setStreamStats("org1", StreamStatsAggregator.deltas(List.of(
        FileKey.of(key("logs", "a.parquet"), meta),
        FileKey.of(key("logs", "b.parquet"), meta))));

    fileList.setStreamStats("org1", StreamStatsAggregator.deltas(List.of(
        new FileKey(key("logs", "a.parquet"), meta, true))));

    final StreamStats stored =
        fileList.getStreamStats("org1", null, null).get(streamKey("logs"));
    assertEquals(1, stored.fileNum());
    assertEquals(10, stored.docNum());
  }

  @Test
  void whenAddingAndRemoving_givenFiles_shouldConvergeStreamStats() {
    fileList.add(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 10));
    fileList.batchAdd(List.of(
        FileKey.of(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 99)),
        FileKey.of(key("logs", "b.parquet"), meta(T0 - SECOND, T0, 20)),
        FileKey.of(key("logs", "c.parquet"), meta(T0, T0 + 9 * SECOND, 30))));
    fileList.remove(key("logs", "b.parquet"));
    fileList.remove(key("logs", "missing.parquet"));
    fileList.batchRemove(List.of(key("logs", "b.parquet")));

    final StreamStats stored = fileList.getStreamStats("org1",
        StreamType.LOGS, "default").get(streamKey("logs"));
    final StreamStats recomputed = fileList.stats("org1", StreamType.LOGS,
        "default", null).get(streamKey("logs"));
    assertEquals(2, stored.fileNum());
    assertEquals(40, stored.docNum());
    assertEquals(4000.0, stored.storageSize());
    assertEquals(recomputed.fileNum(), stored.fileNum());
    assertEquals(recomputed.docNum(), stored.docNum());
    assertEquals(T0 + 9 * SECOND, stored.docTimeMax());
  }

  @Test
  void whenSettingStreamStats_givenConcurrentCallers_shouldAddEveryDelta()
      throws Exception {
    final StreamStats one = new StreamStats(1, 1, T0, T0 + SECOND, 1, 1);
    fileList.setStreamStats("org1", Map.of(streamKey("logs"), one));

    final ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      final List<Future<?>> calls = new ArrayList<>();
      for (int i = 0; i < 400; i++) {
        calls.add(pool.submit(() -> fileList.setStreamStats("org1",
            Map.of(streamKey("logs"), one))));
      }
      for (final Future<?> call : calls) {
        call.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    final StreamStats stored =
        fileList.getStreamStats("org1", null, null).get(streamKey("logs"));
    assertEquals(401, stored.fileNum());
    assertEquals(401, stored.docNum());
    assertEquals(401.0, stored.compressedSize());
    assertEquals(T0, stored.docTimeMin());
  }

  @Test
  void whenSettingStreamStats_givenLargerRemoval_shouldFloorAtZero() {
    fileList.setStreamStats("org1", Map.of(streamKey("logs"),
        new StreamStats(1, 10, T0, T0 + SECOND, 100, 10)));

    fileList.setStreamStats("org1", Map.of(streamKey("logs"),
        new StreamStats(-3, -30, 0, 0, -300, -30)));

    final StreamStats stored =
        fileList.getStreamStats("org1", null, null).get(streamKey("logs"));
    assertEquals(new StreamStats(0, 0, T0, T0 + SECOND, 0, 0), stored);
  }

  @Test
  void whenResettingStreamStats_shouldZeroEveryRow() {
    fileList.setStreamStats("org1", StreamStatsAggregator.deltas(List.of(
        FileKey.of(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 10)))));

    fileList.resetStreamStats();

    assertEquals(StreamStats.EMPTY,
        fileList.getStreamStats("org1", null, null).get(streamKey("logs")));
  }

  @Test
  void whenResettingMinTs_givenStream_shouldOnlyChangeMinTs() {
    fileList.setStreamStats("org1", StreamStatsAggregator.deltas(List.of(
        FileKey.of(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 10)))));

    fileList.resetStreamStatsMinTs("org1", streamKey("logs"), T0 + 500);

    final StreamStats stored =
        fileList.getStreamStats("org1", null, null).get(streamKey("logs"));
    assertEquals(T0 + 500, stored.docTimeMin());
    assertEquals(10, stored.docNum());
  }

  @Test
  void whenDeletingStreamStats_givenStream_shouldDropItsRow() {
    fileList.setStreamStats("org1", StreamStatsAggregator.deltas(List.of(
        FileKey.of(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 10)),
        FileKey.of(key("traces", "b.parquet"), meta(T0, T0 + SECOND, 5)))));

    fileList.deleteStreamStats("org1", StreamType.LOGS, "default");

    assertEquals(List.of(streamKey("traces")), new ArrayList<>(
        fileList.getStreamStats("org1", null, null).keySet()));
  }

  @Test
  void whenClearing_shouldEmptyTheCatalog() {
    fileList.add(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 1));
    assertFalse(fileList.isEmpty());

    fileList.clear();

    assertTrue(fileList.isEmpty());
  }

  @Test
  void whenMarkingInitialised_shouldReport() {
    assertFalse(fileList.getInitialised());
    fileList.setInitialised();
    assertTrue(fileList.getInitialised());
  }

  @Test
  void whenAddingHistory_givenKnownFiles_shouldKeepEachOnceApart() {
    fileList.addHistory(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 1));

    final List<FileKey> files = new ArrayList<>();
    for (int i = 0; i < 150; i++) {
      files.add(FileKey.of(key("logs", "h" + i + ".parquet"),
          meta(T0, T0 + SECOND, 1)));
    }
    files.add(FileKey.of(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 1)));
    fileList.batchAddHistory(files);
    fileList.batchAddHistory(files.subList(0, 10));

    assertEquals(0, fileList.len());
    assertTrue(fileList.getStreamStats("org1", null, null).isEmpty());
    assertEquals(151L, countRows("file_list_history"));
  }

  @Test
  void whenReadingPkBounds_givenFiles_shouldSpanEveryRow() {
    assertEquals(0L, fileList.getMinPkValue());

    fileList.add(key("logs", "a.parquet"), meta(T0, T0 + SECOND, 1));
    fileList.add(key("logs", "b.parquet"), meta(T0, T0 + SECOND, 1));
    final long min = fileList.getMinPkValue();
    fileList.remove(key("logs", "a.parquet"));

    assertTrue(min > 0);
    assertTrue(fileList.getMinPkValue() > min);
    assertEquals(fileList.getMinPkValue(), fileList.getMaxPkValue());
  }

  @Test
  void whenClaimingJobs_givenPendingJobs_shouldTakeNewestPerBusiestStream() {
    fileList.addJob("org1", StreamType.LOGS, "default", T0);
    fileList.addJob("org1", StreamType.LOGS, "default", T0 + SECOND);
    fileList.addJob("org1", StreamType.LOGS, "default", T0 + SECOND);
    fileList.addJob("org1", StreamType.TRACES, "default", T0);

    final List<MergeJob> jobs = fileList.getPendingJobs("node-1", 1);

    assertEquals(1, jobs.size());
    final MergeJob job = jobs.get(0);
    assertEquals(streamKey("logs"), job.stream());
    assertEquals(T0 + SECOND, job.offsets());
    assertEquals(MergeJobStatus.RUNNING, job.status());
    assertEquals("node-1", job.node());
    assertTrue(job.startedAt() > 0);
    assertEquals(Map.of("org1", Map.of("logs", 1L, "traces", 1L)),
        fileList.getPendingJobsCount());
  }

  @Test
  void whenRunningJobs_givenLifecycle_shouldRequeueAndClean() {
    fileList.addJob("org1", StreamType.LOGS, "default", T0);
    fileList.addJob("org1", StreamType.TRACES, "default", T0);
    final List<MergeJob> jobs = fileList.getPendingJobs("node-1", 10);
    assertEquals(2, jobs.size());
    assertTrue(fileList.getPendingJobs("node-2", 10).isEmpty());

    fileList.setJobPending(List.of(jobs.get(0).id()));
    assertEquals(1, fileList.getPendingJobs("node-2", 10).size());

    fileList.updateRunningJobs(jobs.get(1).id());
    assertEquals(0, fileList.checkRunningJobs(0L));
    assertEquals(2, fileList.checkRunningJobs(Long.MAX_VALUE));

    final List<MergeJob> again = fileList.getPendingJobs("node-3", 10);
    assertEquals(2, again.size());
    for (final MergeJob job : again) {
      fileList.setJobDone(job.id());
    }
    assertEquals(0, fileList.checkRunningJobs(Long.MAX_VALUE));
    assertTrue(fileList.getPendingJobsCount().isEmpty());

    assertEquals(0, fileList.cleanDoneJobs(0L));
    assertEquals(2, fileList.cleanDoneJobs(Long.MAX_VALUE));
    fileList.addJob("org1", StreamType.LOGS, "default", T0);
    assertEquals(1, fileList.getPendingJobs("node-1", 10).size());
  }

  /** Counts the rows of a table.
   *
   * @param table the table.
   * @return the row count.
   */
  private long countRows(final String table) {
    return fileList.read("count " + table, conn -> {
      try (Statement stmt = conn.createStatement();
          ResultSet rs = stmt.executeQuery(
              "SELECT COUNT(*) FROM " + table)) {
        rs.next();
        return rs.getLong(1);
      }
    });
  }

  static String key(final String type, final String file) {
    return "files/org1/" + type + "/default/2022/10/03/10/" + file;
  }

  static String streamKey(final String type) {
    return "org1/" + type + "/default";
  }

  static FileMeta meta(final long min, final long max, final long records) {
    return new FileMeta(min, max, records, records * 100, records * 10);
  }
}
