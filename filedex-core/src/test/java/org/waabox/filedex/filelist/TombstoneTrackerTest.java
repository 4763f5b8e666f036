package org.waabox.filedex.filelist;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.filedex.model.DeletedFile;

/**
 * Tests for {@link TombstoneTracker}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TombstoneTrackerTest {

  private static final String FILE =
      "files/default/logs/a/2022/10/03/10/1.parquet";

  private static final long NOW = 10_000_000_000L;

  @Test
  void whenMarking_givenFiles_shouldStampWithClock() {
    final FileList fileList = createMock(FileList.class);
    fileList.batchAddDeleted("default", NOW, List.of(FILE));
    expectLastCall();
    replay(fileList);

    new TombstoneTracker(fileList, () -> NOW)
        .markDeleted("default", List.of(FILE));

    verify(fileList);
  }

  @Test
  void whenListingCandidates_givenRetention_shouldQueryBeforeCutoff() {
    final FileList fileList = createMock(FileList.class);
    final List<DeletedFile> old = List.of(new DeletedFile(FILE, 1));
    expect(fileList.queryDeleted("default", NOW - 3_600_000_000L, 10))
        .andReturn(old);
    replay(fileList);

    final List<DeletedFile> result = new TombstoneTracker(fileList, () -> NOW)
        .purgeCandidates("default", Duration.ofHours(1), 10);

    assertEquals(old, result);
    verify(fileList);
  }

  @Test
  void whenPurging_givenTombstones_shouldRemoveByKey() {
    final FileList fileList = createMock(FileList.class);
    fileList.batchRemoveDeleted(List.of(FILE));
    expectLastCall();
    replay(fileList);

    new TombstoneTracker(fileList, () -> NOW)
        .purge(List.of(new DeletedFile(FILE, 1)));

    verify(fileList);
  }

  @Test
  void whenMarking_givenRealCatalog_shouldHideYoungTombstones() {
    final MemoryFileList fileList = new MemoryFileList(100);
    final TombstoneTracker tracker = new TombstoneTracker(fileList, () -> NOW);

    tracker.markDeleted("default", List.of(FILE));

    assertEquals(0, tracker.purgeCandidates("default", Duration.ofHours(1),
        10).size());
  }
}
