package org.waabox.filedex;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.createStrictControl;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.easymock.IMocksControl;
import org.junit.jupiter.api.Test;
import org.waabox.filedex.db.Db;
import org.waabox.filedex.db.MemoryDb;
import org.waabox.filedex.filelist.FileList;

/**
 * Tests for {@link Filedex}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FiledexTest {

  @Test
  void whenStarting_givenClusterMode_shouldInitialiseInOrder() {
    final IMocksControl control = createStrictControl();
    final Db metaStore = control.createMock(Db.class);
    final Db coordinator = control.createMock(Db.class);
    final FileList fileList = control.createMock(FileList.class);

    expect(metaStore.distributed()).andReturn(true);
    metaStore.createTable();
    expectLastCall();
    coordinator.createTable();
    expectLastCall();
    fileList.createTable();
    expectLastCall();
    fileList.createTableIndex();
    expectLastCall();
    fileList.setInitialised();
    expectLastCall();
    fileList.close();
    expectLastCall();
    coordinator.close();
    expectLastCall();
    metaStore.close();
    expectLastCall();
    control.replay();

    final Filedex filedex = Filedex.builder()
        .mode(Mode.CLUSTER)
        .metaStore(metaStore)
        .coordinator(coordinator)
        .fileList(fileList)
        .build();
    filedex.start();
    filedex.stop();
    filedex.stop();

    control.verify();
  }

  @Test
  void whenBuilding_givenClusterModeWithLocalStore_shouldFail() {
    final FileList fileList = createMock(FileList.class);
    replay(fileList);

    assertThrows(IllegalStateException.class, () -> Filedex.builder()
        .mode(Mode.CLUSTER)
        .metaStore(new MemoryDb())
        .coordinator(new MemoryDb())
        .fileList(fileList)
        .build());
  }

  @Test
  void whenBuilding_givenLocalMode_shouldUseMetaStoreAsCoordinator() {
    final FileList fileList = createMock(FileList.class);
    replay(fileList);
    final MemoryDb metaStore = new MemoryDb();

    final Filedex filedex = Filedex.builder()
        .metaStore(metaStore)
        .fileList(fileList)
        .build();

    assertSame(metaStore, filedex.coordinator());
    assertTrue(filedex.fileCache().isEmpty());
  }

  @Test
  void whenStarting_givenAlreadyStarted_shouldFail() {
    final FileList fileList = createMock(FileList.class);
    fileList.createTable();
    fileList.createTableIndex();
    fileList.setInitialised();
    replay(fileList);

    final Filedex filedex = Filedex.builder()
        .metaStore(new MemoryDb())
        .fileList(fileList)
        .build();
    filedex.start();

    assertTrue(filedex.isStarted());
    assertThrows(IllegalStateException.class, filedex::start);
  }
}
