package org.waabox.filedex.db;

import static org.easymock.EasyMock.aryEq;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CoordinatorNotifier}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CoordinatorNotifierTest {

  @Test
  void whenNotifying_givenPutAndDelete_shouldMirrorOnCoordinator() {
    final Db coordinator = createMock(Db.class);
    coordinator.put(eq("/schema/a"), aryEq(new byte[] {7}), eq(false));
    expectLastCall();
    coordinator.deleteIfExists("/schema/", true, false);
    expectLastCall();
    replay(coordinator);

    final CoordinatorNotifier notifier = new CoordinatorNotifier(coordinator);
    notifier.notifyPut("/schema/a", new byte[] {7});
    notifier.notifyDelete("/schema/", true);

    verify(coordinator);
  }
}
