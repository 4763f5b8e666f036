package org.waabox.filedex.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link WatchHub} and {@link WatchSubscription}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class WatchHubTest {

  @Test
  void whenPublishing_givenOtherPrefix_shouldNotDeliver() throws Exception {
    final WatchHub hub = new WatchHub();
    final WatchSubscription triggers = hub.subscribe("/trigger/");

    hub.notifyPut("/schema/default/logs/x", new byte[] {1});
    hub.notifyPut("/trigger/alert1", "v".getBytes(StandardCharsets.UTF_8));

    final Event event = triggers.poll(Duration.ofSeconds(1));
    assertEquals(Event.Type.PUT, event.type());
    assertEquals("/trigger/alert1", event.key());
    assertNull(triggers.poll(Duration.ofMillis(50)));
  }

  @Test
  void whenPublishing_givenSeveralChanges_shouldKeepCommitOrder()
      throws Exception {
    final WatchHub hub = new WatchHub();
    final WatchSubscription nodes = hub.subscribe("/nodes/");

    hub.notifyPut("/nodes/n1", new byte[0]);
    hub.notifyDelete("/nodes/n1", false);
    hub.publish(Event.empty());

    assertEquals(Event.Type.PUT, nodes.take().type());
    assertEquals(Event.Type.DELETE, nodes.take().type());
    assertEquals(Event.Type.EMPTY, nodes.take().type());
  }

  @Test
  void whenClosing_givenSubscription_shouldDetachFromHub() {
    final WatchHub hub = new WatchHub();
    final WatchSubscription subscription = hub.subscribe("/nodes/");

    subscription.close();

    assertEquals(0, hub.size());
    assertTrue(subscription.isClosed());
    assertFalse(subscription.publish(Event.put("/nodes/n1", null)));
  }

  @Test
  void whenWatchingStore_givenUnwatchedPut_shouldNotDeliver()
      throws Exception {
    final MemoryDb db = new MemoryDb();
    final WatchSubscription subscription = db.watch("/user/");

    db.put("/user/a", new byte[0], false);
    db.put("/user/b", new byte[0], true);

    assertEquals("/user/b", subscription.poll(Duration.ofSeconds(1)).key());
  }

  @Test
  void whenDeletingPrefix_givenNarrowerWatcher_shouldDeliverDelete()
      throws Exception {
    final WatchHub hub = new WatchHub();
    final WatchSubscription alerts = hub.subscribe("/trigger/org1/");
    final WatchSubscription all = hub.subscribe("/trigger/");
    final WatchSubscription other = hub.subscribe("/triggers-old/");

    hub.notifyDelete("/trigger/", true);

    final Event narrow = alerts.poll(Duration.ofSeconds(1));
    assertEquals(Event.Type.DELETE, narrow.type());
    assertEquals("/trigger/org1/", narrow.key());
    assertEquals("/trigger/", all.poll(Duration.ofSeconds(1)).key());
    assertNull(other.poll(Duration.ofMillis(50)));
  }

  @Test
  void whenDeletingSingleKey_givenNarrowerWatcher_shouldNotDeliver()
      throws Exception {
    final WatchHub hub = new WatchHub();
    final WatchSubscription alerts = hub.subscribe("/trigger/org1/");

    hub.notifyDelete("/trigger/", false);

    assertNull(alerts.poll(Duration.ofMillis(50)));
  }
}
