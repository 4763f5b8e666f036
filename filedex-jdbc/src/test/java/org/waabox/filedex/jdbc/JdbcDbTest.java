package org.waabox.filedex.jdbc;

import static org.easymock.EasyMock.aryEq;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.db.ChangeNotifier;
import org.waabox.filedex.db.Event;
import org.waabox.filedex.db.WatchSubscription;

/** Tests for {@link JdbcDb} on H2 in MySQL mode.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class JdbcDbTest {

  /** The store under test. */
  private JdbcDb db;

  @BeforeEach
  void setUp() {
    db = new JdbcDb(new PooledSqlExecutor(H2.dataSource("MySQL")),
        new MysqlDialect(), false);
    db.createTable();
  }

  @AfterEach
  void tearDown() {
    db.close();
  }

  @Test
  void whenCreatingTable_givenExistingTable_shouldSucceed() {
    db.createTable();

    assertEquals(0, db.stats().keysCount());
  }

  @Test
  void whenPutting_givenExistingKey_shouldOverwrite() {
    db.put("/schema/org1/logs/default", bytes("v1"), false);
    db.put("/schema/org1/logs/default", bytes("v2"), false);

    assertEquals("v2", text(db.get("/schema/org1/logs/default")));
    assertEquals(1, db.stats().keysCount());
  }

  @Test
  void whenGetting_givenMissingKey_shouldFail() {
    assertThrows(KeyNotExistsException.class,
        () -> db.get("/schema/org1/missing"));
  }

  @Test
  void whenDeleting_givenMissingKey_shouldFail() {
    assertThrows(KeyNotExistsException.class,
        () -> db.delete("/schema/org1/missing", false, false));
  }

  @Test
  void whenDeleting_givenPrefix_shouldDropMatchingKeys() {
    db.put("/schema/org1/logs/a", bytes("1"), false);
    db.put("/schema/org1/logs/b", bytes("2"), false);
    db.put("/schema/org2/logs/a", bytes("3"), false);

    db.delete("/schema/org1/", true, false);

    assertEquals(List.of("/schema/org2/logs/a"), db.listKeys("/schema/"));
  }

  @Test
  void whenListing_givenPrefix_shouldMatchKey2ByPrefix() {
    db.put("/schema/org1/logs/a", bytes("1"), false);
    db.put("/schema/org1/logs/b", bytes("2"), false);
    db.put("/schema/org1/traces/a", bytes("3"), false);
    db.put("/user/org1/root", bytes("4"), false);

    assertEquals(List.of("/schema/org1/logs/a", "/schema/org1/logs/b"),
        db.listKeys("/schema/org1/logs/"));
    assertEquals(3, db.count("/schema/"));
    assertEquals(1, db.count("/user/org1"));
    assertArrayEquals(bytes("3"),
        db.list("/schema/org1/traces").get("/schema/org1/traces/a"));
  }

  @Test
  void whenMatchingPrefix_givenWildcardCharacters_shouldMatchThemLiterally() {
    db.put("/schema/org1/myXstream", bytes("1"), false);
    db.put("/schema/org1/my_stream", bytes("2"), false);
    db.put("/schema/org1/100%done", bytes("3"), false);
    db.put("/schema/org1/1000done", bytes("4"), false);

    assertEquals(1, db.count("/schema/org1/my_"));
    assertEquals(List.of("/schema/org1/my_stream"),
        db.listKeys("/schema/org1/my_"));
    assertEquals(1, db.count("/schema/org1/100%"));

    db.delete("/schema/org1/my_", true, false);

    assertArrayEquals(bytes("1"), db.get("/schema/org1/myXstream"));
    assertThrows(KeyNotExistsException.class,
        () -> db.delete("/schema/org1/my_", true, false));
  }

  @Test
  void whenEscapingLikePattern_givenWildcards_shouldPrefixEscapeChar() {
    assertEquals("a!_b!%c!!d", JdbcDb.escapeLike("a_b%c!d"));
    assertEquals("plain", JdbcDb.escapeLike("plain"));
  }

  @Test
  void whenWatching_givenMutations_shouldDeliverMatchingEvents()
      throws Exception {
    try (WatchSubscription watch = db.watch("/schema/org1/")) {
      db.put("/user/org1/root", bytes("x"), true);
      db.put("/schema/org1/logs/a", bytes("1"), true);
      db.put("/schema/org1/logs/b", bytes("2"), false);
      db.delete("/schema/org1/logs/a", false, true);

      final Event put = watch.poll(Duration.ofSeconds(1));
      assertEquals(Event.Type.PUT, put.type());
      assertEquals("/schema/org1/logs/a", put.key());
      final Event delete = watch.poll(Duration.ofSeconds(1));
      assertEquals(Event.Type.DELETE, delete.type());
      assertNull(watch.poll(Duration.ofMillis(50)));
    }
  }

  @Test
  void whenClosing_shouldCloseWatches() {
    final WatchSubscription watch = db.watch("/schema/");
    assertFalse(watch.isClosed());

    db.close();

    assertTrue(watch.isClosed());
  }

  @Test
  void whenPutting_givenNotifier_shouldForwardInsteadOfLocalHub() {
    final ChangeNotifier notifier = createMock(ChangeNotifier.class);
    notifier.notifyPut(eq("/nodes/n1"), aryEq(bytes("up")));
    notifier.notifyDelete("/nodes/n1", false);
    replay(notifier);

    try (JdbcDb clustered = new JdbcDb(
        new PooledSqlExecutor(H2.dataSource("MySQL")), new MysqlDialect(),
        true, notifier)) {
      clustered.createTable();
      clustered.put("/nodes/n1", bytes("up"), true);
      clustered.delete("/nodes/n1", false, true);
      assertTrue(clustered.distributed());
    }

    verify(notifier);
  }

  private static byte[] bytes(final String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  private static String text(final byte[] value) {
    return new String(value, StandardCharsets.UTF_8);
  }
}
