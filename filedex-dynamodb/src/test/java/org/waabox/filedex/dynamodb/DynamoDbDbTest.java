package org.waabox.filedex.dynamodb;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.aryEq;
import static org.easymock.EasyMock.capture;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.newCapture;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import org.easymock.Capture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.db.ChangeNotifier;
import org.waabox.filedex.db.DbStats;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;

/**
 * Tests for {@link DynamoDbDb}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DynamoDbDbTest {

  private DynamoDbClient client;

  private DynamoDbDb db;

  @BeforeEach
  void setUp() {
    client = createMock(DynamoDbClient.class);
    db = new DynamoDbDb(DynamoDbConfig.builder()
        .region(Region.EU_WEST_1)
        .tablePrefix("test_")
        .client(client)
        .build());
  }

  @Test
  void whenPutting_givenNestedKey_shouldSplitModuleAndSortKey() {
    final Capture<PutItemRequest> captured = newCapture();
    expect(client.putItem(capture(captured)))
        .andReturn(PutItemResponse.builder().build());
    replay(client);

    db.put("/schema/org1/logs/default", bytes("v1"), false);

    verify(client);
    final PutItemRequest request = captured.getValue();
    assertEquals("test_meta", request.tableName());
    assertEquals("schema", request.item().get("module").s());
    assertEquals("org1/logs/default", request.item().get("key").s());
    assertArrayEquals(bytes("v1"),
        request.item().get("value").b().asByteArray());
  }

  @Test
  void whenGetting_givenStoredKey_shouldReturnItsBytes() {
    final Capture<GetItemRequest> captured = newCapture();
    expect(client.getItem(capture(captured))).andReturn(
        GetItemResponse.builder().item(row("org1/", "v1")).build());
    replay(client);

    assertArrayEquals(bytes("v1"), db.get("/user/org1"));

    verify(client);
    assertEquals("org1/", captured.getValue().key().get("key").s());
    assertTrue(captured.getValue().consistentRead());
  }

  @Test
  void whenGetting_givenMissingKey_shouldThrowKeyNotExists() {
    expect(client.getItem(anyObject(GetItemRequest.class)))
        .andReturn(GetItemResponse.builder().build());
    replay(client);

    assertThrows(KeyNotExistsException.class, () -> db.get("/user/nobody"));
    verify(client);
  }

  @Test
  void whenDeleting_givenMissingKey_shouldThrowKeyNotExists() {
    final Capture<DeleteItemRequest> captured = newCapture();
    expect(client.deleteItem(capture(captured)))
        .andReturn(DeleteItemResponse.builder().build());
    replay(client);

    assertThrows(KeyNotExistsException.class,
        () -> db.delete("/user/nobody", false, false));
    verify(client);
    assertEquals(ReturnValue.ALL_OLD, captured.getValue().returnValues());
  }

  @Test
  void whenDeleting_givenWatchedKey_shouldNotifyTheCoordinator() {
    final ChangeNotifier notifier = createMock(ChangeNotifier.class);
    notifier.notifyDelete(eq("/user/org1"), eq(false));
    expectLastCall();
    notifier.notifyPut(eq("/user/org2"), aryEq(bytes("v2")));
    expectLastCall();
    expect(client.deleteItem(anyObject(DeleteItemRequest.class)))
        .andReturn(DeleteItemResponse.builder()
            .attributes(row("org1/", "v1")).build());
    expect(client.putItem(anyObject(PutItemRequest.class)))
        .andReturn(PutItemResponse.builder().build());
    replay(client, notifier);

    final DynamoDbDb watched = new DynamoDbDb(DynamoDbConfig.builder()
        .region(Region.EU_WEST_1)
        .client(client)
        .build(), notifier);
    watched.delete("/user/org1", false, true);
    watched.put("/user/org2", bytes("v2"), true);

    verify(client, notifier);
    assertTrue(watched.distributed());
  }

  @Test
  void whenListing_givenKeyOnePrefix_shouldMatchKeyOneExactly() {
    final Capture<QueryRequest> captured = newCapture();
    expect(client.query(capture(captured))).andReturn(QueryResponse.builder()
        .items(row("org1/", "a"), row("org1/logs/default", "b"))
        .build());
    replay(client);

    final SortedMap<String, byte[]> listed = db.list("/schema/org1");

    verify(client);
    assertEquals(List.of("/schema/org1", "/schema/org1/logs/default"),
        List.copyOf(listed.keySet()));
    final QueryRequest request = captured.getValue();
    assertEquals("#m = :m AND begins_with(#k, :k)",
        request.keyConditionExpression());
    assertEquals("org1/", request.expressionAttributeValues().get(":k").s());
  }

  @Test
  void whenListing_givenModuleOnly_shouldQueryTheWholeModule() {
    final Capture<QueryRequest> captured = newCapture();
    expect(client.query(capture(captured))).andReturn(QueryResponse.builder()
        .items(row("org1/", "a")).build());
    replay(client);

    assertEquals(1, db.count("/schema/"));

    verify(client);
    assertEquals("#m = :m", captured.getValue().keyConditionExpression());
    assertEquals("#k", captured.getValue().projectionExpression());
  }

  @Test
  void whenDeleting_givenPrefix_shouldBatchDeleteMatches() {
    expect(client.query(anyObject(QueryRequest.class))).andReturn(
        QueryResponse.builder()
            .items(Map.of("key", s("org1/a")), Map.of("key", s("org1/b")))
            .build());
    final Capture<BatchWriteItemRequest> captured = newCapture();
    expect(client.batchWriteItem(capture(captured)))
        .andReturn(BatchWriteItemResponse.builder().build());
    replay(client);

    db.delete("/nodes/org1", true, false);

    verify(client);
    assertEquals(2, captured.getValue().requestItems().get("test_meta")
        .size());
  }

  @Test
  void whenDeleting_givenPrefixWithoutMatches_shouldThrowKeyNotExists() {
    expect(client.query(anyObject(QueryRequest.class)))
        .andReturn(QueryResponse.builder().build());
    replay(client);

    assertThrows(KeyNotExistsException.class,
        () -> db.delete("/nodes/", true, false));
    verify(client);
  }

  @Test
  void whenReadingStats_givenDescribedTable_shouldReportSizeAndCount() {
    expect(client.describeTable(anyObject(DescribeTableRequest.class)))
        .andReturn(DescribeTableResponse.builder().table(TableDescription
            .builder().tableSizeBytes(2048L).itemCount(12L).build())
            .build());
    replay(client);

    assertEquals(new DbStats(2048, 12), db.stats());
    verify(client);
  }

  @Test
  void whenRebuildingKeys_givenSortKeys_shouldRestoreTheOriginalKey() {
    assertEquals("/schema/org1", DynamoDbDb.toKey("schema", "org1/"));
    assertEquals("/schema/org1/logs/a",
        DynamoDbDb.toKey("schema", "org1/logs/a"));
    assertEquals("/schema/", DynamoDbDb.toKey("schema", "/"));
  }

  private static Map<String, AttributeValue> row(final String key,
      final String value) {
    return Map.of("module", s("schema"), "key", s(key),
        "value", AttributeValue.builder()
            .b(SdkBytes.fromByteArray(bytes(value))).build());
  }

  private static AttributeValue s(final String value) {
    return AttributeValue.builder().s(value).build();
  }

  private static byte[] bytes(final String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
