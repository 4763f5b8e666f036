package org.waabox.filedex.dynamodb;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.BackendException;

import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * Client plumbing shared by the DynamoDB stores: table creation, query
 * paging, batch writes with retry of unprocessed items and attribute
 * conversions.
 *
 * <p>A client built from the configuration is owned, and closed, by this
 * instance; a client supplied through the configuration is not.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class DynamoTables implements AutoCloseable {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(DynamoTables.class);

  /** Maximum items of one BatchWriteItem call. */
  static final int BATCH_SIZE = 25;

  /** Attempts at draining unprocessed items before giving up. */
  private static final int MAX_BATCH_ATTEMPTS = 8;

  /** Base backoff between retries of unprocessed items. */
  private static final long BACKOFF_MILLIS = 20;

  /** The configuration, never null. */
  private final DynamoDbConfig config;

  /** The client, never null. */
  private final DynamoDbClient client;

  /** Whether this instance created the client and must close it. */
  private final boolean ownsClient;

  /** Resolves the client of a configuration.
   *
   * @param theConfig the configuration, never null.
   */
  DynamoTables(final DynamoDbConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    if (theConfig.client().isPresent()) {
      client = theConfig.client().get();
      ownsClient = false;
    } else {
      client = theConfig.buildClient();
      ownsClient = true;
    }
  }

  /** Returns the client. */
  DynamoDbClient client() {
    return client;
  }

  /** Returns the prefixed name of a table.
   *
   * @param table the short table name.
   * @return the table name, never null.
   */
  String name(final String table) {
    return config.tableName(table);
  }

  /**
   * Creates a table with a string hash key and a sort key unless it
   * already exists. Billing is on demand.
   *
   * @param table the short table name, never null
   * @param hashKey the hash key attribute, never null
   * @param rangeKey the string sort key attribute, never null
   * @param index an optional secondary index, may be null
   */
  void ensureTable(final String table, final String hashKey,
      final String rangeKey, final IndexSpec index) {
    final String name = name(table);
    try {
      client.describeTable(DescribeTableRequest.builder()
          .tableName(name).build());
      log.debug("[DYNAMODB] table '{}' already exists", name);
      return;
    } catch (final ResourceNotFoundException e) {
      log.info("[DYNAMODB] creating table '{}'", name);
    }
    final List<AttributeDefinition> attributes = new ArrayList<>();
    attributes.add(attribute(hashKey, ScalarAttributeType.S));
    attributes.add(attribute(rangeKey, ScalarAttributeType.S));
    final CreateTableRequest.Builder request = CreateTableRequest.builder()
        .tableName(name)
        .billingMode(BillingMode.PAY_PER_REQUEST)
        .keySchema(key(hashKey, KeyType.HASH), key(rangeKey, KeyType.RANGE));
    if (index != null) {
      attributes.add(attribute(index.hashKey(), ScalarAttributeType.S));
      attributes.add(attribute(index.rangeKey(), ScalarAttributeType.N));
      request.globalSecondaryIndexes(GlobalSecondaryIndex.builder()
          .indexName(index.name())
          .keySchema(key(index.hashKey(), KeyType.HASH),
              key(index.rangeKey(), KeyType.RANGE))
          .projection(Projection.builder()
              .projectionType(ProjectionType.ALL).build())
          .build());
    }
    client.createTable(request.attributeDefinitions(attributes).build());
  }

  /**
   * Runs a query and follows its pages.
   *
   * @param request the first page request, never null
   *
   * @return the items of every page, never null
   */
  List<Map<String, AttributeValue>> queryAll(final QueryRequest request) {
    final List<Map<String, AttributeValue>> items = new ArrayList<>();
    QueryRequest page = request;
    while (true) {
      final QueryResponse response = client.query(page);
      items.addAll(response.items());
      if (!response.hasLastEvaluatedKey()
          || response.lastEvaluatedKey().isEmpty()) {
        return items;
      }
      page = page.toBuilder()
          .exclusiveStartKey(response.lastEvaluatedKey()).build();
    }
  }

  /**
   * Writes up to {@link #BATCH_SIZE} requests to one table, retrying the
   * unprocessed ones with a growing backoff.
   *
   * @param table the short table name, never null
   * @param requests the write requests, never null
   *
   * @throws BackendException if items remain unprocessed after every
   *     attempt
   */
  void batchWrite(final String table, final List<WriteRequest> requests) {
    if (requests.isEmpty()) {
      return;
    }
    Map<String, List<WriteRequest>> pending = Map.of(name(table), requests);
    for (int attempt = 1; attempt <= MAX_BATCH_ATTEMPTS; attempt++) {
      final BatchWriteItemResponse response = client.batchWriteItem(
          BatchWriteItemRequest.builder().requestItems(pending).build());
      if (!response.hasUnprocessedItems()
          || response.unprocessedItems().isEmpty()) {
        return;
      }
      pending = response.unprocessedItems();
      log.debug("[DYNAMODB] {} unprocessed items on '{}', attempt {}",
          pending.values().stream().mapToInt(List::size).sum(), table,
          attempt);
      pause(BACKOFF_MILLIS * attempt);
    }
    throw new BackendException("[DYNAMODB] batch write on '" + table
        + "' left unprocessed items");
  }

  /** Closes the client if it was built here. */
  @Override
  public void close() {
    if (ownsClient) {
      client.close();
    }
  }

  /** Builds a string attribute.
   *
   * @param value the value, never null.
   * @return the attribute, never null.
   */
  static AttributeValue s(final String value) {
    return AttributeValue.builder().s(value).build();
  }

  /** Builds a numeric attribute.
   *
   * @param value the value.
   * @return the attribute, never null.
   */
  static AttributeValue n(final long value) {
    return AttributeValue.builder().n(Long.toString(value)).build();
  }

  /** Builds a numeric attribute without exponent notation.
   *
   * @param value the value.
   * @return the attribute, never null.
   */
  static AttributeValue n(final double value) {
    return AttributeValue.builder()
        .n(BigDecimal.valueOf(value).toPlainString()).build();
  }

  /** Reads a numeric attribute as a long, 0 when absent.
   *
   * @param item the item, never null.
   * @param name the attribute name, never null.
   * @return the value.
   */
  static long longOf(final Map<String, AttributeValue> item,
      final String name) {
    final AttributeValue value = item.get(name);
    if (value == null || value.n() == null) {
      return 0;
    }
    return new BigDecimal(value.n()).longValue();
  }

  /** Reads a numeric attribute as a double, 0 when absent. */
  static double doubleOf(final Map<String, AttributeValue> item,
      final String name) {
    final AttributeValue value = item.get(name);
    if (value == null || value.n() == null) {
      return 0;
    }
    return Double.parseDouble(value.n());
  }

  /** Reads a string attribute, null when absent. */
  static String stringOf(final Map<String, AttributeValue> item,
      final String name) {
    final AttributeValue value = item.get(name);
    return value == null ? null : value.s();
  }

  /** Runs a call, wrapping client errors.
   *
   * @param op the operation name, for the error message.
   * @param call the call.
   * @return the call result.
   */
  static <T> T guard(final String op, final DynamoCall<T> call) {
    try {
      return call.run();
    } catch (final DynamoDbException e) {
      throw failure(op, e);
    }
  }

  /** Wraps a client error.
   *
   * @param op the operation name.
   * @param e the client error.
   * @return the backend error, never null.
   */
  static BackendException failure(final String op,
      final DynamoDbException e) {
    return new BackendException("[DYNAMODB] " + op + " failed: "
        + e.getMessage(), e);
  }

  /** Sleeps between retries.
   *
   * @param millis the pause.
   */
  private static void pause(final long millis) {
    try {
      Thread.sleep(millis);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendException("[DYNAMODB] interrupted while retrying", e);
    }
  }

  private static AttributeDefinition attribute(final String name,
      final ScalarAttributeType type) {
    return AttributeDefinition.builder().attributeName(name)
        .attributeType(type).build();
  }

  private static KeySchemaElement key(final String name,
      final KeyType type) {
    return KeySchemaElement.builder().attributeName(name).keyType(type)
        .build();
  }

  /**
   * A global secondary index with a string hash key and a numeric sort
   * key, projecting every attribute.
   *
   * @param name the index name, never null
   * @param hashKey the hash key attribute, never null
   * @param rangeKey the numeric sort key attribute, never null
   */
  record IndexSpec(String name, String hashKey, String rangeKey) {
  }
}
