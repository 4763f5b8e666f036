package org.waabox.filedex.dynamodb;

import static org.waabox.filedex.dynamodb.DynamoTables.guard;
import static org.waabox.filedex.dynamodb.DynamoTables.s;
import static org.waabox.filedex.dynamodb.DynamoTables.stringOf;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.db.ChangeNotifier;
import org.waabox.filedex.db.Db;
import org.waabox.filedex.db.DbStats;
import org.waabox.filedex.db.WatchHub;
import org.waabox.filedex.db.WatchSubscription;
import org.waabox.filedex.key.KvKey;
import org.waabox.filedex.key.KvKeys;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * A {@link Db} stored in one DynamoDB table.
 *
 * <p>A key {@code /{module}/{key1}/{key2}} is stored under the hash key
 * {@code module} and the sort key {@code {key1}/{key2}}. A prefix matches
 * the module exactly, {@code key1} exactly when given and {@code key2} by
 * prefix, the same rules as the SQL stores.
 *
 * <p>The table is shared by every node, so the store is
 * {@link #distributed()}: watchers elsewhere learn about mutations
 * through the {@link ChangeNotifier}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DynamoDbDb implements Db {

  /** Class logger. */
  private static final Logger log = LoggerFactory.getLogger(DynamoDbDb.class);

  /** The key-value table. */
  static final String META = "meta";

  /** The tables, never null. */
  private final DynamoTables tables;

  /** Local watchers. */
  private final WatchHub hub = new WatchHub();

  /** Receives watched mutations, never null. */
  private final ChangeNotifier notifier;

  /**
   * Creates a store that notifies its own watchers only.
   *
   * @param config the configuration, never null
   */
  public DynamoDbDb(final DynamoDbConfig config) {
    this(config, null);
  }

  /**
   * Creates a store.
   *
   * @param config the configuration, never null
   * @param theNotifier receives watched mutations, null for the local hub
   */
  public DynamoDbDb(final DynamoDbConfig config,
      final ChangeNotifier theNotifier) {
    tables = new DynamoTables(config);
    notifier = theNotifier == null ? hub : theNotifier;
  }

  /** {@inheritDoc} */
  @Override
  public void createTable() {
    guard("create table", () -> {
      tables.ensureTable(META, "module", "key", null);
      return null;
    });
  }

  /** {@inheritDoc} */
  @Override
  public DbStats stats() {
    final TableDescription table = guard("describe table", () ->
        tables.client().describeTable(DescribeTableRequest.builder()
            .tableName(tables.name(META)).build()).table());
    return new DbStats(nullToZero(table.tableSizeBytes()),
        nullToZero(table.itemCount()));
  }

  /** {@inheritDoc} */
  @Override
  public byte[] get(final String key) {
    final GetItemResponse response = guard("get", () ->
        tables.client().getItem(GetItemRequest.builder()
            .tableName(tables.name(META))
            .key(itemKey(KvKeys.parse(key)))
            .consistentRead(true)
            .build()));
    if (!response.hasItem() || response.item().isEmpty()) {
      throw new KeyNotExistsException(key);
    }
    return response.item().get("value").b().asByteArray();
  }

  /** {@inheritDoc} */
  @Override
  public void put(final String key, final byte[] value,
      final boolean needWatch) {
    Objects.requireNonNull(value, "value cannot be null");
    final Map<String, AttributeValue> item =
        new HashMap<>(itemKey(KvKeys.parse(key)));
    item.put("value", AttributeValue.builder()
        .b(SdkBytes.fromByteArray(value)).build());
    guard("put", () -> tables.client().putItem(PutItemRequest.builder()
        .tableName(tables.name(META)).item(item).build()));
    if (needWatch) {
      notifier.notifyPut(key, value);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void delete(final String key, final boolean withPrefix,
      final boolean needWatch) {
    final long deleted = withPrefix ? deletePrefix(key) : deleteOne(key);
    if (deleted == 0) {
      throw new KeyNotExistsException(key);
    }
    if (needWatch) {
      notifier.notifyDelete(key, withPrefix);
    }
  }

  /** {@inheritDoc} */
  @Override
  public SortedMap<String, byte[]> list(final String prefix) {
    final KvKey kv = KvKeys.parse(prefix);
    final SortedMap<String, byte[]> result = new TreeMap<>();
    for (final Map<String, AttributeValue> item : query(kv, false)) {
      result.put(toKey(kv.module(), stringOf(item, "key")),
          item.get("value").b().asByteArray());
    }
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public long count(final String prefix) {
    return query(KvKeys.parse(prefix), true).size();
  }

  /** {@inheritDoc} */
  @Override
  public WatchSubscription watch(final String prefix) {
    return hub.subscribe(prefix);
  }

  /** {@inheritDoc} */
  @Override
  public boolean distributed() {
    return true;
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    hub.closeAll();
    tables.close();
  }

  /** Deletes one key.
   *
   * @param key the key.
   * @return 1 if the key existed, else 0.
   */
  private long deleteOne(final String key) {
    final DeleteItemResponse response = guard("delete", () ->
        tables.client().deleteItem(DeleteItemRequest.builder()
            .tableName(tables.name(META))
            .key(itemKey(KvKeys.parse(key)))
            .returnValues(ReturnValue.ALL_OLD)
            .build()));
    return response.hasAttributes() && !response.attributes().isEmpty()
        ? 1 : 0;
  }

  /** Deletes every key under a prefix, in batches.
   *
   * @param prefix the prefix.
   * @return the number of deleted keys.
   */
  private long deletePrefix(final String prefix) {
    final KvKey kv = KvKeys.parse(prefix);
    final List<Map<String, AttributeValue>> items = query(kv, true);
    final List<WriteRequest> batch = new ArrayList<>();
    for (final Map<String, AttributeValue> item : items) {
      batch.add(WriteRequest.builder().deleteRequest(DeleteRequest.builder()
          .key(Map.of("module", s(kv.module()),
              "key", item.get("key"))).build()).build());
      if (batch.size() == DynamoTables.BATCH_SIZE) {
        flush(batch);
      }
    }
    flush(batch);
    log.debug("[DYNAMODB] deleted {} keys under '{}'", items.size(), prefix);
    return items.size();
  }

  private void flush(final List<WriteRequest> batch) {
    final List<WriteRequest> requests = new ArrayList<>(batch);
    batch.clear();
    guard("delete prefix", () -> {
      tables.batchWrite(META, requests);
      return null;
    });
  }

  /** Queries the items matching a prefix.
   *
   * @param kv the prefix columns.
   * @param keysOnly whether to skip the values.
   * @return the items, never null.
   */
  private List<Map<String, AttributeValue>> query(final KvKey kv,
      final boolean keysOnly) {
    final QueryRequest.Builder request = QueryRequest.builder()
        .tableName(tables.name(META));
    final Map<String, String> names = new HashMap<>();
    final Map<String, AttributeValue> values = new HashMap<>();
    names.put("#m", "module");
    values.put(":m", s(kv.module()));
    if (kv.key1().isEmpty()) {
      request.keyConditionExpression("#m = :m");
    } else {
      names.put("#k", "key");
      values.put(":k", s(kv.key1() + "/" + kv.key2()));
      request.keyConditionExpression("#m = :m AND begins_with(#k, :k)");
    }
    if (keysOnly) {
      names.put("#k", "key");
      request.projectionExpression("#k");
    }
    final QueryRequest built = request.expressionAttributeNames(names)
        .expressionAttributeValues(values).build();
    return guard("query", () -> tables.queryAll(built));
  }

  /** Builds the primary key of a stored key.
   *
   * @param kv the key columns.
   * @return the item key, never null.
   */
  private static Map<String, AttributeValue> itemKey(final KvKey kv) {
    return Map.of("module", s(kv.module()),
        "key", s(kv.key1() + "/" + kv.key2()));
  }

  /** Rebuilds a key from its module and sort key.
   *
   * @param module the module.
   * @param sortKey the {@code {key1}/{key2}} sort key.
   * @return the key, never null.
   */
  static String toKey(final String module, final String sortKey) {
    final int slash = sortKey.indexOf('/');
    final String key1 = slash < 0 ? sortKey : sortKey.substring(0, slash);
    final String key2 = slash < 0 ? "" : sortKey.substring(slash + 1);
    return KvKeys.build(module, key1, key2);
  }

  private static long nullToZero(final Long value) {
    return value == null ? 0 : value;
  }
}
