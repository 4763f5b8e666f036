package org.waabox.filedex.dynamodb;

import static org.waabox.filedex.dynamodb.DynamoTables.doubleOf;
import static org.waabox.filedex.dynamodb.DynamoTables.failure;
import static org.waabox.filedex.dynamodb.DynamoTables.guard;
import static org.waabox.filedex.dynamodb.DynamoTables.longOf;
import static org.waabox.filedex.dynamodb.DynamoTables.n;
import static org.waabox.filedex.dynamodb.DynamoTables.s;
import static org.waabox.filedex.dynamodb.DynamoTables.stringOf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.filedex.KeyNotExistsException;
import org.waabox.filedex.filelist.AbstractFileList;
import org.waabox.filedex.filelist.WriteOutcome;
import org.waabox.filedex.key.DateKeys;
import org.waabox.filedex.key.FileKeyColumns;
import org.waabox.filedex.key.FileKeys;
import org.waabox.filedex.model.DeletedFile;
import org.waabox.filedex.model.FileKey;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.PartitionTimeLevel;
import org.waabox.filedex.model.PkRange;
import org.waabox.filedex.model.StreamStats;
import org.waabox.filedex.model.StreamType;
import org.waabox.filedex.model.TimeRange;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.DeleteRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.Select;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;

/**
 * A file catalog stored in DynamoDB.
 *
 * <p>File rows are keyed by stream ({@code {org}/{type}/{name}}) and
 * {@code {date}/{file}}, so a time window becomes one sort-key range per
 * stream. Every row carries the organization and its insertion time, which
 * the {@code org-created_at-index} global index uses to serve org-wide
 * incremental statistics.
 *
 * <p>Adds are conditional on absence: a chunk goes out as one
 * {@code TransactWriteItems} call, and a chunk that hits an existing file
 * is cancelled as a whole and retried one file at a time by
 * {@link AbstractFileList#batchAdd}; so is a chunk naming one file twice,
 * which a transaction cannot hold. Removals delete one item at a time to
 * learn what was there. Statistics grow through {@code ADD} updates and
 * conditional time updates, so concurrent writers never overwrite each
 * other. Full scans are refused:
 * {@link #list()} returns nothing and {@link #clear()} does nothing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DynamoDbFileList extends AbstractFileList {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(DynamoDbFileList.class);

  /** Files by stream and date/file. */
  static final String FILE_LIST = "file_list";

  /** Tombstones by organization and file. */
  static final String FILE_LIST_DELETED = "file_list_deleted";

  /** Statistics by organization and stream. */
  static final String STREAM_STATS = "stream_stats";

  /** The global index over organization and insertion time. */
  static final String ORG_INDEX = "org-created_at-index";

  /** How far behind the clock the insertion-time high mark stays. */
  private static final long MAX_PK_SKEW_MICROS = 1_000_000L;

  /** The tables, never null. */
  private final DynamoTables tables;

  /** Current time in microseconds, never null. */
  private final LongSupplier clock;

  /**
   * Creates the catalog.
   *
   * @param config the configuration, never null
   */
  public DynamoDbFileList(final DynamoDbConfig config) {
    this(config, TimeRange::nowMicros);
  }

  /** Creates the catalog with a custom clock.
   *
   * @param config the configuration, never null.
   * @param theClock the current time in microseconds, never null.
   */
  DynamoDbFileList(final DynamoDbConfig config, final LongSupplier theClock) {
    super("DYNAMODB", DynamoTables.BATCH_SIZE);
    clock = Objects.requireNonNull(theClock, "clock cannot be null");
    tables = new DynamoTables(config);
  }

  /** {@inheritDoc} */
  @Override
  public void createTable() {
    guard("create table", () -> {
      tables.ensureTable(FILE_LIST, "stream", "file",
          new DynamoTables.IndexSpec(ORG_INDEX, "org", "created_at"));
      tables.ensureTable(FILE_LIST_DELETED, "org", "file", null);
      tables.ensureTable(STREAM_STATS, "org", "stream", null);
      return null;
    });
  }

  /** {@inheritDoc} */
  @Override
  public void createTableIndex() {
    log.debug("[DYNAMODB] '{}' is created along with its table", ORG_INDEX);
  }

  /** {@inheritDoc} */
  @Override
  protected WriteOutcome insertChunk(final List<FileKey> chunk) {
    final long now = clock.getAsLong();
    if (hasDuplicates(chunk)) {
      // one transaction cannot touch an item twice
      log.debug("[DYNAMODB] chunk names a file twice, adding one by one");
      return WriteOutcome.ALREADY_EXISTS;
    }
    if (chunk.size() == 1) {
      try {
        tables.client().putItem(PutItemRequest.builder()
            .tableName(tables.name(FILE_LIST))
            .item(fileItem(chunk.get(0), now))
            .conditionExpression("attribute_not_exists(#f)")
            .expressionAttributeNames(Map.of("#f", "file"))
            .build());
        return WriteOutcome.COMMITTED;
      } catch (final ConditionalCheckFailedException e) {
        return WriteOutcome.ALREADY_EXISTS;
      } catch (final DynamoDbException e) {
        throw failure("put file", e);
      }
    }
    final List<TransactWriteItem> items = new ArrayList<>(chunk.size());
    for (final FileKey file : chunk) {
      items.add(TransactWriteItem.builder().put(Put.builder()
          .tableName(tables.name(FILE_LIST))
          .item(fileItem(file, now))
          .conditionExpression("attribute_not_exists(#f)")
          .expressionAttributeNames(Map.of("#f", "file"))
          .build()).build());
    }
    try {
      tables.client().transactWriteItems(TransactWriteItemsRequest.builder()
          .transactItems(items).build());
      return WriteOutcome.COMMITTED;
    } catch (final TransactionCanceledException e) {
      if (conditionFailed(e)) {
        return WriteOutcome.ALREADY_EXISTS;
      }
      throw failure("put files", e);
    } catch (final DynamoDbException e) {
      throw failure("put files", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  protected List<FileKey> removeChunk(final List<FileKeyColumns> chunk) {
    final List<FileKey> removed = new ArrayList<>();
    for (final FileKeyColumns columns : chunk) {
      final DeleteItemResponse response = guard("remove file", () ->
          tables.client().deleteItem(DeleteItemRequest.builder()
              .tableName(tables.name(FILE_LIST))
              .key(fileKey(columns))
              .returnValues(ReturnValue.ALL_OLD)
              .build()));
      if (response.hasAttributes() && !response.attributes().isEmpty()) {
        removed.add(FileKey.of(key(response.attributes()),
            meta(response.attributes())));
      }
    }
    return removed;
  }

  /** {@inheritDoc} */
  @Override
  protected void insertDeletedChunk(final String org, final long createdAt,
      final List<FileKeyColumns> chunk) {
    final List<WriteRequest> requests = new ArrayList<>(chunk.size());
    for (final FileKeyColumns columns : chunk) {
      final Map<String, AttributeValue> item = new HashMap<>();
      item.put("org", s(org));
      item.put("file", s(deletedSortKey(columns)));
      item.put("created_at", n(createdAt));
      requests.add(WriteRequest.builder()
          .putRequest(PutRequest.builder().item(item).build()).build());
    }
    guard("add tombstones", () -> {
      tables.batchWrite(FILE_LIST_DELETED, requests);
      return null;
    });
  }

  /** {@inheritDoc} */
  @Override
  protected void removeDeletedChunk(final List<FileKeyColumns> chunk) {
    final List<WriteRequest> requests = new ArrayList<>(chunk.size());
    for (final FileKeyColumns columns : chunk) {
      requests.add(delete(Map.of(
          "org", s(FileKeys.orgOf(columns.streamKey())),
          "file", s(deletedSortKey(columns)))));
    }
    guard("remove tombstones", () -> {
      tables.batchWrite(FILE_LIST_DELETED, requests);
      return null;
    });
  }

  /** {@inheritDoc} */
  @Override
  public FileMeta get(final String file) {
    final GetItemResponse response = getFile(file);
    if (!response.hasItem() || response.item().isEmpty()) {
      throw new KeyNotExistsException(file);
    }
    return meta(response.item());
  }

  /** {@inheritDoc} */
  @Override
  public boolean contains(final String file) {
    final GetItemResponse response = getFile(file);
    return response.hasItem() && !response.item().isEmpty();
  }

  /** {@inheritDoc} */
  @Override
  public List<FileKey> list() {
    log.warn("[DYNAMODB] listing every file is not supported");
    return Collections.emptyList();
  }

  /** {@inheritDoc} */
  @Override
  protected List<FileKey> queryRange(final String streamKey,
      final PartitionTimeLevel level, final TimeRange range) {
    final QueryRequest request = QueryRequest.builder()
        .tableName(tables.name(FILE_LIST))
        .keyConditionExpression("#s = :s AND #f BETWEEN :lo AND :hi")
        .expressionAttributeNames(Map.of("#s", "stream", "#f", "file"))
        .expressionAttributeValues(Map.of(
            ":s", s(streamKey),
            ":lo", s(DateKeys.lowerBound(range, level)),
            ":hi", s(DateKeys.upperBound(range))))
        .build();
    final List<FileKey> files = new ArrayList<>();
    for (final Map<String, AttributeValue> item
        : guard("query files", () -> tables.queryAll(request))) {
      final FileMeta meta = meta(item);
      if (meta.overlaps(range.start(), range.end())) {
        files.add(new FileKey(key(item), meta,
            item.containsKey("deleted")
                && Boolean.TRUE.equals(item.get("deleted").bool())));
      }
    }
    return files;
  }

  /** {@inheritDoc} */
  @Override
  public List<DeletedFile> queryDeleted(final String org, final long timeMax,
      final int limit) {
    final List<DeletedFile> deleted = new ArrayList<>();
    if (timeMax == 0) {
      return deleted;
    }
    final QueryRequest request = QueryRequest.builder()
        .tableName(tables.name(FILE_LIST_DELETED))
        .keyConditionExpression("#o = :o")
        .filterExpression("#c < :t")
        .expressionAttributeNames(Map.of("#o", "org", "#c", "created_at"))
        .expressionAttributeValues(Map.of(":o", s(org), ":t", n(timeMax)))
        .build();
    for (final Map<String, AttributeValue> item
        : guard("query tombstones", () -> tables.queryAll(request))) {
      deleted.add(new DeletedFile(FileKeys.ROOT + "/"
          + stringOf(item, "file"), longOf(item, "created_at")));
    }
    deleted.sort(Comparator.comparingLong(DeletedFile::createdAt));
    return deleted.size() > limit
        ? new ArrayList<>(deleted.subList(0, limit)) : deleted;
  }

  /** {@inheritDoc} */
  @Override
  public long getMinTs(final String org, final StreamType type,
      final String name) {
    final QueryRequest request = QueryRequest.builder()
        .tableName(tables.name(FILE_LIST))
        .keyConditionExpression("#s = :s")
        .projectionExpression("min_ts")
        .expressionAttributeNames(Map.of("#s", "stream"))
        .expressionAttributeValues(Map.of(
            ":s", s(FileKeys.streamKey(org, type, name))))
        .build();
    long min = 0;
    for (final Map<String, AttributeValue> item
        : guard("min ts", () -> tables.queryAll(request))) {
      final long minTs = longOf(item, "min_ts");
      if (minTs > TimeRange.BASE_TIME && (min == 0 || minTs < min)) {
        min = minTs;
      }
    }
    return min;
  }

  /** {@inheritDoc} */
  @Override
  public long getMaxPkValue() {
    return clock.getAsLong() - MAX_PK_SKEW_MICROS;
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, StreamStats> stats(final String org,
      final StreamType type, final String name, final PkRange range) {
    final PkRange window = range == null ? PkRange.ALL : range;
    final QueryRequest request;
    if (type != null && name != null) {
      request = QueryRequest.builder()
          .tableName(tables.name(FILE_LIST))
          .keyConditionExpression("#s = :s")
          .expressionAttributeNames(Map.of("#s", "stream"))
          .expressionAttributeValues(Map.of(
              ":s", s(FileKeys.streamKey(org, type, name))))
          .build();
    } else if (window.bounded()) {
      request = QueryRequest.builder()
          .tableName(tables.name(FILE_LIST))
          .indexName(ORG_INDEX)
          .keyConditionExpression("#o = :o AND #c BETWEEN :lo AND :hi")
          .expressionAttributeNames(Map.of("#o", "org", "#c", "created_at"))
          .expressionAttributeValues(Map.of(":o", s(org),
              ":lo", n(window.min() + 1), ":hi", n(window.max())))
          .build();
    } else {
      request = QueryRequest.builder()
          .tableName(tables.name(FILE_LIST))
          .indexName(ORG_INDEX)
          .keyConditionExpression("#o = :o")
          .expressionAttributeNames(Map.of("#o", "org"))
          .expressionAttributeValues(Map.of(":o", s(org)))
          .build();
    }
    final Map<String, StreamStats> stats = new TreeMap<>();
    for (final Map<String, AttributeValue> item
        : guard("stats", () -> tables.queryAll(request))) {
      if (window.contains(longOf(item, "created_at"))) {
        stats.merge(stringOf(item, "stream"),
            StreamStats.EMPTY.addFile(meta(item)), StreamStats::merge);
      }
    }
    return stats;
  }

  /** {@inheritDoc} */
  @Override
  public Map<String, StreamStats> getStreamStats(final String org,
      final StreamType type, final String name) {
    final Map<String, StreamStats> stats = new TreeMap<>();
    if (type != null && name != null) {
      final String streamKey = FileKeys.streamKey(org, type, name);
      final GetItemResponse response = guard("get stream stats", () ->
          tables.client().getItem(GetItemRequest.builder()
              .tableName(tables.name(STREAM_STATS))
              .key(statsKey(org, streamKey))
              .build()));
      if (response.hasItem() && !response.item().isEmpty()) {
        stats.put(streamKey, streamStats(response.item()));
      }
      return stats;
    }
    final QueryRequest request = QueryRequest.builder()
        .tableName(tables.name(STREAM_STATS))
        .keyConditionExpression("#o = :o")
        .expressionAttributeNames(Map.of("#o", "org"))
        .expressionAttributeValues(Map.of(":o", s(org)))
        .build();
    for (final Map<String, AttributeValue> item
        : guard("list stream stats", () -> tables.queryAll(request))) {
      stats.put(stringOf(item, "stream"), streamStats(item));
    }
    return stats;
  }

  /** {@inheritDoc} */
  @Override
  protected void insertEmptyStreamStats(final String org,
      final List<String> streamKeys) {
    for (final String streamKey : streamKeys) {
      try {
        tables.client().putItem(PutItemRequest.builder()
            .tableName(tables.name(STREAM_STATS))
            .item(statsItem(org, streamKey, StreamStats.EMPTY))
            .conditionExpression("attribute_not_exists(#s)")
            .expressionAttributeNames(Map.of("#s", "stream"))
            .build());
      } catch (final ConditionalCheckFailedException e) {
        log.debug("[DYNAMODB] stats of '{}' already exist", streamKey);
      } catch (final DynamoDbException e) {
        throw failure("init stream stats", e);
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  protected void addStreamStats(final String org,
      final Map<String, StreamStats> deltas) {
    deltas.forEach((streamKey, delta) -> {
      guard("add stream stats", () ->
          tables.client().updateItem(UpdateItemRequest.builder()
              .tableName(tables.name(STREAM_STATS))
              .key(statsKey(org, streamKey))
              .updateExpression("ADD file_num :f, doc_num :d,"
                  + " storage_size :s, compressed_size :c")
              .expressionAttributeValues(Map.of(
                  ":f", n(delta.fileNum()),
                  ":d", n(delta.docNum()),
                  ":s", n(delta.storageSize()),
                  ":c", n(delta.compressedSize())))
              .build()));
      if (delta.docTimeMin() > 0) {
        moveTime(org, streamKey, "doc_time_min", delta.docTimeMin(),
            "#t = :z OR #t > :m");
      }
      if (delta.docTimeMax() > 0) {
        moveTime(org, streamKey, "doc_time_max", delta.docTimeMax(),
            "#t < :m");
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public void resetStreamStats() {
    ScanRequest request = ScanRequest.builder()
        .tableName(tables.name(STREAM_STATS))
        .projectionExpression("#o, #s")
        .expressionAttributeNames(Map.of("#o", "org", "#s", "stream"))
        .build();
    while (true) {
      final ScanRequest page = request;
      final ScanResponse response =
          guard("scan stream stats", () -> tables.client().scan(page));
      for (final Map<String, AttributeValue> item : response.items()) {
        final String org = stringOf(item, "org");
        final String streamKey = stringOf(item, "stream");
        guard("reset stream stats", () ->
            tables.client().putItem(PutItemRequest.builder()
                .tableName(tables.name(STREAM_STATS))
                .item(statsItem(org, streamKey, StreamStats.EMPTY))
                .build()));
      }
      if (!response.hasLastEvaluatedKey()
          || response.lastEvaluatedKey().isEmpty()) {
        return;
      }
      request = request.toBuilder()
          .exclusiveStartKey(response.lastEvaluatedKey()).build();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void resetStreamStatsMinTs(final String org, final String streamKey,
      final long minTs) {
    try {
      tables.client().updateItem(UpdateItemRequest.builder()
          .tableName(tables.name(STREAM_STATS))
          .key(statsKey(org, streamKey))
          .updateExpression("SET doc_time_min = :m")
          .conditionExpression("attribute_exists(#s)")
          .expressionAttributeNames(Map.of("#s", "stream"))
          .expressionAttributeValues(Map.of(":m", n(minTs)))
          .build());
    } catch (final ConditionalCheckFailedException e) {
      log.debug("[DYNAMODB] no stats for '{}', min ts not reset", streamKey);
    } catch (final DynamoDbException e) {
      throw failure("reset min ts", e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void deleteStreamStats(final String org, final StreamType type,
      final String name) {
    guard("delete stream stats", () ->
        tables.client().deleteItem(DeleteItemRequest.builder()
            .tableName(tables.name(STREAM_STATS))
            .key(statsKey(org, FileKeys.streamKey(org, type, name)))
            .build()));
  }

  /** {@inheritDoc} */
  @Override
  public long len() {
    long count = 0;
    ScanRequest request = ScanRequest.builder()
        .tableName(tables.name(FILE_LIST))
        .select(Select.COUNT)
        .build();
    while (true) {
      final ScanRequest page = request;
      final ScanResponse response =
          guard("count files", () -> tables.client().scan(page));
      count += response.count() == null ? 0 : response.count();
      if (!response.hasLastEvaluatedKey()
          || response.lastEvaluatedKey().isEmpty()) {
        return count;
      }
      request = request.toBuilder()
          .exclusiveStartKey(response.lastEvaluatedKey()).build();
    }
  }

  /** {@inheritDoc} */
  @Override
  public void clear() {
    log.warn("[DYNAMODB] clearing the file list is not supported");
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    tables.close();
  }

  /** Sets a time bound of a statistics row when its condition holds.
   *
   * @param org the organization id.
   * @param streamKey the stream key.
   * @param attribute the time attribute.
   * @param value the candidate time.
   * @param condition when to take the candidate, over {@code #t},
   *     {@code :m} and {@code :z}.
   */
  private void moveTime(final String org, final String streamKey,
      final String attribute, final long value, final String condition) {
    try {
      tables.client().updateItem(UpdateItemRequest.builder()
          .tableName(tables.name(STREAM_STATS))
          .key(statsKey(org, streamKey))
          .updateExpression("SET #t = :m")
          .conditionExpression(condition)
          .expressionAttributeNames(Map.of("#t", attribute))
          .expressionAttributeValues(condition.contains(":z")
              ? Map.of(":m", n(value), ":z", n(0L))
              : Map.of(":m", n(value)))
          .build());
    } catch (final ConditionalCheckFailedException e) {
      log.trace("[DYNAMODB] {} of '{}' unchanged", attribute, streamKey);
    } catch (final DynamoDbException e) {
      throw failure("move " + attribute, e);
    }
  }

  /** Reads the row of a file.
   *
   * @param file the file key.
   * @return the response, never null.
   */
  private GetItemResponse getFile(final String file) {
    final Map<String, AttributeValue> key =
        fileKey(FileKeys.parseColumns(file));
    return guard("get file", () -> tables.client().getItem(
        GetItemRequest.builder()
            .tableName(tables.name(FILE_LIST))
            .key(key)
            .consistentRead(true)
            .build()));
  }

  /** Builds the item of a file row.
   *
   * @param file the file.
   * @param createdAt the insertion time in microseconds.
   * @return the item, never null.
   */
  private static Map<String, AttributeValue> fileItem(final FileKey file,
      final long createdAt) {
    final FileKeyColumns columns = FileKeys.parseColumns(file.key());
    final FileMeta meta = file.meta();
    final Map<String, AttributeValue> item = new HashMap<>(fileKey(columns));
    item.put("org", s(FileKeys.orgOf(columns.streamKey())));
    item.put("min_ts", n(meta.minTs()));
    item.put("max_ts", n(meta.maxTs()));
    item.put("records", n(meta.records()));
    item.put("original_size", n(meta.originalSize()));
    item.put("compressed_size", n(meta.compressedSize()));
    item.put("deleted", AttributeValue.builder().bool(file.deleted()).build());
    item.put("created_at", n(createdAt));
    return item;
  }

  private static Map<String, AttributeValue> fileKey(
      final FileKeyColumns columns) {
    return Map.of(
        "stream", s(columns.streamKey()),
        "file", s(columns.dateKey() + "/" + columns.fileName()));
  }

  private static String deletedSortKey(final FileKeyColumns columns) {
    return columns.streamKey() + "/" + columns.dateKey() + "/"
        + columns.fileName();
  }

  /** Rebuilds the file key of a row.
   *
   * @param item the row.
   * @return the key, never null.
   */
  private static String key(final Map<String, AttributeValue> item) {
    return FileKeys.ROOT + "/" + stringOf(item, "stream") + "/"
        + stringOf(item, "file");
  }

  private static FileMeta meta(final Map<String, AttributeValue> item) {
    return new FileMeta(longOf(item, "min_ts"), longOf(item, "max_ts"),
        longOf(item, "records"), longOf(item, "original_size"),
        longOf(item, "compressed_size"));
  }

  private static Map<String, AttributeValue> statsKey(final String org,
      final String streamKey) {
    return Map.of("org", s(org), "stream", s(streamKey));
  }

  private static Map<String, AttributeValue> statsItem(final String org,
      final String streamKey, final StreamStats stats) {
    final Map<String, AttributeValue> item =
        new HashMap<>(statsKey(org, streamKey));
    item.put("file_num", n(stats.fileNum()));
    item.put("doc_num", n(stats.docNum()));
    item.put("doc_time_min", n(stats.docTimeMin()));
    item.put("doc_time_max", n(stats.docTimeMax()));
    item.put("storage_size", n(stats.storageSize()));
    item.put("compressed_size", n(stats.compressedSize()));
    return item;
  }

  /** Maps a statistics row; counters that a removal took below zero read
   * as zero.
   *
   * @param item the row.
   * @return the statistics, never null.
   */
  private static StreamStats streamStats(
      final Map<String, AttributeValue> item) {
    return new StreamStats(
        Math.max(0, longOf(item, "file_num")),
        Math.max(0, longOf(item, "doc_num")),
        longOf(item, "doc_time_min"), longOf(item, "doc_time_max"),
        Math.max(0, doubleOf(item, "storage_size")),
        Math.max(0, doubleOf(item, "compressed_size")));
  }

  private static WriteRequest delete(final Map<String, AttributeValue> key) {
    return WriteRequest.builder()
        .deleteRequest(DeleteRequest.builder().key(key).build()).build();
  }

  /** Tells whether a chunk names the same file more than once.
   *
   * @param chunk the chunk.
   * @return true on a repeated file.
   */
  private static boolean hasDuplicates(final List<FileKey> chunk) {
    final Set<String> seen = new HashSet<>();
    for (final FileKey file : chunk) {
      final FileKeyColumns columns = FileKeys.parseColumns(file.key());
      if (!seen.add(deletedSortKey(columns))) {
        return true;
      }
    }
    return false;
  }

  /** Tells whether a cancelled transaction failed on a condition.
   *
   * @param e the cancellation.
   * @return true if any item failed its condition.
   */
  private static boolean conditionFailed(
      final TransactionCanceledException e) {
    if (!e.hasCancellationReasons()) {
      return false;
    }
    for (final CancellationReason reason : e.cancellationReasons()) {
      if ("ConditionalCheckFailed".equals(reason.code())) {
        return true;
      }
    }
    return false;
  }
}
