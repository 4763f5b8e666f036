package org.waabox.filedex.codec;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.filedex.model.StreamStats;

/**
 * Static utility class for converting {@link StreamStats} to and from
 * JSON.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StreamStatsCodec {

  /** Private constructor to prevent instantiation. */
  private StreamStatsCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes statistics into a JSON string.
   *
   * @param stats the statistics, never null.
   * @return the JSON, never null.
   */
  public static String serialize(final StreamStats stats) {
    Objects.requireNonNull(stats, "stats cannot be null");
    final ObjectNode node = FileMetaCodec.MAPPER.createObjectNode();
    node.put("file_num", stats.fileNum());
    node.put("doc_num", stats.docNum());
    node.put("doc_time_min", stats.docTimeMin());
    node.put("doc_time_max", stats.docTimeMax());
    node.put("storage_size", stats.storageSize());
    node.put("compressed_size", stats.compressedSize());
    return node.toString();
  }

  /**
   * Parses statistics from a JSON string.
   *
   * @param json the JSON, never null.
   * @return the statistics, never null.
   * @throws IllegalArgumentException if the JSON is malformed or misses a
   *     field.
   */
  public static StreamStats deserialize(final String json) {
    final JsonNode node = FileMetaCodec.readTree(json);
    return new StreamStats(
        FileMetaCodec.requireField(node, "file_num").asLong(),
        FileMetaCodec.requireField(node, "doc_num").asLong(),
        FileMetaCodec.requireField(node, "doc_time_min").asLong(),
        FileMetaCodec.requireField(node, "doc_time_max").asLong(),
        FileMetaCodec.requireField(node, "storage_size").asDouble(),
        FileMetaCodec.requireField(node, "compressed_size").asDouble());
  }
}
