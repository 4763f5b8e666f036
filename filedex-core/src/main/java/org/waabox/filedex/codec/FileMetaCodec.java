package org.waabox.filedex.codec;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.filedex.model.FileMeta;

/**
 * Static utility class for converting {@link FileMeta} instances to and
 * from JSON.
 *
 * <p>Uses Jackson's tree model so storage adapters can add their own
 * bookkeeping fields next to the metadata fields.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileMetaCodec {

  /** Shared ObjectMapper for tree model operations. */
  static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private FileMetaCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes metadata into a JSON string.
   *
   * @param meta the metadata, never null.
   * @return the JSON, never null.
   */
  public static String serialize(final FileMeta meta) {
    return toNode(meta).toString();
  }

  /**
   * Builds the JSON object of the metadata.
   *
   * <p>The object has the fields {@code min_ts}, {@code max_ts},
   * {@code records}, {@code original_size} and {@code compressed_size}.
   *
   * @param meta the metadata, never null.
   * @return a new mutable node, never null.
   */
  public static ObjectNode toNode(final FileMeta meta) {
    Objects.requireNonNull(meta, "meta cannot be null");
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("min_ts", meta.minTs());
    node.put("max_ts", meta.maxTs());
    node.put("records", meta.records());
    node.put("original_size", meta.originalSize());
    node.put("compressed_size", meta.compressedSize());
    return node;
  }

  /**
   * Parses metadata from a JSON string.
   *
   * @param json the JSON, never null.
   * @return the metadata, never null.
   * @throws IllegalArgumentException if the JSON is malformed or misses a
   *     field.
   */
  public static FileMeta deserialize(final String json) {
    return fromNode(readTree(json));
  }

  /**
   * Reads the metadata fields of a JSON object.
   *
   * @param node the object, never null.
   * @return the metadata, never null.
   * @throws IllegalArgumentException if a field is missing.
   */
  public static FileMeta fromNode(final JsonNode node) {
    return new FileMeta(
        requireField(node, "min_ts").asLong(),
        requireField(node, "max_ts").asLong(),
        requireField(node, "records").asLong(),
        requireField(node, "original_size").asLong(),
        requireField(node, "compressed_size").asLong());
  }

  /**
   * Parses a JSON string into a tree.
   *
   * @param json the JSON, never null.
   * @return the tree, never null.
   * @throws IllegalArgumentException if the JSON is malformed.
   */
  public static JsonNode readTree(final String json) {
    Objects.requireNonNull(json, "json cannot be null");
    try {
      return MAPPER.readTree(json);
    } catch (final Exception e) {
      throw new IllegalArgumentException("Malformed JSON: " + json, e);
    }
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  static JsonNode requireField(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }
}
