package org.waabox.filedex.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.waabox.filedex.model.FileMeta;
import org.waabox.filedex.model.StreamStats;

/**
 * Tests for {@link FileMetaCodec} and {@link StreamStatsCodec}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileMetaCodecTest {

  @Test
  void whenSerializing_givenMeta_shouldUseSnakeCaseFields() {
    final String json = FileMetaCodec.serialize(
        new FileMeta(1, 2, 3, 4, 5));

    assertTrue(json.contains("\"min_ts\":1"));
    assertTrue(json.contains("\"compressed_size\":5"));
  }

  @Test
  void whenDeserializing_givenExtraFields_shouldIgnoreThem() {
    final FileMeta meta = FileMetaCodec.deserialize("{\"min_ts\":1,"
        + "\"max_ts\":2,\"records\":3,\"original_size\":4,"
        + "\"compressed_size\":5,\"created_at\":99}");

    assertEquals(new FileMeta(1, 2, 3, 4, 5), meta);
  }

  @Test
  void whenDeserializing_givenMissingField_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> FileMetaCodec.deserialize("{\"min_ts\":1}"));
  }

  @Test
  void whenDeserializing_givenMalformedJson_shouldFail() {
    assertThrows(IllegalArgumentException.class,
        () -> StreamStatsCodec.deserialize("{not json"));
  }

  @Test
  void whenDecodingStats_givenEncodedStats_shouldRestoreValues() {
    final StreamStats stats = new StreamStats(2, 10, 5, 30, 200.5, 20.25);

    assertEquals(stats,
        StreamStatsCodec.deserialize(StreamStatsCodec.serialize(stats)));
  }
}
