package org.waabox.filedex.key;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.waabox.filedex.model.PartitionTimeLevel;
import org.waabox.filedex.model.TimeRange;

/**
 * Tests for {@link DateKeys}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DateKeysTest {

  /** 2022-10-03T10:15:00Z in microseconds. */
  private static final long T0 = 1664792100L * 1_000_000L;

  private static final long HOUR = 3600L * 1_000_000L;

  @Test
  void whenFormatting_givenMicros_shouldUseUtcHour() {
    assertEquals("2022/10/03/10", DateKeys.dateKey(T0));
  }

  @Test
  void whenExpanding_givenShortWindow_shouldListHours() {
    final List<String> prefixes = DateKeys.prefixes(
        new TimeRange(T0, T0 + 2 * HOUR), PartitionTimeLevel.HOURLY);

    assertEquals(List.of("2022/10/03/10/", "2022/10/03/11/",
        "2022/10/03/12/"), prefixes);
  }

  @Test
  void whenExpanding_givenLongWindow_shouldListDays() {
    final List<String> prefixes = DateKeys.prefixes(
        new TimeRange(T0, T0 + 72 * HOUR), PartitionTimeLevel.HOURLY);

    assertEquals(List.of("2022/10/03/", "2022/10/04/", "2022/10/05/",
        "2022/10/06/"), prefixes);
  }

  @Test
  void whenExpanding_givenDailyLevel_shouldStartAtMidnight() {
    final List<String> prefixes = DateKeys.prefixes(
        new TimeRange(T0, T0 + HOUR), PartitionTimeLevel.DAILY);

    assertEquals(12, prefixes.size());
    assertEquals("2022/10/03/00/", prefixes.get(0));
    assertEquals("2022/10/03/11/", prefixes.get(11));
  }

  @Test
  void whenBounding_givenWindow_shouldCoverEveryKeyOfTheLastHour() {
    final TimeRange range = new TimeRange(T0, T0 + HOUR);

    assertEquals("2022/10/03/10",
        DateKeys.lowerBound(range, PartitionTimeLevel.UNSET));
    assertEquals("2022/10/03/110", DateKeys.upperBound(range));
    assertEquals(true,
        "2022/10/03/11/z.parquet".compareTo(DateKeys.upperBound(range)) < 0);
  }
}
