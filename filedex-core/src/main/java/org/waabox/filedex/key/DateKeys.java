package org.waabox.filedex.key;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import org.waabox.filedex.model.PartitionTimeLevel;
import org.waabox.filedex.model.TimeRange;

/**
 * Formats microsecond timestamps into hour partitions and expands time
 * windows into the partition prefixes that cover them.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DateKeys {

  /** Windows up to this long are scanned by hour, longer ones by day. */
  private static final long HOURLY_SCAN_LIMIT_MICROS =
      48L * 3600L * 1_000_000L;

  /** Hour partition format. */
  private static final DateTimeFormatter HOUR =
      DateTimeFormatter.ofPattern("yyyy/MM/dd/HH").withZone(ZoneOffset.UTC);

  /** Day partition format. */
  private static final DateTimeFormatter DAY =
      DateTimeFormatter.ofPattern("yyyy/MM/dd").withZone(ZoneOffset.UTC);

  /** Private constructor to prevent instantiation. */
  private DateKeys() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Formats a timestamp as an hour partition.
   *
   * @param micros the timestamp in microseconds since the epoch
   *
   * @return {@code YYYY/MM/DD/HH} in UTC, never null
   */
  public static String dateKey(final long micros) {
    return HOUR.format(toInstant(micros));
  }

  /**
   * Lists the partition prefixes that cover a window.
   *
   * <p>Each prefix ends with {@code /}. Windows of at most 48 hours yield
   * one prefix per hour, longer windows one prefix per day. With
   * {@link PartitionTimeLevel#DAILY} the window start is moved to the
   * beginning of its day.
   *
   * @param range the resolved window, never null
   * @param level the stream partition level, never null
   *
   * @return the prefixes in ascending order, never null
   */
  public static List<String> prefixes(final TimeRange range,
      final PartitionTimeLevel level) {
    ZonedDateTime start = toInstant(range.start()).atZone(ZoneOffset.UTC);
    final ZonedDateTime end = toInstant(range.end()).atZone(ZoneOffset.UTC);
    if (level == PartitionTimeLevel.DAILY) {
      start = start.truncatedTo(ChronoUnit.DAYS);
    }

    final List<String> prefixes = new ArrayList<>();
    if (range.end() - range.start() <= HOURLY_SCAN_LIMIT_MICROS) {
      ZonedDateTime hour = start.truncatedTo(ChronoUnit.HOURS);
      while (!hour.isAfter(end)) {
        prefixes.add(HOUR.format(hour) + "/");
        hour = hour.plusHours(1);
      }
    } else {
      ZonedDateTime day = start.truncatedTo(ChronoUnit.DAYS);
      while (!day.isAfter(end)) {
        prefixes.add(DAY.format(day) + "/");
        day = day.plusDays(1);
      }
    }
    return prefixes;
  }

  /**
   * Returns the hour partition of the window start, the lower bound of a
   * sort-key range scan.
   *
   * @param range the resolved window, never null
   * @param level the stream partition level, never null
   *
   * @return the partition, never null
   */
  public static String lowerBound(final TimeRange range,
      final PartitionTimeLevel level) {
    ZonedDateTime start = toInstant(range.start()).atZone(ZoneOffset.UTC);
    if (level == PartitionTimeLevel.DAILY) {
      start = start.truncatedTo(ChronoUnit.DAYS);
    }
    return HOUR.format(start);
  }

  /**
   * Returns the upper bound of a sort-key range scan: the hour partition of
   * the window end followed by {@code 0}, which sorts right after every
   * {@code {partition}/...} key.
   *
   * @param range the resolved window, never null
   *
   * @return the bound, never null
   */
  public static String upperBound(final TimeRange range) {
    return dateKey(range.end()) + "0";
  }

  /** Converts microseconds into an instant.
   *
   * @param micros the timestamp in microseconds.
   * @return the instant, never null.
   */
  private static Instant toInstant(final long micros) {
    return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
  }
}
