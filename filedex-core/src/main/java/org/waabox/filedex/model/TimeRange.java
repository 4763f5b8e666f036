package org.waabox.filedex.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import org.waabox.filedex.DisallowedQueryException;

/**
 * An inclusive time window in microseconds since the epoch.
 *
 * @param start the inclusive start
 * @param end   the inclusive end
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TimeRange(long start, long end) {

  /** The earliest timestamp the catalog accepts, 2020-01-01T00:00:00Z. */
  public static final long BASE_TIME = 1577836800L * 1_000_000L;

  /**
   * Applies the query policy to raw bounds.
   *
   * <p>A zero start means the epoch floor {@link #BASE_TIME}, a zero end
   * means now. Both zero is rejected.
   *
   * @param start the raw start, 0 for unbounded
   * @param end the raw end, 0 for unbounded
   * @param nowMicros the current time in microseconds
   *
   * @return the resolved window, never null
   *
   * @throws DisallowedQueryException if both bounds are zero or the start
   *     is after the end
   */
  public static TimeRange resolve(final long start, final long end,
      final long nowMicros) {
    if (start == 0 && end == 0) {
      throw new DisallowedQueryException(
          "Disallow empty time range query");
    }
    final long from = start == 0 ? BASE_TIME : start;
    final long to = end == 0 ? nowMicros : end;
    if (from > to) {
      throw new DisallowedQueryException("Time range start " + from
          + " is after end " + to);
    }
    return new TimeRange(from, to);
  }

  /**
   * Applies the query policy using the wall clock.
   *
   * @param start the raw start, 0 for unbounded
   * @param end the raw end, 0 for unbounded
   *
   * @return the resolved window, never null
   */
  public static TimeRange resolve(final long start, final long end) {
    return resolve(start, end, nowMicros());
  }

  /**
   * Returns the wall clock in microseconds.
   *
   * @return the current time in microseconds since the epoch
   */
  public static long nowMicros() {
    return ChronoUnit.MICROS.between(Instant.EPOCH, Instant.now());
  }
}
