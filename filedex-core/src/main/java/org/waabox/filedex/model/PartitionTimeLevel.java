package org.waabox.filedex.model;

/**
 * The time granularity a stream partitions its files by.
 *
 * <p>{@link #DAILY} makes date-prefix queries start at the beginning of
 * the day that contains the query start.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum PartitionTimeLevel {
  UNSET,
  HOURLY,
  DAILY
}
