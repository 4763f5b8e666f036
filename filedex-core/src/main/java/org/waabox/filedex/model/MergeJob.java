package org.waabox.filedex.model;

import java.util.Objects;

/**
 * A request to merge the small files of one stream from an offset on.
 *
 * @param id        the job id
 * @param org       the organization id, never null
 * @param stream    the stream key, never null
 * @param offsets   the time offset the merge starts from, in microseconds
 * @param status    the lifecycle status, never null
 * @param node      the node running the job, empty while pending
 * @param startedAt when a node claimed the job, in microseconds
 * @param updatedAt the last heartbeat or status change, in microseconds
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record MergeJob(long id, String org, String stream, long offsets,
    MergeJobStatus status, String node, long startedAt, long updatedAt) {

  /** Validates the components. */
  public MergeJob {
    Objects.requireNonNull(org, "org cannot be null");
    Objects.requireNonNull(stream, "stream cannot be null");
    Objects.requireNonNull(status, "status cannot be null");
    Objects.requireNonNull(node, "node cannot be null");
  }
}
