package org.waabox.filedex.filelist;

import java.util.List;
import java.util.Map;

import org.waabox.filedex.model.MergeJob;
import org.waabox.filedex.model.StreamType;

/**
 * A durable queue of merge jobs shared by the compactor nodes.
 *
 * <p>A job is identified by its stream and offset; posting the same pair
 * twice is a no-op. Nodes claim pending jobs, keep them alive with
 * heartbeats and mark them done. Jobs whose node stopped sending
 * heartbeats are handed back to the pending pool by
 * {@link #checkRunningJobs(long)}.
 *
 * <p>All times are microseconds since the epoch.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MergeJobQueue {

  /**
   * Posts a pending job. An existing job for the same stream and offset
   * is left untouched.
   *
   * @param org the organization id, never null
   * @param type the stream type, never null
   * @param name the stream name, never null
   * @param offset the time offset the merge starts from
   */
  void addJob(String org, StreamType type, String name, long offset);

  /**
   * Claims pending work for a node: for the streams with the most pending
   * jobs, their newest pending job is moved to running on that node.
   * A job is claimed by one node only, even with concurrent callers.
   *
   * @param node the claiming node, never null
   * @param limit the maximum number of streams
   *
   * @return the claimed jobs, never null
   */
  List<MergeJob> getPendingJobs(String node, int limit);

  /**
   * Hands jobs back to the pending pool.
   *
   * @param ids the job ids, never null
   */
  void setJobPending(List<Long> ids);

  /**
   * Marks a job as done.
   *
   * @param id the job id
   */
  void setJobDone(long id);

  /**
   * Records a heartbeat of a running job.
   *
   * @param id the job id
   */
  void updateRunningJobs(long id);

  /**
   * Moves running jobs without a heartbeat since a date back to pending.
   *
   * @param beforeDate the heartbeat cutoff
   *
   * @return the number of jobs handed back
   */
  int checkRunningJobs(long beforeDate);

  /**
   * Deletes done jobs last updated before a date.
   *
   * @param beforeDate the cutoff
   *
   * @return the number of jobs deleted
   */
  int cleanDoneJobs(long beforeDate);

  /**
   * Counts the pending jobs per organization and stream type.
   *
   * @return counts keyed by org then by stream type wire name, never null
   */
  Map<String, Map<String, Long>> getPendingJobsCount();
}
