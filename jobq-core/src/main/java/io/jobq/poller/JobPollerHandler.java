package io.jobq.poller;

import io.jobq.model.Job;

/**
 * Single consumer of a {@link JobPoller}. Each tick that attempts a claim ends in exactly one
 * of {@link #onJob}, {@link #onIdle} or {@link #onError}. Ticks skipped because
 * {@link #availableCapacity()} is {@code 0} produce no callback.
 *
 * <p>Callbacks run on the poller thread. A claimed job is already RUNNING and owned by the
 * poller's worker; the handler must buffer or process it and eventually ack, retry, kill or
 * reschedule it.
 */
public interface JobPollerHandler {

  /**
   * A job was claimed on this tick.
   *
   * @param job the claimed job, owned by the poller's worker
   */
  void onJob(Job job);

  /** The tick completed without claiming a job. */
  default void onIdle() {
  }

  /**
   * The tick failed, typically with a {@link io.jobq.JobStoreException}. The poller keeps
   * ticking.
   *
   * @param error the failure
   */
  default void onError(RuntimeException error) {
  }

  /**
   * Number of jobs this handler can accept right now. The poller skips claiming on ticks
   * where this returns {@code 0}, so rows are never locked that cannot be processed.
   *
   * <p>Default returns {@link Integer#MAX_VALUE} (no cap).
   */
  default int availableCapacity() {
    return Integer.MAX_VALUE;
  }
}
