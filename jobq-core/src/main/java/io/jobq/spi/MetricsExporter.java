package io.jobq.spi;

/**
 * Observability hook for exporting job queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 *
 * @see io.jobq.micrometer.MicrometerMetricsExporter
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /** A job was inserted. */
  void incrementEnqueued();

  /** A poll tick won the claim on a candidate. */
  void incrementClaimed();

  /** A poll tick selected a candidate but another worker claimed it first. */
  void incrementClaimLost();

  /** A job was acknowledged as DONE. */
  void incrementAcked();

  /** A job was killed. */
  void incrementKilled();

  /** A failed job was rescheduled with backoff. */
  void incrementRescheduled();

  /**
   * Records jobs returned to PENDING by the liveness sweeps.
   *
   * @param scheduled failed jobs re-queued by the enqueue-scheduled sweep
   * @param orphaned  running jobs reclaimed from silent workers
   */
  void recordSweep(int scheduled, int orphaned);

  /**
   * Records the wall time of a job handler invocation.
   *
   * @param durationMs handler execution time in milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(long durationMs) {
  }

  /**
   * Records the number of PENDING jobs last observed by {@link io.jobq.JobQueue#len()}.
   */
  default void recordPendingCount(long pending) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEnqueued() {
    }

    @Override
    public void incrementClaimed() {
    }

    @Override
    public void incrementClaimLost() {
    }

    @Override
    public void incrementAcked() {
    }

    @Override
    public void incrementKilled() {
    }

    @Override
    public void incrementRescheduled() {
    }

    @Override
    public void recordSweep(int scheduled, int orphaned) {
    }
  }
}
