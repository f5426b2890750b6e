package io.jobq.registry;

import io.jobq.spi.MetricsExporter;
import io.jobq.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled heartbeat and recovery sweeps for one worker.
 *
 * <p>Two fixed schedules share a single daemon thread: {@link #beat()} every
 * {@code heartbeatInterval}, and {@link #sweep()} (enqueue-scheduled, then reclaim-orphans)
 * every {@code sweepInterval}. Each invocation fails independently; a storage error is
 * logged and the schedule continues.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see WorkerRegistry
 */
public final class PulseScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PulseScheduler.class.getName());

  private final WorkerRegistry registry;
  private final String workerId;
  private final String jobType;
  private final Duration heartbeatInterval;
  private final Duration sweepInterval;
  private final int sweepBatchSize;
  private final Duration livenessTimeout;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> heartbeatTask;
  private volatile ScheduledFuture<?> sweepTask;
  private volatile boolean closed;

  private PulseScheduler(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.workerId = Objects.requireNonNull(builder.workerId, "workerId");
    this.jobType = Objects.requireNonNull(builder.jobType, "jobType");
    this.heartbeatInterval = requirePositive(builder.heartbeatInterval, "heartbeatInterval");
    this.sweepInterval = requirePositive(builder.sweepInterval, "sweepInterval");
    this.livenessTimeout = requirePositive(builder.livenessTimeout, "livenessTimeout");
    if (builder.sweepBatchSize <= 0) {
      throw new IllegalArgumentException("sweepBatchSize must be > 0");
    }
    if (livenessTimeout.compareTo(heartbeatInterval) <= 0) {
      throw new IllegalArgumentException("livenessTimeout must exceed heartbeatInterval");
    }
    this.sweepBatchSize = builder.sweepBatchSize;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts both schedules. The first heartbeat fires immediately; the first sweep after one
   * {@code sweepInterval}. Subsequent calls are no-ops.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PulseScheduler has been closed");
    }
    if (heartbeatTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("jobq-pulse-" + jobType + "-"));
    heartbeatTask = scheduler.scheduleAtFixedRate(this::beat,
        0L, heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS);
    sweepTask = scheduler.scheduleWithFixedDelay(this::sweep,
        sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Sends one heartbeat. Failures are logged. */
  public void beat() {
    if (closed) {
      return;
    }
    try {
      registry.heartbeat(workerId, jobType);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Heartbeat failed for worker " + workerId, t);
    }
  }

  /**
   * Runs both sweeps once. A failure in one sweep does not skip the other.
   *
   * <p>May be invoked directly for testing or one-off recovery.
   */
  public void sweep() {
    if (closed) {
      return;
    }
    int scheduled = 0;
    int orphaned = 0;
    try {
      scheduled = registry.sweepEnqueueScheduled(jobType, sweepBatchSize);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Enqueue-scheduled sweep failed for jobType=" + jobType, t);
    }
    try {
      orphaned = registry.sweepReclaimOrphans(jobType, sweepBatchSize, livenessTimeout);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Orphan sweep failed for jobType=" + jobType, t);
    }
    metrics.recordSweep(scheduled, orphaned);
    if (scheduled > 0 || orphaned > 0) {
      logger.log(Level.INFO, "Sweep for {0}: {1} failed jobs re-queued, {2} orphans reclaimed",
          new Object[]{jobType, scheduled, orphaned});
    }
  }

  /** Cancels both schedules and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (heartbeatTask != null) {
      heartbeatTask.cancel(false);
      heartbeatTask = null;
    }
    if (sweepTask != null) {
      sweepTask.cancel(false);
      sweepTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
    return value;
  }

  /** Builder for {@link PulseScheduler}. */
  public static final class Builder {
    private WorkerRegistry registry;
    private String workerId;
    private String jobType;
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private Duration sweepInterval = Duration.ofSeconds(60);
    private int sweepBatchSize = 100;
    private Duration livenessTimeout = WorkerRegistry.DEFAULT_LIVENESS_TIMEOUT;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     */
    public Builder registry(WorkerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Identity sent with each heartbeat. <b>Required.</b>
     */
    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /**
     * Job type used as the worker type and as the sweep filter. <b>Required.</b>
     */
    public Builder jobType(String jobType) {
      this.jobType = jobType;
      return this;
    }

    /**
     * Optional. Defaults to 30 seconds.
     */
    public Builder heartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
      return this;
    }

    /**
     * Optional. Defaults to 60 seconds.
     */
    public Builder sweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
      return this;
    }

    /**
     * Maximum jobs recovered by each sweep per run. Optional. Defaults to {@code 100}.
     */
    public Builder sweepBatchSize(int sweepBatchSize) {
      this.sweepBatchSize = sweepBatchSize;
      return this;
    }

    /**
     * Silence after which a worker's RUNNING jobs are reclaimed. Optional. Defaults to
     * 5 minutes. Must exceed the heartbeat interval.
     */
    public Builder livenessTimeout(Duration livenessTimeout) {
      this.livenessTimeout = livenessTimeout;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public PulseScheduler build() {
      return new PulseScheduler(this);
    }
  }
}
