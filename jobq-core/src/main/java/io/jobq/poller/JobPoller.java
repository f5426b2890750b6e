package io.jobq.poller;

import io.jobq.claim.JobClaimer;
import io.jobq.model.Job;
import io.jobq.spi.ConnectionProvider;
import io.jobq.spi.JobStore;
import io.jobq.spi.MetricsExporter;
import io.jobq.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic, cancellable producer of claimed jobs for one worker and one job type.
 *
 * <p>Each tick runs the claim protocol exactly once and reports the outcome to its
 * {@link JobPollerHandler}: {@code onJob}, {@code onIdle}, or {@code onError}. A failed tick
 * does not stop the poller; the next tick runs independently. Ticks fire at a fixed rate
 * starting immediately after {@link #start()}. The poller keeps no backlog.
 *
 * <p>{@link #close()} is cooperative: a tick already in progress finishes (including handing
 * over a claimed job) and no further ticks start. A closed poller cannot be restarted; create
 * a new one.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 *
 * @see JobPoller.Builder
 * @see JobClaimer
 */
public final class JobPoller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobPoller.class.getName());

  private final JobClaimer claimer;
  private final JobPollerHandler handler;
  private final String workerId;
  private final String jobType;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private JobPoller(Builder builder) {
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.workerId = Objects.requireNonNull(builder.workerId, "workerId");
    this.jobType = Objects.requireNonNull(builder.jobType, "jobType");
    Objects.requireNonNull(builder.pollInterval, "pollInterval");
    if (builder.pollInterval.isNegative() || builder.pollInterval.isZero()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    this.intervalMs = Math.max(1L, builder.pollInterval.toMillis());
    this.claimer = new JobClaimer(
        Objects.requireNonNull(builder.connectionProvider, "connectionProvider"),
        Objects.requireNonNull(builder.jobStore, "jobStore"),
        builder.metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the tick schedule. Subsequent calls are no-ops while running.
   *
   * @throws IllegalStateException if the poller has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobPoller has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("jobq-poller-" + jobType + "-"));
    pollTask = scheduler.scheduleAtFixedRate(this::poll, 0L, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single tick. Called by the scheduler, but may also be invoked directly.
   */
  public void poll() {
    if (closed) {
      return;
    }
    try {
      if (handler.availableCapacity() <= 0) {
        return;
      }
      Optional<Job> claimed;
      try {
        claimed = claimer.claimNext(workerId, jobType);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Poll tick failed for jobType=" + jobType + " worker=" + workerId, e);
        handler.onError(e);
        return;
      }
      if (claimed.isPresent()) {
        handler.onJob(claimed.get());
      } else {
        handler.onIdle();
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Poll handler failed for jobType=" + jobType, t);
    }
  }

  public boolean isClosed() {
    return closed;
  }

  public String workerId() {
    return workerId;
  }

  public String jobType() {
    return jobType;
  }

  /**
   * Cancels future ticks and waits briefly for an in-flight tick to finish.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
          logger.warning("Poll tick still running after 5s for jobType=" + jobType);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link JobPoller}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private JobPollerHandler handler;
    private String workerId;
    private String jobType;
    private Duration pollInterval = Duration.ofSeconds(1);
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Sets the connection provider used for each tick.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the store used to select and claim candidates.
     *
     * <p><b>Required.</b>
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Sets the consumer of tick results.
     *
     * <p><b>Required.</b>
     */
    public Builder handler(JobPollerHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Sets the identity claims are recorded under ({@code lock_by}).
     *
     * <p><b>Required.</b>
     */
    public Builder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /**
     * Sets the job type this poller claims.
     *
     * <p><b>Required.</b>
     */
    public Builder jobType(String jobType) {
      this.jobType = jobType;
      return this;
    }

    /**
     * Sets the tick interval.
     *
     * <p>Optional. Defaults to 1 second. Must be positive.
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Sets the metrics exporter for claim counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the poller. Call {@link JobPoller#start()} to begin ticking.
     *
     * @throws NullPointerException     if a required setting is missing
     * @throws IllegalArgumentException if {@code pollInterval} is not positive
     */
    public JobPoller build() {
      return new JobPoller(this);
    }
  }
}
