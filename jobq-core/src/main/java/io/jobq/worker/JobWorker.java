package io.jobq.worker;

import io.jobq.JobQueue;
import io.jobq.JobRequest;
import io.jobq.PayloadCodecException;
import io.jobq.model.Job;
import io.jobq.poller.JobPoller;
import io.jobq.poller.JobPollerHandler;
import io.jobq.registry.PulseScheduler;
import io.jobq.registry.WorkerRegistry;
import io.jobq.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes jobs of one {@link JobQueue} with a fixed pool of handler threads.
 *
 * <p>{@link #start()} records a heartbeat, starts the {@link PulseScheduler} (heartbeats and
 * recovery sweeps) and then a {@link JobPoller} that claims jobs only while a handler thread
 * is free. Each claimed job is decoded and passed to the {@link JobHandler}:
 * <ul>
 *   <li>normal return: ack; a lost ownership is logged and ignored</li>
 *   <li>{@link AbortJobException} or an undecodable payload: kill, with the error recorded</li>
 *   <li>any other exception: record the attempt and error, then reschedule with backoff</li>
 * </ul>
 * A job whose attempts reach {@code max_attempts} stays FAILED and is no longer picked up by
 * the sweeps; see {@link io.jobq.dead.DeadJobManager}.
 *
 * <p>Create instances via {@link #builder(JobQueue)}. {@link #close()} stops claiming,
 * drains in-flight jobs within the drain timeout, and stops heartbeats last.
 *
 * @param <T> payload type
 */
public final class JobWorker<T> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobWorker.class.getName());

  private final JobQueue<T> queue;
  private final JobHandler<T> handler;
  private final String workerId;
  private final int concurrency;
  private final Duration pollInterval;
  private final RetryPolicy retryPolicy;
  private final PulseScheduler pulse;
  private final long drainTimeoutMs;
  private final AtomicInteger inFlight = new AtomicInteger();

  private ExecutorService executor;
  private JobPoller poller;
  private boolean started;
  private volatile boolean closed;

  private JobWorker(Builder<T> builder) {
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.workerId = builder.workerId != null
        ? builder.workerId : "worker-" + UUID.randomUUID().toString().substring(0, 8);
    if (builder.concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be >= 1");
    }
    if (builder.drainTimeout == null || builder.drainTimeout.isNegative()) {
      throw new IllegalArgumentException("drainTimeout must not be negative");
    }
    this.concurrency = builder.concurrency;
    this.pollInterval = Objects.requireNonNull(builder.pollInterval, "pollInterval");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.drainTimeoutMs = builder.drainTimeout.toMillis();
    this.pulse = PulseScheduler.builder()
        .registry(queue.workerRegistry())
        .workerId(workerId)
        .jobType(queue.jobType())
        .heartbeatInterval(builder.heartbeatInterval)
        .sweepInterval(builder.sweepInterval)
        .sweepBatchSize(builder.sweepBatchSize)
        .livenessTimeout(builder.livenessTimeout)
        .metrics(queue.metrics())
        .build();
  }

  public static <T> Builder<T> builder(JobQueue<T> queue) {
    return new Builder<>(queue);
  }

  /**
   * Registers the worker and starts heartbeats, sweeps and polling.
   *
   * @throws io.jobq.JobStoreException if the initial heartbeat fails
   * @throws IllegalStateException     if the worker has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobWorker has been closed");
    }
    if (started) {
      return;
    }
    queue.heartbeat(workerId);
    pulse.start();
    executor = Executors.newFixedThreadPool(concurrency,
        new DaemonThreadFactory("jobq-worker-" + queue.jobType() + "-"));
    poller = queue.consume(workerId, pollInterval, new WorkerPollerHandler());
    started = true;
    logger.log(Level.INFO, "Worker {0} started for jobType={1} with concurrency {2}",
        new Object[]{workerId, queue.jobType(), concurrency});
  }

  public String workerId() {
    return workerId;
  }

  /** Jobs currently handed to handler threads. */
  public int inFlight() {
    return inFlight.get();
  }

  public boolean isRunning() {
    return started && !closed;
  }

  private void submit(Job job) {
    inFlight.incrementAndGet();
    try {
      executor.execute(() -> {
        try {
          process(job);
        } finally {
          inFlight.decrementAndGet();
        }
      });
    } catch (RejectedExecutionException e) {
      inFlight.decrementAndGet();
      logger.log(Level.WARNING, "Worker shutting down; releasing job " + job.id(), e);
      queue.retry(workerId, job.id());
    }
  }

  private void process(Job job) {
    try {
      JobRequest<T> request;
      try {
        request = queue.decode(job);
      } catch (PayloadCodecException e) {
        logger.log(Level.SEVERE, "Undecodable payload; killing job " + job.id(), e);
        abort(job, e);
        return;
      }
      long startNanos = System.nanoTime();
      try {
        handler.handle(request);
      } catch (AbortJobException e) {
        logger.log(Level.WARNING, "Handler aborted job " + job.id(), e);
        abort(job, e);
        return;
      } catch (Exception e) {
        fail(job, e);
        return;
      } finally {
        queue.metrics().recordHandlerDurationMs(
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
      }
      if (!queue.ack(workerId, job.id())) {
        logger.log(Level.WARNING, "Job {0} finished but is no longer owned by {1}; ack skipped",
            new Object[]{job.id(), workerId});
      }
    } catch (RuntimeException e) {
      // Job stays RUNNING; it is recovered once this worker stops heartbeating.
      logger.log(Level.SEVERE, "Failed to finalize job " + job.id(), e);
    }
  }

  private void abort(Job job, Exception cause) {
    if (!queue.abort(workerId, job.id(), describe(cause))) {
      logger.log(Level.WARNING, "Job {0} could not be killed; no longer owned by {1}",
          new Object[]{job.id(), workerId});
    }
  }

  private void fail(Job job, Exception cause) {
    int attempts = job.attempts() + 1;
    Duration wait;
    if (cause instanceof RetryAfterException) {
      wait = ((RetryAfterException) cause).retryAfter();
    } else {
      wait = Duration.ofMillis(retryPolicy.computeDelayMs(attempts));
    }
    if (!queue.failAttempt(workerId, job.id(), attempts, describe(cause), wait)) {
      logger.log(Level.WARNING, "Job " + job.id() + " failed but is no longer owned by "
          + workerId + "; attempt not recorded", cause);
      return;
    }
    if (attempts >= job.maxAttempts()) {
      logger.log(Level.WARNING, "Job " + job.id() + " failed after " + attempts
          + " attempts and will not be retried", cause);
    } else {
      logger.log(Level.INFO, "Job " + job.id() + " failed on attempt " + attempts
          + ", retrying in " + wait.toMillis() + "ms", cause);
    }
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null ? error.getClass().getName() : error.getClass().getName() + ": " + message;
  }

  /**
   * Stops claiming, waits up to the drain timeout for running handlers, then stops
   * heartbeats. Jobs interrupted by a forced shutdown stay RUNNING and are reclaimed by
   * another worker's orphan sweep.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (poller != null) {
      poller.close();
    }
    if (executor != null) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "Drain timeout exceeded with {0} jobs in flight; forcing shutdown",
              inFlight.get());
          executor.shutdownNow();
          executor.awaitTermination(5, TimeUnit.SECONDS);
        }
      } catch (InterruptedException e) {
        executor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    pulse.close();
  }

  private final class WorkerPollerHandler implements JobPollerHandler {
    @Override
    public void onJob(Job job) {
      submit(job);
    }

    @Override
    public int availableCapacity() {
      return concurrency - inFlight.get();
    }
  }

  /**
   * Builder for {@link JobWorker}.
   *
   * @param <T> payload type
   */
  public static final class Builder<T> {
    private final JobQueue<T> queue;
    private JobHandler<T> handler;
    private String workerId;
    private int concurrency = 1;
    private Duration pollInterval = Duration.ofSeconds(1);
    private RetryPolicy retryPolicy;
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private Duration sweepInterval = Duration.ofSeconds(60);
    private int sweepBatchSize = 100;
    private Duration livenessTimeout = WorkerRegistry.DEFAULT_LIVENESS_TIMEOUT;
    private Duration drainTimeout = Duration.ofSeconds(5);

    private Builder(JobQueue<T> queue) {
      this.queue = queue;
    }

    /**
     * <b>Required.</b>
     */
    public Builder<T> handler(JobHandler<T> handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Identity recorded as {@code lock_by} and in the worker table. Must be unique among
     * live workers. Optional. Defaults to {@code worker-} plus a random suffix.
     */
    public Builder<T> workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /**
     * Handler threads, and therefore the most jobs this worker holds at once. Optional.
     * Defaults to {@code 1}.
     */
    public Builder<T> concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * Optional. Defaults to 1 second.
     */
    public Builder<T> pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with a 1 second base and
     * 1 hour cap.
     */
    public Builder<T> retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Optional. Defaults to 30 seconds.
     */
    public Builder<T> heartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
      return this;
    }

    /**
     * Optional. Defaults to 60 seconds.
     */
    public Builder<T> sweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
      return this;
    }

    /**
     * Optional. Defaults to {@code 100}.
     */
    public Builder<T> sweepBatchSize(int sweepBatchSize) {
      this.sweepBatchSize = sweepBatchSize;
      return this;
    }

    /**
     * Optional. Defaults to 5 minutes.
     */
    public Builder<T> livenessTimeout(Duration livenessTimeout) {
      this.livenessTimeout = livenessTimeout;
      return this;
    }

    /**
     * How long {@link JobWorker#close()} waits for running handlers. Optional. Defaults to
     * 5 seconds.
     */
    public Builder<T> drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public JobWorker<T> build() {
      return new JobWorker<>(this);
    }
  }
}
