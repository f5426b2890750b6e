package io.jobq;

import io.jobq.claim.JobClaimer;
import io.jobq.model.Job;
import io.jobq.model.JobStatus;
import io.jobq.model.JobUpdate;
import io.jobq.poller.JobPoller;
import io.jobq.poller.JobPollerHandler;
import io.jobq.registry.WorkerRegistry;
import io.jobq.spi.ConnectionProvider;
import io.jobq.spi.JobStore;
import io.jobq.spi.MetricsExporter;
import io.jobq.spi.PayloadCodec;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Typed facade over one job type in a {@link JobStore}.
 *
 * <p>A queue binds a job type to a {@link PayloadCodec}. It holds no connections and no
 * global state; every call borrows a connection from the {@link ConnectionProvider} and runs
 * one store primitive. Any number of queues, in any number of processes, may share the
 * same tables.
 *
 * <p>Lifecycle operations that require ownership ({@link #ack}, {@link #kill},
 * {@link #retry}) return {@code false} when the caller no longer owns the job, for example
 * after its RUNNING job was reclaimed by the orphan sweep. Storage failures propagate as
 * {@link JobStoreException}.
 *
 * <pre>{@code
 * JobQueue<String> emails = JobQueue.builder(PayloadCodec.string())
 *     .connectionProvider(provider)
 *     .jobStore(new H2JobStore())
 *     .jobType("email")
 *     .build();
 * String id = emails.enqueue("hello@example.com");
 * }</pre>
 *
 * @param <T> payload type
 */
public final class JobQueue<T> {
  private static final Logger logger = Logger.getLogger(JobQueue.class.getName());

  public static final int DEFAULT_PAGE_SIZE = 10;

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final String jobType;
  private final PayloadCodec<T> codec;
  private final MetricsExporter metrics;
  private final int defaultMaxAttempts;
  private final int pageSize;
  private final JobClaimer claimer;
  private final WorkerRegistry workerRegistry;

  private JobQueue(Builder<T> builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.jobType = Objects.requireNonNull(builder.jobType, "jobType");
    if (jobType.isEmpty()) {
      throw new IllegalArgumentException("jobType cannot be empty");
    }
    this.codec = Objects.requireNonNull(builder.codec, "codec");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.defaultMaxAttempts < 1) {
      throw new IllegalArgumentException("defaultMaxAttempts must be >= 1");
    }
    if (builder.pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be >= 1");
    }
    this.defaultMaxAttempts = builder.defaultMaxAttempts;
    this.pageSize = builder.pageSize;
    this.claimer = new JobClaimer(connectionProvider, jobStore, metrics);
    this.workerRegistry = new WorkerRegistry(connectionProvider, jobStore);
  }

  public static <T> Builder<T> builder(PayloadCodec<T> codec) {
    return new Builder<>(codec);
  }

  /**
   * Enqueues an immediately eligible job.
   *
   * @return the new job id
   * @throws PayloadCodecException if the payload cannot be encoded
   */
  public String enqueue(T payload) {
    return enqueue(envelopeBuilder(payload).build());
  }

  /**
   * Enqueues a job that becomes eligible at {@code runAt}.
   *
   * @return the new job id
   */
  public String enqueueAt(T payload, Instant runAt) {
    Objects.requireNonNull(runAt, "runAt");
    return enqueue(envelopeBuilder(payload).runAt(runAt).build());
  }

  /**
   * Enqueues a job that becomes eligible after {@code delay}.
   *
   * @return the new job id
   */
  public String enqueueIn(T payload, Duration delay) {
    Objects.requireNonNull(delay, "delay");
    return enqueue(envelopeBuilder(payload).delay(delay).build());
  }

  /**
   * Inserts a prepared envelope. The envelope must target this queue's job type.
   *
   * @return the job id
   */
  public String enqueue(JobEnvelope envelope) {
    requireOwnType(envelope);
    String id = connectionProvider.execute(conn -> jobStore.insert(conn, envelope));
    metrics.incrementEnqueued();
    return id;
  }

  /**
   * Inserts several payloads in one batch.
   *
   * @return the job ids, in input order
   */
  public List<String> enqueueAll(List<T> payloads) {
    Objects.requireNonNull(payloads, "payloads");
    List<JobEnvelope> envelopes = new ArrayList<>(payloads.size());
    for (T payload : payloads) {
      envelopes.add(envelopeBuilder(payload).build());
    }
    List<String> ids = connectionProvider.execute(conn -> jobStore.insertBatch(conn, envelopes));
    for (int i = 0; i < ids.size(); i++) {
      metrics.incrementEnqueued();
    }
    return ids;
  }

  /**
   * Runs the claim protocol once for {@code workerId}.
   *
   * @return the claimed job with its decoded payload, or empty if nothing was claimed
   * @throws PayloadCodecException if the claimed payload cannot be decoded; the job stays
   *                               RUNNING under {@code workerId}
   */
  public Optional<JobRequest<T>> claimNext(String workerId) {
    return claimer.claimNext(workerId, jobType).map(this::decode);
  }

  /**
   * Starts a poll stream that claims jobs of this type for {@code workerId} every
   * {@code pollInterval} and hands each result to {@code handler}.
   *
   * <p>The caller owns the returned poller and must close it. Claimed jobs must be finished
   * with {@link #ack}, {@link #kill}, {@link #retry} or {@link #reschedule}.
   */
  public JobPoller consume(String workerId, Duration pollInterval, JobPollerHandler handler) {
    JobPoller poller = JobPoller.builder()
        .connectionProvider(connectionProvider)
        .jobStore(jobStore)
        .handler(handler)
        .workerId(workerId)
        .jobType(jobType)
        .pollInterval(pollInterval)
        .metrics(metrics)
        .build();
    poller.start();
    return poller;
  }

  /**
   * Marks a RUNNING job owned by {@code workerId} as DONE.
   *
   * @return {@code false} if the worker no longer owns the job
   */
  public boolean ack(String workerId, String jobId) {
    requireIds(workerId, jobId);
    int rows = connectionProvider.execute(conn -> jobStore.ack(conn, workerId, jobId, Instant.now()));
    if (rows == 0) {
      logger.log(Level.FINE, "ack of job {0} by {1} matched no owned job", new Object[]{jobId, workerId});
      return false;
    }
    metrics.incrementAcked();
    return true;
  }

  /**
   * Marks a RUNNING job owned by {@code workerId} as KILLED. The job is never retried.
   *
   * @return {@code false} if the worker no longer owns the job
   */
  public boolean kill(String workerId, String jobId) {
    requireIds(workerId, jobId);
    int rows = connectionProvider.execute(conn -> jobStore.kill(conn, workerId, jobId, Instant.now()));
    if (rows == 0) {
      logger.log(Level.FINE, "kill of job {0} by {1} matched no owned job", new Object[]{jobId, workerId});
      return false;
    }
    metrics.incrementKilled();
    return true;
  }

  /**
   * Kills a RUNNING job owned by {@code workerId} and records why, in one guarded update.
   *
   * @return {@code false} if the worker no longer owns the job
   */
  public boolean abort(String workerId, String jobId, String lastError) {
    requireIds(workerId, jobId);
    int rows = connectionProvider.execute(conn ->
        jobStore.abort(conn, workerId, jobId, lastError, Instant.now()));
    if (rows == 0) {
      logger.log(Level.FINE, "abort of job {0} by {1} matched no owned job", new Object[]{jobId, workerId});
      return false;
    }
    metrics.incrementKilled();
    return true;
  }

  /**
   * Records a failed attempt of a RUNNING job owned by {@code workerId} and makes it eligible
   * again after {@code wait}. The attempt counter, last_error and the FAILED state are written
   * in one update guarded on ownership, so a job reclaimed by another worker is left alone.
   *
   * @param attempts the new attempt count
   * @return {@code false} if the worker no longer owns the job
   */
  public boolean failAttempt(String workerId, String jobId, int attempts, String lastError,
      Duration wait) {
    requireIds(workerId, jobId);
    Objects.requireNonNull(wait, "wait");
    if (wait.isNegative()) {
      throw new IllegalArgumentException("wait must not be negative");
    }
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
    Instant runAt = Instant.now().plus(wait);
    int rows = connectionProvider.execute(conn ->
        jobStore.failAttempt(conn, workerId, jobId, attempts, lastError, runAt));
    if (rows == 0) {
      logger.log(Level.FINE, "failed attempt of job {0} by {1} matched no owned job",
          new Object[]{jobId, workerId});
      return false;
    }
    metrics.incrementRescheduled();
    return true;
  }

  /**
   * Releases a RUNNING job owned by {@code workerId} back to PENDING without counting an
   * attempt or applying backoff.
   *
   * @return {@code false} if the worker no longer owns the job
   */
  public boolean retry(String workerId, String jobId) {
    requireIds(workerId, jobId);
    return connectionProvider.execute(conn -> jobStore.retry(conn, workerId, jobId)) > 0;
  }

  /**
   * Moves a job to FAILED and makes it eligible again after {@code wait}. Does not check
   * ownership and does not increment attempts. Executors holding a claim use
   * {@link #failAttempt} instead.
   *
   * @return {@code false} if no job with that id exists
   */
  public boolean reschedule(String jobId, Duration wait) {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(wait, "wait");
    if (wait.isNegative()) {
      throw new IllegalArgumentException("wait must not be negative");
    }
    Instant runAt = Instant.now().plus(wait);
    boolean updated = connectionProvider.execute(conn -> jobStore.reschedule(conn, jobId, runAt)) > 0;
    if (updated) {
      metrics.incrementRescheduled();
    }
    return updated;
  }

  public boolean reschedule(Job job, Duration wait) {
    Objects.requireNonNull(job, "job");
    return reschedule(job.id(), wait);
  }

  /**
   * Overwrites the mutable fields of a job by id, with no status guard.
   *
   * @return {@code false} if no job with that id exists
   */
  public boolean updateFields(String jobId, JobUpdate update) {
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(update, "update");
    return connectionProvider.execute(conn -> jobStore.updateFields(conn, jobId, update)) > 0;
  }

  /**
   * Records a heartbeat for {@code workerId}, typed with this queue's job type.
   */
  public void heartbeat(String workerId) {
    workerRegistry.heartbeat(workerId, jobType);
  }

  public WorkerRegistry workerRegistry() {
    return workerRegistry;
  }

  /** Number of PENDING jobs of this type. */
  public long len() {
    long pending = connectionProvider.execute(conn -> jobStore.countPending(conn, jobType));
    metrics.recordPendingCount(pending);
    return pending;
  }

  /**
   * Returns one page of jobs of this type in the given status, oldest first.
   *
   * @param page zero-based page number
   */
  public List<Job> list(JobStatus status, int page) {
    Objects.requireNonNull(status, "status");
    if (page < 0) {
      throw new IllegalArgumentException("page must be >= 0, got: " + page);
    }
    int offset = Math.multiplyExact(page, pageSize);
    return connectionProvider.execute(conn -> jobStore.list(conn, jobType, status, offset, pageSize));
  }

  /**
   * Loads a job by id and decodes its payload.
   *
   * @throws PayloadCodecException if the stored payload cannot be decoded
   */
  public Optional<JobRequest<T>> fetchById(String jobId) {
    Objects.requireNonNull(jobId, "jobId");
    return connectionProvider.execute(conn -> jobStore.findById(conn, jobId)).map(this::decode);
  }

  /**
   * Decodes the payload of a job row with this queue's codec.
   */
  public JobRequest<T> decode(Job job) {
    return new JobRequest<>(job, codec.decode(job.payload()));
  }

  public String jobType() {
    return jobType;
  }

  public int pageSize() {
    return pageSize;
  }

  public int defaultMaxAttempts() {
    return defaultMaxAttempts;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  private JobEnvelope.Builder envelopeBuilder(T payload) {
    return JobEnvelope.builder(jobType)
        .payload(codec.encode(payload))
        .maxAttempts(defaultMaxAttempts);
  }

  private void requireOwnType(JobEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    if (!jobType.equals(envelope.jobType())) {
      throw new IllegalArgumentException("Envelope jobType " + envelope.jobType()
          + " does not match queue jobType " + jobType);
    }
  }

  private static void requireIds(String workerId, String jobId) {
    Objects.requireNonNull(workerId, "workerId");
    Objects.requireNonNull(jobId, "jobId");
  }

  /**
   * Builder for {@link JobQueue}.
   *
   * @param <T> payload type
   */
  public static final class Builder<T> {
    private final PayloadCodec<T> codec;
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private String jobType;
    private MetricsExporter metrics;
    private int defaultMaxAttempts = JobEnvelope.DEFAULT_MAX_ATTEMPTS;
    private int pageSize = DEFAULT_PAGE_SIZE;

    private Builder(PayloadCodec<T> codec) {
      this.codec = codec;
    }

    /**
     * <b>Required.</b>
     */
    public Builder<T> connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     */
    public Builder<T> jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Logical queue name all operations are scoped to. <b>Required.</b>
     */
    public Builder<T> jobType(String jobType) {
      this.jobType = jobType;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder<T> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Retry ceiling for jobs enqueued from payloads. Optional. Defaults to
     * {@value JobEnvelope#DEFAULT_MAX_ATTEMPTS}.
     */
    public Builder<T> defaultMaxAttempts(int defaultMaxAttempts) {
      this.defaultMaxAttempts = defaultMaxAttempts;
      return this;
    }

    /**
     * Rows per {@link JobQueue#list} page. Optional. Defaults to {@value JobQueue#DEFAULT_PAGE_SIZE}.
     */
    public Builder<T> pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    public JobQueue<T> build() {
      return new JobQueue<>(this);
    }
  }
}
