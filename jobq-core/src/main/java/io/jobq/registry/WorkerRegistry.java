package io.jobq.registry;

import io.jobq.model.Worker;
import io.jobq.spi.ConnectionProvider;
import io.jobq.spi.JobStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Worker heartbeats and the two recovery sweeps.
 *
 * <p>A worker is alive as long as it keeps calling {@link #heartbeat}; there is no explicit
 * deregistration. {@link #sweepReclaimOrphans} returns RUNNING jobs of silent workers to
 * PENDING, and {@link #sweepEnqueueScheduled} returns retryable FAILED jobs to PENDING.
 * Both sweeps are bounded by a count to cap the recovery burst.
 *
 * <p>Store failures propagate as {@link io.jobq.JobStoreException}.
 */
public final class WorkerRegistry {
  public static final Duration DEFAULT_LIVENESS_TIMEOUT = Duration.ofMinutes(5);
  public static final String ABANDONED_ERROR = "Job was abandoned";

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;

  public WorkerRegistry(ConnectionProvider connectionProvider, JobStore jobStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
  }

  /**
   * Upserts the worker row with {@code last_seen = now}, labelled with the store name.
   */
  public void heartbeat(String workerId, String workerType) {
    heartbeat(workerId, workerType, jobStore.name());
  }

  public void heartbeat(String workerId, String workerType, String storageName) {
    Worker worker = new Worker(workerId, workerType, storageName, Instant.now());
    connectionProvider.execute(conn -> {
      jobStore.heartbeat(conn, worker);
      return null;
    });
  }

  public Optional<Worker> findWorker(String workerId) {
    Objects.requireNonNull(workerId, "workerId");
    return connectionProvider.execute(conn -> jobStore.findWorker(conn, workerId));
  }

  /**
   * Re-queues up to {@code count} FAILED jobs of {@code jobType} that still have attempts
   * left, oldest lock first.
   *
   * @return number of jobs returned to PENDING
   */
  public int sweepEnqueueScheduled(String jobType, int count) {
    Objects.requireNonNull(jobType, "jobType");
    requirePositive(count);
    return connectionProvider.execute(conn -> jobStore.enqueueScheduled(conn, jobType, count));
  }

  /**
   * Reclaims orphans using {@link #DEFAULT_LIVENESS_TIMEOUT}.
   */
  public int sweepReclaimOrphans(String jobType, int count) {
    return sweepReclaimOrphans(jobType, count, DEFAULT_LIVENESS_TIMEOUT);
  }

  /**
   * Returns up to {@code count} RUNNING jobs of {@code jobType} whose owner was last seen
   * more than {@code livenessTimeout} ago to PENDING, with last_error set to
   * {@value #ABANDONED_ERROR}. Attempts are not incremented.
   *
   * @return number of jobs reclaimed
   */
  public int sweepReclaimOrphans(String jobType, int count, Duration livenessTimeout) {
    Objects.requireNonNull(jobType, "jobType");
    Objects.requireNonNull(livenessTimeout, "livenessTimeout");
    requirePositive(count);
    if (livenessTimeout.isNegative() || livenessTimeout.isZero()) {
      throw new IllegalArgumentException("livenessTimeout must be positive");
    }
    Instant cutoff = Instant.now().minus(livenessTimeout);
    return connectionProvider.execute(conn ->
        jobStore.reclaimOrphans(conn, jobType, cutoff, ABANDONED_ERROR, count));
  }

  private static void requirePositive(int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("count must be > 0, got: " + count);
    }
  }
}
