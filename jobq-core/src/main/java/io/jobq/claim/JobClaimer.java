package io.jobq.claim;

import io.jobq.model.Job;
import io.jobq.spi.ConnectionProvider;
import io.jobq.spi.JobStore;
import io.jobq.spi.MetricsExporter;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Two-phase claim: select the oldest eligible candidate, then lock it with a single
 * conditional update.
 *
 * <p>Only the second phase is atomic. The candidate read may race with other workers; a
 * lost race yields "nothing claimed" for this attempt and is never retried within the same
 * call. Exclusivity across workers is enforced entirely by {@link JobStore#claim}, so any
 * number of claimers may share a table.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class JobClaimer {
  private static final Logger logger = Logger.getLogger(JobClaimer.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final MetricsExporter metrics;

  public JobClaimer(ConnectionProvider connectionProvider, JobStore jobStore, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Attempts to claim one job of {@code jobType} for {@code workerId}.
   *
   * @return the claimed job as re-read after the claim, or empty if nothing was eligible or
   *     another worker won the race
   * @throws io.jobq.JobStoreException on storage failure
   */
  public Optional<Job> claimNext(String workerId, String jobType) {
    Objects.requireNonNull(workerId, "workerId");
    Objects.requireNonNull(jobType, "jobType");
    Instant now = Instant.now();
    return connectionProvider.execute(conn -> {
      Optional<Job> candidate = jobStore.selectCandidate(conn, jobType, now);
      if (candidate.isEmpty()) {
        return Optional.<Job>empty();
      }
      String jobId = candidate.get().id();
      if (jobStore.claim(conn, jobId, workerId, now) == 0) {
        metrics.incrementClaimLost();
        logger.log(Level.FINE, "Lost claim on job {0} for worker {1}", new Object[]{jobId, workerId});
        return Optional.<Job>empty();
      }
      metrics.incrementClaimed();
      return jobStore.findById(conn, jobId)
          .filter(job -> workerId.equals(job.lockBy()));
    });
  }
}
