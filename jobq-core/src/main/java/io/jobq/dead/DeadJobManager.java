package io.jobq.dead;

import io.jobq.model.Job;
import io.jobq.spi.ConnectionProvider;
import io.jobq.spi.JobStore;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for dead-lettered jobs: FAILED jobs whose attempts reached
 * {@code max_attempts}. The sweeps never re-queue them; {@link #replay} resets one to
 * PENDING with zero attempts.
 *
 * <p>Storage failures propagate as {@link io.jobq.JobStoreException}.
 *
 * @see JobStore#queryDead
 * @see JobStore#replayDead
 * @see JobStore#countDead
 */
public final class DeadJobManager {
  private static final Logger logger = Logger.getLogger(DeadJobManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;

  public DeadJobManager(ConnectionProvider connectionProvider, JobStore jobStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
  }

  /**
   * @param jobType optional type filter ({@code null} for all)
   * @param limit   maximum number of jobs to return
   * @return dead jobs, oldest first
   */
  public List<Job> query(String jobType, int limit) {
    requirePositive(limit, "limit");
    return connectionProvider.execute(conn -> jobStore.queryDead(conn, jobType, limit));
  }

  public long count(String jobType) {
    return connectionProvider.execute(conn -> jobStore.countDead(conn, jobType));
  }

  /**
   * @return {@code true} if the job was dead and is now PENDING
   */
  public boolean replay(String jobId) {
    Objects.requireNonNull(jobId, "jobId");
    return connectionProvider.execute(conn -> jobStore.replayDead(conn, jobId)) > 0;
  }

  /**
   * Replays every dead job matching the filter, {@code batchSize} at a time.
   *
   * @return number of jobs replayed
   */
  public int replayAll(String jobType, int batchSize) {
    requirePositive(batchSize, "batchSize");
    int total = 0;
    while (true) {
      int replayed = connectionProvider.execute(conn -> {
        List<Job> batch = jobStore.queryDead(conn, jobType, batchSize);
        int n = 0;
        for (Job job : batch) {
          n += jobStore.replayDead(conn, job.id());
        }
        return n;
      });
      total += replayed;
      if (replayed < batchSize) {
        break;
      }
    }
    if (total > 0) {
      logger.log(Level.INFO, "Replayed {0} dead jobs", total);
    }
    return total;
  }

  private static void requirePositive(int value, String name) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be > 0, got: " + value);
    }
  }
}
