package io.jobq.spi;

import io.jobq.JobEnvelope;
import io.jobq.model.Job;
import io.jobq.model.JobStatus;
import io.jobq.model.JobUpdate;
import io.jobq.model.Worker;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the job and worker tables.
 *
 * <p>Every method is a single atomic statement against the store. All methods receive an
 * explicit {@link Connection} so the caller controls transaction boundaries. Failures are
 * reported as {@link io.jobq.JobStoreException}. Implementations live in the
 * {@code jobq-jdbc} module.
 *
 * @see io.jobq.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

  /**
   * Diagnostic label of this store (e.g. "h2", "postgresql"), recorded on worker rows.
   */
  String name();

  /**
   * Inserts a new PENDING job with zero attempts and no lock.
   *
   * @param conn     the JDBC connection
   * @param envelope the job to persist
   * @return the job id
   */
  String insert(Connection conn, JobEnvelope envelope);

  /**
   * Inserts several jobs. Default loops {@link #insert}.
   *
   * @return the job ids, in input order
   */
  default List<String> insertBatch(Connection conn, List<JobEnvelope> envelopes) {
    return envelopes.stream().map(envelope -> insert(conn, envelope)).toList();
  }

  /**
   * Reads the earliest-inserted claimable job of the given type without locking it.
   *
   * <p>Claimable means {@code (status = PENDING OR (status = FAILED AND attempts < max_attempts))
   * AND run_at <= now AND job_type = jobType}. The result may be claimed by another worker
   * before the caller acts on it.
   *
   * @param conn    the JDBC connection
   * @param jobType the job type served by the caller
   * @param now     evaluation time for {@code run_at}
   * @return the candidate, or empty when nothing is eligible
   */
  Optional<Job> selectCandidate(Connection conn, String jobType, Instant now);

  /**
   * Atomically transitions a claimable, unlocked job to RUNNING owned by {@code workerId}.
   *
   * @param conn     the JDBC connection
   * @param jobId    the candidate job id
   * @param workerId the claiming worker
   * @param now      claim time, stored as {@code lock_at}
   * @return rows affected: 1 if this caller won the claim, 0 otherwise
   */
  int claim(Connection conn, String jobId, String workerId, Instant now);

  Optional<Job> findById(Connection conn, String jobId);

  /** Counts PENDING jobs of the given type. */
  long countPending(Connection conn, String jobType);

  /**
   * Marks a RUNNING job owned by {@code workerId} as DONE.
   *
   * @return rows affected; 0 means the job is no longer owned by the worker
   */
  int ack(Connection conn, String workerId, String jobId, Instant now);

  /**
   * Marks a RUNNING job owned by {@code workerId} as KILLED.
   *
   * @return rows affected; 0 means the job is no longer owned by the worker
   */
  int kill(Connection conn, String workerId, String jobId, Instant now);

  /**
   * Marks a RUNNING job owned by {@code workerId} as KILLED and records {@code lastError}.
   *
   * @return rows affected; 0 means the job is no longer owned by the worker
   */
  int abort(Connection conn, String workerId, String jobId, String lastError, Instant now);

  /**
   * Records a failed attempt of a RUNNING job owned by {@code workerId}: sets attempts and
   * last_error, moves it to FAILED, releases the lock and defers it to {@code runAt}, in one
   * statement.
   *
   * @return rows affected; 0 means the job is no longer owned by the worker
   */
  int failAttempt(Connection conn, String workerId, String jobId, int attempts,
      String lastError, Instant runAt);

  /**
   * Returns a RUNNING job owned by {@code workerId} to PENDING immediately. Attempts are not
   * touched and no backoff applies.
   *
   * @return rows affected; 0 means the job is no longer owned by the worker
   */
  int retry(Connection conn, String workerId, String jobId);

  /**
   * Moves a job to FAILED, releases its lock and defers it to {@code runAt}.
   *
   * @return rows affected (0 if the job does not exist)
   */
  int reschedule(Connection conn, String jobId, Instant runAt);

  /**
   * Overwrites the mutable fields of a job unconditionally.
   *
   * @return rows affected (0 if the job does not exist)
   */
  int updateFields(Connection conn, String jobId, JobUpdate update);

  /**
   * Lists jobs in the given status, oldest first.
   *
   * @param jobType optional type filter ({@code null} for all)
   * @param offset  rows to skip
   * @param limit   maximum rows to return
   */
  List<Job> list(Connection conn, String jobType, JobStatus status, int offset, int limit);

  /** Inserts or overwrites the worker row keyed on {@link Worker#id()}. */
  void heartbeat(Connection conn, Worker worker);

  Optional<Worker> findWorker(Connection conn, String workerId);

  /**
   * Resets up to {@code limit} FAILED jobs of the type with {@code attempts < max_attempts}
   * back to PENDING, oldest {@code lock_at} first.
   *
   * @return number of jobs re-queued
   */
  int enqueueScheduled(Connection conn, String jobType, int limit);

  /**
   * Resets up to {@code limit} RUNNING jobs of the type whose owning worker was last seen
   * before {@code lastSeenBefore} back to PENDING, recording {@code lastError}.
   *
   * @return number of jobs reclaimed
   */
  int reclaimOrphans(Connection conn, String jobType, Instant lastSeenBefore,
      String lastError, int limit);

  /**
   * Queries dead-lettered jobs (FAILED with {@code attempts >= max_attempts}), oldest first.
   *
   * @param jobType optional type filter ({@code null} for all)
   */
  default List<Job> queryDead(Connection conn, String jobType, int limit) {
    return List.of();
  }

  /** Counts dead-lettered jobs, optionally filtered by type. */
  default long countDead(Connection conn, String jobType) {
    return 0L;
  }

  /**
   * Resets a dead-lettered job to PENDING with zero attempts. Returns 0 if the job is not
   * dead-lettered.
   */
  default int replayDead(Connection conn, String jobId) {
    return 0;
  }
}
