package io.jobq.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Full set of mutable job fields written by {@link io.jobq.spi.JobStore#updateFields}.
 *
 * <p>Callers start from {@link #of(Job)} and replace the fields they change, e.g.
 * {@code JobUpdate.of(job).withAttempts(0).withLastError(null)}. The write is unguarded, so
 * it is meant for administrative repair; a worker finishing its own claim uses the guarded
 * {@code JobQueue.failAttempt} or {@code JobQueue.abort}.
 */
public record JobUpdate(
    JobStatus status,
    int attempts,
    Instant doneAt,
    String lockBy,
    Instant lockAt,
    String lastError
) {

  public JobUpdate {
    Objects.requireNonNull(status, "status");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
  }

  /** Snapshot of the mutable fields of {@code job}. */
  public static JobUpdate of(Job job) {
    return new JobUpdate(job.status(), job.attempts(), job.doneAt(),
        job.lockBy(), job.lockAt(), job.lastError());
  }

  public JobUpdate withStatus(JobStatus status) {
    return new JobUpdate(status, attempts, doneAt, lockBy, lockAt, lastError);
  }

  public JobUpdate withAttempts(int attempts) {
    return new JobUpdate(status, attempts, doneAt, lockBy, lockAt, lastError);
  }

  public JobUpdate withDoneAt(Instant doneAt) {
    return new JobUpdate(status, attempts, doneAt, lockBy, lockAt, lastError);
  }

  public JobUpdate withLock(String lockBy, Instant lockAt) {
    return new JobUpdate(status, attempts, doneAt, lockBy, lockAt, lastError);
  }

  public JobUpdate withLastError(String lastError) {
    return new JobUpdate(status, attempts, doneAt, lockBy, lockAt, lastError);
  }
}
