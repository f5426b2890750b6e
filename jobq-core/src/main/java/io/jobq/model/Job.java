package io.jobq.model;

import java.time.Instant;

/**
 * Read-only snapshot of a persisted job row.
 *
 * <p>{@code payload} is the stored text form; decoding it into a typed value is the job
 * queue's concern (see {@link io.jobq.spi.PayloadCodec}).
 *
 * @param id          unique job id, immutable
 * @param jobType     logical queue name, never reassigned
 * @param payload     encoded payload, immutable after creation
 * @param status      lifecycle state
 * @param attempts    execution attempt counter
 * @param maxAttempts retry ceiling
 * @param runAt       earliest eligible claim time
 * @param lastError   diagnostic from the last failure, or {@code null}
 * @param lockAt      time of the current or last claim, or {@code null}
 * @param lockBy      id of the current or last owning worker, or {@code null}
 * @param doneAt      terminal timestamp (DONE/KILLED), or {@code null}
 */
public record Job(
    String id,
    String jobType,
    String payload,
    JobStatus status,
    int attempts,
    int maxAttempts,
    Instant runAt,
    String lastError,
    Instant lockAt,
    String lockBy,
    Instant doneAt
) {

  /** Whether the attempt counter still allows automatic re-enqueueing. */
  public boolean retryable() {
    return attempts < maxAttempts;
  }

  /** A FAILED job that exhausted {@code maxAttempts} and will not be re-queued by sweeps. */
  public boolean deadLetter() {
    return status == JobStatus.FAILED && !retryable();
  }
}
