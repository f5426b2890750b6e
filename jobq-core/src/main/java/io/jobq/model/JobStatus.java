package io.jobq.model;

/**
 * Lifecycle state of a job row.
 *
 * <p>Transitions: PENDING → RUNNING on claim; RUNNING → DONE (ack), KILLED (kill),
 * PENDING (retry or orphan reclaim) or FAILED (reschedule); FAILED → PENDING by the
 * enqueue-scheduled sweep while {@code attempts < max_attempts}. DONE and KILLED are terminal.
 */
public enum JobStatus {
  PENDING(0),
  RUNNING(1),
  DONE(2),
  FAILED(3),
  KILLED(4);

  private final int code;

  JobStatus(int code) {
    this.code = code;
  }

  /** Numeric code stored in the {@code status} column. */
  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == DONE || this == KILLED;
  }

  /**
   * Resolves a stored status code.
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static JobStatus fromCode(int code) {
    for (JobStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status code: " + code);
  }
}
