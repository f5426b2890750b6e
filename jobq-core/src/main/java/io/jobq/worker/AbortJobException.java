package io.jobq.worker;

/**
 * Thrown by a {@link JobHandler} when a job can never succeed. The worker kills the job
 * instead of scheduling another attempt, and records the message as {@code last_error}.
 */
public class AbortJobException extends RuntimeException {

  public AbortJobException(String message) {
    super(message);
  }

  public AbortJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
