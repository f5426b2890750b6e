package io.jobq.worker;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown by a {@link JobHandler} to fail the current attempt and retry after a delay the
 * handler chooses, e.g. from an HTTP {@code Retry-After} header.
 *
 * <p>The attempt still counts against {@code max_attempts}; only the {@link RetryPolicy}
 * delay is replaced.
 */
public class RetryAfterException extends RuntimeException {

  private final Duration retryAfter;

  public RetryAfterException(Duration retryAfter) {
    super("Retry after " + validate(retryAfter));
    this.retryAfter = retryAfter;
  }

  public RetryAfterException(Duration retryAfter, String message) {
    super(message);
    this.retryAfter = validate(retryAfter);
  }

  public RetryAfterException(Duration retryAfter, String message, Throwable cause) {
    super(message, cause);
    this.retryAfter = validate(retryAfter);
  }

  /** The requested delay, never negative. */
  public Duration retryAfter() {
    return retryAfter;
  }

  private static Duration validate(Duration retryAfter) {
    Objects.requireNonNull(retryAfter, "retryAfter");
    if (retryAfter.isNegative()) {
      throw new IllegalArgumentException("retryAfter must not be negative");
    }
    return retryAfter;
  }
}
