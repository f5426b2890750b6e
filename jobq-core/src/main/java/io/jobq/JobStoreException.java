package io.jobq;

/**
 * Unchecked exception for storage failures: connectivity, constraint violations and timeouts.
 *
 * <p>Always propagated to the caller; this library never retries a failed store operation
 * internally.
 */
public class JobStoreException extends RuntimeException {

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public JobStoreException(String message) {
    super(message);
  }
}
