package io.jobq;

/**
 * Thrown when a job payload cannot be encoded on enqueue or decoded on dequeue.
 */
public class PayloadCodecException extends RuntimeException {

  public PayloadCodecException(String message, Throwable cause) {
    super(message, cause);
  }

  public PayloadCodecException(String message) {
    super(message);
  }
}
