package io.jobq.worker;

/**
 * Computes how long a failed job waits before it becomes eligible again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

  /**
   * @param attempts attempts recorded so far, including the one that just failed (1-based)
   * @return delay in milliseconds, never negative
   */
  long computeDelayMs(int attempts);
}
