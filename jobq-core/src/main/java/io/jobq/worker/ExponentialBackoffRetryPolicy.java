package io.jobq.worker;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Doubles the delay with every attempt, capped, with multiplicative jitter.
 *
 * <p>The un-jittered delay for attempt {@code n} is {@code min(cap, base * 2^(n-1))}. Jitter
 * scales it by a random factor in {@code [1 - jitter, 1 + jitter)} and the result is capped
 * again, so concurrent failures of a batch do not all come back on the same tick.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofHours(1);
  public static final double DEFAULT_JITTER = 0.5;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  /** Uses a 1 second base, a 1 hour cap and 50% jitter. */
  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_JITTER);
  }

  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay) {
    this(baseDelay, maxDelay, DEFAULT_JITTER);
  }

  /**
   * @param baseDelay delay after the first failed attempt, must be positive
   * @param maxDelay  upper bound, must not be shorter than {@code baseDelay}
   * @param jitter    relative jitter in {@code [0, 1)}; {@code 0} disables it
   */
  public ExponentialBackoffRetryPolicy(Duration baseDelay, Duration maxDelay, double jitter) {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative() || baseDelay.isZero()) {
      throw new IllegalArgumentException("baseDelay must be positive, got: " + baseDelay);
    }
    if (maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelay.toMillis();
    this.maxDelayMs = maxDelay.toMillis();
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long delay = baseDelayMs;
    for (int i = 1; i < attempts && delay < maxDelayMs; i++) {
      delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
    }
    delay = Math.min(delay, maxDelayMs);
    if (jitter > 0.0) {
      double factor = ThreadLocalRandom.current().nextDouble(1.0 - jitter, 1.0 + jitter);
      delay = (long) (delay * factor);
    }
    return Math.max(0L, Math.min(maxDelayMs, delay));
  }
}
