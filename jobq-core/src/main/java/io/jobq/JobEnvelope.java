package io.jobq;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable description of a job to insert: type, encoded payload and scheduling options.
 *
 * <p>Each envelope is assigned a time-ordered UUID ({@code jobId}) by default, generated from a
 * monotonic ULID so ids created by one process sort in creation order.
 *
 * @see io.jobq.spi.JobStore#insert
 */
public final class JobEnvelope {
  public static final int DEFAULT_MAX_ATTEMPTS = 25;

  private final String jobId;
  private final String jobType;
  private final String payload;
  private final Instant runAt;
  private final int maxAttempts;

  private JobEnvelope(Builder builder) {
    this.jobId = builder.jobId == null ? newJobId() : builder.jobId;
    if (this.jobId.isEmpty()) {
      throw new IllegalArgumentException("jobId cannot be empty");
    }
    this.jobType = Objects.requireNonNull(builder.jobType, "jobType");
    if (this.jobType.isEmpty()) {
      throw new IllegalArgumentException("jobType cannot be empty");
    }
    this.payload = Objects.requireNonNull(builder.payload, "payload");
    if (builder.runAt != null && builder.delay != null) {
      throw new IllegalArgumentException("Set either runAt or delay, not both");
    }
    if (builder.delay != null && builder.delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    if (builder.delay != null) {
      this.runAt = Instant.now().plus(builder.delay);
    } else {
      this.runAt = builder.runAt == null ? Instant.now() : builder.runAt;
    }
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    this.maxAttempts = builder.maxAttempts;
  }

  public static Builder builder(String jobType) {
    return new Builder(jobType);
  }

  /** Shorthand for an immediately eligible job with default settings. */
  public static JobEnvelope of(String jobType, String payload) {
    return builder(jobType).payload(payload).build();
  }

  public String jobId() {
    return jobId;
  }

  public String jobType() {
    return jobType;
  }

  public String payload() {
    return payload;
  }

  public Instant runAt() {
    return runAt;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public String toString() {
    return "JobEnvelope{jobId=" + jobId + ", jobType=" + jobType
        + ", runAt=" + runAt + ", maxAttempts=" + maxAttempts + "}";
  }

  private static String newJobId() {
    return UlidCreator.getMonotonicUlid().toUuid().toString();
  }

  /** Builder for {@link JobEnvelope}. */
  public static final class Builder {
    private final String jobType;
    private String jobId;
    private String payload;
    private Instant runAt;
    private Duration delay;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    private Builder(String jobType) {
      this.jobType = jobType;
    }

    /** Overrides the generated id. */
    public Builder jobId(String jobId) {
      this.jobId = jobId;
      return this;
    }

    /** Sets the encoded payload. <b>Required.</b> */
    public Builder payload(String payload) {
      this.payload = payload;
      return this;
    }

    /** Earliest time the job may be claimed. Defaults to now. */
    public Builder runAt(Instant runAt) {
      this.runAt = runAt;
      return this;
    }

    /** Delay relative to build time. Mutually exclusive with {@link #runAt}. */
    public Builder delay(Duration delay) {
      this.delay = delay;
      return this;
    }

    /** Retry ceiling. Defaults to {@value JobEnvelope#DEFAULT_MAX_ATTEMPTS}. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public JobEnvelope build() {
      return new JobEnvelope(this);
    }
  }
}
