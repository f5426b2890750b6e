package io.jobq;

import io.jobq.model.Job;

import java.util.Objects;

/**
 * A job row together with its decoded payload.
 *
 * @param job     the stored job snapshot
 * @param payload the decoded payload
 * @param <T>     payload type
 */
public record JobRequest<T>(Job job, T payload) {

  public JobRequest {
    Objects.requireNonNull(job, "job");
  }

  public String id() {
    return job.id();
  }

  public int attempts() {
    return job.attempts();
  }
}
