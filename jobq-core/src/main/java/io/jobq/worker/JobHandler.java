package io.jobq.worker;

import io.jobq.JobRequest;

/**
 * Application code executed for each claimed job.
 *
 * <p>Returning normally acknowledges the job. Throwing {@link AbortJobException} kills it,
 * {@link RetryAfterException} retries after the given delay, and any other exception
 * retries with the worker's {@link RetryPolicy}. Handlers may run more than once for the
 * same job and should be idempotent.
 *
 * @param <T> payload type
 */
@FunctionalInterface
public interface JobHandler<T> {

  void handle(JobRequest<T> request) throws Exception;
}
