/**
 * Ready-made executor: poll, run a {@link io.jobq.worker.JobHandler}, and finish each job.
 *
 * @see io.jobq.worker.JobWorker
 */
package io.jobq.worker;
