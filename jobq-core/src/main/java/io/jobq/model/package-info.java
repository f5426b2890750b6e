/**
 * Row-level data model: {@link io.jobq.model.Job}, {@link io.jobq.model.Worker},
 * {@link io.jobq.model.JobStatus} and the {@link io.jobq.model.JobUpdate} field set.
 */
package io.jobq.model;
