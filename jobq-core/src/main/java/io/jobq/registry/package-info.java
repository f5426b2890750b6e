/**
 * Worker liveness: heartbeats, the enqueue-scheduled sweep and the orphan-reclaim sweep.
 *
 * <p>A worker's RUNNING jobs are reclaimed only after its {@code last_seen} is older than the
 * liveness timeout, so the timeout must comfortably exceed the heartbeat interval.
 *
 * @see io.jobq.registry.WorkerRegistry
 * @see io.jobq.registry.PulseScheduler
 */
package io.jobq.registry;
