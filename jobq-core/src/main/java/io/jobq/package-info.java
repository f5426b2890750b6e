/**
 * A durable, multi-worker job queue on a relational table.
 *
 * <p>{@link io.jobq.JobQueue} is the entry point: enqueue payloads, claim or consume jobs,
 * and finish them with ack, kill, retry or reschedule. {@link io.jobq.worker.JobWorker}
 * bundles polling, heartbeats, sweeps and retry handling into a ready-made executor.
 *
 * <p>Delivery is at-least-once. A job whose worker stops heartbeating is reclaimed and may
 * run again, so handlers should be idempotent.
 */
package io.jobq;
