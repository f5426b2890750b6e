/**
 * Service Provider Interfaces for plugging storage, connections, payload codecs and metrics
 * into the job queue.
 *
 * @see io.jobq.spi.JobStore
 * @see io.jobq.spi.ConnectionProvider
 * @see io.jobq.spi.PayloadCodec
 * @see io.jobq.spi.MetricsExporter
 */
package io.jobq.spi;
