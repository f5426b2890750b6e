/**
 * Micrometer integration: {@link io.jobq.micrometer.MicrometerMetricsExporter} publishes job
 * queue counters, the pending gauge and handler timings to any {@code MeterRegistry}.
 */
package io.jobq.micrometer;
