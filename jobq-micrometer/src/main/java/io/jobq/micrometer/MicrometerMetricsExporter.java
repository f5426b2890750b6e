package io.jobq.micrometer;

import io.jobq.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code jobq.jobs.enqueued}: jobs inserted</li>
 *   <li>{@code jobq.jobs.claimed}: claims won by a poll tick</li>
 *   <li>{@code jobq.jobs.claim.lost}: candidates taken by another worker first</li>
 *   <li>{@code jobq.jobs.acked}: jobs completed</li>
 *   <li>{@code jobq.jobs.killed}: jobs killed</li>
 *   <li>{@code jobq.jobs.rescheduled}: failed attempts rescheduled with backoff</li>
 *   <li>{@code jobq.sweep.scheduled}: FAILED jobs re-queued by the enqueue-scheduled sweep</li>
 *   <li>{@code jobq.sweep.orphaned}: RUNNING jobs reclaimed from silent workers</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code jobq.jobs.pending}: PENDING count last observed by {@code JobQueue.len()}</li>
 *   <li>{@code jobq.handler.duration}: job handler wall time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter claimed;
  private final Counter claimLost;
  private final Counter acked;
  private final Counter killed;
  private final Counter rescheduled;
  private final Counter sweepScheduled;
  private final Counter sweepOrphaned;
  private final Timer handlerDuration;
  private final Gauge pendingGauge;

  private final AtomicLong pending = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "jobq"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "jobq");
  }

  /**
   * Creates an exporter with a custom metric name prefix, e.g. one per job type.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "emails.jobq"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = counter(namePrefix + ".jobs.enqueued", "Jobs inserted");
    this.claimed = counter(namePrefix + ".jobs.claimed", "Claims won by a poll tick");
    this.claimLost = counter(namePrefix + ".jobs.claim.lost", "Candidates claimed by another worker");
    this.acked = counter(namePrefix + ".jobs.acked", "Jobs completed");
    this.killed = counter(namePrefix + ".jobs.killed", "Jobs killed");
    this.rescheduled = counter(namePrefix + ".jobs.rescheduled", "Failed attempts rescheduled");
    this.sweepScheduled = counter(namePrefix + ".sweep.scheduled", "FAILED jobs re-queued");
    this.sweepOrphaned = counter(namePrefix + ".sweep.orphaned", "RUNNING jobs reclaimed");
    this.handlerDuration = Timer.builder(namePrefix + ".handler.duration")
        .description("Job handler wall time")
        .register(registry);
    this.pendingGauge = Gauge.builder(namePrefix + ".jobs.pending", pending, AtomicLong::get)
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementClaimed() {
    if (closed) return;
    claimed.increment();
  }

  @Override
  public void incrementClaimLost() {
    if (closed) return;
    claimLost.increment();
  }

  @Override
  public void incrementAcked() {
    if (closed) return;
    acked.increment();
  }

  @Override
  public void incrementKilled() {
    if (closed) return;
    killed.increment();
  }

  @Override
  public void incrementRescheduled() {
    if (closed) return;
    rescheduled.increment();
  }

  @Override
  public void recordSweep(int scheduled, int orphaned) {
    if (closed) return;
    sweepScheduled.increment(scheduled);
    sweepOrphaned.increment(orphaned);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  @Override
  public void recordPendingCount(long pending) {
    if (closed) return;
    this.pending.set(pending);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(enqueued, claimed, claimLost, acked, killed, rescheduled,
        sweepScheduled, sweepOrphaned, handlerDuration, pendingGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
