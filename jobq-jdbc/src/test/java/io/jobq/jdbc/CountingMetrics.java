package io.jobq.jdbc;

import io.jobq.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

/** Metrics exporter that counts every call. */
class CountingMetrics implements MetricsExporter {
  final AtomicInteger enqueued = new AtomicInteger();
  final AtomicInteger claimed = new AtomicInteger();
  final AtomicInteger claimLost = new AtomicInteger();
  final AtomicInteger acked = new AtomicInteger();
  final AtomicInteger killed = new AtomicInteger();
  final AtomicInteger rescheduled = new AtomicInteger();
  final AtomicInteger scheduled = new AtomicInteger();
  final AtomicInteger orphaned = new AtomicInteger();
  final AtomicInteger handlerRuns = new AtomicInteger();

  @Override
  public void incrementEnqueued() {
    enqueued.incrementAndGet();
  }

  @Override
  public void incrementClaimed() {
    claimed.incrementAndGet();
  }

  @Override
  public void incrementClaimLost() {
    claimLost.incrementAndGet();
  }

  @Override
  public void incrementAcked() {
    acked.incrementAndGet();
  }

  @Override
  public void incrementKilled() {
    killed.incrementAndGet();
  }

  @Override
  public void incrementRescheduled() {
    rescheduled.incrementAndGet();
  }

  @Override
  public void recordSweep(int scheduled, int orphaned) {
    this.scheduled.addAndGet(scheduled);
    this.orphaned.addAndGet(orphaned);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    handlerRuns.incrementAndGet();
  }
}
