package io.jobq.jdbc;

import io.jobq.JobEnvelope;
import io.jobq.JobQueue;
import io.jobq.JobRequest;
import io.jobq.jdbc.store.AbstractJdbcJobStore;
import io.jobq.model.Job;
import io.jobq.model.JobStatus;
import io.jobq.model.JobUpdate;
import io.jobq.model.Worker;
import io.jobq.spi.PayloadCodec;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
* Store behavior against real database engines. Subclasses provide the DataSource and the
* store, and start each test from empty tables.
*/
abstract class AbstractJobStoreIntegrationTest {
  private static final String TYPE = "it";

  abstract DataSource dataSource();

  abstract AbstractJdbcJobStore store();

  static void resetTables(DataSource dataSource, String truncateSql) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute(truncateSql + " jobq_jobs");
      conn.createStatement().execute(truncateSql + " jobq_workers");
    }
  }

  JobQueue<String> queue() {
    return JobQueue.builder(PayloadCodec.string())
        .connectionProvider(new DataSourceConnectionProvider(dataSource()))
        .jobStore(store())
        .jobType(TYPE)
        .build();
  }

  @Test
  void enqueueClaimAck() {
    JobQueue<String> queue = queue();
    String id = queue.enqueue("{\"key\":\"value\"}");

    JobRequest<String> claimed = queue.claimNext("w1").orElseThrow();
    assertEquals(id, claimed.id());
    assertEquals("{\"key\":\"value\"}", claimed.payload());
    assertFalse(queue.ack("w2", id));
    assertTrue(queue.ack("w1", id));
    assertEquals(JobStatus.DONE, queue.fetchById(id).orElseThrow().job().status());
  }

  @Test
  void batchInsertKeepsInsertionOrder() {
    JobQueue<String> queue = queue();
    queue.enqueueAll(List.of("a", "b", "c"));

    assertEquals("a", queue.claimNext("w").orElseThrow().payload());
    assertEquals("b", queue.claimNext("w").orElseThrow().payload());
    assertEquals("c", queue.claimNext("w").orElseThrow().payload());
    assertEquals(3, queue.list(JobStatus.RUNNING, 0).size());
  }

  @Test
  void concurrentClaimHasSingleWinner() throws Exception {
    JobQueue<String> queue = queue();
    queue.enqueue("contended");
    int claimants = 6;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(claimants);
    try {
      List<Future<Optional<JobRequest<String>>>> results = new ArrayList<>();
      for (int i = 0; i < claimants; i++) {
        String workerId = "w" + i;
        results.add(pool.submit(() -> {
          start.await();
          return queue.claimNext(workerId);
        }));
      }
      start.countDown();
      int winners = 0;
      for (Future<Optional<JobRequest<String>>> result : results) {
        if (result.get(30, TimeUnit.SECONDS).isPresent()) {
          winners++;
        }
      }
      assertEquals(1, winners);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void rescheduleAndEnqueueScheduledSweep() {
    JobQueue<String> queue = queue();
    for (int i = 0; i < 2; i++) {
      queue.enqueue("job-" + i);
      Job job = queue.claimNext("w").orElseThrow().job();
      queue.updateFields(job.id(), JobUpdate.of(job).withAttempts(1).withLastError("boom"));
      queue.reschedule(job, Duration.ofMinutes(10));
    }
    assertFalse(queue.claimNext("w").isPresent());

    assertEquals(1, queue.workerRegistry().sweepEnqueueScheduled(TYPE, 1));
    assertEquals(1, queue.workerRegistry().sweepEnqueueScheduled(TYPE, 5));
    assertEquals(0, queue.workerRegistry().sweepEnqueueScheduled(TYPE, 5));
    assertEquals(2L, queue.len());
  }

  @Test
  void orphanSweepReclaimsOnlySilentWorkers() throws Exception {
    JobQueue<String> queue = queue();
    String orphan = queue.enqueue("orphan");
    queue.claimNext("stale").orElseThrow();
    String owned = queue.enqueue("owned");
    queue.claimNext("fresh").orElseThrow();
    Instant now = Instant.now();
    try (Connection conn = dataSource().getConnection()) {
      store().heartbeat(conn, new Worker("stale", TYPE, store().name(), now.minus(Duration.ofMinutes(6))));
      store().heartbeat(conn, new Worker("fresh", TYPE, store().name(), now.minus(Duration.ofMinutes(1))));
    }

    assertEquals(1, queue.workerRegistry().sweepReclaimOrphans(TYPE, 10));
    Job reclaimed = queue.fetchById(orphan).orElseThrow().job();
    assertEquals(JobStatus.PENDING, reclaimed.status());
    assertNull(reclaimed.lockBy());
    assertEquals("Job was abandoned", reclaimed.lastError());
    assertEquals(JobStatus.RUNNING, queue.fetchById(owned).orElseThrow().job().status());
  }

  @Test
  void heartbeatUpsertsWorker() {
    JobQueue<String> queue = queue();
    queue.heartbeat("w1");
    queue.heartbeat("w1");

    Worker worker = queue.workerRegistry().findWorker("w1").orElseThrow();
    assertEquals(store().name(), worker.storageName());
    assertEquals(TYPE, worker.workerType());
  }

  @Test
  void deadJobReplay() throws Exception {
    JobQueue<String> queue = queue();
    String id = queue.enqueue(JobEnvelope.builder(TYPE).payload("p").maxAttempts(1).build());
    Job job = queue.claimNext("w").orElseThrow().job();
    queue.updateFields(id, JobUpdate.of(job).withAttempts(1));
    queue.reschedule(id, Duration.ZERO);

    try (Connection conn = dataSource().getConnection()) {
      assertEquals(1L, store().countDead(conn, TYPE));
      assertEquals(1, store().replayDead(conn, id));
      assertEquals(0L, store().countDead(conn, TYPE));
    }
    assertEquals(1L, queue.len());
  }
}
