package io.jobq.jdbc;

import io.jobq.JobQueue;
import io.jobq.JobRequest;
import io.jobq.jdbc.store.SqliteJobStore;
import io.jobq.model.Job;
import io.jobq.model.JobStatus;
import io.jobq.model.Worker;
import io.jobq.spi.PayloadCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the queue against a file-backed SQLite database, the way separate worker processes
 * would share it.
 */
class SqliteJobStoreTest {
  private static final String TYPE = "sqlite-jobs";

  @TempDir
  Path tempDir;

  private SQLiteDataSource dataSource;
  private SqliteJobStore store;
  private JobQueue<String> queue;

  @BeforeEach
  void setup() {
    SQLiteConfig config = new SQLiteConfig();
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);
    config.setBusyTimeout(10_000);
    dataSource = new SQLiteDataSource(config);
    dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("jobs.db"));
    Schemas.apply(dataSource, "sqlite");

    store = new SqliteJobStore();
    queue = JobQueue.builder(PayloadCodec.string())
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .jobStore(store)
        .jobType(TYPE)
        .build();
  }

  @Test
  void lifecycleRoundTrip() {
    String id = queue.enqueue("payload");
    assertEquals(1L, queue.len());

    JobRequest<String> claimed = queue.claimNext("w1").orElseThrow();
    assertEquals("payload", claimed.payload());
    assertEquals(JobStatus.RUNNING, claimed.job().status());
    assertFalse(queue.ack("w2", id));
    assertTrue(queue.ack("w1", id));

    Job done = queue.fetchById(id).orElseThrow().job();
    assertEquals(JobStatus.DONE, done.status());
    assertNotNull(done.doneAt());
    assertEquals(0L, queue.len());
  }

  @Test
  void rescheduleAndSweepsWork() throws Exception {
    String failed = queue.enqueue("failed");
    queue.claimNext("w1").orElseThrow();
    queue.reschedule(failed, Duration.ofHours(1));
    assertFalse(queue.claimNext("w1").isPresent());

    String orphan = queue.enqueue("orphan");
    queue.claimNext("crashed").orElseThrow();
    try (Connection conn = dataSource.getConnection()) {
      store.heartbeat(conn, new Worker("crashed", TYPE, store.name(), Instant.now().minus(Duration.ofMinutes(6))));
    }

    assertEquals(1, queue.workerRegistry().sweepEnqueueScheduled(TYPE, 10));
    assertEquals(1, queue.workerRegistry().sweepReclaimOrphans(TYPE, 10));
    Job reclaimed = queue.fetchById(orphan).orElseThrow().job();
    assertEquals(JobStatus.PENDING, reclaimed.status());
    assertNull(reclaimed.lockBy());
    assertEquals(orphan, queue.claimNext("w2").orElseThrow().id());
  }

  @Test
  void heartbeatUpsertKeepsSingleRow() throws Exception {
    queue.heartbeat("w1");
    queue.heartbeat("w1");

    Worker worker = queue.workerRegistry().findWorker("w1").orElseThrow();
    assertEquals("sqlite", worker.storageName());
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(1L, JdbcTemplate.queryForLong(conn, "SELECT COUNT(*) FROM jobq_workers"));
    }
  }

  @Test
  void concurrentClaimantsHaveOneWinner() throws Exception {
    queue.enqueue("contended");
    int claimants = 4;
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
}
