package io.jobq.registry;

import io.jobq.spi.ConnectionProvider;
import io.jobq.spi.JobStore;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.SQLException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRegistryTest {

  private final ConnectionProvider unusedProvider = () -> {
    throw new SQLException("should not connect");
  };
  private final JobStore unusedStore = (JobStore) Proxy.newProxyInstance(
      JobStore.class.getClassLoader(), new Class<?>[]{JobStore.class},
      (proxy, method, args) -> {
        throw new AssertionError("unexpected call " + method.getName());
      });

  @Test
  void sweepsRejectNonPositiveCount() {
    WorkerRegistry registry = new WorkerRegistry(unusedProvider, unusedStore);

    assertThrows(IllegalArgumentException.class, () -> registry.sweepEnqueueScheduled("t", 0));
    assertThrows(IllegalArgumentException.class, () -> registry.sweepReclaimOrphans("t", -1));
  }

  @Test
  void orphanSweepRejectsNonPositiveTimeout() {
    WorkerRegistry registry = new WorkerRegistry(unusedProvider, unusedStore);

    assertThrows(IllegalArgumentException.class,
        () -> registry.sweepReclaimOrphans("t", 10, Duration.ZERO));
    assertThrows(NullPointerException.class,
        () -> registry.sweepReclaimOrphans(null, 10));
  }

  @Test
  void defaultsMatchDocumentedValues() {
    assertEquals(Duration.ofMinutes(5), WorkerRegistry.DEFAULT_LIVENESS_TIMEOUT);
    assertEquals("Job was abandoned", WorkerRegistry.ABANDONED_ERROR);
  }
}
