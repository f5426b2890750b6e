package io.jobq.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A worker registration row, overwritten by every heartbeat.
 *
 * <p>Staleness is inferred from {@code lastSeen}; rows are never deleted.
 *
 * @param id          caller-supplied worker identity
 * @param workerType  the job type this worker consumes
 * @param storageName diagnostic label of the store implementation
 * @param lastSeen    time of the last heartbeat
 */
public record Worker(String id, String workerType, String storageName, Instant lastSeen) {

  public Worker {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(workerType, "workerType");
    Objects.requireNonNull(storageName, "storageName");
    Objects.requireNonNull(lastSeen, "lastSeen");
  }
}
