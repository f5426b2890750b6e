package io.jobq.jdbc.store;

import java.util.List;

/**
 * H2 job store. Primarily for tests and embedded use.
 *
 * <p>Uses the default subquery-bounded sweeps from {@link AbstractJdbcJobStore} and
 * {@code MERGE INTO ... KEY} for the worker upsert.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(String jobTable, String workerTable) {
    super(jobTable, workerTable);
  }

  @Override
  public H2JobStore withTables(String jobTable, String workerTable) {
    return new H2JobStore(jobTable, workerTable);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String upsertWorkerSql() {
    return "MERGE INTO " + workerTable() + " (id, worker_type, storage_name, last_seen)" +
        " KEY (id) VALUES (?,?,?,?)";
  }
}
