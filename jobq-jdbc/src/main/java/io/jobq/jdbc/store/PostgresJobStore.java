package io.jobq.jdbc.store;

import java.util.List;

/**
 * PostgreSQL job store.
 *
 * <p>The sweeps select their bounded id sets with {@code FOR UPDATE SKIP LOCKED}, so
 * concurrent sweepers on different workers split the work instead of blocking on the same
 * rows.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String jobTable, String workerTable) {
    super(jobTable, workerTable);
  }

  @Override
  public PostgresJobStore withTables(String jobTable, String workerTable) {
    return new PostgresJobStore(jobTable, workerTable);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String upsertWorkerSql() {
    return "INSERT INTO " + workerTable() + " (id, worker_type, storage_name, last_seen)" +
        " VALUES (?,?,?,?) ON CONFLICT (id) DO UPDATE SET" +
        " worker_type=EXCLUDED.worker_type, storage_name=EXCLUDED.storage_name," +
        " last_seen=EXCLUDED.last_seen";
  }

  @Override
  protected String scheduledIdsSql() {
    return super.scheduledIdsSql() + " FOR UPDATE SKIP LOCKED";
  }

  @Override
  protected String orphanIdsSql() {
    return super.orphanIdsSql() + " FOR UPDATE OF j SKIP LOCKED";
  }
}
