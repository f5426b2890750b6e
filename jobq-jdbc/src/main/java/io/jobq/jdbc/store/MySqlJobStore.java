package io.jobq.jdbc.store;

import java.util.List;

/**
 * MySQL job store. Also compatible with TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery and an update whose subquery
 * reads the target table, so the sweeps wrap their bounded id selection in a derived table
 * that is materialized before the update runs.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(String jobTable, String workerTable) {
    super(jobTable, workerTable);
  }

  @Override
  public MySqlJobStore withTables(String jobTable, String workerTable) {
    return new MySqlJobStore(jobTable, workerTable);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  protected String upsertWorkerSql() {
    return "INSERT INTO " + workerTable() + " (id, worker_type, storage_name, last_seen)" +
        " VALUES (?,?,?,?) ON DUPLICATE KEY UPDATE" +
        " worker_type=VALUES(worker_type), storage_name=VALUES(storage_name)," +
        " last_seen=VALUES(last_seen)";
  }

  @Override
  protected String scheduledIdsSql() {
    return "SELECT id FROM (" + super.scheduledIdsSql() + ") AS picked";
  }

  @Override
  protected String orphanIdsSql() {
    return "SELECT id FROM (" + super.orphanIdsSql() + ") AS picked";
  }
}
