package io.jobq.jdbc.store;

import java.util.List;

/**
 * SQLite job store.
 *
 * <p>SQLite serializes writers on the database file, so the conditional claim update is
 * trivially atomic. Timestamps are stored as epoch milliseconds (the driver default). For
 * several worker processes on one file, enable WAL journaling and a busy timeout on the
 * connections; the store does not apply pragmas itself.
 */
public final class SqliteJobStore extends AbstractJdbcJobStore {

  public SqliteJobStore() {
    super();
  }

  public SqliteJobStore(String jobTable, String workerTable) {
    super(jobTable, workerTable);
  }

  @Override
  public SqliteJobStore withTables(String jobTable, String workerTable) {
    return new SqliteJobStore(jobTable, workerTable);
  }

  @Override
  public String name() {
    return "sqlite";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:sqlite:");
  }

  @Override
  protected String upsertWorkerSql() {
    return "INSERT INTO " + workerTable() + " (id, worker_type, storage_name, last_seen)" +
        " VALUES (?,?,?,?) ON CONFLICT(id) DO UPDATE SET" +
        " worker_type=excluded.worker_type, storage_name=excluded.storage_name," +
        " last_seen=excluded.last_seen";
  }
}
