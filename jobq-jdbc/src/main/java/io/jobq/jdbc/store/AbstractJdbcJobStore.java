package io.jobq.jdbc.store;

import io.jobq.JobEnvelope;
import io.jobq.jdbc.JdbcTemplate;
import io.jobq.jdbc.TableNames;
import io.jobq.model.Job;
import io.jobq.model.JobStatus;
import io.jobq.model.JobUpdate;
import io.jobq.model.Worker;
import io.jobq.spi.JobStore;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC job store with portable SQL for every primitive.
 *
 * <p>Subclasses supply the worker upsert and may override the two sweeps where the engine
 * needs a different bounded-update form. Register custom implementations via
 * {@code META-INF/services/io.jobq.jdbc.store.AbstractJdbcJobStore}.
 *
 * <p>Timestamps are truncated to milliseconds before they are written so values read back
 * compare equal on every engine.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  protected static final int PENDING = JobStatus.PENDING.code();
  protected static final int RUNNING = JobStatus.RUNNING.code();
  protected static final int DONE = JobStatus.DONE.code();
  protected static final int FAILED = JobStatus.FAILED.code();
  protected static final int KILLED = JobStatus.KILLED.code();

  protected static final String JOB_COLUMNS =
      "id, job_type, payload, status, attempts, max_attempts, run_at, last_error, lock_at, lock_by, done_at";

  /** Rows the claim protocol may pick up, ignoring {@code run_at}. */
  protected static final String CLAIMABLE =
      "(status=" + PENDING + " OR (status=" + FAILED + " AND attempts < max_attempts))";

  protected static final String RETRYABLE_FAILED =
      "status=" + FAILED + " AND attempts < max_attempts";

  protected static final String DEAD =
      "status=" + FAILED + " AND attempts >= max_attempts";

  protected static final JdbcTemplate.RowMapper<Job> JOB_ROW_MAPPER = rs -> new Job(
      rs.getString("id"),
      rs.getString("job_type"),
      rs.getString("payload"),
      JobStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      rs.getInt("max_attempts"),
      toInstant(rs.getTimestamp("run_at")),
      rs.getString("last_error"),
      toInstant(rs.getTimestamp("lock_at")),
      rs.getString("lock_by"),
      toInstant(rs.getTimestamp("done_at")));

  protected static final JdbcTemplate.RowMapper<Worker> WORKER_ROW_MAPPER = rs -> new Worker(
      rs.getString("id"),
      rs.getString("worker_type"),
      rs.getString("storage_name"),
      toInstant(rs.getTimestamp("last_seen")));

  private final String jobTable;
  private final String workerTable;

  protected AbstractJdbcJobStore() {
    this(TableNames.DEFAULT_JOB_TABLE, TableNames.DEFAULT_WORKER_TABLE);
  }

  protected AbstractJdbcJobStore(String jobTable, String workerTable) {
    this.jobTable = TableNames.validate(jobTable);
    this.workerTable = TableNames.validate(workerTable);
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  @Override
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * A store of the same engine bound to other table names, e.g. one pair of tables per
   * application sharing a database.
   *
   * @throws IllegalArgumentException if a table name is invalid
   */
  public abstract AbstractJdbcJobStore withTables(String jobTable, String workerTable);

  /**
   * Insert-or-update statement for the worker table with parameters
   * {@code (id, worker_type, storage_name, last_seen)}.
   */
  protected abstract String upsertWorkerSql();

  protected String jobTable() {
    return jobTable;
  }

  protected String workerTable() {
    return workerTable;
  }

  @Override
  public String insert(Connection conn, JobEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    JdbcTemplate.update(conn, insertSql(), insertParams(envelope));
    return envelope.jobId();
  }

  @Override
  public List<String> insertBatch(Connection conn, List<JobEnvelope> envelopes) {
    if (envelopes.isEmpty()) {
      return List.of();
    }
    List<Object[]> rows = new ArrayList<>(envelopes.size());
    List<String> ids = new ArrayList<>(envelopes.size());
    for (JobEnvelope envelope : envelopes) {
      rows.add(insertParams(envelope));
      ids.add(envelope.jobId());
    }
    JdbcTemplate.batchUpdate(conn, insertSql(), rows);
    return ids;
  }

  private String insertSql() {
    return "INSERT INTO " + jobTable + " (" +
        "id, job_type, payload, status, attempts, max_attempts, run_at, " +
        "last_error, lock_at, lock_by, done_at" +
        ") VALUES (?,?,?," + PENDING + ",0,?,?,NULL,NULL,NULL,NULL)";
  }

  private static Object[] insertParams(JobEnvelope envelope) {
    return new Object[]{
        envelope.jobId(), envelope.jobType(), envelope.payload(),
        envelope.maxAttempts(), ts(envelope.runAt())};
  }

  @Override
  public Optional<Job> selectCandidate(Connection conn, String jobType, Instant now) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobTable +
        " WHERE " + CLAIMABLE + " AND lock_by IS NULL AND run_at <= ? AND job_type=?" +
        " ORDER BY seq LIMIT 1";
    return first(JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, ts(now), jobType));
  }

  @Override
  public int claim(Connection conn, String jobId, String workerId, Instant now) {
    Objects.requireNonNull(workerId, "workerId");
    Timestamp at = ts(now);
    String sql = "UPDATE " + jobTable +
        " SET status=" + RUNNING + ", lock_by=?, lock_at=?" +
        " WHERE id=? AND lock_by IS NULL AND run_at <= ? AND " + CLAIMABLE;
    return JdbcTemplate.update(conn, sql, workerId, at, jobId, at);
  }

  @Override
  public Optional<Job> findById(Connection conn, String jobId) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobTable + " WHERE id=?";
    return first(JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, jobId));
  }

  @Override
  public long countPending(Connection conn, String jobType) {
    String sql = "SELECT COUNT(*) FROM " + jobTable + " WHERE status=" + PENDING + " AND job_type=?";
    return JdbcTemplate.queryForLong(conn, sql, jobType);
  }

  @Override
  public int ack(Connection conn, String workerId, String jobId, Instant now) {
    return finish(conn, DONE, workerId, jobId, now);
  }

  @Override
  public int kill(Connection conn, String workerId, String jobId, Instant now) {
    return finish(conn, KILLED, workerId, jobId, now);
  }

  private int finish(Connection conn, int status, String workerId, String jobId, Instant now) {
    String sql = "UPDATE " + jobTable + " SET status=" + status + ", done_at=?" +
        " WHERE id=? AND lock_by=? AND status=" + RUNNING;
    return JdbcTemplate.update(conn, sql, ts(now), jobId, workerId);
  }

  @Override
  public int abort(Connection conn, String workerId, String jobId, String lastError, Instant now) {
    String sql = "UPDATE " + jobTable + " SET status=" + KILLED + ", done_at=?, last_error=?" +
        " WHERE id=? AND lock_by=? AND status=" + RUNNING;
    return JdbcTemplate.update(conn, sql, ts(now), truncateError(lastError), jobId, workerId);
  }

  @Override
  public int failAttempt(Connection conn, String workerId, String jobId, int attempts,
      String lastError, Instant runAt) {
    String sql = "UPDATE " + jobTable +
        " SET status=" + FAILED + ", attempts=?, last_error=?," +
        " lock_by=NULL, lock_at=NULL, done_at=NULL, run_at=?" +
        " WHERE id=? AND lock_by=? AND status=" + RUNNING;
    return JdbcTemplate.update(conn, sql,
        attempts, truncateError(lastError), ts(runAt), jobId, workerId);
  }

  @Override
  public int retry(Connection conn, String workerId, String jobId) {
    String sql = "UPDATE " + jobTable +
        " SET status=" + PENDING + ", lock_by=NULL, done_at=NULL" +
        " WHERE id=? AND lock_by=? AND status=" + RUNNING;
    return JdbcTemplate.update(conn, sql, jobId, workerId);
  }

  @Override
  public int reschedule(Connection conn, String jobId, Instant runAt) {
    String sql = "UPDATE " + jobTable +
        " SET status=" + FAILED + ", lock_by=NULL, lock_at=NULL, done_at=NULL, run_at=?" +
        " WHERE id=?";
    return JdbcTemplate.update(conn, sql, ts(runAt), jobId);
  }

  @Override
  public int updateFields(Connection conn, String jobId, JobUpdate update) {
    String sql = "UPDATE " + jobTable +
        " SET status=?, attempts=?, done_at=?, lock_by=?, lock_at=?, last_error=?" +
        " WHERE id=?";
    return JdbcTemplate.update(conn, sql,
        update.status().code(), update.attempts(), ts(update.doneAt()),
        update.lockBy(), ts(update.lockAt()), truncateError(update.lastError()), jobId);
  }

  @Override
  public List<Job> list(Connection conn, String jobType, JobStatus status, int offset, int limit) {
    Objects.requireNonNull(status, "status");
    StringBuilder sql = new StringBuilder("SELECT ").append(JOB_COLUMNS)
        .append(" FROM ").append(jobTable).append(" WHERE status=?");
    List<Object> params = new ArrayList<>();
    params.add(status.code());
    if (jobType != null) {
      sql.append(" AND job_type=?");
      params.add(jobType);
    }
    sql.append(" ORDER BY seq LIMIT ? OFFSET ?");
    params.add(limit);
    params.add(offset);
    return JdbcTemplate.query(conn, sql.toString(), JOB_ROW_MAPPER, params.toArray());
  }

  @Override
  public void heartbeat(Connection conn, Worker worker) {
    JdbcTemplate.update(conn, upsertWorkerSql(),
        worker.id(), worker.workerType(), worker.storageName(), ts(worker.lastSeen()));
  }

  @Override
  public Optional<Worker> findWorker(Connection conn, String workerId) {
    String sql = "SELECT id, worker_type, storage_name, last_seen FROM " + workerTable + " WHERE id=?";
    return first(JdbcTemplate.query(conn, sql, WORKER_ROW_MAPPER, workerId));
  }

  /**
   * Default form: {@code UPDATE ... WHERE id IN (SELECT ... ORDER BY ... LIMIT ?)}, with the
   * status predicate repeated on the outer update so a row changed after selection is left
   * alone.
   */
  @Override
  public int enqueueScheduled(Connection conn, String jobType, int limit) {
    String sql = "UPDATE " + jobTable +
        " SET status=" + PENDING + ", done_at=NULL, lock_by=NULL, lock_at=NULL" +
        " WHERE id IN (" + scheduledIdsSql() + ") AND " + RETRYABLE_FAILED;
    return JdbcTemplate.update(conn, sql, jobType, limit);
  }

  /**
   * Ids of retryable FAILED jobs of one type, oldest lock first. Parameters:
   * {@code (job_type, limit)}.
   */
  protected String scheduledIdsSql() {
    return "SELECT id FROM " + jobTable +
        " WHERE " + RETRYABLE_FAILED + " AND job_type=?" +
        " ORDER BY lock_at, seq LIMIT ?";
  }

  @Override
  public int reclaimOrphans(Connection conn, String jobType, Instant lastSeenBefore,
      String lastError, int limit) {
    String sql = "UPDATE " + jobTable +
        " SET status=" + PENDING + ", lock_by=NULL, lock_at=NULL, done_at=NULL, last_error=?" +
        " WHERE id IN (" + orphanIdsSql() + ") AND status=" + RUNNING;
    return JdbcTemplate.update(conn, sql,
        truncateError(lastError), jobType, ts(lastSeenBefore), limit);
  }

  /**
   * Ids of RUNNING jobs of one type whose owner was last seen before a cutoff, oldest lock
   * first. Parameters: {@code (job_type, cutoff, limit)}.
   */
  protected String orphanIdsSql() {
    return "SELECT j.id FROM " + jobTable + " j" +
        " INNER JOIN " + workerTable + " w ON w.id = j.lock_by" +
        " WHERE j.status=" + RUNNING + " AND j.job_type=? AND w.last_seen < ?" +
        " ORDER BY j.lock_at, j.seq LIMIT ?";
  }

  @Override
  public List<Job> queryDead(Connection conn, String jobType, int limit) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobTable + " WHERE " + DEAD +
        (jobType != null ? " AND job_type=?" : "") + " ORDER BY seq LIMIT ?";
    return jobType != null
        ? JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, jobType, limit)
        : JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, limit);
  }

  @Override
  public long countDead(Connection conn, String jobType) {
    String sql = "SELECT COUNT(*) FROM " + jobTable + " WHERE " + DEAD +
        (jobType != null ? " AND job_type=?" : "");
    return jobType != null
        ? JdbcTemplate.queryForLong(conn, sql, jobType)
        : JdbcTemplate.queryForLong(conn, sql);
  }

  @Override
  public int replayDead(Connection conn, String jobId) {
    String sql = "UPDATE " + jobTable +
        " SET status=" + PENDING + ", attempts=0, run_at=?, lock_by=NULL, lock_at=NULL, done_at=NULL" +
        " WHERE id=? AND " + DEAD;
    return JdbcTemplate.update(conn, sql, ts(Instant.now()), jobId);
  }

  protected static Timestamp ts(Instant instant) {
    return instant == null ? null : Timestamp.from(instant.truncatedTo(ChronoUnit.MILLIS));
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  private static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  protected static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
