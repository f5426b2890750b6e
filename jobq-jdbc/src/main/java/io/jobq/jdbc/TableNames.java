package io.jobq.jdbc;

import java.util.Objects;

/**
 * Default table names and validation for identifiers spliced into SQL.
 */
public final class TableNames {
  public static final String DEFAULT_JOB_TABLE = "jobq_jobs";
  public static final String DEFAULT_WORKER_TABLE = "jobq_workers";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  /**
   * @throws IllegalArgumentException if {@code tableName} is not a plain SQL identifier
   */
  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
