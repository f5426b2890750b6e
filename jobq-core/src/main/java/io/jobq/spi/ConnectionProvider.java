package io.jobq.spi;

import io.jobq.JobStoreException;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the job and worker tables.
 *
 * <p>Callers are responsible for closing the returned connection. Components never hold a
 * connection across calls; every store operation borrows one through {@link #execute}.
 *
 * @see io.jobq.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;

  /**
   * Runs {@code callback} on a fresh auto-commit connection and closes it afterwards.
   *
   * @throws JobStoreException if the connection cannot be obtained or the callback fails
   *                           with an {@link SQLException}
   */
  default <T> T execute(ConnectionCallback<T> callback) {
    try (Connection conn = getConnection()) {
      conn.setAutoCommit(true);
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw new JobStoreException("JDBC operation failed", e);
    }
  }

  /** Work performed against a borrowed connection. */
  @FunctionalInterface
  interface ConnectionCallback<T> {
    T doInConnection(Connection conn) throws SQLException;
  }
}
