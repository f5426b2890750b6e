package io.jobq.jdbc;

import io.jobq.JobStoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * Static JDBC helpers for the job stores. Every {@link SQLException} is rethrown as
 * {@link JobStoreException}.
 */
public final class JdbcTemplate {

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new JobStoreException("Failed to execute update", e);
    }
  }

  /** Execute one statement for each parameter row as a JDBC batch. */
  public static int[] batchUpdate(Connection conn, String sql, List<Object[]> rows) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      for (Object[] params : rows) {
        bindParams(ps, params);
        ps.addBatch();
      }
      return ps.executeBatch();
    } catch (SQLException e) {
      throw new JobStoreException("Failed to execute batch update", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new JobStoreException("Failed to execute query", e);
    }
  }

  /** Execute a single-value SELECT such as {@code COUNT(*)}. */
  public static long queryForLong(Connection conn, String sql, Object... params) {
    List<Long> values = query(conn, sql, rs -> rs.getLong(1), params);
    return values.isEmpty() ? 0L : values.get(0);
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
