package io.jobq.jdbc;

import io.jobq.jdbc.store.AbstractJdbcJobStore;
import io.jobq.jdbc.store.JdbcJobStores;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Schema setup shared by the JDBC tests, using the DDL bundled with each store.
 */
final class Schemas {

  private Schemas() {
  }

  /** Fresh in-memory H2 database with the job and worker tables created. */
  static JdbcDataSource h2(String name) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + name + "_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    apply(ds, "h2");
    return ds;
  }

  static void apply(DataSource dataSource, String dialect) {
    apply(dataSource, JdbcJobStores.get(dialect));
  }

  static void apply(DataSource dataSource, AbstractJdbcJobStore store) {
    String script = JdbcJobStores.schema(store);
    try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
      for (String stmt : script.split(";")) {
        String trimmed = stmt.trim();
        if (!trimmed.isEmpty()) {
          st.execute(trimmed);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to apply " + store.name() + " schema", e);
    }
  }
}
