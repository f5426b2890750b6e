package io.jobq.jdbc.store;

import io.jobq.jdbc.TableNames;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of JDBC job stores with auto-detection by JDBC URL.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.jobq.jdbc.store.AbstractJdbcJobStore}. Registered instances use
 * the default table names; the three-argument lookups bind a store to other tables.
 * {@link #schema} returns the bundled DDL for a store, rewritten for its table names.
 *
 * <pre>{@code
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource, "billing_jobs", "billing_workers");
 * String ddl = JdbcJobStores.schema(store);
 * }</pre>
 */
public final class JdbcJobStores {

  private static final List<AbstractJdbcJobStore> STORES;
  private static final Map<String, AbstractJdbcJobStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcJobStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcJobStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcJobStores() {
  }

  public static List<AbstractJdbcJobStore> all() {
    return STORES;
  }

  /**
   * @param name store name (case-insensitive)
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcJobStore get(String name) {
    AbstractJdbcJobStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown job store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Looks up a store by name and binds it to the given tables.
   *
   * @throws IllegalArgumentException if the name is unknown or a table name is invalid
   */
  public static AbstractJdbcJobStore get(String name, String jobTable, String workerTable) {
    return get(name).withTables(jobTable, workerTable);
  }

  /**
   * Detects the store from {@code dataSource} and binds it to the given tables.
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource, String jobTable,
      String workerTable) {
    return detect(dataSource).withTables(jobTable, workerTable);
  }

  /**
   * DDL creating the job and worker tables and their indexes for {@code store}, read from
   * {@code schema/<name>.sql} with the default table names replaced by the store's own.
   * Statements are separated by {@code ;}.
   *
   * @throws IllegalStateException if no script is bundled for the store
   */
  public static String schema(AbstractJdbcJobStore store) {
    String path = "/schema/" + store.name() + ".sql";
    String script;
    try (InputStream is = JdbcJobStores.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IllegalStateException("No schema bundled for job store: " + store.name());
      }
      script = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + path, e);
    }
    return script
        .replace(TableNames.DEFAULT_JOB_TABLE, store.jobTable())
        .replace(TableNames.DEFAULT_WORKER_TABLE, store.workerTable());
  }

  /**
   * Detects the store from the URL of a connection borrowed from {@code dataSource}.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect job store from DataSource", e);
    }
  }

  /**
   * @throws IllegalArgumentException if no registered store handles the URL
   */
  public static AbstractJdbcJobStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcJobStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No job store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
