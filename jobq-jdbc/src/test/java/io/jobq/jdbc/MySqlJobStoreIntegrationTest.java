package io.jobq.jdbc;

import io.jobq.jdbc.store.AbstractJdbcJobStore;
import io.jobq.jdbc.store.MySqlJobStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlJobStoreIntegrationTest extends AbstractJobStoreIntegrationTest {

    @Container
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("jobq_test");

    private static final MySqlJobStore STORE = new MySqlJobStore();
    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() {
        dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
        Schemas.apply(dataSource, "mysql");
    }

    @BeforeEach
    void truncate() throws Exception {
        resetTables(dataSource, "TRUNCATE TABLE");
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcJobStore store() {
        return STORE;
    }
}
