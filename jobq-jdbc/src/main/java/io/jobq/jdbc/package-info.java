/**
 * JDBC plumbing shared by the job stores: {@link io.jobq.jdbc.JdbcTemplate},
 * {@link io.jobq.jdbc.DataSourceConnectionProvider} and table name validation.
 *
 * @see io.jobq.jdbc.store
 */
package io.jobq.jdbc;
