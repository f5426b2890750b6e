/**
 * JDBC {@link io.jobq.spi.JobStore} implementations.
 *
 * <p>{@link io.jobq.jdbc.store.AbstractJdbcJobStore} holds the shared SQL and row mapping.
 * Subclasses supply the worker upsert and engine-specific sweep forms: H2 ({@code MERGE}),
 * MySQL (derived-table bounded updates), PostgreSQL ({@code FOR UPDATE SKIP LOCKED}) and
 * SQLite ({@code ON CONFLICT}).
 *
 * @see io.jobq.jdbc.store.JdbcJobStores
 */
package io.jobq.jdbc.store;
