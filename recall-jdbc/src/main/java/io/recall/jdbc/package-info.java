/**
 * JDBC implementations of the recall stores.
 *
 * <p>{@link io.recall.jdbc.store} holds the stores, {@link io.recall.jdbc.tx} a
 * lightweight transaction manager for code that does not run inside Spring. Schemas for
 * H2 and PostgreSQL ship as {@code /schema/h2.sql} and {@code /schema/postgresql.sql}.
 */
package io.recall.jdbc;
