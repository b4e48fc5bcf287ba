package io.recall.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of auto-commit JDBC connections for work that runs outside any caller
 * transaction: dispatcher status updates, scoring reads and writes, cache access.
 * Callers close what they obtain.
 */
@FunctionalInterface
public interface ConnectionProvider {

  Connection getConnection() throws SQLException;
}
