package io.recall.outbox;

import io.recall.StoreException;
import io.recall.model.OutboxEvent;
import io.recall.spi.ConnectionProvider;
import io.recall.spi.OutboxStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only access to dead-lettered events for manual remediation. Dead letters are
 * never revived automatically.
 */
public final class DeadLetterInspector {
  private static final Logger logger = Logger.getLogger(DeadLetterInspector.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OutboxStore outboxStore;

  public DeadLetterInspector(ConnectionProvider connectionProvider, OutboxStore outboxStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
  }

  /**
   * @param eventType type code filter, or {@code null} for all types
   * @return dead letters oldest first; empty if the store cannot be read
   */
  public List<OutboxEvent> query(String eventType, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0, got: " + limit);
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return outboxStore.queryDeadLetters(conn, eventType, limit);
    } catch (SQLException | StoreException e) {
      logger.log(Level.SEVERE, "Failed to query dead letters", e);
      return List.of();
    }
  }

  /**
   * @param eventType type code filter, or {@code null} for all types
   * @return number of dead letters; 0 if the store cannot be read
   */
  public int count(String eventType) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return outboxStore.countDeadLetters(conn, eventType);
    } catch (SQLException | StoreException e) {
      logger.log(Level.SEVERE, "Failed to count dead letters", e);
      return 0;
    }
  }
}
