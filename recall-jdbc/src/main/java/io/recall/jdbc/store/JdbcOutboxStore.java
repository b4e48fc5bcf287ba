package io.recall.jdbc.store;

import io.recall.jdbc.JdbcTemplate;
import io.recall.jdbc.TableNames;
import io.recall.model.EventStatus;
import io.recall.model.OutboxEvent;
import io.recall.spi.OutboxStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC outbox store. The statements are portable between H2 and PostgreSQL.
 *
 * <p>Every status transition is guarded by the status it leaves, so a row is never moved
 * out of {@code done} or {@code deadletter}, and two dispatchers cannot both claim it.
 */
public class JdbcOutboxStore implements OutboxStore {
  static final int MAX_ERROR_LENGTH = 4000;
  private static final String COLUMNS =
      "id, event_type, entity_id, payload, status, attempts, last_error, next_attempt_at, created_at, updated_at";

  private static final JdbcTemplate.RowMapper<OutboxEvent> EVENT_ROW_MAPPER = rs -> new OutboxEvent(
      rs.getString("id"),
      rs.getString("event_type"),
      rs.getString("entity_id"),
      rs.getString("payload"),
      EventStatus.fromCode(rs.getString("status")),
      rs.getInt("attempts"),
      rs.getString("last_error"),
      JdbcTemplate.instant(rs, "next_attempt_at"),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  private final String tableName;

  public JdbcOutboxStore() {
    this(TableNames.DEFAULT_OUTBOX_TABLE);
  }

  public JdbcOutboxStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
  }

  public String tableName() {
    return tableName;
  }

  @Override
  public void insert(Connection conn, OutboxEvent event) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + tableName + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)",
        event.id(), event.eventType(), event.entityId(), event.payloadJson(),
        event.status().code(), event.attempts(), truncateError(event.lastError()),
        event.nextAttemptAt(), event.createdAt(), event.updatedAt());
  }

  @Override
  public List<OutboxEvent> pollPending(Connection conn, Instant now, int limit) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName
            + " WHERE status='pending' AND next_attempt_at <= ? ORDER BY created_at, id LIMIT ?",
        EVENT_ROW_MAPPER, now, limit);
  }

  @Override
  public int markProcessing(Connection conn, String eventId, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET status='processing', updated_at=? WHERE id=? AND status='pending'",
        now, eventId);
  }

  @Override
  public int markDone(Connection conn, String eventId, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET status='done', updated_at=? WHERE id=? AND status='processing'",
        now, eventId);
  }

  @Override
  public int markRetry(Connection conn, String eventId, Instant nextAttemptAt, String error, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET status='pending', attempts=attempts+1, last_error=?,"
            + " next_attempt_at=?, updated_at=? WHERE id=? AND status='processing'",
        truncateError(error), nextAttemptAt, now, eventId);
  }

  @Override
  public int markDeadLetter(Connection conn, String eventId, String error, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET status='deadletter', attempts=attempts+1, last_error=?,"
            + " updated_at=? WHERE id=? AND status='processing'",
        truncateError(error), now, eventId);
  }

  @Override
  public int deadLetterStale(Connection conn, Instant staleBefore, int maxAttempts, String error, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET status='deadletter', attempts=attempts+1, last_error=?,"
            + " updated_at=? WHERE status='processing' AND updated_at < ? AND attempts+1 >= ?",
        truncateError(error), now, staleBefore, maxAttempts);
  }

  @Override
  public int releaseStale(Connection conn, Instant staleBefore, String error, Instant now) {
    return JdbcTemplate.update(conn,
        "UPDATE " + tableName + " SET status='pending', attempts=attempts+1, last_error=?,"
            + " next_attempt_at=?, updated_at=? WHERE status='processing' AND updated_at < ?",
        truncateError(error), now, now, staleBefore);
  }

  @Override
  public Optional<OutboxEvent> findById(Connection conn, String eventId) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?", EVENT_ROW_MAPPER, eventId);
  }

  @Override
  public List<OutboxEvent> queryDeadLetters(Connection conn, String eventType, int limit) {
    if (eventType == null) {
      return JdbcTemplate.query(conn,
          "SELECT " + COLUMNS + " FROM " + tableName
              + " WHERE status='deadletter' ORDER BY created_at, id LIMIT ?",
          EVENT_ROW_MAPPER, limit);
    }
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName
            + " WHERE status='deadletter' AND event_type=? ORDER BY created_at, id LIMIT ?",
        EVENT_ROW_MAPPER, eventType, limit);
  }

  @Override
  public int countDeadLetters(Connection conn, String eventType) {
    List<Integer> counts = eventType == null
        ? JdbcTemplate.query(conn,
            "SELECT COUNT(*) FROM " + tableName + " WHERE status='deadletter'",
            rs -> rs.getInt(1))
        : JdbcTemplate.query(conn,
            "SELECT COUNT(*) FROM " + tableName + " WHERE status='deadletter' AND event_type=?",
            rs -> rs.getInt(1), eventType);
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  @Override
  public Optional<Instant> oldestPendingCreatedAt(Connection conn) {
    return JdbcTemplate.queryOne(conn,
        "SELECT MIN(created_at) AS oldest FROM " + tableName + " WHERE status='pending'",
        rs -> JdbcTemplate.instant(rs, "oldest"));
  }

  static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
