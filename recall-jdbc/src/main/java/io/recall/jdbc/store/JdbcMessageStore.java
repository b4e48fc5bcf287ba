package io.recall.jdbc.store;

import io.recall.StoreException;
import io.recall.jdbc.JdbcTemplate;
import io.recall.jdbc.TableNames;
import io.recall.model.EvaluationStamp;
import io.recall.model.ScoredMessage;
import io.recall.model.UserReply;
import io.recall.spi.ConnectionProvider;
import io.recall.spi.FeedbackStore;
import io.recall.spi.MessageStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes the scoring columns of the {@code chat_message} table.
 *
 * <p>{@link MessageStore} methods open their own autocommit connection per call.
 * {@link #recordHumanFeedback} runs on the caller's connection so it commits together with
 * the feedback outbox event.
 */
public final class JdbcMessageStore implements MessageStore, FeedbackStore {
  private static final String TABLE = TableNames.MESSAGE_TABLE;

  private static final JdbcTemplate.RowMapper<ScoredMessage> MESSAGE_ROW_MAPPER = rs -> new ScoredMessage(
      rs.getString("id"),
      rs.getString("owner_id"),
      rs.getString("conversation_id"),
      rs.getLong("ordinal"),
      rs.getString("role"),
      rs.getString("content"),
      JdbcTemplate.nullableDouble(rs, "quality_score"),
      JdbcTemplate.nullableDouble(rs, "human_feedback_score"),
      JdbcTemplate.instant(rs, "created_at"));

  private static final JdbcTemplate.RowMapper<UserReply> REPLY_ROW_MAPPER = rs -> new UserReply(
      rs.getString("id"),
      rs.getLong("ordinal"),
      rs.getString("content"),
      JdbcTemplate.instant(rs, "created_at"));

  private final ConnectionProvider connectionProvider;
  private final Clock clock;

  public JdbcMessageStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, Clock.systemUTC());
  }

  public JdbcMessageStore(ConnectionProvider connectionProvider, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public List<ScoredMessage> findUnscored(int limit) {
    return withConnection("find unscored messages", conn -> JdbcTemplate.query(conn,
        "SELECT id, owner_id, conversation_id, ordinal, role, content, quality_score,"
            + " human_feedback_score, created_at FROM " + TABLE
            + " WHERE role='assistant' AND quality_score IS NULL AND content IS NOT NULL"
            + " ORDER BY created_at, id LIMIT ?",
        MESSAGE_ROW_MAPPER, limit));
  }

  @Override
  public boolean hasHumanFeedback(String messageId) {
    return withConnection("read human feedback", conn -> !JdbcTemplate.query(conn,
        "SELECT id FROM " + TABLE + " WHERE id=? AND human_feedback_score IS NOT NULL",
        rs -> rs.getString("id"), messageId).isEmpty());
  }

  @Override
  public Optional<UserReply> findUserReply(String conversationId, String ownerId, long afterOrdinal) {
    return withConnection("find user reply", conn -> {
      Optional<UserReply> next = JdbcTemplate.queryOne(conn,
          "SELECT id, ordinal, content, created_at FROM " + TABLE
              + " WHERE conversation_id=? AND owner_id=? AND role='user' AND ordinal > ?"
              + " ORDER BY ordinal LIMIT 1",
          REPLY_ROW_MAPPER, conversationId, ownerId, afterOrdinal);
      if (next.isPresent()) {
        return next;
      }
      return JdbcTemplate.queryOne(conn,
          "SELECT id, ordinal, content, created_at FROM " + TABLE
              + " WHERE conversation_id=? AND owner_id=? AND role='user'"
              + " ORDER BY created_at DESC, ordinal DESC LIMIT 1",
          REPLY_ROW_MAPPER, conversationId, ownerId);
    });
  }

  @Override
  public boolean writeQualityScore(String messageId, double score, EvaluationStamp stamp) {
    return withConnection("write quality score", conn -> JdbcTemplate.update(conn,
        "UPDATE " + TABLE + " SET quality_score=?, evaluation_model=?, evaluator_version=?,"
            + " evaluated_at=?, updated_at=? WHERE id=?",
        score, stamp.modelId(), stamp.evaluatorVersion(), stamp.evaluatedAt(), clock.instant(),
        messageId) > 0);
  }

  @Override
  public int recordHumanFeedback(Connection conn, String messageId, String ownerId,
      String feedbackType, double score, Instant at) {
    return JdbcTemplate.update(conn,
        "UPDATE " + TABLE + " SET human_feedback_score=?, human_feedback_type=?, human_feedback_at=?,"
            + " feedback_recorded=TRUE, updated_at=? WHERE id=? AND owner_id=?",
        score, feedbackType, at, at, messageId, ownerId);
  }

  private <T> T withConnection(String action, ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return callback.apply(conn);
    } catch (SQLException e) {
      throw new StoreException("Failed to " + action, e);
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }
}
