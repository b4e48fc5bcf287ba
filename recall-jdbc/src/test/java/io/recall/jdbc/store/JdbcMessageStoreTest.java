package io.recall.jdbc.store;

import io.recall.jdbc.DataSourceConnectionProvider;
import io.recall.jdbc.JdbcTemplate;
import io.recall.jdbc.TestDatabases;
import io.recall.model.EvaluationStamp;
import io.recall.model.ScoredMessage;
import io.recall.model.UserReply;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcMessageStoreTest {
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
  private static final Clock CLOCK = Clock.fixed(T0.plusSeconds(3600), ZoneOffset.UTC);

  private JdbcDataSource dataSource;
  private JdbcMessageStore store;

  @BeforeEach
  void setUp() {
    dataSource = TestDatabases.h2();
    store = new JdbcMessageStore(new DataSourceConnectionProvider(dataSource), CLOCK);
  }

  private void message(String id, String conversation, long ordinal, String role, String content, Instant at)
      throws SQLException {
    TestDatabases.insertMessage(dataSource, id, "u1", conversation, ordinal, role, content, at);
  }

  // ── Discovery ────────────────────────────────────────────────

  @Test
  void findUnscoredReturnsAssistantMessagesWithoutScoreOldestFirst() throws SQLException {
    message("a2", "c1", 3, "assistant", "second answer", T0.plusSeconds(20));
    message("a1", "c1", 1, "assistant", "first answer", T0);
    message("q1", "c1", 2, "user", "a question", T0.plusSeconds(10));
    message("a3", "c1", 5, "assistant", null, T0.plusSeconds(30));
    message("a4", "c1", 7, "assistant", "already scored", T0.plusSeconds(40));
    store.writeQualityScore("a4", 6.0, new EvaluationStamp("m", "v1", T0));

    List<ScoredMessage> unscored = store.findUnscored(10);

    assertEquals(List.of("a1", "a2"), unscored.stream().map(ScoredMessage::id).toList());
    ScoredMessage first = unscored.get(0);
    assertEquals("u1", first.ownerId());
    assertEquals("c1", first.conversationId());
    assertEquals(1, first.ordinal());
    assertEquals("first answer", first.content());
    assertNull(first.qualityScore());
    assertNull(first.humanFeedbackScore());
    assertEquals(T0, first.createdAt());
  }

  @Test
  void findUnscoredHonorsLimit() throws SQLException {
    for (int i = 0; i < 4; i++) {
      message("a" + i, "c1", i, "assistant", "answer " + i, T0.plusSeconds(i));
    }
    assertEquals(2, store.findUnscored(2).size());
  }

  // ── Scores ───────────────────────────────────────────────────

  @Test
  void writeQualityScoreStampsEvaluation() throws SQLException {
    message("a1", "c1", 1, "assistant", "answer", T0);
    Instant evaluatedAt = T0.plusSeconds(60);

    assertTrue(store.writeQualityScore("a1", 7.5, new EvaluationStamp("judge-model", "v3", evaluatedAt)));

    try (Connection conn = dataSource.getConnection()) {
      List<Object[]> rows = JdbcTemplate.query(conn,
          "SELECT quality_score, evaluation_model, evaluator_version, evaluated_at FROM chat_message WHERE id=?",
          rs -> new Object[] {rs.getDouble(1), rs.getString(2), rs.getString(3), JdbcTemplate.instant(rs, "evaluated_at")},
          "a1");
      Object[] row = rows.get(0);
      assertEquals(7.5, row[0]);
      assertEquals("judge-model", row[1]);
      assertEquals("v3", row[2]);
      assertEquals(evaluatedAt, row[3]);
    }
  }

  @Test
  void writeQualityScoreCommitsOnConnectionHandedOutInManualCommitMode() throws SQLException {
    message("a1", "c1", 1, "assistant", "answer", T0);
    JdbcMessageStore manualCommit = new JdbcMessageStore(() -> {
      Connection conn = dataSource.getConnection();
      conn.setAutoCommit(false);
      return conn;
    }, CLOCK);

    assertTrue(manualCommit.writeQualityScore("a1", 6.5, new EvaluationStamp("m", "v1", T0)));

    assertEquals(1, TestDatabases.count(dataSource,
        "SELECT COUNT(*) FROM chat_message WHERE id=? AND quality_score IS NOT NULL", "a1"));
    assertTrue(manualCommit.findUnscored(10).isEmpty());
  }

  @Test
  void writeQualityScoreForMissingMessageReportsNoUpdate() {
    assertFalse(store.writeQualityScore("nope", 5.0, new EvaluationStamp("m", "v1", T0)));
  }

  // ── Feedback ─────────────────────────────────────────────────

  @Test
  void humanFeedbackIsScopedToOwner() throws SQLException {
    message("a1", "c1", 1, "assistant", "answer", T0);

    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0, store.recordHumanFeedback(conn, "a1", "someone-else", "like", 8.0, T0));
      assertFalse(store.hasHumanFeedback("a1"));

      assertEquals(1, store.recordHumanFeedback(conn, "a1", "u1", "like", 8.0, T0.plusSeconds(5)));
    }
    assertTrue(store.hasHumanFeedback("a1"));
    assertEquals(1, TestDatabases.count(dataSource,
        "SELECT COUNT(*) FROM chat_message WHERE id=? AND feedback_recorded=TRUE AND human_feedback_type='like'",
        "a1"));
  }

  // ── User replies ─────────────────────────────────────────────

  @Test
  void findUserReplyPrefersNextUserMessage() throws SQLException {
    message("q1", "c1", 1, "user", "first question", T0);
    message("a1", "c1", 2, "assistant", "answer", T0.plusSeconds(1));
    message("q2", "c1", 3, "user", "thanks!", T0.plusSeconds(2));
    message("q3", "c1", 5, "user", "later question", T0.plusSeconds(3));

    UserReply reply = store.findUserReply("c1", "u1", 2).orElseThrow();

    assertEquals("q2", reply.messageId());
    assertEquals(3, reply.ordinal());
    assertEquals("thanks!", reply.content());
  }

  @Test
  void findUserReplyFallsBackToMostRecentUserMessage() throws SQLException {
    message("q1", "c1", 1, "user", "older", T0);
    message("q2", "c1", 3, "user", "newest", T0.plusSeconds(10));
    message("a1", "c1", 4, "assistant", "answer", T0.plusSeconds(20));

    assertEquals("q2", store.findUserReply("c1", "u1", 4).orElseThrow().messageId());
  }

  @Test
  void findUserReplyIgnoresOtherConversationsAndOwners() throws SQLException {
    message("a1", "c1", 1, "assistant", "answer", T0);
    message("q1", "c2", 2, "user", "elsewhere", T0.plusSeconds(1));
    TestDatabases.insertMessage(dataSource, "q2", "u2", "c1", 2, "user", "not mine", T0.plusSeconds(2));

    assertTrue(store.findUserReply("c1", "u1", 1).isEmpty());
  }
}
