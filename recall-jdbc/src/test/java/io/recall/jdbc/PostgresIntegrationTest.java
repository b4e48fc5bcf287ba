package io.recall.jdbc;

import io.recall.jdbc.store.JdbcMessageStore;
import io.recall.jdbc.store.JdbcOutboxStore;
import io.recall.jdbc.store.JdbcScoreCache;
import io.recall.model.EvaluationStamp;
import io.recall.model.EventStatus;
import io.recall.model.EventType;
import io.recall.model.OutboxEvent;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DockerAvailable
@Testcontainers
class PostgresIntegrationTest {
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("recall_test");

  private static PGSimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() {
    dataSource = new PGSimpleDataSource();
    dataSource.setUrl(postgres.getJdbcUrl());
    dataSource.setUser(postgres.getUsername());
    dataSource.setPassword(postgres.getPassword());
    TestDatabases.applySchema(dataSource, Dialect.POSTGRESQL);
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("TRUNCATE TABLE graph_outbox, score_cache, chat_message");
    }
  }

  @Test
  void dialectIsDetectedFromContainer() {
    assertEquals(Dialect.POSTGRESQL, Dialect.detect(dataSource));
  }

  @Test
  void scoreCacheUpsertOverwritesWithinVersion() {
    JdbcScoreCache cache = new JdbcScoreCache(new DataSourceConnectionProvider(dataSource), Dialect.POSTGRESQL);
    cache.put("fp", "v1", 4.0);
    cache.put("fp", "v1", 8.5);
    cache.put("fp", "v2", 1.0);

    assertEquals(OptionalDouble.of(8.5), cache.lookup("fp", "v1"));
    assertEquals(OptionalDouble.of(1.0), cache.lookup("fp", "v2"));
    assertTrue(cache.lookup("fp", "v3").isEmpty());
  }

  @Test
  void outboxLifecycle() throws Exception {
    JdbcOutboxStore store = new JdbcOutboxStore();
    try (Connection conn = dataSource.getConnection()) {
      OutboxEvent event = OutboxEvent.pending(EventType.MESSAGE_UPSERT, "m1", "{\"message_id\":\"m1\"}", T0);
      store.insert(conn, event);

      assertEquals(1, store.pollPending(conn, T0, 10).size());
      assertEquals(1, store.markProcessing(conn, event.id(), T0));
      assertEquals(1, store.markRetry(conn, event.id(), T0.plusSeconds(2), "timeout", T0));
      assertTrue(store.pollPending(conn, T0.plusSeconds(1), 10).isEmpty());
      assertEquals(1, store.markProcessing(conn, event.id(), T0.plusSeconds(2)));
      assertEquals(1, store.markDeadLetter(conn, event.id(), "timeout", T0.plusSeconds(2)));

      OutboxEvent dead = store.findById(conn, event.id()).orElseThrow();
      assertEquals(EventStatus.DEADLETTER, dead.status());
      assertEquals(2, dead.attempts());
      assertEquals(1, store.countDeadLetters(conn, "message_upsert"));
    }
  }

  @Test
  void messageStoreFindsUnscoredAndWritesScores() throws Exception {
    TestDatabases.insertMessage(dataSource, "a1", "u1", "c1", 1, "assistant", "answer", T0);
    TestDatabases.insertMessage(dataSource, "q1", "u1", "c1", 2, "user", "thanks", T0.plusSeconds(5));
    JdbcMessageStore store = new JdbcMessageStore(new DataSourceConnectionProvider(dataSource));

    assertEquals(1, store.findUnscored(10).size());
    assertEquals("q1", store.findUserReply("c1", "u1", 1).orElseThrow().messageId());
    assertTrue(store.writeQualityScore("a1", 6.5, new EvaluationStamp("judge", "v1", T0)));
    assertTrue(store.findUnscored(10).isEmpty());
  }
}
