package io.recall.spring.boot;

import io.recall.jdbc.DataSourceConnectionProvider;
import io.recall.jdbc.Dialect;
import io.recall.jdbc.store.JdbcMessageStore;
import io.recall.jdbc.store.JdbcOutboxStore;
import io.recall.jdbc.store.JdbcScoreCache;
import io.recall.model.ConversationUpsert;
import io.recall.model.FeedbackUpsert;
import io.recall.model.MessageUpsert;
import io.recall.outbox.DeadLetterInspector;
import io.recall.outbox.HandlerRegistry;
import io.recall.outbox.OutboxDispatcher;
import io.recall.scoring.BatchSummary;
import io.recall.scoring.Evaluator;
import io.recall.scoring.ScoringLoop;
import io.recall.scoring.feedback.FeedbackRecorder;
import io.recall.scoring.feedback.FeedbackScores;
import io.recall.scoring.feedback.FeedbackType;
import io.recall.scoring.judge.ScoreJudge;
import io.recall.spi.ConnectionProvider;
import io.recall.spi.FinalScoreHook;
import io.recall.spi.GraphSink;
import io.recall.spi.JudgeModel;
import io.recall.spi.OutboxStore;
import io.recall.spi.ScoreCache;
import io.recall.spi.TxContext;
import io.recall.spring.SpringTxContext;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class RecallAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          DataSourceTransactionManagerAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          RecallAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:recall_" + UUID.randomUUID().toString().replace("-", "")
              + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.mode=always",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql");

  // ── Outbox side ────────────────────────────────────────────────

  @Test
  void createsOutboxAndFeedbackBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("recallOutboxStore"));
      assertTrue(ctx.containsBean("recallConnectionProvider"));
      assertTrue(ctx.containsBean("recallTxContext"));
      assertTrue(ctx.containsBean("recallOutboxWriter"));
      assertTrue(ctx.containsBean("recallFeedbackRecorder"));
      assertTrue(ctx.containsBean("recallDeadLetterInspector"));
      assertTrue(ctx.containsBean("recallHandlerRegistry"));

      assertEquals(Dialect.H2, ctx.getBean(Dialect.class));
      assertInstanceOf(JdbcOutboxStore.class, ctx.getBean(OutboxStore.class));
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(SpringTxContext.class, ctx.getBean(TxContext.class));
      assertInstanceOf(JdbcMessageStore.class, ctx.getBean(JdbcMessageStore.class));
      assertInstanceOf(JdbcScoreCache.class, ctx.getBean(ScoreCache.class));
      assertNotNull(ctx.getBean(DeadLetterInspector.class));
    });
  }

  @Test
  void noDispatcherOrScoringWithoutSinkAndJudge() {
    runner.run(ctx -> {
      assertTrue(ctx.getBeansOfType(OutboxDispatcher.class).isEmpty());
      assertTrue(ctx.getBeansOfType(ScoringLoop.class).isEmpty());
      assertTrue(ctx.getBeansOfType(Evaluator.class).isEmpty());
      assertNull(ctx.getBean(HandlerRegistry.class).handlerFor("feedback"));
    });
  }

  @Test
  void customTableName() {
    runner.withPropertyValues("recall.outbox.table-name=custom_outbox").run(ctx -> {
      JdbcOutboxStore store = (JdbcOutboxStore) ctx.getBean(OutboxStore.class);
      assertEquals("custom_outbox", store.tableName());
    });
  }

  @Test
  void feedbackScoreOverridesAreApplied() {
    runner.withPropertyValues("recall.scoring.feedback-scores.like=6.5").run(ctx -> {
      FeedbackScores scores = ctx.getBean(FeedbackScores.class);
      assertEquals(6.5, scores.scoreFor(FeedbackType.LIKE));
      assertEquals(FeedbackType.DISLIKE.defaultScore(), scores.scoreFor(FeedbackType.DISLIKE));
    });
  }

  @Test
  void unknownFeedbackTypeInOverridesFailsStartup() {
    runner.withPropertyValues("recall.scoring.feedback-scores.meh=3").run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
    });
  }

  @Test
  void recordsFeedbackInsideSpringTransaction() {
    runner.withUserConfiguration(HookConfig.class).run(ctx -> {
      DataSource dataSource = ctx.getBean(DataSource.class);
      insertMessage(dataSource, "m1", "u1", 2, "assistant", "Try restarting the service.");

      FeedbackRecorder recorder = ctx.getBean(FeedbackRecorder.class);
      Boolean recorded = tx(ctx).execute(status -> recorder.record("m1", "u1", FeedbackType.LIKE));
      assertEquals(Boolean.TRUE, recorded);

      JdbcTemplate jdbc = new JdbcTemplate(dataSource);
      assertEquals(8.0, jdbc.queryForObject(
          "SELECT human_feedback_score FROM chat_message WHERE id = ?", Double.class, "m1"));
      assertEquals(1, jdbc.queryForObject(
          "SELECT COUNT(*) FROM graph_outbox WHERE event_type = 'feedback' AND status = 'pending'",
          Integer.class));
      assertEquals(List.of("m1:u1"), ctx.getBean(RecordingHook.class).calls);
    });
  }

  @Test
  void rollbackDiscardsFeedbackAndEvent() {
    runner.withUserConfiguration(HookConfig.class).run(ctx -> {
      DataSource dataSource = ctx.getBean(DataSource.class);
      insertMessage(dataSource, "m1", "u1", 2, "assistant", "Try restarting the service.");

      FeedbackRecorder recorder = ctx.getBean(FeedbackRecorder.class);
      tx(ctx).executeWithoutResult(status -> {
        recorder.record("m1", "u1", FeedbackType.DISLIKE);
        status.setRollbackOnly();
      });

      JdbcTemplate jdbc = new JdbcTemplate(dataSource);
      assertNull(jdbc.queryForObject(
          "SELECT human_feedback_score FROM chat_message WHERE id = ?", Double.class, "m1"));
      assertEquals(0, jdbc.queryForObject("SELECT COUNT(*) FROM graph_outbox", Integer.class));
      assertTrue(ctx.getBean(RecordingHook.class).calls.isEmpty());
    });
  }

  // ── Dispatcher ─────────────────────────────────────────────────

  @Test
  void dispatcherPropagatesCommittedFeedbackToGraph() {
    runner
        .withPropertyValues("recall.outbox.poll-interval=100ms")
        .withUserConfiguration(GraphSinkConfig.class)
        .run(ctx -> {
          assertNotNull(ctx.getBean(OutboxDispatcher.class));
          DataSource dataSource = ctx.getBean(DataSource.class);
          insertMessage(dataSource, "m1", "u1", 2, "assistant", "Use a read replica.");

          FeedbackRecorder recorder = ctx.getBean(FeedbackRecorder.class);
          tx(ctx).execute(status -> recorder.record("m1", "u1", FeedbackType.THAT_WORKED));

          StubGraphSink sink = ctx.getBean(StubGraphSink.class);
          long deadline = System.currentTimeMillis() + 10_000;
          while (sink.feedback.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
          }
          assertEquals(1, sink.feedback.size());
          FeedbackUpsert upsert = sink.feedback.get(0);
          assertEquals("u1", upsert.userId());
          assertEquals("m1", upsert.messageId());
          assertEquals("that_worked", upsert.feedbackType());
          assertEquals(10.0, upsert.score());
        });
  }

  @Test
  void outboxDisabledKeepsHandlersButNoDispatcher() {
    runner
        .withPropertyValues("recall.outbox.enabled=false")
        .withUserConfiguration(GraphSinkConfig.class)
        .run(ctx -> {
          assertTrue(ctx.getBeansOfType(OutboxDispatcher.class).isEmpty());
          assertNotNull(ctx.getBean(HandlerRegistry.class).handlerFor("feedback"));
          assertNotNull(ctx.getBean(HandlerRegistry.class).handlerFor("conversation_upsert"));
        });
  }

  // ── Scoring side ───────────────────────────────────────────────

  @Test
  void scoringBeansCreatedWithJudge() {
    runner
        .withPropertyValues("recall.scoring.warm-up=1h")
        .withUserConfiguration(JudgeConfig.class)
        .run(ctx -> {
          assertNotNull(ctx.getBean(ScoreJudge.class));
          assertNotNull(ctx.getBean(Evaluator.class));
          assertTrue(ctx.getBean(ScoringLoop.class).isRunning());
        });
  }

  @Test
  void processBatchScoresUnscoredMessages() {
    runner
        .withPropertyValues("recall.scoring.warm-up=1h", "recall.scoring.evaluator-version=test-v2")
        .withUserConfiguration(JudgeConfig.class)
        .run(ctx -> {
          DataSource dataSource = ctx.getBean(DataSource.class);
          insertMessage(dataSource, "m1", "u1", 2, "assistant", "Index the owner_id column.");

          BatchSummary summary = ctx.getBean(ScoringLoop.class).processBatch();

          assertEquals(1, summary.found());
          assertEquals(1, summary.evaluated());
          assertEquals(1, summary.persisted());
          JdbcTemplate jdbc = new JdbcTemplate(dataSource);
          assertEquals(8.5, jdbc.queryForObject(
              "SELECT quality_score FROM chat_message WHERE id = ?", Double.class, "m1"));
          assertEquals("test-v2", jdbc.queryForObject(
              "SELECT evaluator_version FROM chat_message WHERE id = ?", String.class, "m1"));
          assertEquals(1, jdbc.queryForObject(
              "SELECT COUNT(*) FROM score_cache WHERE evaluator_version = 'test-v2'", Integer.class));
        });
  }

  @Test
  void scoringLoopDisabledKeepsEvaluator() {
    runner
        .withPropertyValues("recall.scoring.enabled=false")
        .withUserConfiguration(JudgeConfig.class)
        .run(ctx -> {
          assertNotNull(ctx.getBean(Evaluator.class));
          assertTrue(ctx.getBeansOfType(ScoringLoop.class).isEmpty());
        });
  }

  // ── Helpers ────────────────────────────────────────────────────

  private static TransactionTemplate tx(ApplicationContext ctx) {
    return new TransactionTemplate(ctx.getBean(PlatformTransactionManager.class));
  }

  private static void insertMessage(DataSource dataSource, String id, String ownerId, long ordinal,
      String role, String content) {
    Timestamp now = Timestamp.from(Instant.parse("2024-05-01T10:00:00Z").plusSeconds(ordinal));
    new JdbcTemplate(dataSource).update(
        "INSERT INTO chat_message (id, owner_id, conversation_id, ordinal, role, content,"
            + " created_at, updated_at) VALUES (?,?,?,?,?,?,?,?)",
        id, ownerId, "c1", ordinal, role, content, now, now);
  }

  static final class RecordingHook implements FinalScoreHook {
    final List<String> calls = new CopyOnWriteArrayList<>();

    @Override
    public void recompute(String messageId, String ownerId) {
      calls.add(messageId + ":" + ownerId);
    }
  }

  static final class StubGraphSink implements GraphSink {
    final List<ConversationUpsert> conversations = new CopyOnWriteArrayList<>();
    final List<MessageUpsert> messages = new CopyOnWriteArrayList<>();
    final List<FeedbackUpsert> feedback = new CopyOnWriteArrayList<>();

    @Override
    public void upsertConversation(ConversationUpsert conversation, Instant at) {
      conversations.add(conversation);
    }

    @Override
    public void upsertMessage(MessageUpsert message, Instant at) {
      messages.add(message);
    }

    @Override
    public void upsertFeedback(FeedbackUpsert feedback) {
      this.feedback.add(feedback);
    }
  }

  static final class FixedJudgeModel implements JudgeModel {
    @Override
    public String complete(String systemPrompt, String userPrompt) {
      return "8.5";
    }

    @Override
    public String modelId() {
      return "fixed-judge";
    }
  }

  @Configuration
  static class HookConfig {
    @Bean
    RecordingHook recordingHook() {
      return new RecordingHook();
    }
  }

  @Configuration
  static class GraphSinkConfig {
    @Bean
    StubGraphSink stubGraphSink() {
      return new StubGraphSink();
    }
  }

  @Configuration
  static class JudgeConfig {
    @Bean
    FixedJudgeModel fixedJudgeModel() {
      return new FixedJudgeModel();
    }
  }
}
