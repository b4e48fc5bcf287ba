package io.recall.spring.boot;

import io.recall.jdbc.DataSourceConnectionProvider;
import io.recall.jdbc.Dialect;
import io.recall.jdbc.store.JdbcMessageStore;
import io.recall.jdbc.store.JdbcOutboxStore;
import io.recall.jdbc.store.JdbcScoreCache;
import io.recall.outbox.DeadLetterInspector;
import io.recall.outbox.GraphSyncHandlers;
import io.recall.outbox.HandlerRegistry;
import io.recall.outbox.OutboxDispatcher;
import io.recall.outbox.OutboxWriter;
import io.recall.retry.ExponentialBackoffRetryPolicy;
import io.recall.scoring.Evaluator;
import io.recall.scoring.ScoringLoop;
import io.recall.scoring.feedback.FeedbackHeuristic;
import io.recall.scoring.feedback.FeedbackRecorder;
import io.recall.scoring.feedback.FeedbackScores;
import io.recall.scoring.feedback.FeedbackType;
import io.recall.scoring.judge.IssueClassifier;
import io.recall.scoring.judge.ScoreJudge;
import io.recall.spi.ConnectionProvider;
import io.recall.spi.FeedbackStore;
import io.recall.spi.FinalScoreHook;
import io.recall.spi.GraphSink;
import io.recall.spi.JudgeModel;
import io.recall.spi.MessageStore;
import io.recall.spi.MetricsExporter;
import io.recall.spi.OutboxStore;
import io.recall.spi.ScoreCache;
import io.recall.spi.TxContext;
import io.recall.spring.SpringTxContext;
import io.recall.util.JsonCodec;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the graph outbox and the scoring pipeline over the application's {@link DataSource}.
 *
 * <p>The outbox writer, feedback recorder and dead-letter inspector are always configured.
 * The dispatcher needs a {@link GraphSink} bean and the scoring loop needs a
 * {@link JudgeModel} bean; both are supplied by the Neo4j and judge auto-configurations
 * when their properties are set, or by the application.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RecallProperties.class)
public class RecallAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Dialect recallDialect(DataSource dataSource) {
    return Dialect.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider recallConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext recallTxContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(OutboxStore.class)
  public JdbcOutboxStore recallOutboxStore(RecallProperties properties) {
    return new JdbcOutboxStore(properties.getOutbox().getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(MessageStore.class)
  public JdbcMessageStore recallMessageStore(ConnectionProvider connectionProvider) {
    return new JdbcMessageStore(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean(ScoreCache.class)
  public JdbcScoreCache recallScoreCache(ConnectionProvider connectionProvider, Dialect dialect) {
    return new JdbcScoreCache(connectionProvider, dialect);
  }

  @Bean
  @ConditionalOnMissingBean
  public OutboxWriter recallOutboxWriter(TxContext txContext, OutboxStore outboxStore) {
    return new OutboxWriter(txContext, outboxStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public FeedbackScores recallFeedbackScores(RecallProperties properties) {
    Map<String, Double> configured = properties.getScoring().getFeedbackScores();
    if (configured.isEmpty()) {
      return FeedbackScores.defaults();
    }
    Map<FeedbackType, Double> overrides = new EnumMap<>(FeedbackType.class);
    configured.forEach((code, score) -> overrides.put(FeedbackType.fromCode(code), score));
    return FeedbackScores.withOverrides(overrides);
  }

  @Bean
  @ConditionalOnMissingBean
  public FeedbackRecorder recallFeedbackRecorder(
      TxContext txContext,
      FeedbackStore feedbackStore,
      OutboxWriter outboxWriter,
      FeedbackScores feedbackScores,
      ObjectProvider<FinalScoreHook> finalScoreHook) {
    return new FeedbackRecorder(txContext, feedbackStore, outboxWriter,
        finalScoreHook.getIfAvailable(() -> FinalScoreHook.NOOP), feedbackScores, Clock.systemUTC());
  }

  @Bean
  @ConditionalOnMissingBean
  public DeadLetterInspector recallDeadLetterInspector(
      ConnectionProvider connectionProvider, OutboxStore outboxStore) {
    return new DeadLetterInspector(connectionProvider, outboxStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public HandlerRegistry recallHandlerRegistry(ObjectProvider<GraphSink> graphSink) {
    HandlerRegistry registry = new HandlerRegistry();
    GraphSink sink = graphSink.getIfAvailable();
    if (sink != null) {
      GraphSyncHandlers.registerAll(registry, sink, JsonCodec.getDefault());
    }
    return registry;
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(GraphSink.class)
  @ConditionalOnProperty(prefix = "recall.outbox", name = "enabled", matchIfMissing = true)
  public OutboxDispatcher recallOutboxDispatcher(
      ConnectionProvider connectionProvider,
      OutboxStore outboxStore,
      HandlerRegistry handlerRegistry,
      RecallProperties properties,
      ObjectProvider<MetricsExporter> metrics) {
    RecallProperties.Outbox outbox = properties.getOutbox();
    return OutboxDispatcher.builder()
        .connectionProvider(connectionProvider)
        .outboxStore(outboxStore)
        .handlerRegistry(handlerRegistry)
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            outbox.getRetry().getBaseDelay().toMillis(), outbox.getRetry().getMaxDelay().toMillis()))
        .maxAttempts(outbox.getMaxAttempts())
        .batchSize(outbox.getBatchSize())
        .pollInterval(outbox.getPollInterval())
        .processingTimeout(outbox.getProcessingTimeout())
        .stopTimeout(outbox.getStopTimeout())
        .metrics(metrics.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }

  /**
   * Scoring beans, present when a judge model is available.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnBean(JudgeModel.class)
  static class ScoringConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ScoreJudge recallScoreJudge(
        JudgeModel judgeModel, RecallProperties properties, ObjectProvider<MetricsExporter> metrics) {
      RecallProperties.Judge judge = properties.getJudge();
      return ScoreJudge.builder()
          .model(judgeModel)
          .maxAttempts(judge.getMaxAttempts())
          .retryPolicy(new ExponentialBackoffRetryPolicy(
              judge.getBackoffBase().toMillis(), judge.getBackoffMax().toMillis()))
          .metrics(metrics.getIfAvailable(() -> MetricsExporter.NOOP))
          .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public IssueClassifier recallIssueClassifier(ScoreJudge scoreJudge) {
      return new IssueClassifier(scoreJudge);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Evaluator recallEvaluator(
        ScoreJudge scoreJudge,
        ScoreCache scoreCache,
        MessageStore messageStore,
        IssueClassifier issueClassifier,
        RecallProperties properties,
        ObjectProvider<MetricsExporter> metrics) {
      RecallProperties.Scoring scoring = properties.getScoring();
      return Evaluator.builder()
          .judge(scoreJudge)
          .cache(scoreCache)
          .messageStore(messageStore)
          .evaluatorVersion(scoring.getEvaluatorVersion())
          .maxConcurrency(scoring.getMaxConcurrency())
          .feedbackAdjustmentEnabled(scoring.isFeedbackAdjustmentEnabled())
          .heuristic(new FeedbackHeuristic())
          .issueClassifier(issueClassifier)
          .metrics(metrics.getIfAvailable(() -> MetricsExporter.NOOP))
          .build();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "recall.scoring", name = "enabled", matchIfMissing = true)
    public ScoringLoop recallScoringLoop(
        Evaluator evaluator,
        MessageStore messageStore,
        RecallProperties properties,
        ObjectProvider<FinalScoreHook> finalScoreHook,
        ObjectProvider<MetricsExporter> metrics) {
      RecallProperties.Scoring scoring = properties.getScoring();
      return ScoringLoop.builder()
          .evaluator(evaluator)
          .messageStore(messageStore)
          .finalScoreHook(finalScoreHook.getIfAvailable(() -> FinalScoreHook.NOOP))
          .batchSize(scoring.getBatchSize())
          .processInterval(scoring.getProcessInterval())
          .warmUp(scoring.getWarmUp())
          .errorCooldown(scoring.getErrorCooldown())
          .metrics(metrics.getIfAvailable(() -> MetricsExporter.NOOP))
          .build();
    }
  }
}
