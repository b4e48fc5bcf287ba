package io.recall.scoring;

import io.recall.StoreException;
import io.recall.model.EvaluationStamp;
import io.recall.model.ScoredMessage;
import io.recall.schedule.PeriodicLoop;
import io.recall.spi.FinalScoreHook;
import io.recall.spi.MessageStore;
import io.recall.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background job that scores assistant messages which have no quality score yet.
 *
 * <p>After a warm-up delay it repeatedly runs {@link #processBatch()} and sleeps the
 * process interval. A failed batch is logged and retried after the error cooldown.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class ScoringLoop implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ScoringLoop.class.getName());

  private final Evaluator evaluator;
  private final MessageStore messageStore;
  private final FinalScoreHook finalScoreHook;
  private final int batchSize;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final PeriodicLoop loop;

  private ScoringLoop(Builder builder) {
    this.evaluator = Objects.requireNonNull(builder.evaluator, "evaluator");
    this.messageStore = Objects.requireNonNull(builder.messageStore, "messageStore");
    this.finalScoreHook = builder.finalScoreHook != null ? builder.finalScoreHook : FinalScoreHook.NOOP;
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1, got: " + builder.batchSize);
    }
    this.batchSize = builder.batchSize;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.loop = PeriodicLoop.builder("recall-scoring")
        .task(this::processBatch)
        .initialDelay(builder.warmUp)
        .interval(builder.processInterval)
        .errorCooldown(builder.errorCooldown)
        .stopTimeout(builder.stopTimeout)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Discovers up to {@code batchSize} unscored messages, scores them and writes the scores.
   * A score that cannot be written is logged and skipped; the message is picked up again
   * by a later batch.
   *
   * @throws StoreException if unscored messages cannot be read
   */
  public BatchSummary processBatch() {
    long startNanos = System.nanoTime();
    List<ScoredMessage> found = messageStore.findUnscored(batchSize);
    if (found.isEmpty()) {
      logger.fine("No unscored messages");
      return BatchSummary.EMPTY;
    }

    List<EvaluationItem> items = new ArrayList<>(found.size());
    for (ScoredMessage message : found) {
      items.add(EvaluationItem.from(message));
    }
    List<EvaluationResult> results = evaluator.evaluateBatch(items);
    EvaluationStamp stamp = new EvaluationStamp(
        evaluator.modelId(), evaluator.evaluatorVersion(), clock.instant());

    int cached = 0;
    int evaluated = 0;
    int persisted = 0;
    for (EvaluationResult result : results) {
      if (result.source() == ScoreSource.CACHE) {
        cached++;
      } else if (result.source() == ScoreSource.JUDGE) {
        evaluated++;
      }
      if (persist(result, stamp)) {
        persisted++;
      }
    }

    long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
    metrics.recordBatchDurationMs(durationMs);
    BatchSummary summary = new BatchSummary(found.size(), cached, evaluated, persisted);
    logger.info("Scored batch: found=" + summary.found() + ", cached=" + summary.cached()
        + ", evaluated=" + summary.evaluated() + ", persisted=" + summary.persisted()
        + " in " + durationMs + "ms");
    return summary;
  }

  private boolean persist(EvaluationResult result, EvaluationStamp stamp) {
    boolean updated;
    try {
      updated = messageStore.writeQualityScore(result.messageId(), result.score(), stamp);
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Failed to write quality score for message " + result.messageId(), e);
      return false;
    }
    if (updated) {
      try {
        finalScoreHook.recompute(result.messageId(), result.ownerId());
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Final score recompute failed for message " + result.messageId(), e);
      }
    }
    return updated;
  }

  public void start() {
    loop.start();
  }

  /**
   * Requests a cooperative stop; a batch in progress completes.
   */
  public void stop() {
    loop.stop();
  }

  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return loop.awaitTermination(timeout);
  }

  public boolean isRunning() {
    return loop.isRunning();
  }

  /**
   * Stops the loop, cancelling it after the stop timeout. The evaluator is not closed.
   */
  @Override
  public void close() {
    loop.close();
  }

  /** Builder for {@link ScoringLoop}. */
  public static final class Builder {
    private Evaluator evaluator;
    private MessageStore messageStore;
    private FinalScoreHook finalScoreHook;
    private int batchSize = 20;
    private Duration processInterval = Duration.ofMinutes(30);
    private Duration warmUp = Duration.ofSeconds(45);
    private Duration errorCooldown = Duration.ofSeconds(60);
    private Duration stopTimeout = Duration.ofSeconds(5);
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder evaluator(Evaluator evaluator) {
      this.evaluator = evaluator;
      return this;
    }

    /** <b>Required.</b> */
    public Builder messageStore(MessageStore messageStore) {
      this.messageStore = messageStore;
      return this;
    }

    /** Called after each persisted score. Default: no-op. */
    public Builder finalScoreHook(FinalScoreHook finalScoreHook) {
      this.finalScoreHook = finalScoreHook;
      return this;
    }

    /** Default: 20. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Default: 30 minutes. */
    public Builder processInterval(Duration processInterval) {
      this.processInterval = processInterval;
      return this;
    }

    /** Delay before the first batch. Default: 45 seconds. */
    public Builder warmUp(Duration warmUp) {
      this.warmUp = warmUp;
      return this;
    }

    /** Default: 60 seconds. */
    public Builder errorCooldown(Duration errorCooldown) {
      this.errorCooldown = errorCooldown;
      return this;
    }

    /** Default: 5 seconds. */
    public Builder stopTimeout(Duration stopTimeout) {
      this.stopTimeout = stopTimeout;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ScoringLoop build() {
      return new ScoringLoop(this);
    }
  }
}
