package io.recall.scoring;

import io.recall.StoreException;
import io.recall.model.UserReply;
import io.recall.scoring.feedback.FeedbackAnalysis;
import io.recall.scoring.feedback.FeedbackHeuristic;
import io.recall.scoring.judge.IssueClassifier;
import io.recall.scoring.judge.IssueTag;
import io.recall.scoring.judge.JudgeVerdict;
import io.recall.scoring.judge.ScoreJudge;
import io.recall.spi.MessageStore;
import io.recall.spi.MetricsExporter;
import io.recall.spi.ScoreCache;
import io.recall.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cache-aware quality scoring of assistant messages.
 *
 * <p>For each item: blank text scores neutral; otherwise the content fingerprint is looked
 * up in the {@link ScoreCache} under the evaluator version, and on a miss the
 * {@link ScoreJudge} is asked and its verdict cached (unless the judge call failed). When
 * feedback adjustment is enabled, the user's reply to the message then nudges the score
 * (see {@link FeedbackHeuristic}); a negative reply additionally triggers a best-effort
 * {@link IssueClassifier} call off the scoring path.
 *
 * <p>{@link #evaluateBatch(List)} fans items out on the executor with at most
 * {@code maxConcurrency} evaluations in flight. An item that fails unexpectedly scores
 * neutral; the batch never fails as a whole.
 *
 * <p>Create instances via {@link #builder()}. Closing the evaluator shuts down the executor
 * only if the evaluator created it.
 */
public final class Evaluator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Evaluator.class.getName());

  private final ScoreJudge judge;
  private final ScoreCache cache;
  private final MessageStore messageStore;
  private final String evaluatorVersion;
  private final int maxConcurrency;
  private final boolean feedbackAdjustmentEnabled;
  private final FeedbackHeuristic heuristic;
  private final IssueClassifier issueClassifier;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final Semaphore permits;
  private final MetricsExporter metrics;

  private Evaluator(Builder builder) {
    this.judge = Objects.requireNonNull(builder.judge, "judge");
    this.cache = Objects.requireNonNull(builder.cache, "cache");
    this.evaluatorVersion = Objects.requireNonNull(builder.evaluatorVersion, "evaluatorVersion");
    if (evaluatorVersion.isBlank()) {
      throw new IllegalArgumentException("evaluatorVersion must not be blank");
    }
    if (builder.maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1, got: " + builder.maxConcurrency);
    }
    this.feedbackAdjustmentEnabled = builder.feedbackAdjustmentEnabled;
    if (feedbackAdjustmentEnabled && builder.messageStore == null) {
      throw new IllegalArgumentException("messageStore is required when feedback adjustment is enabled");
    }
    this.messageStore = builder.messageStore;
    this.maxConcurrency = builder.maxConcurrency;
    this.heuristic = builder.heuristic != null ? builder.heuristic : new FeedbackHeuristic();
    this.issueClassifier = builder.issueClassifier;
    this.ownsExecutor = builder.executor == null;
    this.executor = builder.executor != null
        ? builder.executor
        : Executors.newCachedThreadPool(new DaemonThreadFactory("recall-evaluator-"));
    this.permits = new Semaphore(maxConcurrency);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String modelId() {
    return judge.modelId();
  }

  public String evaluatorVersion() {
    return evaluatorVersion;
  }

  public int maxConcurrency() {
    return maxConcurrency;
  }

  /**
   * Scores all items concurrently.
   *
   * @return one result per item, in input order
   */
  public List<EvaluationResult> evaluateBatch(List<EvaluationItem> items) {
    List<CompletableFuture<EvaluationResult>> futures = new ArrayList<>(items.size());
    for (EvaluationItem item : items) {
      CompletableFuture<EvaluationResult> future;
      try {
        future = CompletableFuture.supplyAsync(() -> evaluateBounded(item), executor);
      } catch (RejectedExecutionException e) {
        logger.log(Level.WARNING, "Evaluator executor rejected message " + item.messageId(), e);
        metrics.incrementScoreDefaulted();
        future = CompletableFuture.completedFuture(EvaluationResult.neutral(item));
      }
      futures.add(future);
    }
    List<EvaluationResult> results = new ArrayList<>(futures.size());
    for (CompletableFuture<EvaluationResult> future : futures) {
      results.add(future.join());
    }
    return results;
  }

  private EvaluationResult evaluateBounded(EvaluationItem item) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      metrics.incrementScoreDefaulted();
      return EvaluationResult.neutral(item);
    }
    try {
      return evaluate(item);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Evaluation of message " + item.messageId()
          + " failed; using neutral score", e);
      metrics.incrementScoreDefaulted();
      return EvaluationResult.neutral(item);
    } finally {
      permits.release();
    }
  }

  /**
   * Scores one item on the calling thread.
   */
  public EvaluationResult evaluate(EvaluationItem item) {
    String text = item.text();
    if (text == null || text.isBlank()) {
      metrics.incrementScoreDefaulted();
      return EvaluationResult.neutral(item);
    }

    String fingerprint = ContentHasher.fingerprint(text);
    OptionalDouble cached = lookup(fingerprint);
    double base;
    ScoreSource source;
    if (cached.isPresent()) {
      metrics.incrementCacheHit();
      base = Scores.clamp(cached.getAsDouble());
      source = ScoreSource.CACHE;
    } else {
      metrics.incrementCacheMiss();
      JudgeVerdict verdict = judge.score(text);
      base = verdict.score();
      source = verdict.source() == JudgeVerdict.Source.JUDGED ? ScoreSource.JUDGE : ScoreSource.DEFAULT;
      if (source == ScoreSource.DEFAULT) {
        metrics.incrementScoreDefaulted();
      }
      if (verdict.cacheable()) {
        store(fingerprint, base);
      }
    }

    double score = feedbackAdjustmentEnabled ? applyFeedbackAdjustment(item, base) : base;
    return new EvaluationResult(item.messageId(), item.ownerId(), score, source);
  }

  /**
   * Adjusts {@code base} by the user's reply to the message. Returns {@code base}
   * unchanged when the message carries explicit human feedback, no user reply exists, or
   * the message store fails.
   */
  public double applyFeedbackAdjustment(EvaluationItem item, double base) {
    if (messageStore == null) {
      return base;
    }
    Optional<UserReply> reply;
    try {
      if (messageStore.hasHumanFeedback(item.messageId())) {
        return base;
      }
      reply = messageStore.findUserReply(item.conversationId(), item.ownerId(), item.ordinal());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Feedback lookup failed for message " + item.messageId()
          + "; keeping base score", e);
      return base;
    }
    if (reply.isEmpty()) {
      return base;
    }

    FeedbackAnalysis analysis = heuristic.analyze(reply.get().content());
    if (analysis.delta() != 0.0) {
      metrics.incrementFeedbackAdjusted();
      logger.fine(() -> "Feedback adjustment " + analysis.delta() + " for message " + item.messageId()
          + " (signals " + analysis.signals() + ")");
    }
    if (analysis.negative()) {
      classifyIssue(item, reply.get());
    }
    return Scores.clamp(base + analysis.delta());
  }

  private void classifyIssue(EvaluationItem item, UserReply reply) {
    if (issueClassifier == null) {
      return;
    }
    try {
      CompletableFuture
          .supplyAsync(() -> issueClassifier.classify(item.text(), reply.content()), executor)
          .whenComplete((tag, failure) -> {
            if (failure != null) {
              logger.log(Level.WARNING, "Issue classification failed for message " + item.messageId(), failure);
            } else {
              onIssueTagged(item, tag);
            }
          });
    } catch (RejectedExecutionException e) {
      logger.log(Level.WARNING, "Issue classification skipped for message " + item.messageId(), e);
    }
  }

  private void onIssueTagged(EvaluationItem item, IssueTag tag) {
    logger.info("Negative reply to message " + item.messageId() + " tagged " + tag.code());
    metrics.incrementIssueTagged(tag.code());
  }

  private OptionalDouble lookup(String fingerprint) {
    try {
      return cache.lookup(fingerprint, evaluatorVersion);
    } catch (StoreException e) {
      logger.log(Level.WARNING, "Score cache lookup failed; treating as miss", e);
      return OptionalDouble.empty();
    }
  }

  private void store(String fingerprint, double score) {
    try {
      cache.put(fingerprint, evaluatorVersion, score);
    } catch (StoreException e) {
      logger.log(Level.WARNING, "Score cache write failed", e);
    }
  }

  /**
   * Shuts down the executor if this evaluator created it.
   */
  @Override
  public void close() {
    if (!ownsExecutor) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link Evaluator}. */
  public static final class Builder {
    private ScoreJudge judge;
    private ScoreCache cache;
    private MessageStore messageStore;
    private String evaluatorVersion = "v1";
    private int maxConcurrency = 5;
    private boolean feedbackAdjustmentEnabled;
    private FeedbackHeuristic heuristic;
    private IssueClassifier issueClassifier;
    private ExecutorService executor;
    private MetricsExporter metrics;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder judge(ScoreJudge judge) {
      this.judge = judge;
      return this;
    }

    /** <b>Required.</b> */
    public Builder cache(ScoreCache cache) {
      this.cache = cache;
      return this;
    }

    /** Required when feedback adjustment is enabled. */
    public Builder messageStore(MessageStore messageStore) {
      this.messageStore = messageStore;
      return this;
    }

    /**
     * Cache namespace. Bump it when the rubric or model changes so stale scores are not
     * reused. Default: {@code v1}.
     */
    public Builder evaluatorVersion(String evaluatorVersion) {
      this.evaluatorVersion = evaluatorVersion;
      return this;
    }

    /** Evaluations in flight per batch. Default: 5. */
    public Builder maxConcurrency(int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }

    /** Default: disabled. */
    public Builder feedbackAdjustmentEnabled(boolean feedbackAdjustmentEnabled) {
      this.feedbackAdjustmentEnabled = feedbackAdjustmentEnabled;
      return this;
    }

    public Builder heuristic(FeedbackHeuristic heuristic) {
      this.heuristic = heuristic;
      return this;
    }

    /** Optional. Without one, negative replies are not classified. */
    public Builder issueClassifier(IssueClassifier issueClassifier) {
      this.issueClassifier = issueClassifier;
      return this;
    }

    /**
     * Optional. Defaults to a cached pool of daemon threads owned by the evaluator.
     */
    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Evaluator build() {
      return new Evaluator(this);
    }
  }
}
