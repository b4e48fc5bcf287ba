package io.recall.scoring.judge;

import io.recall.ErrorKind;
import io.recall.retry.ExponentialBackoffRetryPolicy;
import io.recall.retry.RetryPolicy;
import io.recall.schedule.Sleeper;
import io.recall.scoring.Scores;
import io.recall.spi.JudgeModel;
import io.recall.spi.MetricsExporter;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Asks a {@link JudgeModel} for a 1-10 quality rating of a response.
 *
 * <p>The rubric prompt is sent first. If the reply holds no number, one strict reprompt
 * follows; if that also fails the verdict is the neutral score. Each model call is
 * retried on {@linkplain ErrorKind#retryable() retryable} failures up to
 * {@code maxAttempts} times with backoff from the {@link RetryPolicy}. Other failures are
 * not retried. This class never throws for model failures: it degrades to the neutral
 * score and reports how the verdict was obtained.
 *
 * <p>Thread-safe; one instance is shared by all concurrent evaluations.
 */
public final class ScoreJudge {
  private static final Logger logger = Logger.getLogger(ScoreJudge.class.getName());

  static final String RUBRIC_SYSTEM_PROMPT =
      "You are an AI response quality evaluator. Rate the quality of AI responses strictly "
          + "from 1 to 10. Consider accuracy, helpfulness, clarity, and completeness. "
          + "Respond with only a single number (integer or one decimal).";
  static final String STRICT_SYSTEM_PROMPT = "Output only a number 1-10. No extra text.";

  private final JudgeModel model;
  private final int maxAttempts;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;
  private final MetricsExporter metrics;

  private ScoreJudge(Builder builder) {
    this.model = Objects.requireNonNull(builder.model, "model");
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    this.maxAttempts = builder.maxAttempts;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(800, 8_000);
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  static String rubricPrompt(String content) {
    return "Rate this AI response:\n\n" + content + "\n\nScore:";
  }

  public String modelId() {
    return model.modelId();
  }

  /**
   * Scores the content. Never throws for model failures.
   */
  public JudgeVerdict score(String content) {
    try {
      OptionalDouble parsed = ScoreParser.parse(call(RUBRIC_SYSTEM_PROMPT, rubricPrompt(content)));
      if (parsed.isEmpty()) {
        logger.fine("Judge reply was not numeric; sending strict reprompt");
        parsed = ScoreParser.parse(call(STRICT_SYSTEM_PROMPT, content));
      }
      if (parsed.isPresent()) {
        return new JudgeVerdict(Scores.clamp(parsed.getAsDouble()), JudgeVerdict.Source.JUDGED);
      }
      logger.warning("Judge reply not numeric after strict reprompt; using neutral score");
      return new JudgeVerdict(Scores.NEUTRAL, JudgeVerdict.Source.UNPARSEABLE);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Judge call failed (" + ErrorKind.classify(e)
          + "); using neutral score", e);
      return new JudgeVerdict(Scores.NEUTRAL, JudgeVerdict.Source.FAILED);
    }
  }

  /**
   * One model exchange with retries on retryable failures.
   *
   * @throws RuntimeException the last failure once attempts are exhausted, or the first
   *     non-retryable one
   */
  String call(String systemPrompt, String userPrompt) {
    for (int attempt = 1; ; attempt++) {
      try {
        return model.complete(systemPrompt, userPrompt);
      } catch (RuntimeException e) {
        ErrorKind kind = ErrorKind.classify(e);
        if (!kind.retryable() || attempt >= maxAttempts) {
          throw e;
        }
        long delayMs = retryPolicy.computeDelayMs(attempt);
        metrics.incrementJudgeRetry();
        logger.warning("Judge call attempt " + attempt + "/" + maxAttempts + " failed ("
            + e.getMessage() + "); retrying in " + delayMs + "ms");
        pause(delayMs);
      }
    }
  }

  private void pause(long delayMs) {
    try {
      sleeper.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new JudgeException(ErrorKind.PERMANENT, "Interrupted during judge backoff", e);
    }
  }

  /**
   * Builder for {@link ScoreJudge}.
   */
  public static final class Builder {
    private JudgeModel model;
    private int maxAttempts = 3;
    private RetryPolicy retryPolicy;
    private Sleeper sleeper;
    private MetricsExporter metrics;

    private Builder() {
    }

    /** <b>Required.</b> */
    public Builder model(JudgeModel model) {
      this.model = model;
      return this;
    }

    /** Attempts per model call, including the first. Default: 3. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Default: 800ms doubling, capped at 8s. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public ScoreJudge build() {
      return new ScoreJudge(this);
    }
  }
}
