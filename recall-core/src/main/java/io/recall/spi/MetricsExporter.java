package io.recall.spi;

/**
 * Observability hook for both pipelines. {@link #NOOP} discards everything; the
 * {@code recall-micrometer} module bridges to Micrometer.
 */
public interface MetricsExporter {

  MetricsExporter NOOP = new Noop();

  // scoring

  void incrementCacheHit();

  void incrementCacheMiss();

  /** A judge call failed transiently and will be retried. */
  void incrementJudgeRetry();

  /** An item fell back to the neutral default score. */
  void incrementScoreDefaulted();

  /** A non-zero feedback adjustment was applied. */
  default void incrementFeedbackAdjusted() {
  }

  /**
   * A negative reply was classified.
   *
   * @param tag the issue tag code, e.g. {@code "off-topic"}
   */
  default void incrementIssueTagged(String tag) {
  }

  default void recordBatchDurationMs(long durationMs) {
  }

  // outbox

  void incrementDispatchDone();

  void incrementDispatchRetry();

  void incrementDispatchDeadLetter();

  /**
   * @param lagMs age of the oldest pending event in milliseconds, 0 when none is pending
   */
  void recordOldestPendingLagMs(long lagMs);

  /**
   * No-op implementation.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementCacheHit() {
    }

    @Override
    public void incrementCacheMiss() {
    }

    @Override
    public void incrementJudgeRetry() {
    }

    @Override
    public void incrementScoreDefaulted() {
    }

    @Override
    public void incrementDispatchDone() {
    }

    @Override
    public void incrementDispatchRetry() {
    }

    @Override
    public void incrementDispatchDeadLetter() {
    }

    @Override
    public void recordOldestPendingLagMs(long lagMs) {
    }
  }
}
