package io.recall.scoring.judge;

/**
 * Outcome of one judge scoring.
 *
 * @param score  clamped score in [1, 10]
 * @param source how the score was obtained
 */
public record JudgeVerdict(double score, Source source) {

  public enum Source {
    /** Parsed from the rubric reply or the strict reprompt. */
    JUDGED,
    /** Neither reply contained a number; neutral score. */
    UNPARSEABLE,
    /** Calls failed (retries exhausted or non-retryable); neutral score. */
    FAILED
  }

  /**
   * Whether the score reflects the content. Failed calls say nothing about the content
   * and must not be cached.
   */
  public boolean cacheable() {
    return source != Source.FAILED;
  }
}
