package io.recall.scoring;

/**
 * Final score of one {@link EvaluationItem}, after any feedback adjustment.
 *
 * @param score  clamped to [1, 10]
 * @param source where the base score came from
 */
public record EvaluationResult(String messageId, String ownerId, double score, ScoreSource source) {

  static EvaluationResult neutral(EvaluationItem item) {
    return new EvaluationResult(item.messageId(), item.ownerId(), Scores.NEUTRAL, ScoreSource.DEFAULT);
  }

  /** Whether the base score was served from the score cache. */
  public boolean cached() {
    return source == ScoreSource.CACHE;
  }
}
