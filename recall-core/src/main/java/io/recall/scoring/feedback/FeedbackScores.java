package io.recall.scoring.feedback;

import io.recall.scoring.Scores;

import java.util.EnumMap;
import java.util.Map;

/**
 * Human feedback score per {@link FeedbackType}: the type's default unless overridden by
 * configuration.
 */
public final class FeedbackScores {
  private final Map<FeedbackType, Double> scores = new EnumMap<>(FeedbackType.class);

  private FeedbackScores(Map<FeedbackType, Double> overrides) {
    for (FeedbackType type : FeedbackType.values()) {
      scores.put(type, type.defaultScore());
    }
    overrides.forEach((type, score) -> {
      if (score == null || score < Scores.MIN || score > Scores.MAX) {
        throw new IllegalArgumentException(
            "Feedback score for " + type.code() + " must be within [1, 10], got: " + score);
      }
      scores.put(type, score);
    });
  }

  public static FeedbackScores defaults() {
    return new FeedbackScores(Map.of());
  }

  public static FeedbackScores withOverrides(Map<FeedbackType, Double> overrides) {
    return new FeedbackScores(overrides == null ? Map.of() : overrides);
  }

  public double scoreFor(FeedbackType type) {
    return scores.get(type);
  }
}
