package io.recall.scoring.feedback;

import java.util.Set;

/**
 * Result of {@link FeedbackHeuristic#analyze(String)}.
 *
 * @param sentiment -1, 0 or +1
 * @param capsRatio share of alphabetic words written in capitals
 * @param signals   cues that fired
 * @param delta     score adjustment, already clamped to [-2.0, +1.5]
 */
public record FeedbackAnalysis(int sentiment, double capsRatio, Set<FeedbackSignal> signals, double delta) {

  static final FeedbackAnalysis NEUTRAL = new FeedbackAnalysis(0, 0.0, Set.of(), 0.0);

  public FeedbackAnalysis {
    signals = Set.copyOf(signals);
  }

  public boolean negative() {
    return sentiment < 0;
  }
}
