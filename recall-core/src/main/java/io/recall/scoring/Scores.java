package io.recall.scoring;

/**
 * Score range shared by every stage of the scoring pipeline.
 */
public final class Scores {
  public static final double MIN = 1.0;
  public static final double MAX = 10.0;
  /** Used for blank content, unparseable judge replies and failed items. */
  public static final double NEUTRAL = 5.0;

  private Scores() {}

  public static double clamp(double score) {
    if (Double.isNaN(score)) {
      return NEUTRAL;
    }
    return Math.max(MIN, Math.min(MAX, score));
  }
}
