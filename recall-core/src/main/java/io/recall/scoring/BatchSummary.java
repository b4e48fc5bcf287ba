package io.recall.scoring;

/**
 * Counts for one {@link ScoringLoop#processBatch()} run.
 *
 * @param found     unscored messages discovered
 * @param cached    items served from the score cache
 * @param evaluated items scored by the judge
 * @param persisted scores written to a message row
 */
public record BatchSummary(int found, int cached, int evaluated, int persisted) {
  public static final BatchSummary EMPTY = new BatchSummary(0, 0, 0, 0);
}
