package io.recall.spi;

import java.util.OptionalDouble;

/**
 * Scores keyed by (content fingerprint, evaluator version). An entry written under one
 * version is never visible to a lookup under another.
 *
 * <p>Implementations may throw {@link io.recall.StoreException}; the evaluator treats a
 * failed lookup as a miss and a failed write as a no-op.
 */
public interface ScoreCache {

  OptionalDouble lookup(String fingerprint, String evaluatorVersion);

  /**
   * Inserts or overwrites the entry and refreshes its timestamp.
   */
  void put(String fingerprint, String evaluatorVersion, double score);
}
