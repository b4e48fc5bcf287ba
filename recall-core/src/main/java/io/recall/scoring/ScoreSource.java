package io.recall.scoring;

/**
 * Where an item's base score came from.
 */
public enum ScoreSource {
  /** Score cache hit; the judge was not called. */
  CACHE,
  /** Parsed from a judge reply. */
  JUDGE,
  /** Neutral score: blank content, unparseable or failed judge, or an unexpected error. */
  DEFAULT
}
