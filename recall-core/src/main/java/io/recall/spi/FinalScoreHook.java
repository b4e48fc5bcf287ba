package io.recall.spi;

/**
 * Callback into the memory subsystem that combines quality and human feedback scores.
 * Called after every successful write of either score.
 */
@FunctionalInterface
public interface FinalScoreHook {

  FinalScoreHook NOOP = (messageId, ownerId) -> { };

  void recompute(String messageId, String ownerId);
}
