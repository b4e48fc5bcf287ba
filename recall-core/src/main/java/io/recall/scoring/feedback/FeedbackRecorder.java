package io.recall.scoring.feedback;

import io.recall.model.FeedbackUpsert;
import io.recall.outbox.OutboxWriter;
import io.recall.spi.FeedbackStore;
import io.recall.spi.FinalScoreHook;
import io.recall.spi.TxContext;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records explicit human feedback on an assistant message.
 *
 * <p>The feedback columns and the {@code feedback} outbox event are written in the
 * caller's transaction. The final score is recomputed only after that transaction
 * commits.
 */
public final class FeedbackRecorder {
  private static final Logger logger = Logger.getLogger(FeedbackRecorder.class.getName());

  private final TxContext txContext;
  private final FeedbackStore feedbackStore;
  private final OutboxWriter outboxWriter;
  private final FinalScoreHook finalScoreHook;
  private final FeedbackScores scores;
  private final Clock clock;

  public FeedbackRecorder(TxContext txContext, FeedbackStore feedbackStore, OutboxWriter outboxWriter,
      FinalScoreHook finalScoreHook, FeedbackScores scores, Clock clock) {
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.feedbackStore = Objects.requireNonNull(feedbackStore, "feedbackStore");
    this.outboxWriter = Objects.requireNonNull(outboxWriter, "outboxWriter");
    this.finalScoreHook = Objects.requireNonNull(finalScoreHook, "finalScoreHook");
    this.scores = Objects.requireNonNull(scores, "scores");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Convenience overload taking the raw feedback type code.
   *
   * @throws IllegalArgumentException if the code is not a known feedback type
   */
  public boolean record(String messageId, String ownerId, String feedbackType) {
    return record(messageId, ownerId, FeedbackType.fromCode(feedbackType));
  }

  /**
   * @return {@code false} if no message of the owner matched
   * @throws IllegalStateException if no transaction is active
   */
  public boolean record(String messageId, String ownerId, FeedbackType type) {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(type, "type");
    if (!txContext.isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    double score = scores.scoreFor(type);
    Instant at = clock.instant();
    int updated = feedbackStore.recordHumanFeedback(
        txContext.currentConnection(), messageId, ownerId, type.code(), score, at);
    if (updated == 0) {
      logger.fine(() -> "No message " + messageId + " for owner " + ownerId + "; feedback ignored");
      return false;
    }
    outboxWriter.append(new FeedbackUpsert(ownerId, messageId, type.code(), score, at));
    txContext.afterCommit(() -> recompute(messageId, ownerId));
    return true;
  }

  private void recompute(String messageId, String ownerId) {
    try {
      finalScoreHook.recompute(messageId, ownerId);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Final score recompute failed for message " + messageId, e);
    }
  }
}
