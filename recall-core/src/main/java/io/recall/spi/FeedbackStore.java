package io.recall.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Writes explicit human feedback inside the caller's transaction so the feedback row and
 * its outbox event commit together.
 */
public interface FeedbackStore {

  /**
   * Sets {@code human_feedback_score}, {@code human_feedback_type},
   * {@code human_feedback_at} and marks the message as having recorded feedback.
   *
   * @return the number of message rows updated (0 if the message does not belong to the owner)
   */
  int recordHumanFeedback(Connection conn, String messageId, String ownerId,
      String feedbackType, double score, Instant at);
}
