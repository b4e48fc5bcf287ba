package io.recall.scoring.feedback;

/**
 * Cues detected in a user's follow-up message.
 */
public enum FeedbackSignal {
  POSITIVE_ACK,
  NEGATIVE_FEEDBACK,
  CAPS_FRUSTRATION,
  FOLLOWUP_QUESTION,
  SHORT_ACK
}
