package io.recall.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit human feedback on a message.
 */
public record FeedbackUpsert(
    String userId,
    String messageId,
    String feedbackType,
    double score,
    Instant at
) implements GraphPayload {

  public FeedbackUpsert {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(feedbackType, "feedbackType");
    Objects.requireNonNull(at, "at");
  }

  @Override
  public EventType eventType() {
    return EventType.FEEDBACK;
  }

  @Override
  public String entityId() {
    return messageId;
  }

  @Override
  public Map<String, Object> toFields() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("user_id", userId);
    fields.put("message_id", messageId);
    fields.put("feedback_type", feedbackType);
    fields.put("score", score);
    fields.put("at", at.toString());
    return fields;
  }
}
