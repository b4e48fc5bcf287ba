package io.recall.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conversation created or renamed, with its optional topic classification.
 * {@code topic} and {@code subTopic} may be {@code null}.
 */
public record ConversationUpsert(
    String userId,
    String conversationId,
    String title,
    String topic,
    String subTopic
) implements GraphPayload {

  public ConversationUpsert {
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(conversationId, "conversationId");
    title = title == null ? "" : title;
  }

  @Override
  public EventType eventType() {
    return EventType.CONVERSATION_UPSERT;
  }

  @Override
  public String entityId() {
    return conversationId;
  }

  @Override
  public Map<String, Object> toFields() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("user_id", userId);
    fields.put("conversation_id", conversationId);
    fields.put("title", title);
    if (topic != null) {
      fields.put("topic", topic);
    }
    if (subTopic != null) {
      fields.put("sub_topic", subTopic);
    }
    return fields;
  }
}
