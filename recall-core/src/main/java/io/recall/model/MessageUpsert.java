package io.recall.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Message appended to a conversation.
 */
public record MessageUpsert(String conversationId, String messageId, String messageType)
    implements GraphPayload {

  public MessageUpsert {
    Objects.requireNonNull(conversationId, "conversationId");
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(messageType, "messageType");
  }

  @Override
  public EventType eventType() {
    return EventType.MESSAGE_UPSERT;
  }

  @Override
  public String entityId() {
    return messageId;
  }

  @Override
  public Map<String, Object> toFields() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("conversation_id", conversationId);
    fields.put("message_id", messageId);
    fields.put("message_type", messageType);
    return fields;
  }
}
