package io.recall.model;

import java.util.Optional;

/**
 * Kinds of graph propagation events. The stored {@code event_type} column holds
 * {@link #code()}.
 */
public enum EventType {
  CONVERSATION_UPSERT("conversation_upsert"),
  MESSAGE_UPSERT("message_upsert"),
  FEEDBACK("feedback");

  private final String code;

  EventType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Resolves a stored code. Rows written by newer producers may carry codes this
   * version does not know, so an unknown code is not an error here.
   */
  public static Optional<EventType> fromCode(String code) {
    for (EventType type : values()) {
      if (type.code.equals(code)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
