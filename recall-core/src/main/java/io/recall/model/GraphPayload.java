package io.recall.model;

import java.util.Map;

/**
 * Typed payload of a graph propagation event. Each variant knows its {@link EventType},
 * the entity it belongs to, and how to flatten itself for the outbox codec.
 */
public sealed interface GraphPayload permits ConversationUpsert, MessageUpsert, FeedbackUpsert {

  EventType eventType();

  String entityId();

  /** Flat field map written as the outbox payload. */
  Map<String, Object> toFields();
}
