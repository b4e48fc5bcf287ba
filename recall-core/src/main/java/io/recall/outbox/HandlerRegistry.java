package io.recall.outbox;

import io.recall.model.EventType;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe mapping from stored event type code to its handler. One handler per type;
 * registering again replaces the previous handler.
 */
public final class HandlerRegistry {
  private final Map<String, EventHandler> handlers = new ConcurrentHashMap<>();

  public HandlerRegistry register(EventType type, EventHandler handler) {
    return register(type.code(), handler);
  }

  public HandlerRegistry register(String typeCode, EventHandler handler) {
    Objects.requireNonNull(typeCode, "typeCode");
    Objects.requireNonNull(handler, "handler");
    handlers.put(typeCode, handler);
    return this;
  }

  /**
   * @return the handler, or {@code null} if none is registered for the code
   */
  public EventHandler handlerFor(String typeCode) {
    return typeCode == null ? null : handlers.get(typeCode);
  }
}
