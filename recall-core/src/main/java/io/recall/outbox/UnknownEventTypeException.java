package io.recall.outbox;

import io.recall.ErrorKind;
import io.recall.RecallException;

/**
 * No handler is registered for an event's type. Replaying can never succeed, so the
 * event is dead-lettered without consuming its retry budget.
 */
public final class UnknownEventTypeException extends RecallException {
  public UnknownEventTypeException(String eventType) {
    super(ErrorKind.PERMANENT, "No handler for event type: " + eventType);
  }
}
