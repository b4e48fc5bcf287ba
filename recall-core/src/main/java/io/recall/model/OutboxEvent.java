package io.recall.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A persisted graph outbox row.
 *
 * <p>{@code eventType} is kept as the raw stored code rather than {@link EventType} so rows
 * with unrecognized types can still be read, reported and dead-lettered.
 *
 * @param id            event identity (UUID)
 * @param eventType     stored type code, see {@link EventType#code()}
 * @param entityId      identity of the business row the event propagates
 * @param payloadJson   opaque JSON payload
 * @param status        lifecycle status
 * @param attempts      failed delivery attempts so far
 * @param lastError     message of the most recent failure, or {@code null}
 * @param nextAttemptAt earliest time the event may be polled again
 * @param createdAt     creation time; also the poll order
 * @param updatedAt     last status change
 */
public record OutboxEvent(
    String id,
    String eventType,
    String entityId,
    String payloadJson,
    EventStatus status,
    int attempts,
    String lastError,
    Instant nextAttemptAt,
    Instant createdAt,
    Instant updatedAt
) {

  /**
   * Creates a new pending event with zero attempts, due immediately.
   */
  public static OutboxEvent pending(EventType type, String entityId, String payloadJson, Instant now) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(payloadJson, "payloadJson");
    Objects.requireNonNull(now, "now");
    return new OutboxEvent(UUID.randomUUID().toString(), type.code(), entityId, payloadJson,
        EventStatus.PENDING, 0, null, now, now, now);
  }
}
