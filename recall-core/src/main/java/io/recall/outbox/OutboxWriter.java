package io.recall.outbox;

import io.recall.model.EventType;
import io.recall.model.GraphPayload;
import io.recall.model.OutboxEvent;
import io.recall.spi.OutboxStore;
import io.recall.spi.TxContext;
import io.recall.util.JsonCodec;

import java.sql.Connection;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Producer entry point: appends a graph propagation event inside the caller's active
 * transaction.
 *
 * <p>The event commits or rolls back together with the business mutation. A failed
 * insert propagates as {@link io.recall.StoreException}; the caller must let it abort
 * the transaction.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *   insertConversation(tx, ...);
 *   writer.append(new ConversationUpsert(userId, conversationId, title, null, null));
 *   tx.commit();
 * }
 * }</pre>
 *
 * @see TxContext
 * @see OutboxStore#insert
 */
public final class OutboxWriter {
  private static final Logger logger = Logger.getLogger(OutboxWriter.class.getName());

  private final TxContext txContext;
  private final OutboxStore outboxStore;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public OutboxWriter(TxContext txContext, OutboxStore outboxStore) {
    this(txContext, outboxStore, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public OutboxWriter(TxContext txContext, OutboxStore outboxStore, JsonCodec jsonCodec, Clock clock) {
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Appends a typed payload.
   *
   * @return the new event id
   * @throws IllegalStateException if no transaction is active
   */
  public String append(GraphPayload payload) {
    Objects.requireNonNull(payload, "payload");
    return append(payload.eventType(), payload.entityId(), payload.toFields());
  }

  /**
   * Appends an event with status pending and zero attempts.
   *
   * @param type     event type
   * @param entityId identity of the mutated business row
   * @param payload  flat payload fields
   * @return the new event id
   * @throws IllegalStateException if no transaction is active
   */
  public String append(EventType type, String entityId, Map<String, ?> payload) {
    if (!txContext.isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(entityId, "entityId");
    OutboxEvent event = OutboxEvent.pending(type, entityId, jsonCodec.toJson(payload), clock.instant());
    Connection conn = txContext.currentConnection();
    outboxStore.insert(conn, event);
    logger.fine(() -> "Appended " + type.code() + " event " + event.id() + " for " + entityId);
    return event.id();
  }
}
