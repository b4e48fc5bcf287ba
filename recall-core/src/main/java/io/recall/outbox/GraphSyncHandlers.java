package io.recall.outbox;

import io.recall.model.ConversationUpsert;
import io.recall.model.EventType;
import io.recall.model.FeedbackUpsert;
import io.recall.model.MessageUpsert;
import io.recall.model.OutboxEvent;
import io.recall.spi.GraphSink;
import io.recall.util.JsonCodec;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Objects;

/**
 * Handlers that replay outbox events into a {@link GraphSink}, one per {@link EventType}.
 *
 * <p>Payloads are decoded into the same records producers append, so a malformed or
 * incomplete payload fails with {@link PayloadException} and is dead-lettered.
 */
public final class GraphSyncHandlers {
  private final GraphSink sink;
  private final JsonCodec jsonCodec;

  public GraphSyncHandlers(GraphSink sink, JsonCodec jsonCodec) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Registers the conversation, message and feedback handlers.
   */
  public static HandlerRegistry registerAll(HandlerRegistry registry, GraphSink sink, JsonCodec jsonCodec) {
    GraphSyncHandlers handlers = new GraphSyncHandlers(sink, jsonCodec);
    return registry
        .register(EventType.CONVERSATION_UPSERT, handlers::onConversationUpsert)
        .register(EventType.MESSAGE_UPSERT, handlers::onMessageUpsert)
        .register(EventType.FEEDBACK, handlers::onFeedback);
  }

  boolean onConversationUpsert(OutboxEvent event) {
    Map<String, String> fields = decode(event);
    ConversationUpsert upsert = new ConversationUpsert(
        required(fields, "user_id"),
        required(fields, "conversation_id"),
        fields.getOrDefault("title", ""),
        fields.get("topic"),
        fields.get("sub_topic"));
    sink.upsertConversation(upsert, event.createdAt());
    return true;
  }

  boolean onMessageUpsert(OutboxEvent event) {
    Map<String, String> fields = decode(event);
    MessageUpsert upsert = new MessageUpsert(
        required(fields, "conversation_id"),
        required(fields, "message_id"),
        required(fields, "message_type"));
    sink.upsertMessage(upsert, event.createdAt());
    return true;
  }

  boolean onFeedback(OutboxEvent event) {
    Map<String, String> fields = decode(event);
    String rawScore = required(fields, "score");
    double score;
    try {
      score = Double.parseDouble(rawScore);
    } catch (NumberFormatException e) {
      throw new PayloadException("Invalid score '" + rawScore + "' in event " + event.id(), e);
    }
    String rawAt = fields.get("at");
    Instant at;
    try {
      at = rawAt == null ? event.createdAt() : Instant.parse(rawAt);
    } catch (DateTimeParseException e) {
      throw new PayloadException("Invalid timestamp '" + rawAt + "' in event " + event.id(), e);
    }
    FeedbackUpsert upsert = new FeedbackUpsert(
        required(fields, "user_id"),
        required(fields, "message_id"),
        required(fields, "feedback_type"),
        score,
        at);
    sink.upsertFeedback(upsert);
    return true;
  }

  private Map<String, String> decode(OutboxEvent event) {
    try {
      return jsonCodec.parseObject(event.payloadJson());
    } catch (IllegalArgumentException e) {
      throw new PayloadException("Malformed payload in event " + event.id() + ": " + e.getMessage(), e);
    }
  }

  private static String required(Map<String, String> fields, String name) {
    String value = fields.get(name);
    if (value == null || value.isBlank()) {
      throw new PayloadException("Missing required field '" + name + "'");
    }
    return value;
  }
}
