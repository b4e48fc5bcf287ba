package io.recall.spi;

import io.recall.model.ConversationUpsert;
import io.recall.model.FeedbackUpsert;
import io.recall.model.MessageUpsert;

import java.time.Instant;

/**
 * Secondary graph store. Every operation is an idempotent merge by natural key and runs
 * in its own store-side transaction: applying the same payload twice leaves the graph
 * unchanged.
 *
 * @see io.recall.neo4j.Neo4jGraphSink
 */
public interface GraphSink {

  /**
   * Merges owner and conversation, sets mutable fields and replaces the topic edges.
   *
   * @param at event time, stored as the conversation's {@code updated_at}
   */
  void upsertConversation(ConversationUpsert conversation, Instant at);

  /**
   * Merges conversation, message and the containment edge.
   *
   * @param at event time, stored as the message's {@code created_at} on first merge
   */
  void upsertMessage(MessageUpsert message, Instant at);

  /**
   * Merges owner, message and the feedback edge; edge properties are last-write-wins.
   */
  void upsertFeedback(FeedbackUpsert feedback);
}
