package io.recall.scoring;

import io.recall.model.ScoredMessage;

import java.util.Objects;

/**
 * One assistant message to score.
 */
public record EvaluationItem(String messageId, String ownerId, String conversationId, long ordinal, String text) {

  public EvaluationItem {
    Objects.requireNonNull(messageId, "messageId");
  }

  public static EvaluationItem from(ScoredMessage message) {
    return new EvaluationItem(message.id(), message.ownerId(), message.conversationId(),
        message.ordinal(), message.content());
  }
}
