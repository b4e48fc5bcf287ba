package io.recall.spi;

import io.recall.model.EvaluationStamp;
import io.recall.model.ScoredMessage;
import io.recall.model.UserReply;

import java.util.List;
import java.util.Optional;

/**
 * Access to chat messages needed by the scoring pipeline. Each call is a single,
 * self-contained statement; implementations manage their own connections.
 *
 * <p>Failures surface as {@link io.recall.StoreException}.
 *
 * @see io.recall.jdbc.store.JdbcMessageStore
 */
public interface MessageStore {

  /**
   * Assistant messages with no quality score and non-null content, oldest first.
   */
  List<ScoredMessage> findUnscored(int limit);

  /**
   * Whether an explicit human feedback score has been recorded for the message.
   */
  boolean hasHumanFeedback(String messageId);

  /**
   * The first user message after {@code afterOrdinal} in the conversation, or, when none
   * follows, the most recent user message of the conversation.
   */
  Optional<UserReply> findUserReply(String conversationId, String ownerId, long afterOrdinal);

  /**
   * Writes the quality score and its evaluation metadata.
   *
   * @return {@code true} if a message row was updated
   */
  boolean writeQualityScore(String messageId, double score, EvaluationStamp stamp);
}
