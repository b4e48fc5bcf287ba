package io.recall.model;

import java.time.Instant;

/**
 * A chat message row as read by the scoring pipeline. Score fields are {@code null}
 * until written.
 *
 * @param id                 message identity
 * @param ownerId            owning user
 * @param conversationId     conversation the message belongs to
 * @param ordinal            position within the conversation (monotonic per conversation)
 * @param role               {@code "assistant"} or {@code "user"}
 * @param content            message text (may be blank)
 * @param qualityScore       model-judged score R, or {@code null}
 * @param humanFeedbackScore explicit human feedback score H, or {@code null}
 * @param createdAt          creation time
 */
public record ScoredMessage(
    String id,
    String ownerId,
    String conversationId,
    long ordinal,
    String role,
    String content,
    Double qualityScore,
    Double humanFeedbackScore,
    Instant createdAt
) {
  public static final String ROLE_ASSISTANT = "assistant";
  public static final String ROLE_USER = "user";
}
