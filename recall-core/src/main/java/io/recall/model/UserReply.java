package io.recall.model;

import java.time.Instant;

/**
 * A user message used as the feedback signal for a preceding assistant message.
 */
public record UserReply(String messageId, long ordinal, String content, Instant createdAt) {}
