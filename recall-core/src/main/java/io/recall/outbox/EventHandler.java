package io.recall.outbox;

import io.recall.model.OutboxEvent;

/**
 * Applies one outbox event to the secondary store. Must be idempotent: the dispatcher
 * delivers at least once.
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * @return {@code true} on success; {@code false} is treated like a retryable failure
   * @throws Exception on failure; classified with {@link io.recall.ErrorKind#classify}
   */
  boolean handle(OutboxEvent event) throws Exception;
}
