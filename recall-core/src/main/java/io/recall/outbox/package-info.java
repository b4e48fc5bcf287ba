/**
 * Transactional outbox for graph propagation.
 *
 * <p>Producers append events with {@link io.recall.outbox.OutboxWriter} inside their
 * business transaction. {@link io.recall.outbox.OutboxDispatcher} later replays them
 * through the {@link io.recall.outbox.HandlerRegistry}, retrying with backoff and
 * dead-lettering events that cannot succeed.
 */
package io.recall.outbox;
