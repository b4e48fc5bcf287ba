package io.recall.spi;

import io.recall.model.OutboxEvent;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for the graph outbox.
 *
 * <p>Every method receives an explicit {@link Connection} so the caller decides the
 * transaction: producers pass the connection of their business transaction, the
 * dispatcher passes auto-commit connections. Each status transition is a single
 * statement guarded by the expected current status, so concurrent dispatchers never
 * move an event backwards and a {@code deadletter} row is never touched again.
 *
 * <p>Failures surface as {@link io.recall.StoreException}.
 *
 * @see io.recall.jdbc.store.JdbcOutboxStore
 */
public interface OutboxStore {

  /**
   * Inserts a new event. Throws if the row cannot be written, so the caller's
   * transaction rolls back together with the business mutation.
   */
  void insert(Connection conn, OutboxEvent event);

  /**
   * Pending events whose next attempt is due, oldest first.
   */
  List<OutboxEvent> pollPending(Connection conn, Instant now, int limit);

  /**
   * {@code pending -> processing}.
   *
   * @return 1 if this caller claimed the event, 0 if it was no longer pending
   */
  int markProcessing(Connection conn, String eventId, Instant now);

  /** {@code processing -> done}. */
  int markDone(Connection conn, String eventId, Instant now);

  /**
   * {@code processing -> pending}, incrementing {@code attempts} and recording the error.
   *
   * @param nextAttemptAt earliest time the event may be polled again
   */
  int markRetry(Connection conn, String eventId, Instant nextAttemptAt, String error, Instant now);

  /**
   * {@code processing -> deadletter}, incrementing {@code attempts} and recording the error.
   */
  int markDeadLetter(Connection conn, String eventId, String error, Instant now);

  /**
   * {@code processing -> deadletter} for events stuck since before {@code staleBefore} whose
   * timed-out claim is their last allowed attempt ({@code attempts + 1 >= maxAttempts}).
   * Counts the attempt and records {@code error}.
   *
   * @return number of events dead-lettered
   */
  int deadLetterStale(Connection conn, Instant staleBefore, int maxAttempts, String error, Instant now);

  /**
   * {@code processing -> pending} for events stuck since before {@code staleBefore}, due
   * immediately. The timed-out claim counts as an attempt and {@code error} is recorded.
   *
   * @return number of events released
   */
  int releaseStale(Connection conn, Instant staleBefore, String error, Instant now);

  Optional<OutboxEvent> findById(Connection conn, String eventId);

  /**
   * Dead-lettered events, oldest first.
   *
   * @param eventType optional type code filter ({@code null} for all)
   */
  List<OutboxEvent> queryDeadLetters(Connection conn, String eventType, int limit);

  /**
   * @param eventType optional type code filter ({@code null} for all)
   */
  int countDeadLetters(Connection conn, String eventType);

  /**
   * Creation time of the oldest pending event, used for the lag gauge.
   */
  default Optional<Instant> oldestPendingCreatedAt(Connection conn) {
    return Optional.empty();
  }
}
