package io.recall.spi;

import java.sql.Connection;

/**
 * View of the caller's current transaction, used by producers that must write in the
 * same transaction as the business mutation ({@code OutboxWriter},
 * {@code FeedbackRecorder}).
 *
 * <p>Implementations: {@code io.recall.jdbc.tx.ThreadLocalTxContext} for plain JDBC and
 * {@code io.recall.spring.SpringTxContext} for Spring-managed transactions.
 */
public interface TxContext {

  boolean isTransactionActive();

  /**
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  /**
   * Runs {@code callback} once the current transaction has committed. Not run on rollback.
   *
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);
}
