package io.recall.jdbc.tx;

import io.recall.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction manager for plain JDBC. {@link #begin()} takes a connection, disables
 * auto-commit and binds it to a {@link ThreadLocalTxContext}, so the outbox writer and
 * feedback recorder see it as the current transaction.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *   feedbackRecorder.record(messageId, ownerId, FeedbackType.LIKE);
 *   tx.commit();
 * }
 * }</pre>
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  /**
   * @throws SQLException if a connection cannot be obtained
   * @throws IllegalStateException if this thread already has an active transaction
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection, txContext);
  }

  /**
   * Runs {@code work} in a new transaction, committing when it returns and rolling back
   * when it throws.
   */
  public <T> T inTransaction(TransactionalWork<T> work) throws Exception {
    try (Transaction tx = begin()) {
      T result = work.run();
      tx.commit();
      return result;
    }
  }

  @FunctionalInterface
  public interface TransactionalWork<T> {
    T run() throws Exception;
  }

  /**
   * Handle for one transaction. {@link #close()} rolls back unless {@link #commit()} or
   * {@link #rollback()} already completed it.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext) {
      this.connection = connection;
      this.txContext = txContext;
    }

    /**
     * Commits, then runs the after-commit callbacks. A failing callback is rethrown after
     * the connection is released; the commit itself stands.
     */
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        rollbackQuietly(e);
        throw e;
      } finally {
        finish(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finish(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    public boolean isCompleted() {
      return completed;
    }

    private void finish(boolean committed) throws SQLException {
      completed = true;
      RuntimeException callbackFailure = null;
      try {
        if (committed) {
          txContext.runAfterCommitAndClear();
        } else {
          txContext.clear();
        }
      } catch (RuntimeException e) {
        callbackFailure = e;
      } finally {
        try {
          connection.setAutoCommit(true);
        } catch (SQLException e) {
          if (callbackFailure != null) {
            callbackFailure.addSuppressed(e);
          } else {
            logger.log(Level.WARNING, "Failed to restore auto-commit", e);
          }
        } finally {
          connection.close();
        }
      }
      if (callbackFailure != null) {
        throw callbackFailure;
      }
    }

    private void rollbackQuietly(SQLException commitFailure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        commitFailure.addSuppressed(e);
        logger.log(Level.WARNING, "Rollback after failed commit also failed", e);
      }
    }
  }
}
