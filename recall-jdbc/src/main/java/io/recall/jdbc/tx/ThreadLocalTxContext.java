package io.recall.jdbc.tx;

import io.recall.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TxContext} holding the current connection and its after-commit callbacks in a
 * {@link ThreadLocal}. Bound and cleared by {@link JdbcTransactionManager}.
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return require().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    require().afterCommit.add(callback);
  }

  private TxState require() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  /**
   * Unbinds the transaction and runs its after-commit callbacks in registration order.
   * Every callback runs; the first failure is rethrown with later ones suppressed.
   */
  void runAfterCommitAndClear() {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    state.remove();
    RuntimeException first = null;
    for (Runnable callback : current.afterCommit) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        if (first == null) {
          first = e;
        } else {
          first.addSuppressed(e);
        }
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Unbinds the transaction, discarding its callbacks. */
  void clear() {
    state.remove();
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
