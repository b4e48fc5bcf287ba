package io.recall;

import java.io.IOException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;

/**
 * Failure taxonomy shared by the scoring pipeline and the outbox dispatcher.
 *
 * <p>Retry decisions are made from the kind alone, never from concrete exception types:
 * callers classify once with {@link #classify(Throwable)} and then consult
 * {@link #retryable()}.
 */
public enum ErrorKind {
  /** Network or timeout failure of a remote dependency (judge model, graph store). */
  TRANSIENT(true),
  /** A model reply that could not be read as a number. */
  PARSE(false),
  /** Relational store failure. */
  PERSISTENCE(true),
  /**
   * Failure that cannot succeed on replay: unknown event type, malformed payload, or a
   * programming error such as an illegal argument or a null dereference.
   */
  PERMANENT(false);

  private static final int MAX_CAUSE_DEPTH = 16;

  private final boolean retryable;

  ErrorKind(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean retryable() {
    return retryable;
  }

  /**
   * Classifies a failure by walking its cause chain. The first link that carries or
   * implies a kind wins. Logic errors ({@link IllegalArgumentException},
   * {@link IllegalStateException}, {@link NullPointerException}, {@link ClassCastException},
   * {@link UnsupportedOperationException}) are {@link #PERMANENT}; unrecognized failures
   * are treated as {@link #TRANSIENT}.
   *
   * @param error the failure to classify (may be {@code null})
   * @return the kind, never {@code null}
   */
  public static ErrorKind classify(Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof RecallException recall) {
        return recall.kind();
      }
      if (current instanceof SQLException) {
        return PERSISTENCE;
      }
      if (current instanceof IOException || current instanceof TimeoutException) {
        return TRANSIENT;
      }
      if (current instanceof NumberFormatException) {
        return PARSE;
      }
      if (isLogicError(current)) {
        return PERMANENT;
      }
      current = current.getCause();
    }
    return TRANSIENT;
  }

  private static boolean isLogicError(Throwable t) {
    return t instanceof IllegalArgumentException
        || t instanceof IllegalStateException
        || t instanceof NullPointerException
        || t instanceof ClassCastException
        || t instanceof UnsupportedOperationException;
  }
}
