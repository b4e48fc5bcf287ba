package io.recall.outbox;

import io.recall.ErrorKind;
import io.recall.RecallException;

/**
 * The graph store rejected or failed a write. Retried by the dispatcher.
 */
public final class GraphSinkException extends RecallException {
  public GraphSinkException(String message, Throwable cause) {
    super(ErrorKind.TRANSIENT, message, cause);
  }
}
