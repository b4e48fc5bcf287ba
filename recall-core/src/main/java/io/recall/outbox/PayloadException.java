package io.recall.outbox;

import io.recall.ErrorKind;
import io.recall.RecallException;

/**
 * An outbox payload is malformed or lacks a required field.
 */
public final class PayloadException extends RecallException {
  public PayloadException(String message) {
    super(ErrorKind.PERMANENT, message);
  }

  public PayloadException(String message, Throwable cause) {
    super(ErrorKind.PERMANENT, message, cause);
  }
}
