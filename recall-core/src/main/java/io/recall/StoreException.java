package io.recall;

/**
 * Unchecked exception wrapping relational store errors. Always classified as
 * {@link ErrorKind#PERSISTENCE}.
 */
public final class StoreException extends RecallException {
  public StoreException(String message, Throwable cause) {
    super(ErrorKind.PERSISTENCE, message, cause);
  }
}
