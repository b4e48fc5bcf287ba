package io.recall;

import java.util.Objects;

/**
 * Base unchecked exception carrying an {@link ErrorKind}.
 */
public class RecallException extends RuntimeException {
  private final ErrorKind kind;

  public RecallException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public RecallException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }
}
