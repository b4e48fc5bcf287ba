package io.recall.model;

/**
 * Outbox event lifecycle: {@code PENDING -> PROCESSING -> DONE}, back to {@code PENDING}
 * for a retry, or {@code DEADLETTER}. {@code DONE} and {@code DEADLETTER} are terminal.
 */
public enum EventStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  DONE("done"),
  DEADLETTER("deadletter");

  private final String code;

  EventStatus(String code) {
    this.code = code;
  }

  /** Value stored in the {@code status} column. */
  public String code() {
    return code;
  }

  public boolean isTerminal() {
    return this == DONE || this == DEADLETTER;
  }

  public static EventStatus fromCode(String code) {
    for (EventStatus status : values()) {
      if (status.code.equals(code)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown event status: " + code);
  }
}
