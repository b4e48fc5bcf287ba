package io.recall.outbox;

/**
 * What happened to one event in a dispatch cycle.
 *
 * @param eventId   the event
 * @param eventType stored type code
 * @param outcome   resulting transition
 * @param attempts  attempt count after this dispatch
 * @param error     failure message for {@code RETRY} / {@code DEAD_LETTER}, otherwise {@code null}
 */
public record DispatchResult(String eventId, String eventType, Outcome outcome, int attempts, String error) {

  public enum Outcome {
    DONE,
    RETRY,
    DEAD_LETTER
  }
}
