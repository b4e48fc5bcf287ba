package io.recall.outbox;

import io.recall.StoreException;
import io.recall.model.EventStatus;
import io.recall.model.EventType;
import io.recall.model.MessageUpsert;
import io.recall.model.OutboxEvent;
import io.recall.retry.ExponentialBackoffRetryPolicy;
import io.recall.testing.InMemoryGraphSink;
import io.recall.testing.InMemoryOutboxStore;
import io.recall.testing.MutableClock;
import io.recall.testing.RecordingMetrics;
import io.recall.testing.StubConnections;
import io.recall.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboxDispatcherTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);
  private final InMemoryOutboxStore store = new InMemoryOutboxStore();
  private final InMemoryGraphSink sink = new InMemoryGraphSink();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final HandlerRegistry registry =
      GraphSyncHandlers.registerAll(new HandlerRegistry(), sink, JsonCodec.getDefault());

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void builderRejectsMissingCollaborators() {
    assertThrows(NullPointerException.class, () ->
        OutboxDispatcher.builder().outboxStore(store).handlerRegistry(registry).build());
    assertThrows(NullPointerException.class, () ->
        OutboxDispatcher.builder().connectionProvider(StubConnections.provider()).handlerRegistry(registry).build());
    assertThrows(NullPointerException.class, () ->
        OutboxDispatcher.builder().connectionProvider(StubConnections.provider()).outboxStore(store).build());
  }

  @Test
  void builderRejectsInvalidLimits() {
    assertThrows(IllegalArgumentException.class, () -> builder().maxAttempts(0).build());
    assertThrows(IllegalArgumentException.class, () -> builder().batchSize(0).build());
    assertThrows(IllegalArgumentException.class, () -> builder().processingTimeout(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> builder().pollInterval(Duration.ZERO).build());
  }

  // ── Dispatch outcomes ───────────────────────────────────────────

  @Test
  void successfulEventIsMarkedDone() {
    String id = enqueueMessage("m1");

    List<DispatchResult> results = builder().build().dispatchOnce();

    assertEquals(List.of(new DispatchResult(id, "message_upsert", DispatchResult.Outcome.DONE, 0, null)), results);
    assertEquals(EventStatus.DONE, store.get(id).status());
    assertEquals(1, sink.messages.size());
    assertEquals(1, metrics.dispatchDone.get());
  }

  @Test
  void eventsAreDispatchedInCreationOrder() {
    List<String> seen = new ArrayList<>();
    HandlerRegistry recording = new HandlerRegistry()
        .register(EventType.MESSAGE_UPSERT, event -> seen.add(event.entityId()));
    enqueueMessage("first");
    clock.advance(Duration.ofSeconds(1));
    enqueueMessage("second");
    clock.advance(Duration.ofSeconds(1));
    enqueueMessage("third");

    builder().handlerRegistry(recording).build().dispatchOnce();

    assertEquals(List.of("first", "second", "third"), seen);
  }

  @Test
  void transientFailureSchedulesRetryWithBackoff() {
    sink.failuresRemaining.set(1);
    String id = enqueueMessage("m1");
    OutboxDispatcher dispatcher = builder().build();

    DispatchResult result = dispatcher.dispatchOnce().get(0);

    assertEquals(DispatchResult.Outcome.RETRY, result.outcome());
    assertEquals(1, result.attempts());
    OutboxEvent stored = store.get(id);
    assertEquals(EventStatus.PENDING, stored.status());
    assertEquals(1, stored.attempts());
    assertEquals("graph unavailable", stored.lastError());
    assertEquals(NOW.plusSeconds(1), stored.nextAttemptAt());

    assertTrue(dispatcher.dispatchOnce().isEmpty(), "not due yet");

    clock.advance(Duration.ofSeconds(1));
    assertEquals(DispatchResult.Outcome.DONE, dispatcher.dispatchOnce().get(0).outcome());
    assertEquals(EventStatus.DONE, store.get(id).status());
    assertEquals(1, metrics.dispatchRetry.get());
  }

  @Test
  void retryDelaysNeverDecrease() {
    sink.failuresRemaining.set(Integer.MAX_VALUE);
    String id = enqueueMessage("m1");
    OutboxDispatcher dispatcher = builder().maxAttempts(6).build();

    List<Duration> delays = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      Instant before = clock.instant();
      dispatcher.dispatchOnce();
      Instant next = store.get(id).nextAttemptAt();
      delays.add(Duration.between(before, next));
      clock.set(next);
    }

    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
        Duration.ofSeconds(8), Duration.ofSeconds(16)), delays);
  }

  @Test
  void deadLetteredAfterMaxAttempts() {
    sink.failuresRemaining.set(Integer.MAX_VALUE);
    String id = enqueueMessage("m1");
    OutboxDispatcher dispatcher = builder().maxAttempts(3).build();

    List<DispatchResult> results = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      results.addAll(dispatcher.dispatchOnce());
      clock.advance(Duration.ofMinutes(10));
    }

    assertEquals(List.of(DispatchResult.Outcome.RETRY, DispatchResult.Outcome.RETRY,
        DispatchResult.Outcome.DEAD_LETTER), results.stream().map(DispatchResult::outcome).toList());
    OutboxEvent stored = store.get(id);
    assertEquals(EventStatus.DEADLETTER, stored.status());
    assertEquals(3, stored.attempts());
    assertEquals("graph unavailable", stored.lastError());
    assertEquals(1, metrics.dispatchDeadLetter.get());
  }

  @Test
  void unknownEventTypeIsDeadLetteredImmediately() {
    OutboxEvent event = new OutboxEvent("e1", "reindex", "x", "{}", EventStatus.PENDING, 0, null, NOW, NOW, NOW);
    store.insert(null, event);

    DispatchResult result = builder().build().dispatchOnce().get(0);

    assertEquals(DispatchResult.Outcome.DEAD_LETTER, result.outcome());
    assertEquals(1, result.attempts());
    assertTrue(result.error().contains("reindex"));
    assertEquals(EventStatus.DEADLETTER, store.get("e1").status());
  }

  @Test
  void malformedPayloadIsDeadLetteredImmediately() {
    OutboxEvent event = OutboxEvent.pending(EventType.FEEDBACK, "m1", "{\"user_id\":\"u1\"}", NOW);
    store.insert(null, event);

    DispatchResult result = builder().build().dispatchOnce().get(0);

    assertEquals(DispatchResult.Outcome.DEAD_LETTER, result.outcome());
    assertEquals(EventStatus.DEADLETTER, store.get(event.id()).status());
  }

  @Test
  void handlerLogicErrorIsDeadLetteredImmediately() {
    String id = enqueueMessage("m1");
    HandlerRegistry broken = new HandlerRegistry().register(EventType.MESSAGE_UPSERT, event -> {
      throw new IllegalArgumentException("conversation id must not be blank");
    });

    DispatchResult result = builder().handlerRegistry(broken).build().dispatchOnce().get(0);

    assertEquals(DispatchResult.Outcome.DEAD_LETTER, result.outcome());
    assertEquals(1, result.attempts());
    assertEquals(EventStatus.DEADLETTER, store.get(id).status());
    assertEquals(1, metrics.dispatchDeadLetter.get());
  }

  @Test
  void handlerReportingFailureIsRetried() {
    String id = enqueueMessage("m1");
    HandlerRegistry refusing = new HandlerRegistry().register(EventType.MESSAGE_UPSERT, event -> false);

    DispatchResult result = builder().handlerRegistry(refusing).build().dispatchOnce().get(0);

    assertEquals(DispatchResult.Outcome.RETRY, result.outcome());
    assertEquals(EventStatus.PENDING, store.get(id).status());
  }

  // ── Recovery ────────────────────────────────────────────────────

  @Test
  void staleProcessingEventsAreReleased() {
    String id = enqueueMessage("m1");
    store.markProcessing(null, id, NOW);
    OutboxDispatcher dispatcher = builder().processingTimeout(Duration.ofMinutes(5)).build();

    assertTrue(dispatcher.dispatchOnce().isEmpty());

    clock.advance(Duration.ofMinutes(6));
    List<DispatchResult> results = dispatcher.dispatchOnce();

    assertEquals(1, results.size());
    assertEquals(DispatchResult.Outcome.DONE, results.get(0).outcome());
    assertEquals(1, store.get(id).attempts());
  }

  @Test
  void eventThatNeverCompletesIsDeadLetteredAtMaxAttempts() {
    String id = enqueueMessage("m1");
    OutboxDispatcher dispatcher = builder().maxAttempts(3).processingTimeout(Duration.ofMinutes(5)).build();
    store.failStatusUpdates = true;

    dispatcher.dispatchOnce();
    for (int cycle = 1; cycle <= 2; cycle++) {
      clock.advance(Duration.ofMinutes(6));
      dispatcher.dispatchOnce();
      assertEquals(EventStatus.PROCESSING, store.get(id).status());
      assertEquals(cycle, store.get(id).attempts());
    }

    clock.advance(Duration.ofMinutes(6));
    assertTrue(dispatcher.dispatchOnce().isEmpty());

    OutboxEvent dead = store.get(id);
    assertEquals(EventStatus.DEADLETTER, dead.status());
    assertEquals(3, dead.attempts());
    assertTrue(dead.lastError().contains("timed out"));
    assertEquals(1, metrics.dispatchDeadLetter.get());
  }

  @Test
  void failedStatusUpdateLeavesEventForStaleRelease() {
    String id = enqueueMessage("m1");
    OutboxDispatcher dispatcher = builder().build();
    store.failStatusUpdates = true;

    dispatcher.dispatchOnce();
    assertEquals(EventStatus.PROCESSING, store.get(id).status());

    store.failStatusUpdates = false;
    clock.advance(Duration.ofMinutes(6));
    dispatcher.dispatchOnce();

    assertEquals(EventStatus.DONE, store.get(id).status());
    assertEquals(1, sink.messages.size());
  }

  @Test
  void pollFailurePropagates() {
    store.failPolls = true;

    assertThrows(StoreException.class, () -> builder().build().dispatchOnce());
  }

  @Test
  void recordsOldestPendingLag() {
    enqueueMessage("m1");
    sink.failuresRemaining.set(1);
    OutboxDispatcher dispatcher = builder().build();
    clock.advance(Duration.ofSeconds(30));

    dispatcher.dispatchOnce();

    assertEquals(30_000, metrics.oldestPendingLagMs.get());
  }

  @Test
  void deadLettersCanBeInspected() {
    store.insert(null, new OutboxEvent("e1", "reindex", "x", "{}", EventStatus.PENDING, 0, null, NOW, NOW, NOW));
    enqueueMessage("m1");
    builder().build().dispatchOnce();
    DeadLetterInspector inspector = new DeadLetterInspector(StubConnections.provider(), store);

    assertEquals(1, inspector.count(null));
    assertEquals(1, inspector.count("reindex"));
    assertEquals(0, inspector.count("message_upsert"));
    assertEquals("e1", inspector.query(null, 10).get(0).id());
    assertThrows(IllegalArgumentException.class, () -> inspector.query(null, 0));
  }

  // ── Background loop ─────────────────────────────────────────────

  @Test
  void backgroundLoopDispatchesUntilClosed() throws Exception {
    String id = enqueueMessage("m1");
    OutboxDispatcher dispatcher = OutboxDispatcher.builder()
        .connectionProvider(StubConnections.provider())
        .outboxStore(store)
        .handlerRegistry(registry)
        .pollInterval(Duration.ofMillis(20))
        .build();

    try (dispatcher) {
      dispatcher.start();
      long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
      while (store.get(id).status() != EventStatus.DONE && System.nanoTime() < deadline) {
        Thread.sleep(10);
      }
      assertTrue(dispatcher.isRunning());
    }
    assertEquals(EventStatus.DONE, store.get(id).status());
  }

  private OutboxDispatcher.Builder builder() {
    return OutboxDispatcher.builder()
        .connectionProvider(StubConnections.provider())
        .outboxStore(store)
        .handlerRegistry(registry)
        .retryPolicy(new ExponentialBackoffRetryPolicy(1_000, 300_000))
        .clock(clock)
        .metrics(metrics);
  }

  private String enqueueMessage(String messageId) {
    MessageUpsert upsert = new MessageUpsert("c1", messageId, "assistant");
    OutboxEvent event = OutboxEvent.pending(EventType.MESSAGE_UPSERT, messageId,
        JsonCodec.getDefault().toJson(upsert.toFields()), clock.instant());
    store.insert(null, event);
    return event.id();
  }
}
