package io.recall.outbox;

import io.recall.ErrorKind;
import io.recall.StoreException;
import io.recall.model.OutboxEvent;
import io.recall.retry.ExponentialBackoffRetryPolicy;
import io.recall.retry.RetryPolicy;
import io.recall.schedule.PeriodicLoop;
import io.recall.spi.ConnectionProvider;
import io.recall.spi.MetricsExporter;
import io.recall.spi.OutboxStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Propagates pending outbox events to their handlers.
 *
 * <p>Each cycle ({@link #dispatchOnce()}) releases stale {@code processing} claims, polls
 * due pending events oldest first and dispatches them one by one: claim, handle, then
 * mark {@code done}, schedule a retry with backoff, or dead-letter. Non-retryable failures
 * (see {@link ErrorKind}) are dead-lettered on the first attempt; retryable ones once
 * {@code maxAttempts} is reached.
 *
 * <p>A failure while polling propagates to the caller. A failure while updating an
 * event's status is logged and leaves the event {@code processing} until the stale
 * release picks it up again. A timed-out claim counts as an attempt, so an event whose
 * handler keeps killing the worker is dead-lettered once {@code maxAttempts} is reached.
 *
 * <p>{@link #start()} runs cycles on a background {@link PeriodicLoop}; {@link #close()}
 * stops it. Create instances via {@link #builder()}.
 *
 * @see OutboxWriter
 * @see HandlerRegistry
 */
public final class OutboxDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OutboxDispatcher.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OutboxStore outboxStore;
  private final HandlerRegistry handlerRegistry;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final int batchSize;
  private final Duration processingTimeout;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final PeriodicLoop loop;

  private OutboxDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
    this.handlerRegistry = Objects.requireNonNull(builder.handlerRegistry, "handlerRegistry");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(1_000, 300_000);
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + builder.maxAttempts);
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1, got: " + builder.batchSize);
    }
    Objects.requireNonNull(builder.processingTimeout, "processingTimeout");
    if (builder.processingTimeout.isNegative() || builder.processingTimeout.isZero()) {
      throw new IllegalArgumentException("processingTimeout must be > 0, got: " + builder.processingTimeout);
    }
    this.maxAttempts = builder.maxAttempts;
    this.batchSize = builder.batchSize;
    this.processingTimeout = builder.processingTimeout;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.loop = PeriodicLoop.builder("recall-outbox-dispatcher")
        .task(this::dispatchOnce)
        .interval(builder.pollInterval)
        .stopTimeout(builder.stopTimeout)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs one release-poll-dispatch cycle.
   *
   * @return one result per event this dispatcher claimed, in poll order
   * @throws StoreException if the pending events cannot be polled
   */
  public List<DispatchResult> dispatchOnce() {
    Instant now = clock.instant();
    List<OutboxEvent> events;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      Instant staleBefore = now.minus(processingTimeout);
      String timedOut = "Processing timed out after " + processingTimeout;
      int deadLettered = outboxStore.deadLetterStale(conn, staleBefore, maxAttempts, timedOut, now);
      for (int i = 0; i < deadLettered; i++) {
        metrics.incrementDispatchDeadLetter();
      }
      if (deadLettered > 0) {
        logger.severe("Dead-lettered " + deadLettered + " stale processing event(s) with no attempts left");
      }
      int released = outboxStore.releaseStale(conn, staleBefore, timedOut, now);
      if (released > 0) {
        logger.warning("Released " + released + " stale processing event(s) back to pending");
      }
      events = outboxStore.pollPending(conn, now, batchSize);
      Optional<Instant> oldest = outboxStore.oldestPendingCreatedAt(conn);
      metrics.recordOldestPendingLagMs(
          oldest.map(at -> Math.max(0L, Duration.between(at, now).toMillis())).orElse(0L));
    } catch (SQLException e) {
      throw new StoreException("Failed to poll outbox", e);
    }

    List<DispatchResult> results = new ArrayList<>(events.size());
    for (OutboxEvent event : events) {
      if (claim(event.id())) {
        results.add(dispatch(event));
      }
    }
    if (!results.isEmpty()) {
      logger.fine(() -> "Dispatched " + results.size() + " outbox event(s)");
    }
    return results;
  }

  private boolean claim(String eventId) {
    int[] claimed = new int[1];
    withConnection("claim", eventId,
        conn -> claimed[0] = outboxStore.markProcessing(conn, eventId, clock.instant()));
    return claimed[0] == 1;
  }

  private DispatchResult dispatch(OutboxEvent event) {
    try {
      EventHandler handler = handlerRegistry.handlerFor(event.eventType());
      if (handler == null) {
        throw new UnknownEventTypeException(event.eventType());
      }
      if (!handler.handle(event)) {
        return handleFailure(event, ErrorKind.TRANSIENT, "Handler reported failure", null);
      }
      withConnection("mark done", event.id(),
          conn -> outboxStore.markDone(conn, event.id(), clock.instant()));
      metrics.incrementDispatchDone();
      return new DispatchResult(event.id(), event.eventType(), DispatchResult.Outcome.DONE,
          event.attempts(), null);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return handleFailure(event, ErrorKind.TRANSIENT, describe(e), e);
    } catch (Exception e) {
      return handleFailure(event, ErrorKind.classify(e), describe(e), e);
    }
  }

  private DispatchResult handleFailure(OutboxEvent event, ErrorKind kind, String error, Exception failure) {
    int attempts = event.attempts() + 1;
    Instant now = clock.instant();
    if (!kind.retryable() || attempts >= maxAttempts) {
      withConnection("mark deadletter", event.id(),
          conn -> outboxStore.markDeadLetter(conn, event.id(), error, now));
      metrics.incrementDispatchDeadLetter();
      logger.log(Level.SEVERE, "Event " + event.id() + " (" + event.eventType() + ") dead-lettered after "
          + attempts + " attempt(s), " + kind + ": " + error, failure);
      return new DispatchResult(event.id(), event.eventType(), DispatchResult.Outcome.DEAD_LETTER,
          attempts, error);
    }
    Instant nextAttemptAt = now.plusMillis(retryPolicy.computeDelayMs(attempts));
    withConnection("mark retry", event.id(),
        conn -> outboxStore.markRetry(conn, event.id(), nextAttemptAt, error, now));
    metrics.incrementDispatchRetry();
    logger.log(Level.WARNING, "Event " + event.id() + " (" + event.eventType() + ") failed attempt "
        + attempts + "/" + maxAttempts + "; next attempt at " + nextAttemptAt + ": " + error);
    return new DispatchResult(event.id(), event.eventType(), DispatchResult.Outcome.RETRY,
        attempts, error);
  }

  private void withConnection(String action, String eventId, StoreAction op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      op.execute(conn);
    } catch (SQLException | StoreException e) {
      logger.log(Level.SEVERE, "Failed to " + action + " for eventId=" + eventId, e);
    }
  }

  private static String describe(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getName() : message;
  }

  @FunctionalInterface
  private interface StoreAction {
    void execute(Connection conn) throws SQLException;
  }

  /**
   * Starts dispatching on a background thread every poll interval.
   */
  public void start() {
    loop.start();
  }

  /**
   * Requests a cooperative stop; the current cycle completes.
   */
  public void stop() {
    loop.stop();
  }

  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return loop.awaitTermination(timeout);
  }

  public boolean isRunning() {
    return loop.isRunning();
  }

  /**
   * Stops the background loop, waiting up to the stop timeout before cancelling it.
   */
  @Override
  public void close() {
    loop.close();
  }

  /** Builder for {@link OutboxDispatcher}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private OutboxStore outboxStore;
    private HandlerRegistry handlerRegistry;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 10;
    private int batchSize = 50;
    private Duration pollInterval = Duration.ofSeconds(5);
    private Duration processingTimeout = Duration.ofMinutes(5);
    private Duration stopTimeout = Duration.ofSeconds(5);
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Source of auto-commit connections for polling and status updates.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Delay before the next attempt of a failed event.
     *
     * <p>Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with 1s base and 300s cap.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Attempts before a retryable failure is dead-lettered. Default: 10. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Events polled per cycle. Default: 50. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Pause between cycles, also after a failed one. Default: 5 seconds. */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = pollInterval;
      return this;
    }

    /** How long an event may stay {@code processing} before it is released. Default: 5 minutes. */
    public Builder processingTimeout(Duration processingTimeout) {
      this.processingTimeout = processingTimeout;
      return this;
    }

    /** Default: 5 seconds. */
    public Builder stopTimeout(Duration stopTimeout) {
      this.stopTimeout = stopTimeout;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public OutboxDispatcher build() {
      return new OutboxDispatcher(this);
    }
  }
}
