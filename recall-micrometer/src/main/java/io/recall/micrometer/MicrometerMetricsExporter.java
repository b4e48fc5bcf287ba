package io.recall.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.recall.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Scoring</h3>
 * <ul>
 *   <li>{@code recall.scoring.cache.hit} / {@code recall.scoring.cache.miss}</li>
 *   <li>{@code recall.scoring.judge.retry}: judge calls retried after a transient failure</li>
 *   <li>{@code recall.scoring.defaulted}: items that fell back to the neutral score</li>
 *   <li>{@code recall.scoring.feedback.adjusted}: non-zero feedback adjustments</li>
 *   <li>{@code recall.scoring.issue.tagged}: negative replies classified, tagged {@code tag}</li>
 *   <li>{@code recall.scoring.batch.duration}: timer over scoring batches</li>
 * </ul>
 *
 * <h3>Outbox</h3>
 * <ul>
 *   <li>{@code recall.outbox.dispatch.done}, {@code .retry}, {@code .deadletter}</li>
 *   <li>{@code recall.outbox.lag.oldest.ms}: gauge, age of the oldest pending event</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter cacheHit;
  private final Counter cacheMiss;
  private final Counter judgeRetry;
  private final Counter scoreDefaulted;
  private final Counter feedbackAdjusted;
  private final Timer batchDuration;
  private final Counter dispatchDone;
  private final Counter dispatchRetry;
  private final Counter dispatchDeadLetter;
  private final Gauge lagGauge;
  private final Map<String, Counter> issueTagged = new ConcurrentHashMap<>();

  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "recall");
  }

  /**
   * @param namePrefix prefix for all meter names, without a trailing dot
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;

    this.cacheHit = counter("scoring.cache.hit", "Scores served from the cache");
    this.cacheMiss = counter("scoring.cache.miss", "Scores not found in the cache");
    this.judgeRetry = counter("scoring.judge.retry", "Judge calls retried after a transient failure");
    this.scoreDefaulted = counter("scoring.defaulted", "Messages given the neutral default score");
    this.feedbackAdjusted = counter("scoring.feedback.adjusted", "Scores adjusted by the user's reply");
    this.batchDuration = Timer.builder(namePrefix + ".scoring.batch.duration")
        .description("Duration of scoring batches")
        .register(registry);

    this.dispatchDone = counter("outbox.dispatch.done", "Outbox events applied to the graph");
    this.dispatchRetry = counter("outbox.dispatch.retry", "Outbox events scheduled for retry");
    this.dispatchDeadLetter = counter("outbox.dispatch.deadletter", "Outbox events moved to deadletter");
    this.lagGauge = Gauge.builder(namePrefix + ".outbox.lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .description("Age of the oldest pending outbox event")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(namePrefix + "." + name).description(description).register(registry);
  }

  @Override
  public void incrementCacheHit() {
    if (closed) return;
    cacheHit.increment();
  }

  @Override
  public void incrementCacheMiss() {
    if (closed) return;
    cacheMiss.increment();
  }

  @Override
  public void incrementJudgeRetry() {
    if (closed) return;
    judgeRetry.increment();
  }

  @Override
  public void incrementScoreDefaulted() {
    if (closed) return;
    scoreDefaulted.increment();
  }

  @Override
  public void incrementFeedbackAdjusted() {
    if (closed) return;
    feedbackAdjusted.increment();
  }

  @Override
  public void incrementIssueTagged(String tag) {
    if (closed) return;
    issueTagged.computeIfAbsent(tag, t -> Counter.builder(namePrefix + ".scoring.issue.tagged")
        .description("Negative replies classified by issue")
        .tag("tag", t)
        .register(registry)).increment();
  }

  @Override
  public void recordBatchDurationMs(long durationMs) {
    if (closed) return;
    batchDuration.record(Duration.ofMillis(durationMs));
  }

  @Override
  public void incrementDispatchDone() {
    if (closed) return;
    dispatchDone.increment();
  }

  @Override
  public void incrementDispatchRetry() {
    if (closed) return;
    dispatchRetry.increment();
  }

  @Override
  public void incrementDispatchDeadLetter() {
    if (closed) return;
    dispatchDeadLetter.increment();
  }

  @Override
  public void recordOldestPendingLagMs(long lagMs) {
    if (closed) return;
    oldestLagMs.set(lagMs);
  }

  /** Total scoring batch time recorded so far. */
  double totalBatchTime(TimeUnit unit) {
    return batchDuration.totalTime(unit);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(cacheHit, cacheMiss, judgeRetry, scoreDefaulted,
        feedbackAdjusted, batchDuration, dispatchDone, dispatchRetry, dispatchDeadLetter, lagGauge));
    meters.addAll(issueTagged.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
