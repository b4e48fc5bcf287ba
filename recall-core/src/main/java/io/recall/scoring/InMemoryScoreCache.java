package io.recall.scoring;

import io.recall.spi.ScoreCache;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ScoreCache} held in a concurrent map, for tests and single-process setups
 * without a relational cache table. Entries never expire.
 */
public final class InMemoryScoreCache implements ScoreCache {
  private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryScoreCache() {
    this(Clock.systemUTC());
  }

  public InMemoryScoreCache(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public OptionalDouble lookup(String fingerprint, String evaluatorVersion) {
    Entry entry = entries.get(new Key(fingerprint, evaluatorVersion));
    return entry == null ? OptionalDouble.empty() : OptionalDouble.of(entry.score());
  }

  @Override
  public void put(String fingerprint, String evaluatorVersion, double score) {
    entries.put(new Key(fingerprint, evaluatorVersion), new Entry(score, clock.instant()));
  }

  /** Time of the last write for the key, if present. */
  public Optional<Instant> cachedAt(String fingerprint, String evaluatorVersion) {
    Entry entry = entries.get(new Key(fingerprint, evaluatorVersion));
    return entry == null ? Optional.empty() : Optional.of(entry.cachedAt());
  }

  public int size() {
    return entries.size();
  }

  private record Key(String fingerprint, String evaluatorVersion) {
    Key {
      Objects.requireNonNull(fingerprint, "fingerprint");
      Objects.requireNonNull(evaluatorVersion, "evaluatorVersion");
    }
  }

  private record Entry(double score, Instant cachedAt) {}
}
