package io.recall.jdbc.store;

import io.recall.StoreException;
import io.recall.jdbc.Dialect;
import io.recall.jdbc.JdbcTemplate;
import io.recall.jdbc.TableNames;
import io.recall.spi.ConnectionProvider;
import io.recall.spi.ScoreCache;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Score cache in the {@code score_cache} table, keyed by fingerprint and evaluator version.
 * Writes are dialect-specific upserts, so the last write for a key wins.
 */
public final class JdbcScoreCache implements ScoreCache {
  private final ConnectionProvider connectionProvider;
  private final Dialect dialect;
  private final Clock clock;

  public JdbcScoreCache(ConnectionProvider connectionProvider, Dialect dialect) {
    this(connectionProvider, dialect, Clock.systemUTC());
  }

  public JdbcScoreCache(ConnectionProvider connectionProvider, Dialect dialect, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public OptionalDouble lookup(String fingerprint, String evaluatorVersion) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      List<Double> scores = JdbcTemplate.query(conn,
          "SELECT score FROM " + TableNames.SCORE_CACHE_TABLE + " WHERE fingerprint=? AND evaluator_version=?",
          rs -> rs.getDouble("score"), fingerprint, evaluatorVersion);
      return scores.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(scores.get(0));
    } catch (SQLException e) {
      throw new StoreException("Failed to look up cached score", e);
    }
  }

  @Override
  public void put(String fingerprint, String evaluatorVersion, double score) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      JdbcTemplate.update(conn, dialect.scoreCacheUpsert(TableNames.SCORE_CACHE_TABLE),
          fingerprint, evaluatorVersion, score, clock.instant());
    } catch (SQLException e) {
      throw new StoreException("Failed to cache score", e);
    }
  }
}
