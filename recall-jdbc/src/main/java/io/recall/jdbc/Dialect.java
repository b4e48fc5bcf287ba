package io.recall.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Supported databases and the few statements that differ between them. Everything else
 * the stores issue is portable SQL.
 *
 * <pre>{@code
 * Dialect dialect = Dialect.detect(dataSource);
 * Dialect dialect = Dialect.detect("jdbc:postgresql://localhost/recall");
 * }</pre>
 */
public enum Dialect {
  H2("h2", List.of("jdbc:h2:")) {
    @Override
    public String scoreCacheUpsert(String table) {
      return "MERGE INTO " + table + " (fingerprint, evaluator_version, score, cached_at)"
          + " KEY (fingerprint, evaluator_version) VALUES (?,?,?,?)";
    }
  },
  POSTGRESQL("postgresql", List.of("jdbc:postgresql:")) {
    @Override
    public String scoreCacheUpsert(String table) {
      return "INSERT INTO " + table + " (fingerprint, evaluator_version, score, cached_at)"
          + " VALUES (?,?,?,?) ON CONFLICT (fingerprint, evaluator_version)"
          + " DO UPDATE SET score=EXCLUDED.score, cached_at=EXCLUDED.cached_at";
    }
  };

  private final String id;
  private final List<String> jdbcUrlPrefixes;

  Dialect(String id, List<String> jdbcUrlPrefixes) {
    this.id = id;
    this.jdbcUrlPrefixes = jdbcUrlPrefixes;
  }

  /** Name used in configuration and as the schema resource name. */
  public String id() {
    return id;
  }

  public List<String> jdbcUrlPrefixes() {
    return jdbcUrlPrefixes;
  }

  /** Classpath location of the DDL for this database. */
  public String schemaResource() {
    return "/schema/" + id + ".sql";
  }

  /**
   * Insert-or-overwrite of one score cache row. Parameters: fingerprint, evaluator
   * version, score, cached-at.
   */
  public abstract String scoreCacheUpsert(String table);

  /**
   * @throws IllegalArgumentException if the name is unknown
   */
  public static Dialect fromId(String id) {
    for (Dialect dialect : values()) {
      if (dialect.id.equalsIgnoreCase(id)) {
        return dialect;
      }
    }
    throw new IllegalArgumentException("Unknown dialect: " + id + ". Available: " + Arrays.toString(values()));
  }

  /**
   * Detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if no dialect handles the URL
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (Dialect dialect : values()) {
      for (String prefix : dialect.jdbcUrlPrefixes) {
        if (url.startsWith(prefix)) {
          return dialect;
        }
      }
    }
    throw new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl);
  }

  /**
   * Detects the dialect from the URL of a connection obtained from the data source.
   *
   * @throws IllegalStateException if no connection can be obtained
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
  }
}
