package io.recall.jdbc;

import java.util.Objects;

/**
 * Table names used by the JDBC stores, and validation for configurable ones. Table names
 * are concatenated into SQL, so only plain identifiers are accepted.
 */
public final class TableNames {
  public static final String DEFAULT_OUTBOX_TABLE = "graph_outbox";
  public static final String MESSAGE_TABLE = "chat_message";
  public static final String SCORE_CACHE_TABLE = "score_cache";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
