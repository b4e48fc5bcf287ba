package io.recall.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DialectTest {

  @Test
  void detectsDialectFromJdbcUrl() {
    assertEquals(Dialect.H2, Dialect.detect("jdbc:h2:mem:test"));
    assertEquals(Dialect.POSTGRESQL, Dialect.detect("jdbc:postgresql://localhost:5432/recall"));
    assertEquals(Dialect.POSTGRESQL, Dialect.detect("JDBC:POSTGRESQL://db/recall"));
  }

  @Test
  void unknownUrlIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Dialect.detect("jdbc:mysql://localhost/recall"));
    assertThrows(IllegalArgumentException.class, () -> Dialect.detect(""));
  }

  @Test
  void detectsDialectFromDataSource() {
    assertEquals(Dialect.H2, Dialect.detect(TestDatabases.h2()));
  }

  @Test
  void fromIdIgnoresCase() {
    assertEquals(Dialect.POSTGRESQL, Dialect.fromId("PostgreSQL"));
    assertThrows(IllegalArgumentException.class, () -> Dialect.fromId("oracle"));
  }

  @Test
  void upsertStatementsTargetTheCacheKey() {
    assertTrue(Dialect.H2.scoreCacheUpsert("score_cache").contains("KEY (fingerprint, evaluator_version)"));
    assertTrue(Dialect.POSTGRESQL.scoreCacheUpsert("score_cache")
        .contains("ON CONFLICT (fingerprint, evaluator_version)"));
  }

  @Test
  void tableNamesMustBePlainIdentifiers() {
    assertEquals("graph_outbox_v2", TableNames.validate("graph_outbox_v2"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("outbox; DROP TABLE x"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1outbox"));
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }
}
