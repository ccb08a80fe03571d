package com.mahler.schemarunner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DialectTest {

  @Test
  void testWhenDialectNameDoesNotExist_shouldThrowException() {
    // Given
    String dialectName = "bad dialect";

    // When
    Exception result =
        assertThrows(IllegalArgumentException.class, () -> Dialect.getValueByName(dialectName));

    // Then
    assertTrue(result.getMessage().startsWith("Unknown dialect: " + dialectName));
    assertTrue(result.getMessage().endsWith("Expected one of [SQLITE, H2, POSTGRESQL, MY_SQL]"));
  }

  @Test
  void testWhenDialectNameDoesExistsButInvalidCase_shouldThrowException() {
    // Given
    String dialectName = "sqlite";

    // When
    Exception result =
        assertThrows(IllegalArgumentException.class, () -> Dialect.getValueByName(dialectName));

    // Then
    assertTrue(result.getMessage().startsWith("Unknown dialect: " + dialectName));
  }

  @Test
  void testWhenDialectNameDoesExist_shouldReturnDialect() {
    assertEquals(Dialect.SQLITE, Dialect.getValueByName("SQLITE"));
    assertEquals(Dialect.H2, Dialect.getValueByName("H2"));
  }

  @Test
  void testDialectFromJdbcUrl() {
    assertEquals(Dialect.SQLITE, Dialect.fromJdbcUrl("jdbc:sqlite:/tmp/mahler.db"));
    assertEquals(Dialect.H2, Dialect.fromJdbcUrl("jdbc:h2:mem:test"));
    assertEquals(Dialect.POSTGRESQL, Dialect.fromJdbcUrl("jdbc:postgresql://db/mahler"));
    assertEquals(Dialect.MY_SQL, Dialect.fromJdbcUrl("jdbc:mysql://db/mahler"));
    assertThrows(IllegalArgumentException.class, () -> Dialect.fromJdbcUrl("jdbc:oracle:thin:@x"));
  }

  @Test
  void testSqliteIntegrityStatements() {
    assertTrue(Dialect.SQLITE.suspendsIntegrityChecks("PRAGMA foreign_keys=OFF"));
    assertTrue(Dialect.SQLITE.suspendsIntegrityChecks("pragma foreign_keys = 0"));
    assertTrue(Dialect.SQLITE.resumesIntegrityChecks("PRAGMA foreign_keys=ON"));
    assertFalse(Dialect.SQLITE.resumesIntegrityChecks("PRAGMA foreign_keys"));
    assertFalse(Dialect.SQLITE.suspendsIntegrityChecks("PRAGMA foreign_key_check"));
    assertFalse(Dialect.SQLITE.suspendsIntegrityChecks("DROP TABLE trades"));
  }

  @Test
  void testOtherIntegrityStatements() {
    assertTrue(Dialect.H2.suspendsIntegrityChecks("SET REFERENTIAL_INTEGRITY FALSE"));
    assertTrue(Dialect.H2.resumesIntegrityChecks("set referential_integrity true"));
    assertTrue(Dialect.MY_SQL.suspendsIntegrityChecks("SET FOREIGN_KEY_CHECKS=0"));
    assertTrue(Dialect.MY_SQL.resumesIntegrityChecks("SET FOREIGN_KEY_CHECKS = 1"));
    assertTrue(
        Dialect.POSTGRESQL.suspendsIntegrityChecks("SET session_replication_role = replica"));
    assertTrue(
        Dialect.POSTGRESQL.resumesIntegrityChecks("SET session_replication_role TO DEFAULT"));
  }

  @Test
  void testIntegrityReporting() {
    assertTrue(Dialect.SQLITE.canReportIntegrityChecks());
    assertTrue(Dialect.POSTGRESQL.canReportIntegrityChecks());
    assertTrue(Dialect.MY_SQL.canReportIntegrityChecks());
    assertFalse(Dialect.H2.canReportIntegrityChecks());
    assertThrows(
        UnsupportedOperationException.class, () -> Dialect.H2.integrityChecksEnabled(null));
  }

  @Test
  void testQuoteIdentifier() {
    assertEquals("status", Dialect.SQLITE.quoteIdentifier("status"));
    assertEquals("\"order date\"", Dialect.SQLITE.quoteIdentifier("order date"));
    assertEquals("`order date`", Dialect.MY_SQL.quoteIdentifier("order date"));
  }
}
