package com.mahler.schemarunner;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** The database engines supported by {@link MigrationRunner}. */
public interface Dialect {

  String getName();

  /**
   * @return True if DDL statements can be rolled back, so a whole migration can run in one
   *     transaction.
   */
  boolean isTransactionalDdl();

  /**
   * @return The prefix identifying this engine's JDBC URLs, e.g. {@code jdbc:sqlite:}.
   */
  String getJdbcPrefix();

  /**
   * @param statement A statement from a migration.
   * @return True if the statement switches off foreign key enforcement.
   */
  boolean suspendsIntegrityChecks(String statement);

  /**
   * @param statement A statement from a migration.
   * @return True if the statement switches foreign key enforcement back on.
   */
  boolean resumesIntegrityChecks(String statement);

  /**
   * @return The statement used to switch foreign key enforcement back on after a failure.
   */
  String getResumeIntegrityChecks();

  /**
   * @return True if {@link #integrityChecksEnabled(Connection)} can ask the database for the
   *     current state. Where it cannot, a migration which suspends enforcement must resume it
   *     itself.
   */
  boolean canReportIntegrityChecks();

  /**
   * Asks the database whether foreign key enforcement is currently active for the connection.
   *
   * @param connection The connection.
   * @return True if enforcement is on.
   * @throws SQLException If the query fails or returns nothing.
   * @throws UnsupportedOperationException If {@link #canReportIntegrityChecks()} is false.
   */
  boolean integrityChecksEnabled(Connection connection) throws SQLException;

  /**
   * Lists rows which violate a foreign key. Engines which cannot scan for violations return an
   * empty list.
   *
   * @param connection The connection.
   * @return A description of each violating row.
   * @throws SQLException If the scan fails.
   */
  List<String> findIntegrityViolations(Connection connection) throws SQLException;

  void createLedgerTableIfNotExists(Connection connection, String tableName) throws SQLException;

  /**
   * @param identifier A table or column name as reported by the database.
   * @return The name, quoted if it is not a plain word.
   */
  String quoteIdentifier(String identifier);

  Dialect SQLITE =
      DefaultDialect.builder("SQLITE")
          .jdbcPrefix("jdbc:sqlite:")
          .transactionalDdl(true)
          .suspendPattern("^PRAGMA\\s+foreign_keys\\s*=\\s*'?(OFF|0|FALSE|NO)'?$")
          .resumePattern("^PRAGMA\\s+foreign_keys\\s*=\\s*'?(ON|1|TRUE|YES)'?$")
          .resumeIntegrityChecks("PRAGMA foreign_keys=ON")
          .integrityQuery("PRAGMA foreign_keys")
          .integrityEnabledValue("1")
          .integrityViolationScan("PRAGMA foreign_key_check")
          .ledgerTableDdl(
              "CREATE TABLE IF NOT EXISTS {{table}} ("
                  + "migration_id TEXT PRIMARY KEY, applied_at TEXT NOT NULL)")
          .build();

  Dialect H2 =
      DefaultDialect.builder("H2")
          .jdbcPrefix("jdbc:h2:")
          .transactionalDdl(false)
          .suspendPattern("^SET\\s+REFERENTIAL_INTEGRITY\\s+FALSE$")
          .resumePattern("^SET\\s+REFERENTIAL_INTEGRITY\\s+TRUE$")
          .resumeIntegrityChecks("SET REFERENTIAL_INTEGRITY TRUE")
          // H2 2.x does not expose the database-wide setting, so there is no query for it
          .build();

  Dialect POSTGRESQL =
      DefaultDialect.builder("POSTGRESQL")
          .jdbcPrefix("jdbc:postgresql:")
          .transactionalDdl(true)
          .suspendPattern(
              "^SET\\s+(SESSION\\s+)?session_replication_role\\s*(=|TO)\\s*'?replica'?$")
          .resumePattern(
              "^SET\\s+(SESSION\\s+)?session_replication_role\\s*(=|TO)\\s*'?(origin|DEFAULT)'?$")
          .resumeIntegrityChecks("SET session_replication_role = origin")
          .integrityQuery("SHOW session_replication_role")
          .integrityEnabledValue("origin")
          .build();

  Dialect MY_SQL =
      DefaultDialect.builder("MY_SQL")
          .jdbcPrefix("jdbc:mysql:")
          .transactionalDdl(false)
          .suspendPattern("^SET\\s+(SESSION\\s+)?FOREIGN_KEY_CHECKS\\s*=\\s*(0|OFF)$")
          .resumePattern("^SET\\s+(SESSION\\s+)?FOREIGN_KEY_CHECKS\\s*=\\s*(1|ON)$")
          .resumeIntegrityChecks("SET FOREIGN_KEY_CHECKS=1")
          .integrityQuery("SELECT @@FOREIGN_KEY_CHECKS")
          .integrityEnabledValue("1")
          .identifierQuote('`')
          .build();

  static Stream<Dialect> values() {
    return Stream.of(SQLITE, H2, POSTGRESQL, MY_SQL);
  }

  /**
   * @param name The exact dialect name, e.g. {@code SQLITE}.
   * @return The dialect.
   * @throws IllegalArgumentException If there is no such dialect.
   */
  static Dialect getValueByName(String name) {
    return values()
        .filter(it -> it.getName().equals(name))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown dialect: "
                        + name
                        + ". Expected one of "
                        + values().map(Dialect::getName).collect(Collectors.toList())));
  }

  /**
   * @param url A JDBC URL.
   * @return The dialect matching the URL's vendor prefix.
   * @throws IllegalArgumentException If the vendor is not supported.
   */
  static Dialect fromJdbcUrl(String url) {
    return values()
        .filter(it -> url.startsWith(it.getJdbcPrefix()))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException("Cannot determine dialect from JDBC URL " + url));
  }
}
