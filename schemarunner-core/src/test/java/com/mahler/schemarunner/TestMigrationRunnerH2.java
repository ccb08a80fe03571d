package com.mahler.schemarunner;

import static com.mahler.schemarunner.TestSupport.write;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** H2 does not roll back DDL, so migrations run statement by statement. */
class TestMigrationRunnerH2 {

  @TempDir Path migrations;

  private HikariDataSource dataSource;

  @BeforeEach
  void setUp() throws IOException {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(
        "jdbc:h2:mem:runner" + System.nanoTime() + ";DB_CLOSE_DELAY=-1;DEFAULT_LOCK_TIMEOUT=2000");
    config.setUsername("test");
    config.setPassword("test");
    dataSource = new HikariDataSource(config);

    write(
        migrations,
        "0001_create_accounts.sql",
        "CREATE TABLE IF NOT EXISTS accounts (id INT PRIMARY KEY, name VARCHAR(50) NOT NULL);");
    write(
        migrations,
        "0002_seed_accounts.sql",
        "INSERT INTO accounts VALUES (1, 'alice');\n"
            + "INSERT INTO accounts VALUES (2, 'bob');\n"
            + "CREATE INDEX IF NOT EXISTS idx_accounts_name ON accounts(name);");
  }

  @AfterEach
  void tearDown() {
    dataSource.close();
  }

  private MigrationRunner runner() {
    return MigrationRunner.builder()
        .connectionProvider(ConnectionProvider.fromDataSource(dataSource))
        .dialect(Dialect.H2)
        .source(DirectoryMigrationSource.builder().directory(migrations).build())
        .ledgerTable("applied_migrations")
        .build();
  }

  private List<String> query(String sql) throws SQLException {
    List<String> result = new ArrayList<>();
    try (Connection connection = dataSource.getConnection();
        Statement s = connection.createStatement();
        ResultSet rs = s.executeQuery(sql)) {
      while (rs.next()) {
        result.add(rs.getString(1));
      }
    }
    return result;
  }

  @Test
  void appliesAndSkips() throws SQLException {
    RunResult first = runner().run();
    RunResult second = runner().run();

    assertThat(first.getApplied(), contains("0001", "0002"));
    assertThat(second.getApplied(), empty());
    assertThat(second.getSkipped(), contains("0001", "0002"));
    assertThat(
        query("SELECT migration_id FROM applied_migrations ORDER BY migration_id"),
        contains("0001", "0002"));
    assertThat(query("SELECT COUNT(*) FROM accounts"), contains("2"));
  }

  @Test
  void partiallyAppliedMigrationCanBeRetried() throws IOException, SQLException {
    write(
        migrations,
        "0003_audit.sql",
        "CREATE TABLE IF NOT EXISTS audit (id INT PRIMARY KEY, note VARCHAR(100));\n"
            + "INSERT INTO audit_log VALUES (1, 'typo');");

    StatementException e = assertThrows(StatementException.class, () -> runner().run());

    assertThat(e.getMigrationId(), equalTo("0003"));
    assertThat(e.getStatementIndex(), equalTo(2));
    // no transactional DDL, so the first statement stays applied
    assertThat(query("SELECT COUNT(*) FROM audit"), contains("0"));
    assertThat(
        query("SELECT migration_id FROM applied_migrations ORDER BY migration_id"),
        contains("0001", "0002"));

    write(
        migrations,
        "0003_audit.sql",
        "CREATE TABLE IF NOT EXISTS audit (id INT PRIMARY KEY, note VARCHAR(100));\n"
            + "INSERT INTO audit VALUES (1, 'fixed');");

    RunResult retry = runner().run();

    assertThat(retry.getApplied(), contains("0003"));
    assertThat(query("SELECT note FROM audit"), contains("fixed"));
  }

  @Test
  void rebuildWithExplicitColumns() throws IOException, SQLException {
    runner().run();
    write(
        migrations,
        "0003_rebuild_accounts.sql",
        "CREATE TABLE IF NOT EXISTS accounts_new (id INT PRIMARY KEY, name VARCHAR(50) NOT NULL,"
            + " status VARCHAR(20) DEFAULT 'open' CHECK (status IN ('open', 'closed')));\n"
            + "INSERT INTO accounts_new (id, name) SELECT id, name FROM accounts;\n"
            + "DROP TABLE accounts;\n"
            + "ALTER TABLE accounts_new RENAME TO accounts;\n"
            + "CREATE INDEX IF NOT EXISTS idx_accounts_name ON accounts(name);");

    runner().run();

    assertThat(
        query("SELECT name || ':' || status FROM accounts ORDER BY id"),
        contains("alice:open", "bob:open"));
  }

  @Test
  void integrityChecksLeftDisabledAreRefused() throws IOException, SQLException {
    write(
        migrations,
        "0003_notes.sql",
        "SET REFERENTIAL_INTEGRITY FALSE;\n"
            + "CREATE TABLE IF NOT EXISTS notes (id INT PRIMARY KEY);");

    ConsistencyException e = assertThrows(ConsistencyException.class, () -> runner().run());

    assertThat(e.getMigrationId(), equalTo("0003"));
    assertThat(e.getMessage(), containsString("SET REFERENTIAL_INTEGRITY TRUE"));
    assertThat(
        query("SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES WHERE TABLE_NAME = 'NOTES'"),
        empty());
    assertThat(
        query("SELECT migration_id FROM applied_migrations ORDER BY migration_id"),
        contains("0001", "0002"));
  }

  @Test
  void integrityChecksSuspendedAndResumedAreApplied() throws IOException, SQLException {
    write(
        migrations,
        "0003_notes.sql",
        "SET REFERENTIAL_INTEGRITY FALSE;\n"
            + "CREATE TABLE IF NOT EXISTS notes (id INT PRIMARY KEY);\n"
            + "SET REFERENTIAL_INTEGRITY TRUE;");

    RunResult result = runner().run();

    assertThat(result.getApplied(), contains("0001", "0002", "0003"));
    assertThat(query("SELECT COUNT(*) FROM notes"), contains("0"));
  }

  @Test
  void integrityQueryWithNoRowsIsAConsistencyFailure() throws SQLException {
    Dialect dialect =
        DefaultDialect.builder("H2_EMPTY_QUERY")
            .jdbcPrefix("jdbc:h2:")
            .suspendPattern("^SET\\s+REFERENTIAL_INTEGRITY\\s+FALSE$")
            .resumePattern("^SET\\s+REFERENTIAL_INTEGRITY\\s+TRUE$")
            .resumeIntegrityChecks("SET REFERENTIAL_INTEGRITY TRUE")
            .integrityQuery("SELECT 'TRUE' FROM INFORMATION_SCHEMA.TABLES WHERE 1 = 0")
            .integrityEnabledValue("TRUE")
            .build();
    Migration migration =
        new Migration(
            "0003",
            "notes",
            List.of(
                "SET REFERENTIAL_INTEGRITY FALSE",
                "CREATE TABLE IF NOT EXISTS notes (id INT PRIMARY KEY)",
                "SET REFERENTIAL_INTEGRITY TRUE"),
            "0003_notes.sql");

    StatementExecutor executor = StatementExecutor.builder().dialect(dialect).build();

    try (Connection connection = dataSource.getConnection()) {
      assertThrows(SQLException.class, () -> dialect.integrityChecksEnabled(connection));
      ConsistencyException e =
          assertThrows(ConsistencyException.class, () -> executor.apply(connection, migration));
      assertThat(e.getMessage(), containsString("returned no rows"));
    }
  }

  @Test
  void poolWithAutoCommitOffStillRecordsEachMigration() throws SQLException {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(dataSource.getJdbcUrl());
    config.setUsername("test");
    config.setPassword("test");
    config.setAutoCommit(false);
    try (HikariDataSource manualCommit = new HikariDataSource(config)) {
      MigrationRunner runner =
          MigrationRunner.builder()
              .connectionProvider(ConnectionProvider.fromDataSource(manualCommit))
              .dialect(Dialect.H2)
              .source(DirectoryMigrationSource.builder().directory(migrations).build())
              .build();

      RunResult first = runner.run();
      RunResult second = runner.run();

      assertThat(first.getApplied(), contains("0001", "0002"));
      assertThat(second.getApplied(), empty());
      assertThat(second.getSkipped(), contains("0001", "0002"));
      try (Connection connection = manualCommit.getConnection()) {
        assertFalse(connection.getAutoCommit());
      }
    }

    assertThat(
        query("SELECT migration_id FROM schema_migrations ORDER BY migration_id"),
        contains("0001", "0002"));
    assertThat(query("SELECT COUNT(*) FROM accounts"), contains("2"));
  }
}
