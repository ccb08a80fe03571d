package com.mahler.schemarunner;

import static com.mahler.schemarunner.TestSupport.copyFixture;
import static com.mahler.schemarunner.TestSupport.execute;
import static com.mahler.schemarunner.TestSupport.queryLong;
import static com.mahler.schemarunner.TestSupport.queryStrings;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Widening {@code trades.status} by rebuilding the table, as migration 0003 does. */
class TestTradeStatusMigration {

  private static final String INSERT_TRADE =
      "INSERT INTO trades (id, recommendation_id, opened_at, status, underlying, spread_type,"
          + " short_strike, long_strike, expiration, entry_credit, contracts)"
          + " VALUES ('%s', 'rec-1', '2026-01-05T15:00:00Z', '%s', 'SPY', 'bull_put', 580, 575,"
          + " '2026-02-20', 1.25, 2)";

  @TempDir Path dir;

  private Path migrations;
  private String url;

  @BeforeEach
  void setUp() throws IOException, SQLException {
    migrations = Files.createDirectory(dir.resolve("migrations"));
    url = TestSupport.sqliteUrl(dir);
    copyFixture("0001_initial_schema.sql", migrations);
    copyFixture("0002_positions.sql", migrations);
    runner().run();
    execute(
        url,
        "INSERT INTO recommendations (id, underlying, spread_type, short_strike, long_strike,"
            + " expiration, credit, max_loss) VALUES ('rec-1', 'SPY', 'bull_put', 580, 575,"
            + " '2026-02-20', 1.25, 375)",
        String.format(INSERT_TRADE, "t-1", "open"),
        String.format(INSERT_TRADE, "t-2", "open"),
        String.format(INSERT_TRADE, "t-3", "closed"),
        "INSERT INTO positions (id, trade_id, underlying, current_value)"
            + " VALUES ('p-1', 't-1', 'SPY', 0.8)",
        "INSERT INTO positions (id, trade_id, underlying, current_value)"
            + " VALUES ('p-2', 't-2', 'SPY', 0.6)");
    copyFixture("0003_trade_status_pending_fill.sql", migrations);
  }

  private MigrationRunner runner() {
    return MigrationRunner.builder()
        .connectionProvider(ConnectionProvider.fromConnectionDetails(url, null, null))
        .dialect(Dialect.SQLITE)
        .source(DirectoryMigrationSource.builder().directory(migrations).build())
        .build();
  }

  @Test
  void oldConstraintRejectsNewStatuses() {
    SQLException e =
        assertThrows(
            SQLException.class, () -> execute(url, String.format(INSERT_TRADE, "t-9", "expired")));
    assertThat(e.getMessage(), containsString("CHECK constraint failed"));
  }

  @Test
  void widensStatusWithoutLosingRows() throws SQLException {
    List<String> before = queryStrings(url, "SELECT id || ':' || status FROM trades ORDER BY id");

    RunResult result = runner().run();

    assertThat(result.getApplied(), contains("0003"));
    assertThat(result.getSkipped(), contains("0001", "0002"));
    assertThat(queryLong(url, "SELECT COUNT(*) FROM trades"), equalTo(3L));
    assertThat(
        queryStrings(url, "SELECT id || ':' || status FROM trades ORDER BY id"), equalTo(before));
    assertThat(queryLong(url, "SELECT COUNT(*) FROM positions"), equalTo(2L));
    assertThat(queryStrings(url, "PRAGMA foreign_key_check"), empty());
  }

  @Test
  void newStatusesAreAcceptedAndBogusOnesRejected() throws SQLException {
    runner().run();

    execute(url, String.format(INSERT_TRADE, "t-4", "expired"));
    execute(url, String.format(INSERT_TRADE, "t-5", "pending_fill"));
    SQLException e =
        assertThrows(
            SQLException.class, () -> execute(url, String.format(INSERT_TRADE, "t-6", "bogus")));

    assertThat(e.getMessage(), containsString("CHECK constraint failed"));
    assertThat(queryLong(url, "SELECT COUNT(*) FROM trades"), equalTo(5L));
  }

  @Test
  void indexesAreRecreatedAndUsable() throws SQLException {
    runner().run();

    assertThat(
        queryStrings(
            url, "SELECT name FROM sqlite_master WHERE type = 'index' AND tbl_name = 'trades'"
                + " AND name LIKE 'idx_%'"),
        containsInAnyOrder("idx_trades_status", "idx_trades_underlying"));
    assertThat(
        queryLong(url, "SELECT COUNT(*) FROM trades INDEXED BY idx_trades_status"
            + " WHERE status = 'open'"),
        equalTo(2L));
    assertThat(
        queryLong(url, "SELECT COUNT(*) FROM trades INDEXED BY idx_trades_underlying"
            + " WHERE underlying = 'SPY'"),
        equalTo(3L));
  }

  @Test
  void secondRunChangesNothing() throws SQLException {
    runner().run();
    List<String> schema =
        queryStrings(url, "SELECT sql FROM sqlite_master WHERE sql IS NOT NULL ORDER BY name");
    List<String> ledger =
        queryStrings(url, "SELECT migration_id || applied_at FROM schema_migrations ORDER BY 1");

    RunResult second = runner().run();

    assertThat(second.getApplied(), empty());
    assertThat(second.getSkipped(), contains("0001", "0002", "0003"));
    assertThat(
        queryStrings(url, "SELECT sql FROM sqlite_master WHERE sql IS NOT NULL ORDER BY name"),
        equalTo(schema));
    assertThat(
        queryStrings(url, "SELECT migration_id || applied_at FROM schema_migrations ORDER BY 1"),
        equalTo(ledger));
    assertThat(
        queryLong(url, "SELECT COUNT(*) FROM schema_migrations WHERE migration_id = '0003'"),
        equalTo(1L));
  }
}
