package com.mahler.schemarunner;

import java.io.PrintWriter;
import java.io.Writer;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies pending migrations, in id order, to a database and records each in the ledger.
 *
 * <p>Migrations run strictly one after another. The first failure stops the run, so a later
 * migration never runs on top of a failed one. Re-running after fixing the problem is safe: applied
 * migrations are skipped.
 *
 * <p>Only one runner may work on a database at a time. Nothing here locks against a concurrent run.
 *
 * <p>Usage:
 *
 * <pre>RunResult result = MigrationRunner.builder()
 *   .connectionProvider(ConnectionProvider.fromConnectionDetails(url, null, null))
 *   .dialect(Dialect.SQLITE)
 *   .source(DirectoryMigrationSource.builder().directory(dir).build())
 *   .build()
 *   .run();</pre>
 */
@Slf4j
@Builder
public final class MigrationRunner implements Validatable {

  /** Where connections to the target database come from. Required. */
  private final ConnectionProvider connectionProvider;

  /** The target database dialect. Required. */
  private final Dialect dialect;

  /** Where the migrations come from. Required. */
  private final MigrationSource source;

  /** The name of the ledger table. Defaults to {@code schema_migrations}. */
  @Builder.Default private final String ledgerTable = "schema_migrations";

  /** Source of the {@code applied_at} time written to the ledger. Defaults to the UTC clock. */
  @Builder.Default private final Clock clock = Clock.systemUTC();

  /** Notified of each migration's progress. Optional. */
  @Builder.Default private final MigrationListener listener = MigrationListener.NONE;

  @Override
  public void validate(Validator validator) {
    validator.notNull("connectionProvider", connectionProvider);
    validator.notNull("dialect", dialect);
    validator.notNull("source", source);
    validator.notBlank("ledgerTable", ledgerTable);
    validator.notNull("clock", clock);
    validator.notNull("listener", listener);
  }

  /**
   * Applies every pending migration.
   *
   * @return The migrations applied and skipped.
   * @throws MigrationException On the first failure, identifying the migration and statement.
   */
  public RunResult run() {
    new Validator().validate(this);
    List<Migration> migrations = source.list();
    MigrationLedger ledger = ledger();
    StatementExecutor executor = StatementExecutor.builder().dialect(dialect).build();
    List<String> applied = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    Map<String, MigrationState> states = new LinkedHashMap<>();
    try (Connection connection = connectionProvider.obtainConnection()) {
      boolean autoCommit = forceAutoCommit(connection);
      try {
        Set<String> appliedIds = ledger.appliedIds(connection);
        warnAboutLedger(migrations, appliedIds);
        migrations.forEach(
            it ->
                states.put(
                    it.getId(),
                    appliedIds.contains(it.getId())
                        ? MigrationState.APPLIED
                        : MigrationState.PENDING));
        for (Migration migration : migrations) {
          if (ledger.isApplied(connection, migration.getId())) {
            log.debug("Skipping migration {}, already applied", migration.getId());
            states.put(migration.getId(), MigrationState.APPLIED);
            listener.skipped(migration);
            skipped.add(migration.getId());
            continue;
          }
          moveTo(states, migration, MigrationState.APPLYING);
          listener.applying(migration);
          try {
            executor.apply(connection, migration);
            ledger.recordApplied(connection, migration.getId(), clock.instant());
          } catch (MigrationException e) {
            log.error(
                "Migration {} ({}) failed. No further migrations will be run",
                migration.getId(),
                migration.getSource(),
                e);
            moveTo(states, migration, MigrationState.FAILED);
            listener.failed(migration, e);
            throw e;
          }
          log.info("Applied migration {}: {}", migration.getId(), migration.getDescription());
          moveTo(states, migration, MigrationState.APPLIED);
          listener.applied(migration);
          applied.add(migration.getId());
        }
      } finally {
        restoreAutoCommit(connection, autoCommit);
      }
    } catch (SQLException e) {
      throw new UncheckedException(e);
    }
    log.info(
        "Migrations complete: {} applied, {} already applied", applied.size(), skipped.size());
    return new RunResult(applied, skipped, states);
  }

  /**
   * @return The migrations not yet recorded in the ledger, in the order they would run.
   */
  public List<Migration> pending() {
    new Validator().validate(this);
    List<Migration> migrations = source.list();
    MigrationLedger ledger = ledger();
    try (Connection connection = connectionProvider.obtainConnection()) {
      boolean autoCommit = forceAutoCommit(connection);
      try {
        Set<String> appliedIds = ledger.appliedIds(connection);
        return migrations.stream()
            .filter(it -> !appliedIds.contains(it.getId()))
            .collect(Collectors.toList());
      } finally {
        restoreAutoCommit(connection, autoCommit);
      }
    } catch (SQLException e) {
      throw new UncheckedException(e);
    }
  }

  /**
   * Writes the pending migrations as a single SQL script, so they can be reviewed or applied with
   * other tools.
   *
   * @param writer The writer to which the migrations are written.
   */
  public void writePending(Writer writer) {
    PrintWriter printWriter = new PrintWriter(writer);
    List<Migration> pending = pending();
    if (pending.isEmpty()) {
      printWriter.println("-- No pending migrations");
    }
    pending.forEach(
        migration -> {
          printWriter.print("-- ");
          printWriter.print(migration.getId());
          printWriter.print(": ");
          printWriter.println(migration.getDescription());
          migration.getStatements().forEach(statement -> printWriter.println(statement + ";"));
          printWriter.println();
        });
    printWriter.flush();
  }

  private void moveTo(
      Map<String, MigrationState> states, Migration migration, MigrationState next) {
    MigrationState current = states.get(migration.getId());
    if (!current.canMoveTo(next)) {
      throw new IllegalStateException(
          "Migration " + migration.getId() + " cannot move from " + current + " to " + next);
    }
    log.debug("Migration {}: {} -> {}", migration.getId(), current, next);
    states.put(migration.getId(), next);
    listener.stateChanged(migration, next);
  }

  /**
   * Each statement and each ledger write must be committed as it completes, whatever mode the
   * connection arrives in (pools are often configured with auto-commit off).
   *
   * @return The connection's original auto-commit setting.
   */
  private static boolean forceAutoCommit(Connection connection) throws SQLException {
    boolean autoCommit = connection.getAutoCommit();
    if (!autoCommit) {
      log.debug("Connection has auto-commit off; enabling it for the run");
      connection.setAutoCommit(true);
    }
    return autoCommit;
  }

  private static void restoreAutoCommit(Connection connection, boolean autoCommit) {
    if (!autoCommit) {
      Utils.safelyRun("restoring auto-commit", () -> connection.setAutoCommit(false));
    }
  }

  private MigrationLedger ledger() {
    return MigrationLedger.builder().dialect(dialect).tableName(ledgerTable).build();
  }

  private static void warnAboutLedger(List<Migration> migrations, Set<String> appliedIds) {
    Set<String> known = migrations.stream().map(Migration::getId).collect(Collectors.toSet());
    Set<String> unknown = new TreeSet<>(appliedIds);
    unknown.removeAll(known);
    if (!unknown.isEmpty()) {
      log.warn("Ledger lists migrations with no matching file: {}", unknown);
    }
    String latestApplied =
        appliedIds.stream().filter(known::contains).max(String::compareTo).orElse(null);
    if (latestApplied == null) {
      return;
    }
    migrations.stream()
        .map(Migration::getId)
        .filter(id -> !appliedIds.contains(id) && id.compareTo(latestApplied) < 0)
        .forEach(
            id ->
                log.warn(
                    "Migration {} is pending but sorts before applied migration {}; it will be"
                        + " applied out of order",
                    id,
                    latestApplied));
  }
}
