package com.mahler.schemarunner;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the statements of one migration against the target database.
 *
 * <p>Statements which suspend referential-integrity checks run first and statements which resume
 * them run last, both outside any transaction; SQLite, for one, ignores such changes inside a
 * transaction. If the dialect supports transactional DDL the remaining statements run in a single
 * transaction, otherwise they run one at a time and a failure part way through leaves the earlier
 * statements applied. Migrations must therefore be written so they can be safely re-run ({@code
 * CREATE TABLE IF NOT EXISTS}, {@code CREATE INDEX IF NOT EXISTS} and so on).
 *
 * <p>Table rebuilds (create a shadow table, copy the rows, drop the original, rename the shadow)
 * have each copy checked by {@link CopyPreflight} before it runs. Indexes on the rebuilt table are
 * not recreated automatically; the migration must recreate them itself.
 */
@Slf4j
@Builder
public final class StatementExecutor implements Validatable {

  /** The database dialect. Required. */
  private final Dialect dialect;

  /** Set to false to skip the column check before table copies. Defaults to true. */
  @Builder.Default private final boolean preflightCopies = true;

  @Override
  public void validate(Validator validator) {
    validator.notNull("dialect", dialect);
  }

  /**
   * Applies a migration.
   *
   * @param connection The connection to use, in auto-commit mode. Must not be shared with other
   *     work for the duration.
   * @param migration The migration.
   * @throws StatementException If a statement fails.
   * @throws SchemaMismatchException If a table copy would not line up.
   * @throws ConsistencyException If referential-integrity checks are not enabled afterwards, or
   *     could be left disabled on a dialect which cannot report them.
   */
  public void apply(Connection connection, Migration migration) {
    new Validator().validate(this);
    List<Integer> suspend = new ArrayList<>();
    List<Integer> body = new ArrayList<>();
    List<Integer> resume = new ArrayList<>();
    List<String> statements = migration.getStatements();
    for (int i = 0; i < statements.size(); i++) {
      String statement = statements.get(i);
      if (dialect.suspendsIntegrityChecks(statement)) {
        suspend.add(i);
      } else if (dialect.resumesIntegrityChecks(statement)) {
        resume.add(i);
      } else {
        body.add(i);
      }
    }
    boolean suspended = !suspend.isEmpty();
    if (suspended && resume.isEmpty() && !dialect.canReportIntegrityChecks()) {
      throw new ConsistencyException(
          migration.getId(),
          "suspends referential integrity checks without resuming them, and "
              + dialect.getName()
              + " cannot report whether they are enabled; the migration must end with "
              + dialect.getResumeIntegrityChecks());
    }
    log.info(
        "Applying migration {}: {} ({} statements{})",
        migration.getId(),
        migration.getDescription(),
        statements.size(),
        dialect.isTransactionalDdl() ? " in one transaction" : "");

    for (int index : suspend) {
      execute(connection, migration, index);
    }
    try {
      if (dialect.isTransactionalDdl()) {
        executeInTransaction(connection, migration, body);
      } else {
        for (int index : body) {
          execute(connection, migration, index);
        }
      }
    } catch (MigrationException e) {
      if (suspended) {
        Utils.safelyRun(
            "restoring referential integrity checks",
            () -> executeRaw(connection, dialect.getResumeIntegrityChecks()));
      }
      throw e;
    }
    for (int index : resume) {
      execute(connection, migration, index);
    }
    if (suspended) {
      verifyIntegrity(connection, migration);
    }
  }

  private void executeInTransaction(Connection connection, Migration migration, List<Integer> body) {
    if (body.isEmpty()) {
      return;
    }
    int lastPosition = body.get(body.size() - 1) + 1;
    boolean restoreAutoCommit = false;
    try {
      if (connection.getAutoCommit()) {
        log.debug("Setting auto-commit false");
        connection.setAutoCommit(false);
        restoreAutoCommit = true;
      }
      for (int index : body) {
        execute(connection, migration, index);
      }
      log.debug("Committing migration {}", migration.getId());
      connection.commit();
    } catch (SQLException e) {
      rollback(connection, migration, e);
      throw new StatementException(migration.getId(), lastPosition, e);
    } catch (RuntimeException e) {
      rollback(connection, migration, e);
      throw e;
    } finally {
      if (restoreAutoCommit) {
        Utils.safelyRun("restoring auto-commit", () -> connection.setAutoCommit(true));
      }
    }
  }

  private void rollback(Connection connection, Migration migration, Exception cause) {
    try {
      log.warn(
          "Exception applying migration {} ({}{}). Rolling back",
          migration.getId(),
          cause.getClass().getSimpleName(),
          cause.getMessage() == null ? "" : (" - " + cause.getMessage()));
      connection.rollback();
    } catch (Exception ex) {
      log.warn("Failed to roll back", ex);
    }
  }

  private void execute(Connection connection, Migration migration, int index) {
    int position = index + 1;
    String sql = migration.getStatements().get(index);
    try {
      if (preflightCopies) {
        sql = CopyPreflight.check(connection, dialect, migration.getId(), position, sql);
      }
      log.debug("Migration {} statement #{}: {}", migration.getId(), position, sql);
      executeRaw(connection, sql);
    } catch (SQLException e) {
      throw new StatementException(migration.getId(), position, e);
    }
  }

  private static void executeRaw(Connection connection, String sql) throws SQLException {
    try (Statement s = connection.createStatement()) {
      s.execute(sql);
    }
  }

  private void verifyIntegrity(Connection connection, Migration migration) {
    try {
      if (!dialect.canReportIntegrityChecks()) {
        log.debug(
            "{} cannot report referential integrity checks; migration {} resumed them itself",
            dialect.getName(),
            migration.getId());
      } else if (!dialect.integrityChecksEnabled(connection)) {
        throw new ConsistencyException(
            migration.getId(),
            "referential integrity checks were suspended and are still disabled; the migration"
                + " must end with "
                + dialect.getResumeIntegrityChecks());
      }
      List<String> violations = dialect.findIntegrityViolations(connection);
      if (!violations.isEmpty()) {
        throw new ConsistencyException(
            migration.getId(),
            violations.size()
                + " foreign key violation(s) after migration, e.g. "
                + violations.subList(0, Math.min(5, violations.size())));
      }
      log.debug("Referential integrity checks verified after migration {}", migration.getId());
    } catch (SQLException e) {
      throw new ConsistencyException(
          migration.getId(),
          "unable to verify referential integrity checks: " + e.getMessage(),
          e);
    }
  }
}
