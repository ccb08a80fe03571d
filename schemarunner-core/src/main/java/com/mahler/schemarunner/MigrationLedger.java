package com.mahler.schemarunner;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Records which migrations have been applied, in a table of the target database shaped {@code
 * (migration_id PRIMARY KEY, applied_at)}. The table is created on first use, so there is no
 * separate initialisation step. Entries are only ever inserted.
 */
@Slf4j
@Builder
public final class MigrationLedger implements Validatable {

  /** The database dialect. Required. */
  private final Dialect dialect;

  /** The ledger table name. Defaults to {@code schema_migrations}. */
  @Getter @Builder.Default private final String tableName = "schema_migrations";

  private volatile boolean bootstrapped;

  @Override
  public void validate(Validator validator) {
    validator.notNull("dialect", dialect);
    validator.notBlank("tableName", tableName);
    validator.isTrue(
        "tableName",
        tableName.matches("[A-Za-z_][A-Za-z0-9_]*"),
        "must be a plain identifier but was %s",
        tableName);
  }

  /**
   * @param connection The connection to the target database.
   * @param migrationId The migration id.
   * @return True if the migration has been recorded as applied.
   * @throws LedgerWriteException If the ledger cannot be read.
   */
  public boolean isApplied(Connection connection, String migrationId) {
    bootstrap(connection, migrationId);
    try {
      return exists(connection, migrationId);
    } catch (SQLException e) {
      throw new LedgerWriteException(
          "Unable to read ledger " + tableName + " for migration " + migrationId, migrationId, e);
    }
  }

  /**
   * @param connection The connection to the target database.
   * @return The ids of all applied migrations, in id order.
   * @throws LedgerWriteException If the ledger cannot be read.
   */
  public Set<String> appliedIds(Connection connection) {
    bootstrap(connection, null);
    Set<String> ids = new LinkedHashSet<>();
    try (PreparedStatement s =
            connection.prepareStatement(
                "SELECT migration_id FROM " + tableName + " ORDER BY migration_id");
        ResultSet rs = s.executeQuery()) {
      while (rs.next()) {
        ids.add(rs.getString(1));
      }
      return ids;
    } catch (SQLException e) {
      throw new LedgerWriteException("Unable to read ledger " + tableName, null, e);
    }
  }

  /**
   * Records a migration as applied. Recording one that is already present is a no-op, so that a
   * retried run does not fail on its own earlier success.
   *
   * @param connection The connection to the target database.
   * @param migrationId The migration id.
   * @param appliedAt When the migration completed.
   * @throws LedgerWriteException If the entry cannot be written.
   */
  public void recordApplied(Connection connection, String migrationId, Instant appliedAt) {
    bootstrap(connection, migrationId);
    try (PreparedStatement s =
        connection.prepareStatement(
            "INSERT INTO " + tableName + " (migration_id, applied_at) VALUES (?, ?)")) {
      s.setString(1, migrationId);
      s.setString(2, appliedAt.toString());
      s.executeUpdate();
      log.debug("Recorded migration {} as applied at {}", migrationId, appliedAt);
    } catch (SQLException e) {
      log.info(
          "Error recording migration {} ({} - {}). May already be recorded, checking",
          migrationId,
          e.getClass().getSimpleName(),
          e.getMessage());
      if (alreadyRecorded(connection, migrationId, e)) {
        log.info("Migration {} was already recorded as applied", migrationId);
        return;
      }
      throw new LedgerWriteException(
          "Unable to record migration " + migrationId + " in ledger " + tableName + ": "
              + e.getMessage(),
          migrationId,
          e);
    }
  }

  private boolean alreadyRecorded(Connection connection, String migrationId, SQLException cause) {
    try {
      return exists(connection, migrationId);
    } catch (SQLException e) {
      cause.addSuppressed(e);
      return false;
    }
  }

  private boolean exists(Connection connection, String migrationId) throws SQLException {
    try (PreparedStatement s =
        connection.prepareStatement(
            "SELECT 1 FROM " + tableName + " WHERE migration_id = ?")) {
      s.setString(1, migrationId);
      try (ResultSet rs = s.executeQuery()) {
        return rs.next();
      }
    }
  }

  private void bootstrap(Connection connection, String migrationId) {
    if (bootstrapped) {
      return;
    }
    new Validator().validate(this);
    try {
      dialect.createLedgerTableIfNotExists(connection, tableName);
      bootstrapped = true;
    } catch (SQLException e) {
      throw new LedgerWriteException(
          "Unable to create ledger " + tableName + ": " + e.getMessage(), migrationId, e);
    }
  }
}
