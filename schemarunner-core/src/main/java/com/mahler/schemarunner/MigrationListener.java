package com.mahler.schemarunner;

/** Receives notifications as a {@link MigrationRunner} moves each migration through its states. */
public interface MigrationListener {

  MigrationListener NONE = new MigrationListener() {};

  /**
   * Called when a migration is found in the ledger and so not run again.
   *
   * @param migration The migration.
   */
  default void skipped(Migration migration) {
    // No-op
  }

  /**
   * Called when a migration moves from {@link MigrationState#PENDING} to {@link
   * MigrationState#APPLYING}.
   *
   * @param migration The migration.
   */
  default void applying(Migration migration) {
    // No-op
  }

  /**
   * Called once a migration has been applied and recorded in the ledger.
   *
   * @param migration The migration.
   */
  default void applied(Migration migration) {
    // No-op
  }

  /**
   * Called when a migration fails. The run stops immediately afterwards.
   *
   * @param migration The migration.
   * @param cause The failure.
   */
  default void failed(Migration migration, MigrationException cause) {
    // No-op
  }

  /**
   * Called whenever a migration moves to a new {@link MigrationState}, before the more specific
   * callback for that state.
   *
   * @param migration The migration.
   * @param state The state it has just entered.
   */
  default void stateChanged(Migration migration, MigrationState state) {
    // No-op
  }
}
