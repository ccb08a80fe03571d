package com.mahler.schemarunner;

/**
 * The lifecycle of a single migration within a run: {@code PENDING -> APPLYING -> APPLIED |
 * FAILED}. Migrations already in the ledger start the run as {@link #APPLIED}.
 */
public enum MigrationState {
  PENDING,
  APPLYING,
  APPLIED,
  FAILED;

  /**
   * @param next The proposed next state.
   * @return True if a migration in this state may move to {@code next}.
   */
  public boolean canMoveTo(MigrationState next) {
    switch (this) {
      case PENDING:
        return next == APPLYING;
      case APPLYING:
        return next == APPLIED || next == FAILED;
      default:
        return false;
    }
  }
}
