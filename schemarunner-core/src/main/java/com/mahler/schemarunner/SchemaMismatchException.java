package com.mahler.schemarunner;

/**
 * Thrown by the copy pre-flight check when the source and target of an {@code INSERT ... SELECT}
 * do not line up. The copy statement itself is never issued.
 */
public class SchemaMismatchException extends MigrationException {

  public SchemaMismatchException(String migrationId, int statementIndex, String detail) {
    super(
        "Migration "
            + migrationId
            + " failed at statement #"
            + statementIndex
            + ": schema mismatch, "
            + detail,
        migrationId,
        statementIndex,
        null);
  }
}
