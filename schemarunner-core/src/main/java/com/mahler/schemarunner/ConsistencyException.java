package com.mahler.schemarunner;

/**
 * Thrown when a migration that suspended referential-integrity checks completes without them being
 * enabled again, or leaves rows that violate a foreign key. The schema changes may already be
 * committed at this point, so the database needs manual inspection.
 */
public class ConsistencyException extends MigrationException {

  public ConsistencyException(String migrationId, String message) {
    super("Migration " + migrationId + ": " + message, migrationId, null, null);
  }

  public ConsistencyException(String migrationId, String message, Throwable cause) {
    super("Migration " + migrationId + ": " + message, migrationId, null, cause);
  }
}
