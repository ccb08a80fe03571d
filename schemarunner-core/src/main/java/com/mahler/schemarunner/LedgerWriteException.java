package com.mahler.schemarunner;

/** Thrown when the applied-migration ledger cannot be read, created or written. */
public class LedgerWriteException extends MigrationException {

  public LedgerWriteException(String message, String migrationId, Throwable cause) {
    super(message, migrationId, null, cause);
  }
}
