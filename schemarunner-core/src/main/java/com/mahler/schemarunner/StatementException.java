package com.mahler.schemarunner;

import java.sql.SQLException;

/** Thrown when the database rejects one of a migration's statements. */
public class StatementException extends MigrationException {

  public StatementException(String migrationId, int statementIndex, SQLException cause) {
    super(
        "Migration "
            + migrationId
            + " failed at statement #"
            + statementIndex
            + ": "
            + cause.getMessage(),
        migrationId,
        statementIndex,
        cause);
  }
}
