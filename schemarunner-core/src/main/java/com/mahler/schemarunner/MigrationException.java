package com.mahler.schemarunner;

import lombok.Getter;

/**
 * Base type for every failure raised while discovering or applying migrations. Carries enough
 * context to locate the problem by hand: the id of the migration involved and, where a single
 * statement was at fault, its 1-based position within the migration file.
 */
@Getter
public abstract class MigrationException extends RuntimeException {

  /** The migration being processed, or null if the failure is not specific to one migration. */
  private final String migrationId;

  /** 1-based position of the failing statement within its migration, or null. */
  private final Integer statementIndex;

  protected MigrationException(
      String message, String migrationId, Integer statementIndex, Throwable cause) {
    super(message, cause);
    this.migrationId = migrationId;
    this.statementIndex = statementIndex;
  }
}
