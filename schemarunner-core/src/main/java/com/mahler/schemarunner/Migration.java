package com.mahler.schemarunner;

import java.util.List;
import lombok.Value;

/** A migration loaded by a {@link MigrationSource}. Immutable once authored. */
@Value
public class Migration {

  /** Lexically sortable id, e.g. {@code 0003}. */
  String id;

  String description;

  /** The SQL statements, comments removed, in the order they must run. */
  List<String> statements;

  /** Where the migration was loaded from, for diagnostics. */
  String source;

  public Migration(String id, String description, List<String> statements, String source) {
    this.id = id;
    this.description = description;
    this.statements = List.copyOf(statements);
    this.source = source;
  }
}
