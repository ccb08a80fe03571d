package com.mahler.schemarunner;

import java.util.List;
import java.util.Map;
import lombok.Value;

/** The outcome of a successful {@link MigrationRunner#run()}. */
@Value
public class RunResult {

  /** Ids of the migrations applied by this run, in the order applied. */
  List<String> applied;

  /** Ids of the migrations skipped because the ledger already listed them. */
  List<String> skipped;

  /** The final state of every migration in the source, keyed and ordered by id. */
  Map<String, MigrationState> states;
}
