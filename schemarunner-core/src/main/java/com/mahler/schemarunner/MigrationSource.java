package com.mahler.schemarunner;

import java.util.List;

/** Supplies the full, ordered set of migrations. */
public interface MigrationSource {

  /**
   * @return Every known migration, ordered by id ascending.
   * @throws DiscoveryException If the migration set is invalid.
   */
  List<Migration> list();
}
