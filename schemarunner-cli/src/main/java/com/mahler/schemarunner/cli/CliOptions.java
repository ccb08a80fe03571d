package com.mahler.schemarunner.cli;

import java.nio.file.Path;
import lombok.Builder;
import lombok.Value;

/** Parsed command-line arguments. */
@Value
@Builder
class CliOptions {

  static final String USAGE =
      "Usage: schemarunner --url <jdbc-url> --dir <migrations-dir> [options]\n"
          + "\n"
          + "Applies the pending migrations in <migrations-dir> to the database at <jdbc-url>.\n"
          + "\n"
          + "Options:\n"
          + "  --url <jdbc-url>        JDBC URL of the target database (required)\n"
          + "  --dir <path>            Directory of <id>_<name>.sql migration files (required)\n"
          + "  --user <name>           Database user\n"
          + "  --password <secret>     Database password\n"
          + "  --dialect <name>        SQLITE, H2, POSTGRESQL or MY_SQL (default: from the URL)\n"
          + "  --ledger-table <name>   Ledger table name (default: schema_migrations)\n"
          + "  --dry-run               Print the pending migrations instead of applying them\n"
          + "  --help                  Show this message";

  String url;
  Path directory;
  String user;
  String password;
  String dialect;
  String ledgerTable;
  boolean dryRun;
  boolean help;

  /**
   * @param args The arguments, as {@code --name value} or {@code --name=value}.
   * @return The options.
   * @throws IllegalArgumentException If the arguments are invalid.
   */
  static CliOptions parse(String... args) {
    CliOptionsBuilder builder = builder();
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      String name = arg;
      String value = null;
      int equals = arg.indexOf('=');
      if (arg.startsWith("--") && equals > 0) {
        name = arg.substring(0, equals);
        value = arg.substring(equals + 1);
      }
      switch (name) {
        case "--help":
        case "-h":
          return builder.help(true).build();
        case "--dry-run":
          builder.dryRun(true);
          continue;
        case "--url":
        case "--dir":
        case "--user":
        case "--password":
        case "--dialect":
        case "--ledger-table":
          if (value == null) {
            if (i + 1 >= args.length) {
              throw new IllegalArgumentException("Missing value for " + name);
            }
            value = args[++i];
          }
          break;
        default:
          throw new IllegalArgumentException("Unknown option " + arg);
      }
      switch (name) {
        case "--url":
          builder.url(value);
          break;
        case "--dir":
          builder.directory(Path.of(value));
          break;
        case "--user":
          builder.user(value);
          break;
        case "--password":
          builder.password(value);
          break;
        case "--dialect":
          builder.dialect(value);
          break;
        default:
          builder.ledgerTable(value);
          break;
      }
    }
    CliOptions options = builder.build();
    if (options.url == null || options.url.isBlank()) {
      throw new IllegalArgumentException("--url is required");
    }
    if (options.directory == null) {
      throw new IllegalArgumentException("--dir is required");
    }
    return options;
  }
}
