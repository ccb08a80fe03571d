package com.mahler.schemarunner.cli;

import com.mahler.schemarunner.ConnectionProvider;
import com.mahler.schemarunner.Dialect;
import com.mahler.schemarunner.DirectoryMigrationSource;
import com.mahler.schemarunner.MigrationException;
import com.mahler.schemarunner.MigrationRunner;
import com.mahler.schemarunner.RunResult;
import java.io.PrintStream;
import java.io.PrintWriter;
import lombok.extern.slf4j.Slf4j;

/**
 * Command-line entry point. Exits with 0 when every migration is applied (or there was nothing to
 * do), 1 when a migration fails, and 2 when the arguments are invalid. On failure the error stream
 * names the failing migration and, where one statement was at fault, its position in the file.
 */
@Slf4j
public final class SchemaRunnerCli {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_USAGE = 2;

  private final PrintStream out;
  private final PrintStream err;

  SchemaRunnerCli(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  public static void main(String[] args) {
    System.exit(new SchemaRunnerCli(System.out, System.err).run(args));
  }

  int run(String... args) {
    CliOptions options;
    Dialect dialect;
    try {
      options = CliOptions.parse(args);
      if (options.isHelp()) {
        out.println(CliOptions.USAGE);
        return EXIT_OK;
      }
      dialect =
          options.getDialect() == null
              ? Dialect.fromJdbcUrl(options.getUrl())
              : Dialect.getValueByName(options.getDialect());
    } catch (IllegalArgumentException e) {
      err.println("error: " + e.getMessage());
      err.println(CliOptions.USAGE);
      return EXIT_USAGE;
    }

    MigrationRunner.MigrationRunnerBuilder builder =
        MigrationRunner.builder()
            .connectionProvider(
                ConnectionProvider.fromConnectionDetails(
                    options.getUrl(), options.getUser(), options.getPassword()))
            .dialect(dialect)
            .source(DirectoryMigrationSource.builder().directory(options.getDirectory()).build());
    if (options.getLedgerTable() != null) {
      builder.ledgerTable(options.getLedgerTable());
    }
    MigrationRunner runner = builder.build();

    try {
      if (options.isDryRun()) {
        runner.writePending(new PrintWriter(out));
        return EXIT_OK;
      }
      RunResult result = runner.run();
      out.println(
          "Applied "
              + result.getApplied().size()
              + " migration(s), "
              + result.getSkipped().size()
              + " already applied");
      return EXIT_OK;
    } catch (MigrationException e) {
      err.println(e.getMessage());
      return EXIT_FAILED;
    } catch (IllegalArgumentException e) {
      err.println("error: " + e.getMessage());
      return EXIT_USAGE;
    } catch (RuntimeException e) {
      log.error("Migration run failed", e);
      err.println("Migration run failed: " + rootCause(e).getMessage());
      return EXIT_FAILED;
    }
  }

  private static Throwable rootCause(Throwable e) {
    Throwable cause = e;
    while (cause.getCause() != null && cause.getCause() != cause) {
      cause = cause.getCause();
    }
    return cause;
  }
}
