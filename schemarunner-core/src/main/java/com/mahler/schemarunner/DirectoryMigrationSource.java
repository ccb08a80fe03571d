package com.mahler.schemarunner;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads migrations from the {@code .sql} files in a single directory. Each file is one migration,
 * named {@code <id>_<name>.sql} where the id is a zero-padded number such as {@code 0003}.
 *
 * <p>Files may begin with comment lines documenting the migration. A line of the form {@code --
 * Migration: <text>} supplies the description; otherwise it is derived from the file name.
 *
 * <p>Usage:
 *
 * <pre>MigrationSource source = DirectoryMigrationSource.builder()
 *   .directory(Path.of("src/migrations"))
 *   .build();</pre>
 */
@Slf4j
@Builder
public final class DirectoryMigrationSource implements MigrationSource, Validatable {

  private static final Pattern FILE_NAME = Pattern.compile("^(\\d+)_([A-Za-z0-9_\\-.]+)\\.sql$");
  private static final Pattern DESCRIPTION =
      Pattern.compile("^\\s*--\\s*Migration:\\s*(.+?)\\s*$", Pattern.MULTILINE);

  /** The directory to read. Required. */
  private final Path directory;

  /** The encoding of the migration files. Defaults to UTF-8. */
  @Builder.Default private final Charset charset = StandardCharsets.UTF_8;

  @Override
  public void validate(Validator validator) {
    validator.notNull("directory", directory);
    validator.notNull("charset", charset);
  }

  @Override
  public List<Migration> list() {
    new Validator().validate(this);
    if (!Files.isDirectory(directory)) {
      throw new DiscoveryException("Migration directory " + directory + " does not exist");
    }
    Map<String, Migration> byId = new TreeMap<>();
    for (Path file : sqlFiles()) {
      Migration migration = load(file);
      Migration existing = byId.putIfAbsent(migration.getId(), migration);
      if (existing != null) {
        throw new DiscoveryException(
            "Duplicate migration id "
                + migration.getId()
                + ": "
                + existing.getSource()
                + " and "
                + migration.getSource());
      }
    }
    checkIdWidths(byId.keySet());
    log.debug("Found {} migrations in {}", byId.size(), directory);
    return new ArrayList<>(byId.values());
  }

  private List<Path> sqlFiles() {
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(Files::isRegularFile)
          .filter(it -> it.getFileName().toString().endsWith(".sql"))
          .sorted(Comparator.comparing(it -> it.getFileName().toString()))
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new DiscoveryException("Unable to list migration directory " + directory, e);
    }
  }

  private Migration load(Path file) {
    String fileName = file.getFileName().toString();
    Matcher nameMatcher = FILE_NAME.matcher(fileName);
    if (!nameMatcher.matches()) {
      throw new DiscoveryException(
          "Migration file " + fileName + " does not follow the <id>_<name>.sql naming convention");
    }
    String script;
    try {
      script = Files.readString(file, charset);
    } catch (IOException e) {
      throw new DiscoveryException("Unable to read migration file " + fileName, e);
    }
    List<String> statements = SqlScriptParser.parse(fileName, script);
    if (statements.isEmpty()) {
      throw new DiscoveryException("Migration file " + fileName + " contains no statements");
    }
    Matcher descriptionMatcher = DESCRIPTION.matcher(script);
    String description =
        descriptionMatcher.find()
            ? descriptionMatcher.group(1)
            : nameMatcher.group(2).replace('_', ' ');
    return new Migration(nameMatcher.group(1), description, statements, fileName);
  }

  private static void checkIdWidths(Iterable<String> ids) {
    String first = null;
    for (String id : ids) {
      if (first == null) {
        first = id;
      } else if (id.length() != first.length()) {
        throw new DiscoveryException(
            "Migration ids "
                + first
                + " and "
                + id
                + " have different widths; zero-pad them so they sort in numeric order");
      }
    }
  }
}
