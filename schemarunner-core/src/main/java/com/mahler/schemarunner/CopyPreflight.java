package com.mahler.schemarunner;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks the column layout of a table-copy statement ({@code INSERT INTO t SELECT ... FROM s})
 * immediately before it runs, so that a copy between mismatched tables fails without touching any
 * rows.
 *
 * <p>A positional {@code INSERT INTO t SELECT * FROM s} only works if both tables declare the same
 * columns in the same order. Such copies are rewritten to name their columns explicitly, matched by
 * name, and are rejected if the source has a column the target lacks.
 *
 * <p>Where a source column is copied into a target column and both declare a type, the two must
 * fall in the same broad family (numeric, character or binary), judged from the declared type name
 * the way SQLite assigns column affinity. Other types ({@code NUMERIC}, {@code DATE}, {@code
 * BOOLEAN} and the like) and computed expressions are not checked, nor are lengths or precision.
 */
@Slf4j
final class CopyPreflight {

  private static final String IDENTIFIER = "[\\w.\"`]+";
  private static final Pattern COPY =
      Pattern.compile(
          "^INSERT\\s+INTO\\s+(?<target>"
              + IDENTIFIER
              + ")\\s*(?:\\((?<columns>[^)]*)\\))?\\s*SELECT\\s+(?<select>.+?)\\s+FROM\\s+(?<source>"
              + IDENTIFIER
              + ")(?<rest>\\s+(?:WHERE|ORDER|LIMIT|GROUP)\\b.*)?$",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

  private CopyPreflight() {}

  /**
   * @param connection The connection the copy will run on, so uncommitted tables are visible.
   * @param dialect The database dialect.
   * @param migrationId The migration being applied.
   * @param statementIndex 1-based position of the statement.
   * @param statement The statement.
   * @return The statement to execute in place of {@code statement}. This is {@code statement}
   *     itself unless it was a positional copy.
   * @throws SchemaMismatchException If the copy's columns do not line up.
   * @throws SQLException If either table's columns cannot be read.
   */
  static String check(
      Connection connection,
      Dialect dialect,
      String migrationId,
      int statementIndex,
      String statement)
      throws SQLException {
    Matcher matcher = COPY.matcher(statement.trim());
    if (!matcher.matches()) {
      return statement;
    }
    String target = matcher.group("target");
    String source = matcher.group("source");
    String select = matcher.group("select").trim();
    String rest = matcher.group("rest") == null ? "" : matcher.group("rest");
    Map<String, String> targetTypes = columnsOf(connection, target);
    Map<String, String> sourceTypes = columnsOf(connection, source);
    List<String> targetColumns = new ArrayList<>(targetTypes.keySet());
    List<String> sourceColumns = new ArrayList<>(sourceTypes.keySet());
    boolean selectAll = select.equals("*");
    List<String> selected =
        selectAll
            ? sourceColumns
            : splitTopLevel(select).stream()
                .map(CopyPreflight::unquote)
                .collect(Collectors.toList());

    if (matcher.group("columns") != null) {
      List<String> insertColumns =
          splitTopLevel(matcher.group("columns")).stream()
              .map(CopyPreflight::unquote)
              .collect(Collectors.toList());
      Set<String> unknown = missingFrom(insertColumns, targetColumns);
      if (!unknown.isEmpty()) {
        throw new SchemaMismatchException(
            migrationId, statementIndex, target + " has no column(s) " + unknown);
      }
      if (insertColumns.size() != selected.size()) {
        throw new SchemaMismatchException(
            migrationId,
            statementIndex,
            "copy names "
                + insertColumns.size()
                + " column(s) of "
                + target
                + " but selects "
                + selected.size()
                + " from "
                + source);
      }
      checkTypes(
          migrationId,
          statementIndex,
          source,
          sourceTypes,
          selected,
          target,
          targetTypes,
          insertColumns);
      return statement;
    }

    if (!selectAll) {
      if (selected.size() != targetColumns.size()) {
        throw new SchemaMismatchException(
            migrationId,
            statementIndex,
            target
                + " has "
                + targetColumns.size()
                + " column(s) but the copy selects "
                + selected.size()
                + " from "
                + source);
      }
      checkTypes(
          migrationId,
          statementIndex,
          source,
          sourceTypes,
          selected,
          target,
          targetTypes,
          targetColumns);
      return statement;
    }

    Set<String> missing = missingFrom(sourceColumns, targetColumns);
    if (!missing.isEmpty()) {
      throw new SchemaMismatchException(
          migrationId,
          statementIndex,
          source
              + " has "
              + sourceColumns.size()
              + " column(s) but "
              + target
              + " has "
              + targetColumns.size()
              + "; no column in "
              + target
              + " for "
              + missing);
    }
    checkTypes(
        migrationId,
        statementIndex,
        source,
        sourceTypes,
        sourceColumns,
        target,
        targetTypes,
        sourceColumns);
    String columnList =
        sourceColumns.stream().map(dialect::quoteIdentifier).collect(Collectors.joining(", "));
    String rewritten =
        "INSERT INTO "
            + target
            + " ("
            + columnList
            + ") SELECT "
            + columnList
            + " FROM "
            + source
            + rest;
    log.info(
        "Migration {} statement #{}: copying {} into {} by column name",
        migrationId,
        statementIndex,
        source,
        target);
    return rewritten;
  }

  /** Column names mapped to their declared type names, in table order. */
  private static Map<String, String> columnsOf(Connection connection, String table)
      throws SQLException {
    Map<String, String> columns = new LinkedHashMap<>();
    try (Statement s = connection.createStatement();
        ResultSet rs = s.executeQuery("SELECT * FROM " + table + " WHERE 1 = 0")) {
      ResultSetMetaData metaData = rs.getMetaData();
      for (int i = 1; i <= metaData.getColumnCount(); i++) {
        columns.put(metaData.getColumnName(i), metaData.getColumnTypeName(i));
      }
    }
    return columns;
  }

  private static void checkTypes(
     String migrationId,
     int statementIndex,
     String source,
     Map<String,
     String> sourceTypes,
     List<String> selected,
     String target,
     Map<String,
     String> targetTypes,
     List<String> into) {     for (int i = 0; i < selected.size(); i++) {
      String from = selected.get(i);
      String to = into.get(i);
      String fromType = typeOf(sourceTypes, from);
      String toType = typeOf(targetTypes, to);
      String fromFamily = typeFamily(fromType);
      String toFamily = typeFamily(toType);
      if (fromFamily != null && toFamily != null && !fromFamily.equals(toFamily)) {
        throw new SchemaMismatchException(
            migrationId,
            statementIndex,
            source
                + "."
                + from
                + " is "
                + fromType
                + " but "
                + target
                + "."
                + to
                + " is "
                + toType);
      }
    }
  }

  /** Null if the table has no such column, or the column has no declared type. */
  private static String typeOf(Map<String, String> types, String column) {
    return types.entrySet().stream()
        .filter(it -> it.getKey().equalsIgnoreCase(column))
        .map(Map.Entry::getValue)
        .filter(Objects::nonNull)
        .findFirst()
        .orElse(null);
  }

  static String typeFamily(String typeName) {
    if (typeName == null) {
      return null;
    }
    String type = typeName.toUpperCase(Locale.ROOT);
    if (type.contains("INT")
        || type.contains("REAL")
        || type.contains("FLOA")
        || type.contains("DOUB")) {
      return "numeric";
    }
    if (type.contains("CHAR") || type.contains("CLOB") || type.contains("TEXT")) {
      return "character";
    }
    if (type.contains("BLOB") || type.contains("BINARY") || type.contains("BYTEA")) {
      return "binary";
    }
    return null;
  }

  private static Set<String> missingFrom(List<String> wanted, List<String> available) {
    Set<String> present =
        available.stream().map(it -> it.toLowerCase(Locale.ROOT)).collect(Collectors.toSet());
    return wanted.stream()
        .filter(it -> !present.contains(it.toLowerCase(Locale.ROOT)))
        .collect(Collectors.toCollection(TreeSet::new));
  }

  /** Splits on commas which are not inside parentheses or quotes. */
  static List<String> splitTopLevel(String list) {
    List<String> parts = new ArrayList<>();
    StringBuilder part = new StringBuilder();
    int depth = 0;
    char quote = 0;
    for (char c : list.toCharArray()) {
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"' || c == '`') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == ',' && depth == 0) {
        parts.add(part.toString().trim());
        part.setLength(0);
        continue;
      }
      part.append(c);
    }
    if (!part.toString().isBlank()) {
      parts.add(part.toString().trim());
    }
    return parts;
  }

  private static String unquote(String identifier) {
    if (identifier.length() > 1) {
      char first = identifier.charAt(0);
      if ((first == '"' || first == '`') && identifier.charAt(identifier.length() - 1) == first) {
        return identifier.substring(1, identifier.length() - 1);
      }
    }
    return identifier;
  }
}
