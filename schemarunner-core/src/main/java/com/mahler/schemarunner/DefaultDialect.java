package com.mahler.schemarunner;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class DefaultDialect implements Dialect {

  private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  static Builder builder(String name) {
    return new Builder(name);
  }

  @Getter private final String name;
  @Getter private final String jdbcPrefix;
  @Getter private final boolean transactionalDdl;
  private final Pattern suspendPattern;
  private final Pattern resumePattern;
  @Getter private final String resumeIntegrityChecks;
  private final String integrityQuery;
  private final String integrityEnabledValue;
  private final String integrityViolationScan;
  private final String ledgerTableDdl;
  private final char identifierQuote;

  @Override
  public boolean suspendsIntegrityChecks(String statement) {
    return suspendPattern.matcher(statement.trim()).matches();
  }

  @Override
  public boolean resumesIntegrityChecks(String statement) {
    return resumePattern.matcher(statement.trim()).matches();
  }

  @Override
  public boolean canReportIntegrityChecks() {
    return integrityQuery != null;
  }

  @Override
  public boolean integrityChecksEnabled(Connection connection) throws SQLException {
    if (integrityQuery == null) {
      throw new UnsupportedOperationException(name + " cannot report foreign key enforcement");
    }
    try (Statement s = connection.createStatement();
        ResultSet rs = s.executeQuery(integrityQuery)) {
      if (!rs.next()) {
        throw new SQLException(integrityQuery + " returned no rows");
      }
      String value = rs.getString(1);
      return value != null && value.trim().equalsIgnoreCase(integrityEnabledValue);
    }
  }

  @Override
  public List<String> findIntegrityViolations(Connection connection) throws SQLException {
    List<String> violations = new ArrayList<>();
    if (integrityViolationScan == null) {
      return violations;
    }
    try (Statement s = connection.createStatement();
        ResultSet rs = s.executeQuery(integrityViolationScan)) {
      ResultSetMetaData metaData = rs.getMetaData();
      while (rs.next()) {
        StringBuilder row = new StringBuilder();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
          if (i > 1) {
            row.append(", ");
          }
          row.append(metaData.getColumnLabel(i)).append('=').append(rs.getString(i));
        }
        violations.add(row.toString());
      }
    }
    return violations;
  }

  @Override
  public void createLedgerTableIfNotExists(Connection connection, String tableName)
      throws SQLException {
    try (Statement s = connection.createStatement()) {
      s.execute(ledgerTableDdl.replace("{{table}}", tableName));
    }
  }

  @Override
  public String quoteIdentifier(String identifier) {
    if (PLAIN_IDENTIFIER.matcher(identifier).matches()) {
      return identifier;
    }
    String quote = String.valueOf(identifierQuote);
    return quote + identifier.replace(quote, quote + quote) + quote;
  }

  @Override
  public String toString() {
    return name;
  }

  @Setter
  @Accessors(fluent = true)
  static final class Builder {
    private final String name;
    private String jdbcPrefix;
    private boolean transactionalDdl;
    private String suspendPattern = "(?!)";
    private String resumePattern = "(?!)";
    private String resumeIntegrityChecks;
    private String integrityQuery;
    private String integrityEnabledValue;
    private String integrityViolationScan;
    private String ledgerTableDdl =
        "CREATE TABLE IF NOT EXISTS {{table}} ("
            + "migration_id VARCHAR(255) NOT NULL PRIMARY KEY, applied_at VARCHAR(64) NOT NULL)";
    private char identifierQuote = '"';

    Builder(String name) {
      this.name = name;
    }

    Dialect build() {
      return new DefaultDialect(
          name,
          jdbcPrefix,
          transactionalDdl,
          Pattern.compile(suspendPattern, Pattern.CASE_INSENSITIVE),
          Pattern.compile(resumePattern, Pattern.CASE_INSENSITIVE),
          resumeIntegrityChecks,
          integrityQuery,
          integrityEnabledValue,
          integrityViolationScan,
          ledgerTableDdl,
          identifierQuote);
    }
  }
}
