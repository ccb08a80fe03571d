package com.mahler.schemarunner;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a SQL script into statements on top-level semicolons. Handles line and block comments
 * (which are dropped), quoted strings and identifiers, and {@code CREATE TRIGGER ... BEGIN ... END}
 * bodies, whose inner semicolons do not end the statement.
 */
final class SqlScriptParser {

  private static final Pattern TRIGGER_START =
      Pattern.compile("^CREATE\\s+(TEMP\\s+|TEMPORARY\\s+)?TRIGGER\\b", Pattern.CASE_INSENSITIVE);

  private final String scriptName;
  private final String script;
  private final List<String> statements = new ArrayList<>();
  private final StringBuilder current = new StringBuilder();
  private int pos;
  private int line = 1;
  private int blockDepth;

  private SqlScriptParser(String scriptName, String script) {
    this.scriptName = scriptName;
    this.script = script;
  }

  /**
   * @param scriptName Name used in error messages.
   * @param script The script text.
   * @return The statements, trimmed, without their terminating semicolons.
   * @throws DiscoveryException If a string, identifier, comment or trigger body is unterminated.
   */
  static List<String> parse(String scriptName, String script) {
    SqlScriptParser parser = new SqlScriptParser(scriptName, script);
    parser.run();
    return parser.statements;
  }

  private void run() {
    while (pos < script.length()) {
      char c = script.charAt(pos);
      if (c == '-' && peek(1) == '-') {
        skipLineComment();
      } else if (c == '/' && peek(1) == '*') {
        skipBlockComment();
      } else if (c == '\'' || c == '"' || c == '`') {
        copyQuoted(c);
      } else if (Character.isLetter(c) || c == '_') {
        copyWord();
      } else if (c == ';') {
        pos++;
        terminate(false);
      } else {
        if (c == '\n') {
          line++;
        }
        current.append(c);
        pos++;
      }
    }
    terminate(true);
  }

  private void terminate(boolean endOfScript) {
    String statement = current.toString().trim();
    if (statement.isEmpty()) {
      current.setLength(0);
      blockDepth = 0;
      return;
    }
    if (TRIGGER_START.matcher(statement).find() && blockDepth > 0) {
      if (endOfScript) {
        throw malformed("unterminated trigger body");
      }
      current.append(';');
      return;
    }
    statements.add(statement);
    current.setLength(0);
    blockDepth = 0;
  }

  /** Copies a keyword or unquoted identifier, tracking BEGIN/CASE ... END nesting. */
  private void copyWord() {
    int start = pos;
    while (pos < script.length() && isWordPart(script.charAt(pos))) {
      pos++;
    }
    String word = script.substring(start, pos);
    current.append(word);
    if (start > 0 && script.charAt(start - 1) == '.') {
      // a qualified column name such as NEW.end
      return;
    }
    if (word.equalsIgnoreCase("BEGIN") || word.equalsIgnoreCase("CASE")) {
      blockDepth++;
    } else if (word.equalsIgnoreCase("END") && blockDepth > 0) {
      blockDepth--;
    }
  }

  private void skipLineComment() {
    while (pos < script.length() && script.charAt(pos) != '\n') {
      pos++;
    }
  }

  private void skipBlockComment() {
    int startLine = line;
    pos += 2;
    while (pos < script.length()) {
      char c = script.charAt(pos);
      if (c == '*' && peek(1) == '/') {
        pos += 2;
        current.append(' ');
        return;
      }
      if (c == '\n') {
        line++;
      }
      pos++;
    }
    throw malformed("unterminated block comment starting on line " + startLine);
  }

  private void copyQuoted(char quote) {
    int startLine = line;
    current.append(quote);
    pos++;
    while (pos < script.length()) {
      char c = script.charAt(pos);
      current.append(c);
      pos++;
      if (c == '\n') {
        line++;
      }
      if (c == quote) {
        if (peek(0) == quote) {
          // doubled quote is an escaped quote
          current.append(quote);
          pos++;
        } else {
          return;
        }
      }
    }
    throw malformed(
        "unterminated " + (quote == '\'' ? "string" : "identifier") + " starting on line " + startLine);
  }

  private static boolean isWordPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }

  private char peek(int offset) {
    int i = pos + offset;
    return i < script.length() ? script.charAt(i) : '\0';
  }

  private DiscoveryException malformed(String detail) {
    return new DiscoveryException("Malformed migration " + scriptName + ": " + detail);
  }
}
