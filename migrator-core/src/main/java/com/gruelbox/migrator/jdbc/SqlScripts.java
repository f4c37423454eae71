package com.gruelbox.migrator.jdbc;

import static java.util.stream.Collectors.toList;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** Splits migration scripts into individual statements. */
public final class SqlScripts {

  /** Placed on its own between statements in a multi-statement script. */
  public static final String SEPARATOR = "--;;";

  private static final Pattern SPLITTER = Pattern.compile(Pattern.quote(SEPARATOR));

  private SqlScripts() {}

  /**
   * @param script The script. May be null.
   * @return The non-blank statements in the script, trimmed, in order.
   */
  public static List<String> statements(String script) {
    if (script == null || script.isBlank()) {
      return List.of();
    }
    return Arrays.stream(SPLITTER.split(script))
        .map(String::trim)
        .filter(statement -> !statement.isEmpty())
        .collect(toList());
  }
}
