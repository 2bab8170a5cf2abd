package io.intellixity.coframe.schema.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A {@code Table.column} reference as written in declarations, e.g. {@code User.id}. */
public record TableColumnRef(String table, String column) {
  private static final Pattern REF = Pattern.compile("^\\s*([A-Za-z_][A-Za-z0-9_]*)\\.([A-Za-z_][A-Za-z0-9_]*)\\s*$");

  /** @return the parsed reference, or {@code null} when {@code s} is not of the form {@code Table.column} */
  public static TableColumnRef parse(String s) {
    if (s == null) return null;
    Matcher m = REF.matcher(s);
    return m.matches() ? new TableColumnRef(m.group(1), m.group(2)) : null;
  }

  @Override public String toString() { return table + "." + column; }
}
