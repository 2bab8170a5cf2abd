package io.intellixity.coframe.schema.codegen;

import java.util.Locale;
import java.util.Set;

/** Column and table names to Java identifiers. */
final class JavaNames {
  private static final Set<String> KEYWORDS = Set.of(
      "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const", "continue",
      "default", "do", "double", "else", "enum", "extends", "final", "finally", "float", "for", "goto", "if",
      "implements", "import", "instanceof", "int", "interface", "long", "native", "new", "package", "private",
      "protected", "public", "return", "short", "static", "strictfp", "super", "switch", "synchronized", "this",
      "throw", "throws", "transient", "try", "void", "volatile", "while", "true", "false", "null", "record",
      "var", "yield");

  private JavaNames() {}

  /** {@code is_active} -> {@code isActive}, {@code TimeStamp} -> {@code timeStamp}, {@code ID} -> {@code id}. */
  static String field(String name) {
    StringBuilder out = new StringBuilder();
    for (String part : (name == null ? "" : name).split("[_\\-. ]+")) {
      String seg = part.chars().filter(Character::isJavaIdentifierPart)
          .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append).toString();
      if (seg.isEmpty()) continue;
      if (seg.equals(seg.toUpperCase(Locale.ROOT))) seg = seg.toLowerCase(Locale.ROOT);
      out.append(out.length() == 0 ? Character.toLowerCase(seg.charAt(0)) + seg.substring(1) : cap(seg));
    }
    if (out.length() == 0) return "field";
    if (!Character.isJavaIdentifierStart(out.charAt(0))) out.insert(0, '_');
    String s = out.toString();
    return KEYWORDS.contains(s) ? s + "_" : s;
  }

  static String cap(String name) {
    if (name == null || name.isEmpty()) return "";
    return Character.toUpperCase(name.charAt(0)) + name.substring(1);
  }

  /** English-ish plural for collection fields: {@code review -> reviews}, {@code category -> categories}. */
  static String plural(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    if (lower.endsWith("y") && name.length() > 1 && "aeiou".indexOf(lower.charAt(lower.length() - 2)) < 0) {
      return name.substring(0, name.length() - 1) + "ies";
    }
    if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("ch") || lower.endsWith("sh")) {
      return name + "es";
    }
    return name + "s";
  }

  /** Java string literal body. */
  static String escape(String s) {
    StringBuilder out = new StringBuilder(s.length() + 8);
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\\' -> out.append("\\\\");
        case '"' -> out.append("\\\"");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        default -> out.append(c);
      }
    }
    return out.toString();
  }
}
