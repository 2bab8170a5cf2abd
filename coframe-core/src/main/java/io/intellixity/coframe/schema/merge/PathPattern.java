package io.intellixity.coframe.schema.merge;

import java.util.regex.Pattern;

/**
 * Glob over dot-notation paths: {@code *} matches any run of characters (dots included), {@code ?} matches
 * one character, {@code [abc]} a character class.
 */
public final class PathPattern {
  private final String glob;
  private final Pattern regex;

  private PathPattern(String glob) {
    this.glob = glob;
    this.regex = Pattern.compile(toRegex(glob));
  }

  public static PathPattern compile(String glob) {
    if (glob == null || glob.isBlank()) throw new IllegalArgumentException("pattern is blank");
    return new PathPattern(glob);
  }

  public boolean matches(String path) {
    return path != null && regex.matcher(path).matches();
  }

  public boolean isLiteral() {
    return glob.indexOf('*') < 0 && glob.indexOf('?') < 0 && glob.indexOf('[') < 0;
  }

  public String glob() { return glob; }

  private static String toRegex(String glob) {
    StringBuilder out = new StringBuilder(glob.length() + 8);
    int i = 0;
    while (i < glob.length()) {
      char c = glob.charAt(i++);
      switch (c) {
        case '*' -> out.append(".*");
        case '?' -> out.append('.');
        case '[' -> {
          int close = glob.indexOf(']', i);
          if (close < 0) {
            out.append("\\[");
          } else {
            String body = glob.substring(i, close);
            if (body.startsWith("!")) body = "^" + body.substring(1);
            out.append('[').append(body.replace("\\", "\\\\")).append(']');
            i = close + 1;
          }
        }
        default -> out.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return out.toString();
  }

  @Override public String toString() { return glob; }
}
