package io.intellixity.coframe.schema.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Helpers for the loosely typed attribute maps carried by types, tables and columns. */
public final class Attributes {
  private Attributes() {}

  /** Unmodifiable, order-preserving copy; unlike {@code Map.copyOf} it accepts null values. */
  public static Map<String, Object> freeze(Map<String, Object> m) {
    if (m == null || m.isEmpty()) return Map.of();
    return Collections.unmodifiableMap(new LinkedHashMap<>(m));
  }

  /**
   * Deep-merge {@code base} under {@code own}: keys of {@code own} always win, nested maps present on both
   * sides are merged recursively. Neither input is modified.
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> mergeUnder(Map<String, Object> own, Map<String, Object> base) {
    Map<String, Object> out = new LinkedHashMap<>(base);
    for (var e : own.entrySet()) {
      Object mine = e.getValue();
      Object theirs = out.get(e.getKey());
      if (mine instanceof Map<?, ?> mm && theirs instanceof Map<?, ?> tm) {
        out.put(e.getKey(), mergeUnder((Map<String, Object>) mm, (Map<String, Object>) tm));
      } else {
        out.put(e.getKey(), mine);
      }
    }
    return out;
  }

  public static boolean isTrue(Object v) {
    if (v instanceof Boolean b) return b;
    if (v == null) return false;
    return "true".equalsIgnoreCase(String.valueOf(v).trim());
  }
}
