package io.intellixity.coframe.schema.model;

/**
 * The Java type a column type ultimately maps to, e.g. {@code java.time.LocalDate} or {@code byte[]}.
 */
public record NativeType(String javaType) {
  public NativeType {
    if (javaType == null || javaType.isBlank()) throw new IllegalArgumentException("javaType is blank");
  }

  public static NativeType of(String javaType) { return new NativeType(javaType); }

  public String simpleName() {
    int i = javaType.lastIndexOf('.');
    return i < 0 ? javaType : javaType.substring(i + 1);
  }

  /** Fully-qualified name to import, or {@code null} for {@code java.lang}, primitives and arrays. */
  public String importName() {
    if (javaType.endsWith("[]") || !javaType.contains(".")) return null;
    String pkg = javaType.substring(0, javaType.lastIndexOf('.'));
    return "java.lang".equals(pkg) ? null : javaType;
  }
}
