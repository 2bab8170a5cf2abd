package io.intellixity.coframe.schema.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Storage-engine scalar types available to every plugin, with their Java equivalents.
 * <p>
 * A fixed registration table built once; plugin types can only extend these through {@code base}.
 */
public final class BuiltinTypes {
  private static final Map<String, NativeType> NATIVE = new LinkedHashMap<>();

  static {
    register("Integer", "Integer");
    register("BigInteger", "Long");
    register("SmallInteger", "Short");
    register("String", "String");
    register("Text", "String");
    register("Unicode", "String");
    register("UnicodeText", "String");
    register("Boolean", "Boolean");
    register("Date", "java.time.LocalDate");
    register("DateTime", "java.time.LocalDateTime");
    register("Time", "java.time.LocalTime");
    register("Interval", "java.time.Duration");
    register("Numeric", "java.math.BigDecimal");
    register("Float", "Double");
    register("Double", "Double");
    register("LargeBinary", "byte[]");
    register("JSON", "com.fasterxml.jackson.databind.JsonNode");
    register("Uuid", "java.util.UUID");
  }

  private BuiltinTypes() {}

  private static void register(String name, String javaType) {
    NATIVE.put(name, NativeType.of(javaType));
  }

  public static List<TypeDef> all() {
    return NATIVE.entrySet().stream().map(e -> TypeDef.builtin(e.getKey(), e.getValue())).toList();
  }

  public static boolean isBuiltin(String name) { return NATIVE.containsKey(name); }
}
