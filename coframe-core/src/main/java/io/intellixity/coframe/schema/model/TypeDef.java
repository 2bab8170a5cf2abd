package io.intellixity.coframe.schema.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A column type: a built-in storage type or a plugin-declared type that refines one through {@code base}
 * (alias {@code inherits}), or a composite type whose {@code columns} form a reusable column group.
 */
public record TypeDef(
    String name,
    /** Declaring plugin, {@link #BUILTIN} for storage-engine types. */
    String owningPlugin,
    /** Own attributes, without {@code base}, {@code inherits} and {@code columns}. */
    Map<String, Object> attributes,
    String baseTypeName,
    /** Ancestors, nearest first. Empty until resolved and for types without a base. */
    List<String> inheritanceChain,
    /** Own attributes with every ancestor's deep-merged underneath. */
    Map<String, Object> resolvedAttributes,
    NativeType nativeType,
    /** Raw column declarations of a composite type (own, else inherited from the nearest ancestor). */
    List<Map<String, Object>> columnSpecs,
    List<ColumnDef> embeddedColumns
) {
  public static final String BUILTIN = "<builtin>";

  public TypeDef {
    attributes = Attributes.freeze(attributes);
    inheritanceChain = inheritanceChain == null ? List.of() : List.copyOf(inheritanceChain);
    resolvedAttributes = resolvedAttributes == null ? attributes : Attributes.freeze(resolvedAttributes);
    List<Map<String, Object>> specs = new ArrayList<>();
    if (columnSpecs != null) {
      for (Map<String, Object> s : columnSpecs) specs.add(Attributes.freeze(s));
    }
    columnSpecs = List.copyOf(specs);
    embeddedColumns = embeddedColumns == null ? List.of() : List.copyOf(embeddedColumns);
  }

  public static TypeDef builtin(String name, NativeType nativeType) {
    return new TypeDef(name, BUILTIN, Map.of(), null, List.of(), Map.of(), nativeType, List.of(), List.of());
  }

  /** Unresolved plugin type from its declaration attributes. */
  @SuppressWarnings("unchecked")
  public static TypeDef declared(String name, String plugin, Map<String, Object> declaration) {
    Map<String, Object> own = new LinkedHashMap<>(declaration);
    Object base = own.remove("base");
    Object inherits = own.remove("inherits");
    Object columns = own.remove("columns");
    String baseName = base != null ? String.valueOf(base) : (inherits != null ? String.valueOf(inherits) : null);

    List<Map<String, Object>> specs = new ArrayList<>();
    if (columns instanceof List<?> l) {
      for (Object o : l) {
        if (o instanceof Map<?, ?> m) specs.add((Map<String, Object>) m);
      }
    }
    return new TypeDef(name, plugin, own, baseName, List.of(), own, null, specs, List.of());
  }

  public boolean isBuiltin() { return BUILTIN.equals(owningPlugin); }

  /** A type used as a column group (mixin) rather than a scalar column type. */
  public boolean isComposite() { return !columnSpecs.isEmpty(); }

  public boolean isResolved() { return nativeType != null || isComposite(); }

  public TypeDef resolved(List<String> chain, Map<String, Object> merged, NativeType nativeType,
                          List<Map<String, Object>> specs) {
    return new TypeDef(name, owningPlugin, attributes, baseTypeName, chain, merged, nativeType, specs, embeddedColumns);
  }

  public TypeDef withEmbeddedColumns(List<ColumnDef> columns) {
    return new TypeDef(name, owningPlugin, attributes, baseTypeName, inheritanceChain, resolvedAttributes,
        nativeType, columnSpecs, columns);
  }

  /** The storage-engine type name at the end of the chain, e.g. {@code String} for {@code Name -> Description}. */
  public String storageTypeName() {
    return inheritanceChain.isEmpty() ? name : inheritanceChain.get(inheritanceChain.size() - 1);
  }
}
