package io.intellixity.coframe.schema.model;

import io.intellixity.coframe.schema.plugin.Plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The resolved data model handed to collaborators (source generator, command dispatcher, query compiler).
 * <p>
 * Immutable: any schema change requires running the composition pipeline again.
 */
public final class Schema {
  private final List<Plugin> plugins;
  private final TypeCatalog types;
  private final Map<String, TableDef> tables;
  private final Map<String, TableDef> byPhysicalName;

  public Schema(List<Plugin> sortedPlugins, TypeCatalog types, List<TableDef> tables) {
    this.plugins = List.copyOf(sortedPlugins);
    this.types = types;
    Map<String, TableDef> m = new LinkedHashMap<>();
    Map<String, TableDef> p = new LinkedHashMap<>();
    for (TableDef t : tables) {
      m.put(t.name(), t);
      p.putIfAbsent(t.physicalName(), t);
    }
    this.tables = Collections.unmodifiableMap(m);
    this.byPhysicalName = Collections.unmodifiableMap(p);
  }

  /** Plugins in dependency order. */
  public List<Plugin> plugins() { return plugins; }

  public TypeCatalog types() { return types; }

  /** Tables in first-declaration order. */
  public List<TableDef> tables() { return new ArrayList<>(tables.values()); }

  public Optional<TableDef> findTable(String name) { return Optional.ofNullable(tables.get(name)); }

  public TableDef table(String name) {
    TableDef t = tables.get(name);
    if (t == null) throw new IllegalArgumentException("Table '" + name + "' not found");
    return t;
  }

  public Optional<TableDef> findByPhysicalName(String physicalName) {
    return Optional.ofNullable(byPhysicalName.get(physicalName));
  }

  /** Target table of a resolved foreign key. */
  public TableDef targetOf(ForeignKeyRef fk) { return table(fk.targetTableName()); }

  /** Mixin types referenced by any table, in first-use order. */
  public List<TypeDef> usedMixins() {
    Set<String> names = new LinkedHashSet<>();
    for (TableDef t : tables.values()) names.addAll(t.mixins());
    List<TypeDef> out = new ArrayList<>(names.size());
    for (String n : names) out.add(types.get(n));
    return out;
  }

  /** {@code source_imports} declared by the plugins' manifests, deduplicated, in dependency order. */
  public List<String> pluginSourceImports() {
    Set<String> out = new LinkedHashSet<>();
    for (Plugin p : plugins) out.addAll(p.sourceImports());
    return new ArrayList<>(out);
  }
}
