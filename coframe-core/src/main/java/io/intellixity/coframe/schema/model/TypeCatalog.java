package io.intellixity.coframe.schema.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Resolved types by name: built-ins first, then plugin types in dependency order. */
public final class TypeCatalog {
  private final Map<String, TypeDef> types;

  public TypeCatalog(List<TypeDef> types) {
    Map<String, TypeDef> m = new LinkedHashMap<>();
    for (TypeDef t : types) m.put(t.name(), t);
    this.types = Collections.unmodifiableMap(m);
  }

  public Optional<TypeDef> find(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(types.get(name));
  }

  public TypeDef get(String name) {
    TypeDef t = types.get(name);
    if (t == null) throw new IllegalArgumentException("Unknown type: " + name);
    return t;
  }

  public boolean contains(String name) { return types.containsKey(name); }

  public Collection<TypeDef> all() { return types.values(); }

  public int size() { return types.size(); }
}
