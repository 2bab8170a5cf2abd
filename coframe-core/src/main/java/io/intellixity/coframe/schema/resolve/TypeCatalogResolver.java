package io.intellixity.coframe.schema.resolve;

import io.intellixity.coframe.schema.error.CircularTypeInheritanceException;
import io.intellixity.coframe.schema.error.DuplicateTypeException;
import io.intellixity.coframe.schema.error.UnknownBaseTypeException;
import io.intellixity.coframe.schema.merge.ComposedDocument;
import io.intellixity.coframe.schema.merge.MergeEngine;
import io.intellixity.coframe.schema.merge.Node;
import io.intellixity.coframe.schema.model.Attributes;
import io.intellixity.coframe.schema.model.BuiltinTypes;
import io.intellixity.coframe.schema.model.ColumnDef;
import io.intellixity.coframe.schema.model.TypeCatalog;
import io.intellixity.coframe.schema.model.TypeDef;
import io.intellixity.coframe.schema.plugin.Plugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the {@link TypeCatalog}: built-in types, then every plugin-declared type in dependency order.
 * <p>
 * Types are declared once: a plugin redeclaring a built-in or another plugin's type fails. A plugin may spread
 * one type over several of its documents; those parts are merged, composite columns by name. Each plugin type is
 * resolved by walking its {@code base} chain; resolution always starts again from the type's own attributes,
 * so resolving the same type twice gives the same chain and attributes.
 */
public final class TypeCatalogResolver {
  private static final Logger log = LoggerFactory.getLogger(TypeCatalogResolver.class);

  public TypeCatalog build(List<Plugin> sortedPlugins) {
    Map<String, TypeDef> types = new LinkedHashMap<>();
    for (TypeDef t : BuiltinTypes.all()) types.put(t.name(), t);

    for (Plugin p : sortedPlugins) {
      for (var e : ownTypes(p).entries().entrySet()) {
        TypeDef existing = types.get(e.getKey());
        if (existing != null) throw new DuplicateTypeException(e.getKey(), p.name(), existing.owningPlugin());
        Map<String, Object> decl = e.getValue() instanceof Node.MapNode m ? m.attributes() : Map.of();
        types.put(e.getKey(), TypeDef.declared(e.getKey(), p.name(), decl));
      }
    }

    Map<String, TypeDef> resolved = new LinkedHashMap<>();
    for (TypeDef t : types.values()) resolved.put(t.name(), resolve(t, types));

    // composite columns may use any type, so they are built against the complete catalog
    TypeCatalog scalarCatalog = new TypeCatalog(new ArrayList<>(resolved.values()));
    ColumnResolver columns = new ColumnResolver(scalarCatalog);
    List<TypeDef> out = new ArrayList<>(resolved.size());
    for (TypeDef t : resolved.values()) {
      if (!t.isComposite()) {
        out.add(t);
        continue;
      }
      List<ColumnDef> embedded = new ArrayList<>();
      for (Map<String, Object> spec : t.columnSpecs()) {
        embedded.addAll(columns.expand(spec, t.owningPlugin(), "type: " + t.name(), null, new ArrayDeque<>(List.of(t.name()))));
      }
      out.add(t.withEmbeddedColumns(embedded));
    }

    log.info("coframe.types op=resolved builtin={} declared={}",
        BuiltinTypes.all().size(), out.size() - BuiltinTypes.all().size());
    return new TypeCatalog(out);
  }

  /** Types of one plugin, with a type split over several of its documents merged into one declaration. */
  private static Node.MapNode ownTypes(Plugin p) {
    if (p.declarations().size() == 1) return p.declarations().get(0).map(ComposedDocument.TYPES);
    MergeEngine engine = new MergeEngine();
    for (Node.MapNode doc : p.declarations()) {
      engine.merge(new Node.MapNode(Map.of(ComposedDocument.TYPES, doc.map(ComposedDocument.TYPES)), null), p.name());
    }
    return engine.result().types();
  }

  /**
   * Resolve {@code type} against {@code types}: inheritance chain (nearest ancestor first), attributes
   * inherited from every ancestor (own attributes win) and the native type of the chain's terminal type.
   */
  public TypeDef resolve(TypeDef type, Map<String, TypeDef> types) {
    if (type.isBuiltin()) return type;

    List<String> chain = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    seen.add(type.name());
    Map<String, Object> merged = new LinkedHashMap<>(type.attributes());
    List<Map<String, Object>> specs = type.columnSpecs();

    TypeDef current = type;
    while (current.baseTypeName() != null) {
      String baseName = current.baseTypeName();
      TypeDef base = types.get(baseName);
      if (base == null) throw new UnknownBaseTypeException(current.name(), baseName, current.owningPlugin());
      if (!seen.add(baseName)) {
        List<String> cycle = new ArrayList<>(seen);
        cycle.add(baseName);
        throw new CircularTypeInheritanceException(cycle);
      }
      chain.add(baseName);
      merged = Attributes.mergeUnder(merged, base.attributes());
      if (specs.isEmpty()) specs = base.columnSpecs();
      current = base;
    }

    if (current.nativeType() == null && specs.isEmpty()) {
      throw new UnknownBaseTypeException(type.name(), null, type.owningPlugin());
    }
    return type.resolved(chain, merged, current.nativeType(), specs);
  }
}
