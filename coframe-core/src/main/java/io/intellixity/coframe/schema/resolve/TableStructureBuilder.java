package io.intellixity.coframe.schema.resolve;

import io.intellixity.coframe.schema.config.YamlDocuments;
import io.intellixity.coframe.schema.error.DuplicateColumnException;
import io.intellixity.coframe.schema.error.InvalidManyToManyException;
import io.intellixity.coframe.schema.error.InvalidMixinException;
import io.intellixity.coframe.schema.merge.ComposedDocument;
import io.intellixity.coframe.schema.merge.Node;
import io.intellixity.coframe.schema.model.ColumnDef;
import io.intellixity.coframe.schema.model.ManyToManyDef;
import io.intellixity.coframe.schema.model.TableColumnRef;
import io.intellixity.coframe.schema.model.TableDef;
import io.intellixity.coframe.schema.model.TypeCatalog;
import io.intellixity.coframe.schema.model.TypeDef;
import io.intellixity.coframe.schema.plugin.Plugin;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structural pass: builds every table from the composed document with its columns fully expanded, leaving
 * foreign keys and many-to-many targets as unresolved stubs.
 */
public final class TableStructureBuilder {
  private final TypeCatalog types;
  private final ColumnResolver columns;

  public TableStructureBuilder(TypeCatalog types) {
    this.types = types;
    this.columns = new ColumnResolver(types);
  }

  public List<TableDef> build(ComposedDocument document, List<Plugin> sortedPlugins) {
    List<TableDef> out = new ArrayList<>();
    for (var e : document.tables().entries().entrySet()) {
      if (!(e.getValue() instanceof Node.MapNode table)) continue;
      out.add(buildTable(e.getKey(), table, contributors(e.getKey(), sortedPlugins)));
    }
    return out;
  }

  TableDef buildTable(String name, Node.MapNode table, List<Plugin> owners) {
    Map<String, Object> attributes = table.without("columns").attributes();
    String physicalName = attributes.get("name") == null
        ? name.toLowerCase(Locale.ROOT)
        : String.valueOf(attributes.get("name"));
    String owner = "table: " + name;

    List<ColumnDef> cols = new ArrayList<>();
    for (Node item : table.list("columns").items()) {
      if (!(item instanceof Node.MapNode column)) continue;
      String plugin = column.plugin() != null ? column.plugin() : table.plugin();
      cols.addAll(columns.expand(column.attributes(), plugin, owner, null, new ArrayDeque<>()));
    }

    List<String> mixins = YamlDocuments.stringList(attributes.get("mixins"));
    for (String mixin : mixins) {
      TypeDef type = types.find(mixin).orElse(null);
      if (type == null || !type.isComposite()) throw new InvalidMixinException(name, mixin);
      for (Map<String, Object> spec : type.columnSpecs()) {
        cols.addAll(columns.expand(spec, type.owningPlugin(), owner, mixin, new ArrayDeque<>(List.of(mixin))));
      }
    }

    checkDuplicates(name, cols);
    return new TableDef(name, physicalName, owners, attributes, cols, mixins, manyToMany(name, attributes.get("many_to_many")));
  }

  static void checkDuplicates(String tableName, List<ColumnDef> cols) {
    Map<String, ColumnDef> seen = new HashMap<>();
    for (ColumnDef c : cols) {
      ColumnDef prev = seen.putIfAbsent(c.name(), c);
      if (prev != null) throw new DuplicateColumnException(tableName, c.name(), prev.plugin(), c.plugin());
    }
  }

  /** A table linked to itself gets {@code tag_id} and {@code tag_id_2} unless both join columns are named. */
  private static ManyToManyDef manyToMany(String tableName, Object value) {
    if (value == null) return null;
    if (!(value instanceof Map<?, ?> m)) throw new InvalidManyToManyException(tableName, "many_to_many must be a mapping");
    ManyToManyDef.Target t1 = target(tableName, "target1", m.get("target1"));
    ManyToManyDef.Target t2 = target(tableName, "target2", m.get("target2"));
    if (t1.joinColumn().equals(t2.joinColumn())) {
      if (!explicitColumn(m.get("target2"))) {
        t2 = t2.withJoinColumn(t2.joinColumn() + "_2");
      } else if (!explicitColumn(m.get("target1"))) {
        t1 = t1.withJoinColumn(t1.joinColumn() + "_1");
      } else {
        throw new InvalidManyToManyException(tableName, "target1 and target2 both use join column '" + t1.joinColumn() + "'");
      }
    }
    return new ManyToManyDef(t1, t2);
  }

  private static boolean explicitColumn(Object target) {
    return target instanceof Map<?, ?> m && m.get("column") != null && !String.valueOf(m.get("column")).isBlank();
  }

  private static ManyToManyDef.Target target(String tableName, String key, Object value) {
    if (value == null) throw new InvalidManyToManyException(tableName, key + " is missing");
    Object ref = value;
    Object joinColumn = null;
    if (value instanceof Map<?, ?> m) {
      ref = m.get("table");
      joinColumn = m.get("column");
    }
    TableColumnRef parsed = ref == null ? null : TableColumnRef.parse(String.valueOf(ref));
    if (parsed == null) {
      throw new InvalidManyToManyException(tableName, key + " '" + ref + "' is not a Table.column reference");
    }
    return ManyToManyDef.Target.stub(parsed, joinColumn == null ? null : String.valueOf(joinColumn));
  }

  /** Plugins declaring {@code tableName}, in dependency order. */
  private static List<Plugin> contributors(String tableName, List<Plugin> sortedPlugins) {
    Map<String, Plugin> out = new LinkedHashMap<>();
    for (Plugin p : sortedPlugins) {
      for (Node.MapNode doc : p.declarations()) {
        if (doc.map(ComposedDocument.TABLES).has(tableName)) out.putIfAbsent(p.name(), p);
      }
    }
    return new ArrayList<>(out.values());
  }
}
