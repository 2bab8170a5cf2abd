package io.intellixity.coframe.schema.model;

import io.intellixity.coframe.schema.plugin.Plugin;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A table: every plugin that declares the same table name extends it, in dependency order.
 * <p>
 * {@code columns} holds the final physical columns in first-declared order: the table's own (composite types
 * already expanded), then mixin columns, then the generated many-to-many key columns.
 */
public record TableDef(
    /** Logical (class) name. */
    String name,
    String physicalName,
    List<Plugin> owningPlugins,
    /** Merged table attributes without {@code columns}. */
    Map<String, Object> attributes,
    List<ColumnDef> columns,
    /** Mixin type names from the {@code mixins} attribute. */
    List<String> mixins,
    ManyToManyDef manyToMany
) {
  public TableDef {
    owningPlugins = owningPlugins == null ? List.of() : List.copyOf(owningPlugins);
    attributes = Attributes.freeze(attributes);
    columns = columns == null ? List.of() : List.copyOf(columns);
    mixins = mixins == null ? List.of() : List.copyOf(mixins);
  }

  public Optional<ColumnDef> column(String columnName) {
    for (ColumnDef c : columns) {
      if (c.name().equals(columnName)) return Optional.of(c);
    }
    return Optional.empty();
  }

  /** Columns declared by the table itself (composite types expanded), without mixin and join-key columns. */
  public List<ColumnDef> ownColumns() {
    List<ColumnDef> out = new ArrayList<>();
    for (ColumnDef c : columns) {
      if (c.mixin() == null && c.manyToManyTag() == null) out.add(c);
    }
    return out;
  }

  public List<ColumnDef> foreignKeys() {
    List<ColumnDef> out = new ArrayList<>();
    for (ColumnDef c : columns) {
      if (c.isForeignKey()) out.add(c);
    }
    return out;
  }

  public List<String> owningPluginNames() {
    List<String> out = new ArrayList<>(owningPlugins.size());
    for (Plugin p : owningPlugins) out.add(p.name());
    return out;
  }

  public boolean isManyToMany() { return manyToMany != null; }

  /** Every foreign key and many-to-many target has been resolved. */
  public boolean isResolved() {
    for (ColumnDef c : columns) {
      if (c.isForeignKey() && !c.foreignKey().isResolved()) return false;
    }
    return manyToMany == null || manyToMany.isResolved();
  }

  public TableDef withColumns(List<ColumnDef> newColumns, ManyToManyDef m2m) {
    return new TableDef(name, physicalName, owningPlugins, attributes, newColumns, mixins, m2m);
  }
}
