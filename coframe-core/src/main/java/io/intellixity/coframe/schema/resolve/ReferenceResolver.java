package io.intellixity.coframe.schema.resolve;

import io.intellixity.coframe.schema.error.InvalidForeignReferenceException;
import io.intellixity.coframe.schema.error.InvalidManyToManyException;
import io.intellixity.coframe.schema.error.UnknownForeignTableException;
import io.intellixity.coframe.schema.model.ColumnDef;
import io.intellixity.coframe.schema.model.ForeignKeyRef;
import io.intellixity.coframe.schema.model.ManyToManyDef;
import io.intellixity.coframe.schema.model.TableDef;
import io.intellixity.coframe.schema.model.TypeDef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference pass: runs only once every table has been built, so neither plugin order nor column order matters
 * for foreign keys and many-to-many targets.
 * <p>
 * The structural tables are never modified; resolved copies are returned. A foreign key pointing at another
 * foreign key takes the type at the end of the chain. Join columns of many-to-many tables exist only after this
 * pass, so a reference to one is followed to the column the join column points at.
 */
public final class ReferenceResolver {
  private final Map<String, TableDef> structural = new LinkedHashMap<>();

  public ReferenceResolver(List<TableDef> structuralTables) {
    for (TableDef t : structuralTables) structural.put(t.name(), t);
  }

  public List<TableDef> resolveAll() {
    List<TableDef> out = new ArrayList<>(structural.size());
    for (TableDef t : structural.values()) out.add(resolve(t));
    return out;
  }

  TableDef resolve(TableDef table) {
    List<ColumnDef> cols = new ArrayList<>(table.columns().size() + 2);
    for (ColumnDef c : table.columns()) {
      if (!c.isForeignKey()) {
        cols.add(c);
        continue;
      }
      ForeignKeyRef fk = c.foreignKey();
      TableDef target = targetTable(table, c, fk);
      TypeDef type = referencedType(table.name(), c.name(), fk, new LinkedHashSet<>());
      cols.add(c.withForeignKey(fk.resolve(target.physicalName(), type)));
    }

    ManyToManyDef m2m = table.manyToMany();
    if (m2m != null) {
      ManyToManyDef.Target t1 = resolveTarget(table.name(), "target1", m2m.target1());
      ManyToManyDef.Target t2 = resolveTarget(table.name(), "target2", m2m.target2());
      m2m = new ManyToManyDef(t1, t2);
      cols.add(joinColumn(table, "target1", t1));
      cols.add(joinColumn(table, "target2", t2));
      TableStructureBuilder.checkDuplicates(table.name(), cols);
    }
    return table.withColumns(cols, m2m);
  }

  private TableDef targetTable(TableDef table, ColumnDef c, ForeignKeyRef fk) {
    TableDef target = structural.get(fk.targetTableName());
    if (target == null) throw new UnknownForeignTableException(table.name(), c.name(), fk.targetTableName());
    return target;
  }

  private TypeDef referencedType(String tableName, String columnName, ForeignKeyRef fk, Set<String> visiting) {
    TableDef target = structural.get(fk.targetTableName());
    if (target == null) throw new UnknownForeignTableException(tableName, columnName, fk.targetTableName());
    return typeOf(tableName, columnName, target, fk.targetColumnName(), fk.target(), visiting);
  }

  /** Type held by {@code target.columnName}, following foreign keys and join columns of link tables. */
  private TypeDef typeOf(String tableName, String columnName, TableDef target, String targetColumn, String ref,
                         Set<String> visiting) {
    if (!visiting.add(tableName + "." + columnName)) {
      throw new InvalidForeignReferenceException(tableName, columnName, "circular foreign key chain " + visiting);
    }
    ColumnDef col = target.column(targetColumn).orElse(null);
    if (col == null) {
      ManyToManyDef.Target join = joinTarget(target, targetColumn);
      if (join == null) {
        throw new InvalidForeignReferenceException(tableName, columnName,
            "column '" + targetColumn + "' does not exist on table '" + target.name() + "'");
      }
      TableDef linked = structural.get(join.tableName());
      if (linked == null) throw new UnknownForeignTableException(target.name(), targetColumn, join.tableName());
      return typeOf(target.name(), targetColumn, linked, join.columnName(), ref, visiting);
    }
    if (col.isForeignKey()) {
      return referencedType(target.name(), col.name(), col.foreignKey(), visiting);
    }
    if (col.resolvedType() == null) {
      throw new InvalidForeignReferenceException(tableName, columnName, ref + " has no type");
    }
    return col.resolvedType();
  }

  private static ManyToManyDef.Target joinTarget(TableDef table, String column) {
    ManyToManyDef m2m = table.manyToMany();
    if (m2m == null) return null;
    if (m2m.target1().joinColumn().equals(column)) return m2m.target1();
    if (m2m.target2().joinColumn().equals(column)) return m2m.target2();
    return null;
  }

  private ManyToManyDef.Target resolveTarget(String tableName, String key, ManyToManyDef.Target target) {
    TableDef t = structural.get(target.tableName());
    if (t == null) throw new InvalidManyToManyException(tableName, key + " references unknown table '" + target.tableName() + "'");
    if (t.column(target.columnName()).isEmpty() && joinTarget(t, target.columnName()) == null) {
      throw new InvalidManyToManyException(tableName,
          key + " references unknown column '" + target.tableName() + "." + target.columnName() + "'");
    }
    TypeDef type = typeOf(tableName, key, t, target.columnName(), target.tableName() + "." + target.columnName(),
        new LinkedHashSet<>());
    return target.resolve(t.physicalName(), type);
  }

  private static ColumnDef joinColumn(TableDef table, String tag, ManyToManyDef.Target target) {
    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("name", target.joinColumn());
    attrs.put("primary_key", true);
    attrs.put("nullable", false);
    String plugin = table.owningPlugins().isEmpty() ? null : table.owningPlugins().get(0).name();
    return ColumnDef.of(target.joinColumn(), plugin, attrs, target.resolvedType(), null, tag, null);
  }
}
