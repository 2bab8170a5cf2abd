package io.intellixity.coframe.schema.resolve;

import io.intellixity.coframe.schema.error.InvalidForeignReferenceException;
import io.intellixity.coframe.schema.error.SchemaCompositionException;
import io.intellixity.coframe.schema.model.ColumnDef;
import io.intellixity.coframe.schema.model.ForeignKeyRef;
import io.intellixity.coframe.schema.model.TableColumnRef;
import io.intellixity.coframe.schema.model.TypeCatalog;
import io.intellixity.coframe.schema.model.TypeDef;

import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns one raw column declaration into physical {@link ColumnDef}s.
 * <p>
 * A column whose {@code type} is a known scalar type inherits the type's attributes it does not set itself. A
 * composite type expands into one column per embedded column, named with the declaration's {@code prefix}.
 * Anything else must be a {@code Table.column} reference (or an explicit {@code foreign_key.target}) and
 * becomes an unresolved {@link ForeignKeyRef} stub.
 */
final class ColumnResolver {
  private final TypeCatalog types;

  ColumnResolver(TypeCatalog types) {
    this.types = types;
  }

  /**
   * @param owner     "table: X" / "type: X", for messages
   * @param mixin     mixin type name for columns contributed through a table's {@code mixins}, else null
   * @param expanding composite types currently being expanded, guards against a type containing itself
   */
  List<ColumnDef> expand(Map<String, Object> raw, String plugin, String owner, String mixin, Deque<String> expanding) {
    Object nameValue = raw.get("name");
    if (nameValue == null) throw new SchemaCompositionException("Column without name in " + owner + ": " + raw);
    String name = String.valueOf(nameValue);

    Object fk = raw.get("foreign_key");
    if (fk != null) return List.of(foreignKey(name, plugin, owner, raw, fk, mixin));

    Object typeValue = raw.get("type");
    if (typeValue == null) {
      throw new InvalidForeignReferenceException(ownerName(owner), name, "no type declared");
    }
    String typeName = String.valueOf(typeValue);
    TypeDef type = types.find(typeName).orElse(null);

    if (type != null && type.isComposite()) {
      if (expanding.contains(type.name())) {
        throw new SchemaCompositionException("Composite type " + type.name() + " contains itself (" + owner + ")");
      }
      String prefix = raw.get("prefix") == null ? "" : String.valueOf(raw.get("prefix"));
      expanding.push(type.name());
      try {
        List<ColumnDef> out = new ArrayList<>();
        for (Map<String, Object> spec : type.columnSpecs()) {
          Map<String, Object> prefixed = new LinkedHashMap<>(spec);
          prefixed.put("name", prefix + spec.get("name"));
          out.addAll(expand(prefixed, plugin, owner, mixin, expanding));
        }
        return out;
      } finally {
        expanding.pop();
      }
    }

    if (type != null) {
      Map<String, Object> attrs = new LinkedHashMap<>(raw);
      for (var e : type.resolvedAttributes().entrySet()) attrs.putIfAbsent(e.getKey(), e.getValue());
      return List.of(ColumnDef.of(name, plugin, attrs, type, null, null, mixin));
    }

    TableColumnRef ref = TableColumnRef.parse(typeName);
    if (ref == null) {
      throw new InvalidForeignReferenceException(ownerName(owner), name,
          "type '" + typeName + "' is neither a known type nor a Table.column reference");
    }
    return List.of(ColumnDef.of(name, plugin, raw, null, ForeignKeyRef.stub(ref, Map.of()), null, mixin));
  }

  private static ColumnDef foreignKey(String name, String plugin, String owner, Map<String, Object> raw,
                                      Object fk, String mixin) {
    Map<String, Object> options = new LinkedHashMap<>();
    Object target = fk;
    if (fk instanceof Map<?, ?> m) {
      for (var e : m.entrySet()) options.put(String.valueOf(e.getKey()), e.getValue());
      target = options.remove("target");
    }
    TableColumnRef ref = target == null ? null : TableColumnRef.parse(String.valueOf(target));
    if (ref == null) {
      throw new InvalidForeignReferenceException(ownerName(owner), name,
          "foreign_key target '" + target + "' is not a Table.column reference");
    }
    return ColumnDef.of(name, plugin, raw, null, ForeignKeyRef.stub(ref, options), null, mixin);
  }

  private static String ownerName(String owner) {
    int i = owner.indexOf(": ");
    return i < 0 ? owner : owner.substring(i + 2);
  }
}
