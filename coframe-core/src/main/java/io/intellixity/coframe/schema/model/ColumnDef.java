package io.intellixity.coframe.schema.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A physical column of a table (or of a composite type).
 * <p>
 * For type purposes only one of {@link #resolvedType()} and {@link #foreignKey()} is meaningful: a foreign-key
 * column takes the type of the column it references, known once the reference pass has run.
 */
public record ColumnDef(
    String name,
    /** Plugin that declared (or last extended) the column. */
    String plugin,
    /** Declared attributes plus attributes inherited from the column type. */
    Map<String, Object> rawAttributes,
    TypeDef resolvedType,
    Map<String, Object> fieldConstraints,
    Map<String, Object> typeParameters,
    Map<String, Object> relationParameters,
    Map<String, Object> otherAttributes,
    ForeignKeyRef foreignKey,
    /** {@code target1}/{@code target2} for the generated key columns of a many-to-many table. */
    String manyToManyTag,
    /** Name of the mixin type this column comes from, {@code null} for the table's own columns. */
    String mixin
) {
  public static final Set<String> FIELD_KEYS =
      Set.of("primary_key", "autoincrement", "unique", "nullable", "index", "default");
  public static final Set<String> TYPE_KEYS = Set.of("length", "precision", "scale", "timezone");
  public static final Set<String> RELATION_KEYS = Set.of("onupdate", "ondelete");
  /** Structural keys consumed by resolution; never bucketed. */
  public static final Set<String> STRUCTURAL_KEYS = Set.of("name", "type", "prefix", "foreign_key");

  public ColumnDef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("column name is required");
    rawAttributes = Attributes.freeze(rawAttributes);
    fieldConstraints = Attributes.freeze(fieldConstraints);
    typeParameters = Attributes.freeze(typeParameters);
    relationParameters = Attributes.freeze(relationParameters);
    otherAttributes = Attributes.freeze(otherAttributes);
  }

  /** Bucket {@code attributes} by fixed key membership. */
  public static ColumnDef of(String name, String plugin, Map<String, Object> attributes, TypeDef type,
                             ForeignKeyRef fk, String manyToManyTag, String mixin) {
    Map<String, Object> field = new LinkedHashMap<>();
    Map<String, Object> typeParams = new LinkedHashMap<>();
    Map<String, Object> relation = new LinkedHashMap<>();
    Map<String, Object> other = new LinkedHashMap<>();
    for (var e : attributes.entrySet()) {
      String k = e.getKey();
      if (STRUCTURAL_KEYS.contains(k)) continue;
      if (FIELD_KEYS.contains(k)) field.put(k, e.getValue());
      else if (TYPE_KEYS.contains(k)) typeParams.put(k, e.getValue());
      else if (RELATION_KEYS.contains(k)) relation.put(k, e.getValue());
      else other.put(k, e.getValue());
    }
    if (fk != null) {
      for (var e : fk.options().entrySet()) {
        if (RELATION_KEYS.contains(e.getKey())) relation.putIfAbsent(e.getKey(), e.getValue());
      }
    }
    return new ColumnDef(name, plugin, attributes, type, field, typeParams, relation, other, fk, manyToManyTag, mixin);
  }

  public boolean isForeignKey() { return foreignKey != null; }

  /** Referenced column's type for foreign keys, the resolved type otherwise. */
  public TypeDef effectiveType() {
    return foreignKey != null ? foreignKey.targetColumnType() : resolvedType;
  }

  public boolean isPrimaryKey() { return Attributes.isTrue(fieldConstraints.get("primary_key")); }

  public boolean isAutoincrement() { return Attributes.isTrue(fieldConstraints.get("autoincrement")); }

  public boolean isIndexed() { return Attributes.isTrue(fieldConstraints.get("index")); }

  public boolean isUnique() { return Attributes.isTrue(fieldConstraints.get("unique")); }

  /** {@code false} only when declared {@code nullable: false}; an absent key means nullable. */
  public boolean isNullable() {
    Object v = fieldConstraints.get("nullable");
    return v == null || Attributes.isTrue(v);
  }

  public boolean hasDefault() { return fieldConstraints.containsKey("default"); }

  /** Type parameter from the column, falling back to the effective type's resolved attributes. */
  public Object typeParameter(String key) {
    if (typeParameters.containsKey(key)) return typeParameters.get(key);
    TypeDef t = effectiveType();
    return t == null ? null : t.resolvedAttributes().get(key);
  }

  public ColumnDef withForeignKey(ForeignKeyRef fk) {
    return new ColumnDef(name, plugin, rawAttributes, resolvedType, fieldConstraints, typeParameters,
        relationParameters, otherAttributes, fk, manyToManyTag, mixin);
  }
}
