package io.intellixity.coframe.schema.model;

import java.util.Map;

/**
 * Reference from a column to {@code targetTableName.targetColumnName}.
 * <p>
 * Built as a stub by the structural pass (names and options only); the reference pass returns a resolved copy
 * carrying the target's physical table name and column type. The target {@link TableDef} itself is looked up
 * by name through {@link Schema#table(String)}.
 */
public record ForeignKeyRef(
    String targetTableName,
    String targetColumnName,
    String targetPhysicalName,
    TypeDef targetColumnType,
    /** Relation options passed through to the generated mapping, e.g. {@code onupdate}, {@code ondelete}. */
    Map<String, Object> options
) {
  public ForeignKeyRef {
    options = Attributes.freeze(options);
  }

  public static ForeignKeyRef stub(TableColumnRef ref, Map<String, Object> options) {
    return new ForeignKeyRef(ref.table(), ref.column(), null, null, options);
  }

  public boolean isResolved() { return targetColumnType != null; }

  public ForeignKeyRef resolve(String physicalName, TypeDef columnType) {
    return new ForeignKeyRef(targetTableName, targetColumnName, physicalName, columnType, options);
  }

  public String target() { return targetTableName + "." + targetColumnName; }
}
