package io.intellixity.coframe.schema.model;

/** Join table linking two tables through a composite key made of two foreign keys. */
public record ManyToManyDef(Target target1, Target target2) {

  /**
   * @param joinColumn column of the join table holding the key, {@code book_id} for {@code Book.id} by default
   */
  public record Target(String tableName, String columnName, String joinColumn, String targetPhysicalName,
                       TypeDef resolvedType) {
    public static Target stub(TableColumnRef ref, String joinColumn) {
      String jc = joinColumn == null || joinColumn.isBlank() ? defaultJoinColumn(ref) : joinColumn;
      return new Target(ref.table(), ref.column(), jc, null, null);
    }

    public static String defaultJoinColumn(TableColumnRef ref) {
      return ref.table().toLowerCase(java.util.Locale.ROOT) + "_" + ref.column();
    }

    public Target withJoinColumn(String name) {
      return new Target(tableName, columnName, name, targetPhysicalName, resolvedType);
    }

    public boolean isResolved() { return resolvedType != null; }

    public Target resolve(String physicalName, TypeDef type) {
      return new Target(tableName, columnName, joinColumn, physicalName, type);
    }
  }

  public boolean isResolved() { return target1.isResolved() && target2.isResolved(); }
}
