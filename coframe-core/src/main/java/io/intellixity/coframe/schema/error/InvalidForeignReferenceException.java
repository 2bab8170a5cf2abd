package io.intellixity.coframe.schema.error;

/** A column's type is neither a known type nor a resolvable {@code Table.column} reference. */
public final class InvalidForeignReferenceException extends SchemaCompositionException {
  private final String tableName;
  private final String columnName;

  public InvalidForeignReferenceException(String tableName, String columnName, String detail) {
    super("Column \"" + columnName + "\" in table \"" + tableName + "\" has invalid foreign reference: " + detail);
    this.tableName = tableName;
    this.columnName = columnName;
  }

  public String tableName() { return tableName; }
  public String columnName() { return columnName; }
}
