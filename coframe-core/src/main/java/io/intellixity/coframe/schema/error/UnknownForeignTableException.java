package io.intellixity.coframe.schema.error;

public final class UnknownForeignTableException extends SchemaCompositionException {
  private final String tableName;
  private final String columnName;
  private final String targetTableName;

  public UnknownForeignTableException(String tableName, String columnName, String targetTableName) {
    super("Foreign key " + tableName + "." + columnName + " references unknown table \"" + targetTableName + "\"");
    this.tableName = tableName;
    this.columnName = columnName;
    this.targetTableName = targetTableName;
  }

  public String tableName() { return tableName; }
  public String columnName() { return columnName; }
  public String targetTableName() { return targetTableName; }
}
