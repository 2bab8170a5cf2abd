package io.intellixity.coframe.schema.error;

public final class DuplicateColumnException extends SchemaCompositionException {
  private final String tableName;
  private final String columnName;

  public DuplicateColumnException(String tableName, String columnName, String firstPlugin, String secondPlugin) {
    super("Duplicated column \"" + columnName + "\" in table \"" + tableName + "\" (from " + firstPlugin
        + " and " + secondPlugin + ")");
    this.tableName = tableName;
    this.columnName = columnName;
  }

  public String tableName() { return tableName; }
  public String columnName() { return columnName; }
}
