package io.intellixity.coframe.schema.error;

public final class InvalidManyToManyException extends SchemaCompositionException {
  private final String tableName;

  public InvalidManyToManyException(String tableName, String detail) {
    super("Many to many error for table \"" + tableName + "\": " + detail);
    this.tableName = tableName;
  }

  public String tableName() { return tableName; }
}
