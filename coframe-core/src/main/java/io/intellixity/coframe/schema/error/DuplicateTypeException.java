package io.intellixity.coframe.schema.error;

public final class DuplicateTypeException extends SchemaCompositionException {
  private final String typeName;
  private final String plugin;

  public DuplicateTypeException(String typeName, String plugin, String definedBy) {
    super("Type already defined: " + typeName + " (redeclared by " + plugin + ", defined by " + definedBy + ")");
    this.typeName = typeName;
    this.plugin = plugin;
  }

  public String typeName() { return typeName; }
  public String plugin() { return plugin; }
}
