package io.intellixity.coframe.schema.error;

public final class UnknownBaseTypeException extends SchemaCompositionException {
  private final String typeName;
  private final String baseTypeName;
  private final String plugin;

  public UnknownBaseTypeException(String typeName, String baseTypeName, String plugin) {
    super(baseTypeName == null
        ? "Type \"" + typeName + "\" declared in \"" + plugin + "\" has neither a base type nor columns"
        : "Base type \"" + baseTypeName + "\" of type \"" + typeName + "\" declared in \"" + plugin + "\" is not found");
    this.typeName = typeName;
    this.baseTypeName = baseTypeName;
    this.plugin = plugin;
  }

  public String typeName() { return typeName; }
  public String baseTypeName() { return baseTypeName; }
  public String plugin() { return plugin; }
}
