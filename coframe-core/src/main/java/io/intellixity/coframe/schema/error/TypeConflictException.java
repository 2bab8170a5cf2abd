package io.intellixity.coframe.schema.error;

/** Two plugins declared incompatible shapes (map, list, scalar) at the same document path. */
public final class TypeConflictException extends SchemaCompositionException {
  private final String path;
  private final String existingPlugin;
  private final String incomingPlugin;

  public TypeConflictException(String path, String existingPlugin, String existingShape,
                               String incomingPlugin, String incomingShape) {
    super("Incompatible types for key '" + path + "' between " + existingPlugin + " and " + incomingPlugin
        + ": " + existingShape + " vs " + incomingShape);
    this.path = path;
    this.existingPlugin = existingPlugin;
    this.incomingPlugin = incomingPlugin;
  }

  public String path() { return path; }
  public String existingPlugin() { return existingPlugin; }
  public String incomingPlugin() { return incomingPlugin; }
}
