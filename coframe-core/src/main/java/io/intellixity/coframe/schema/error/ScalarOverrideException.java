package io.intellixity.coframe.schema.error;

/** Raised instead of a warning when strict merging is enabled and a plugin overrides a scalar value. */
public final class ScalarOverrideException extends SchemaCompositionException {
  private final String path;
  private final String plugin;

  public ScalarOverrideException(String path, String plugin, Object existing, Object incoming) {
    super("Plugin " + plugin + " overrides value for key '" + path + "': " + existing + " -> " + incoming);
    this.path = path;
    this.plugin = plugin;
  }

  public String path() { return path; }
  public String plugin() { return plugin; }
}
