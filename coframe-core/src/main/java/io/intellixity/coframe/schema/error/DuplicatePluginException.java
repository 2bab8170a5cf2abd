package io.intellixity.coframe.schema.error;

import java.nio.file.Path;

public final class DuplicatePluginException extends SchemaCompositionException {
  private final String pluginName;

  public DuplicatePluginException(String pluginName, Path first, Path second) {
    super("Duplicate plugin name: " + pluginName
        + (first == null && second == null ? "" : " (declared in " + first + " and " + second + ")"));
    this.pluginName = pluginName;
  }

  public String pluginName() { return pluginName; }
}
