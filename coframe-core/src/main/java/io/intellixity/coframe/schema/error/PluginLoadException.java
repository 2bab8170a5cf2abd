package io.intellixity.coframe.schema.error;

import java.nio.file.Path;

/** A plugin root, manifest or declaration document could not be read or parsed. */
public final class PluginLoadException extends SchemaCompositionException {
  private final Path path;

  public PluginLoadException(Path path, String message) {
    super(message + ": " + path);
    this.path = path;
  }

  public PluginLoadException(Path path, String message, Throwable cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }

  public Path path() { return path; }
}
