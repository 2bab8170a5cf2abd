package io.intellixity.coframe.schema.error;

import java.util.Map;
import java.util.Set;

/** One or more plugins depend on plugin names that were never discovered. */
public final class UnknownDependencyException extends SchemaCompositionException {
  private final Map<String, Set<String>> missing;

  public UnknownDependencyException(Map<String, Set<String>> missing) {
    super("Unknown plugin dependencies: " + missing);
    this.missing = Map.copyOf(missing);
  }

  /** plugin name -> dependency names that do not exist */
  public Map<String, Set<String>> missing() { return missing; }
}
