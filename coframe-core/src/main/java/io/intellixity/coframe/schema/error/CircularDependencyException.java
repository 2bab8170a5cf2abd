package io.intellixity.coframe.schema.error;

import java.util.Set;

public final class CircularDependencyException extends SchemaCompositionException {
  private final Set<String> cycle;

  public CircularDependencyException(Set<String> cycle) {
    super("Circular dependency found between plugins: " + cycle);
    this.cycle = Set.copyOf(cycle);
  }

  public Set<String> cycle() { return cycle; }
}
