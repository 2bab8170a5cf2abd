package io.intellixity.coframe.schema.error;

import java.util.List;

public final class CircularTypeInheritanceException extends SchemaCompositionException {
  private final List<String> chain;

  public CircularTypeInheritanceException(List<String> chain) {
    super("Circular type inheritance: " + String.join(" -> ", chain));
    this.chain = List.copyOf(chain);
  }

  public List<String> chain() { return chain; }
}
