package io.intellixity.coframe.schema.merge;

import java.util.Map;

/** The union of every plugin declaration, read-only once the merge pass has completed. */
public record ComposedDocument(Node.MapNode root) {
  public static final String TYPES = "types";
  public static final String TABLES = "tables";

  public ComposedDocument {
    root = root == null ? Node.MapNode.empty() : root;
  }

  public Node.MapNode types() { return root.map(TYPES); }

  public Node.MapNode tables() { return root.map(TABLES); }

  @SuppressWarnings("unchecked")
  public Map<String, Object> toPlain() { return (Map<String, Object>) root.toPlain(); }
}
