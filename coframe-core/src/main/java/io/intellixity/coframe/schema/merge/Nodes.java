package io.intellixity.coframe.schema.merge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Conversions between plain parsed YAML objects and {@link Node} trees. */
public final class Nodes {
  private Nodes() {}

  /**
   * Convert a parsed document to a node tree. Nested maps are tagged with {@code plugin}; a {@code _plugin}
   * key already present in the input wins over it.
   */
  public static Node fromPlain(Object value, String plugin) {
    if (value instanceof Map<?, ?> m) return mapFromPlain(m, plugin);
    if (value instanceof List<?> l) {
      List<Node> items = new ArrayList<>(l.size());
      for (Object o : l) items.add(fromPlain(o, plugin));
      return new Node.ListNode(items);
    }
    return new Node.ScalarNode(value);
  }

  public static Node.MapNode mapFromPlain(Map<?, ?> m, String plugin) {
    Map<String, Node> entries = new LinkedHashMap<>();
    String tag = plugin;
    for (var e : m.entrySet()) {
      String key = String.valueOf(e.getKey());
      if (Node.PLUGIN_KEY.equals(key)) {
        if (e.getValue() != null) tag = String.valueOf(e.getValue());
        continue;
      }
      entries.put(key, fromPlain(e.getValue(), plugin));
    }
    return new Node.MapNode(entries, tag);
  }

  /** Copy of {@code n} where every untagged map (at any depth) gets {@code plugin}. */
  public static Node tagUntagged(Node n, String plugin) {
    if (n instanceof Node.MapNode m) {
      Map<String, Node> entries = new LinkedHashMap<>();
      for (var e : m.entries().entrySet()) entries.put(e.getKey(), tagUntagged(e.getValue(), plugin));
      return new Node.MapNode(entries, m.plugin() == null ? plugin : m.plugin());
    }
    if (n instanceof Node.ListNode l) {
      List<Node> items = new ArrayList<>(l.items().size());
      for (Node i : l.items()) items.add(tagUntagged(i, plugin));
      return new Node.ListNode(items);
    }
    return n;
  }
}
