package io.intellixity.coframe.schema.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable document tree node: a map, a list or a scalar.
 * <p>
 * Map nodes carry the provenance of the plugin that defined (or, for merged columns, last extended) them.
 * Content equality ({@link #sameContent(Node)}) ignores provenance; {@code equals} does not.
 */
public sealed interface Node permits Node.MapNode, Node.ListNode, Node.ScalarNode {
  /** Key under which provenance is exposed when a map node is converted to plain Java objects. */
  String PLUGIN_KEY = "_plugin";

  String shape();

  /** Plain {@code Map}/{@code List}/scalar view; map provenance appears under {@link #PLUGIN_KEY}. */
  Object toPlain();

  /** Plain view without provenance at any depth, as consumed by the resolvers. */
  Object toData();

  boolean sameContent(Node other);

  record MapNode(Map<String, Node> entries, String plugin) implements Node {
    public MapNode {
      entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static MapNode empty() { return new MapNode(Map.of(), null); }

    public Node get(String key) { return entries.get(key); }

    public boolean has(String key) { return entries.containsKey(key); }

    public MapNode withPlugin(String plugin) {
      return Objects.equals(this.plugin, plugin) ? this : new MapNode(entries, plugin);
    }

    public MapNode with(String key, Node value) {
      Map<String, Node> copy = new LinkedHashMap<>(entries);
      copy.put(key, value);
      return new MapNode(copy, plugin);
    }

    public MapNode without(String key) {
      if (!entries.containsKey(key)) return this;
      Map<String, Node> copy = new LinkedHashMap<>(entries);
      copy.remove(key);
      return new MapNode(copy, plugin);
    }

    /** Child map at {@code key}, or an empty map when absent or null. */
    public MapNode map(String key) {
      Node n = entries.get(key);
      if (n instanceof MapNode m) return m;
      return empty();
    }

    /** Child list at {@code key}, or an empty list when absent or null. */
    public ListNode list(String key) {
      Node n = entries.get(key);
      if (n instanceof ListNode l) return l;
      return ListNode.empty();
    }

    /** Scalar at {@code key} rendered as a string, or {@code null}. */
    public String string(String key) {
      Node n = entries.get(key);
      if (n instanceof ScalarNode s && s.value() != null) return String.valueOf(s.value());
      return null;
    }

    /** Plain attribute map without the provenance tag. */
    public Map<String, Object> attributes() {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : entries.entrySet()) out.put(e.getKey(), e.getValue().toData());
      return out;
    }

    @Override public String shape() { return "map"; }

    @Override public Object toData() { return attributes(); }

    @Override
    public Object toPlain() {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : entries.entrySet()) out.put(e.getKey(), e.getValue().toPlain());
      if (plugin != null) out.put(PLUGIN_KEY, plugin);
      return out;
    }

    @Override
    public boolean sameContent(Node other) {
      if (!(other instanceof MapNode m) || m.entries.size() != entries.size()) return false;
      for (var e : entries.entrySet()) {
        Node o = m.entries.get(e.getKey());
        if (o == null || !e.getValue().sameContent(o)) return false;
      }
      return true;
    }
  }

  record ListNode(List<Node> items) implements Node {
    public ListNode {
      items = items == null ? List.of() : List.copyOf(items);
    }

    public static ListNode empty() { return new ListNode(List.of()); }

    public boolean containsContent(Node n) {
      for (Node i : items) {
        if (i.sameContent(n)) return true;
      }
      return false;
    }

    @Override public String shape() { return "list"; }

    @Override
    public Object toPlain() {
      List<Object> out = new ArrayList<>(items.size());
      for (Node n : items) out.add(n.toPlain());
      return out;
    }

    @Override
    public Object toData() {
      List<Object> out = new ArrayList<>(items.size());
      for (Node n : items) out.add(n.toData());
      return out;
    }

    @Override
    public boolean sameContent(Node other) {
      if (!(other instanceof ListNode l) || l.items.size() != items.size()) return false;
      for (int i = 0; i < items.size(); i++) {
        if (!items.get(i).sameContent(l.items.get(i))) return false;
      }
      return true;
    }
  }

  record ScalarNode(Object value) implements Node {
    @Override public String shape() { return "scalar"; }
    @Override public Object toPlain() { return value; }
    @Override public Object toData() { return value; }

    @Override
    public boolean sameContent(Node other) {
      return other instanceof ScalarNode s && Objects.equals(value, s.value);
    }
  }
}
