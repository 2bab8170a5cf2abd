package io.intellixity.coframe.schema.merge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges column lists by column {@code name} instead of structural equality.
 * <p>
 * A column redeclared by a later plugin has its attributes deep-merged into the existing entry (later values
 * win per field) and takes the later plugin as provenance. New columns are appended in declaration order.
 */
public final class ColumnListMergeHandler implements ListMergeHandler {
  public static final List<String> DEFAULT_PATTERNS = List.of("tables.*.columns", "types.*.columns");

  @Override
  public Node.ListNode merge(Node.ListNode existing, Node.ListNode incoming, MergeContext ctx) {
    List<Node> out = new ArrayList<>(existing.items());
    Map<String, Integer> byName = new LinkedHashMap<>();
    for (int i = 0; i < out.size(); i++) {
      String name = nameOf(out.get(i));
      if (name != null) byName.putIfAbsent(name, i);
    }

    for (Node item : incoming.items()) {
      String name = nameOf(item);
      Integer at = name == null ? null : byName.get(name);
      if (at != null) {
        Node.MapNode merged = ctx.mergeMaps((Node.MapNode) out.get(at), (Node.MapNode) item, ctx.path() + "." + name);
        out.set(at, merged.withPlugin(ctx.plugin()));
        continue;
      }
      if (name == null && new Node.ListNode(out).containsContent(item)) continue;
      out.add(Nodes.tagUntagged(item, ctx.plugin()));
      if (name != null) {
        byName.put(name, out.size() - 1);
        ctx.added(item, ctx.path() + "." + name);
      }
    }
    return new Node.ListNode(out);
  }

  private static String nameOf(Node n) {
    return n instanceof Node.MapNode m ? m.string("name") : null;
  }
}
