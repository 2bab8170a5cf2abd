package io.intellixity.coframe.schema.merge;

import io.intellixity.coframe.schema.error.ScalarOverrideException;
import io.intellixity.coframe.schema.error.TypeConflictException;
import io.intellixity.coframe.schema.plugin.Plugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds plugin declarations, in dependency order, into one {@link ComposedDocument}.
 * <p>
 * Single writer: the engine is fed plugin by plugin and document by document, then {@link #result()} hands out
 * the immutable tree. Lists whose path matches a registered {@link ListMergeHandler} pattern are merged by that
 * handler (an exact path registration wins over a pattern); the column handler is registered by default.
 */
public final class MergeEngine {
  private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

  private final MergeOptions options;
  private final Map<String, ListMergeHandler> exactHandlers = new LinkedHashMap<>();
  private final List<Map.Entry<PathPattern, ListMergeHandler>> patternHandlers = new ArrayList<>();
  private final MergeHistory history = new MergeHistory();
  private Node.MapNode root = Node.MapNode.empty();

  public MergeEngine() {
    this(MergeOptions.defaults());
  }

  public MergeEngine(MergeOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    ColumnListMergeHandler columns = new ColumnListMergeHandler();
    for (String p : ColumnListMergeHandler.DEFAULT_PATTERNS) registerHandler(p, columns);
  }

  public MergeEngine registerHandler(String pattern, ListMergeHandler handler) {
    Objects.requireNonNull(handler, "handler");
    PathPattern pp = PathPattern.compile(pattern);
    if (pp.isLiteral()) {
      exactHandlers.put(pattern, handler);
    } else {
      patternHandlers.removeIf(e -> e.getKey().glob().equals(pattern));
      patternHandlers.add(Map.entry(pp, handler));
    }
    return this;
  }

  ListMergeHandler handlerFor(String path) {
    ListMergeHandler h = exactHandlers.get(path);
    if (h != null) return h;
    for (var e : patternHandlers) {
      if (e.getKey().matches(path)) return e.getValue();
    }
    return null;
  }

  public void mergeAll(List<Plugin> sortedPlugins) {
    for (Plugin p : sortedPlugins) {
      for (Node.MapNode doc : p.declarations()) merge(doc, p.name());
    }
  }

  public void merge(Node.MapNode document, String plugin) {
    Objects.requireNonNull(plugin, "plugin");
    if (document == null) return;
    root = mergeMaps(root, document, plugin, "");
  }

  public ComposedDocument result() { return new ComposedDocument(root); }

  public MergeHistory history() { return history.copy(); }

  private Node.MapNode mergeMaps(Node.MapNode existing, Node.MapNode incoming, String plugin, String prefix) {
    Map<String, Node> out = new LinkedHashMap<>(existing.entries());
    for (var e : incoming.entries().entrySet()) {
      String key = e.getKey();
      String path = prefix.isEmpty() ? key : prefix + "." + key;
      Node current = out.get(key);
      String previous = history.lastContributor(path);
      // entries appended by a list handler have no history of their own
      if (previous == null && current != null) previous = existing.plugin();
      history.record(path, plugin);

      if (current == null) {
        log.debug("coframe.merge op=add plugin={} path={}", plugin, path);
        recordSubtree(e.getValue(), plugin, path);
        out.put(key, Nodes.tagUntagged(e.getValue(), plugin));
      } else {
        out.put(key, mergeValues(current, e.getValue(), plugin, previous, path));
      }
    }
    String tag = existing.plugin() != null ? existing.plugin() : (prefix.isEmpty() ? null : plugin);
    return new Node.MapNode(out, tag);
  }

  private Node mergeValues(Node existing, Node incoming, String plugin, String previous, String path) {
    if (existing instanceof Node.MapNode em && incoming instanceof Node.MapNode im) {
      log.debug("coframe.merge op=merge_map plugin={} path={}", plugin, path);
      return mergeMaps(em, im, plugin, path);
    }
    if (existing instanceof Node.ListNode el && incoming instanceof Node.ListNode il) {
      ListMergeHandler h = handlerFor(path);
      if (h != null) {
        log.debug("coframe.merge op=merge_list_custom plugin={} path={}", plugin, path);
        return h.merge(el, il, new Context(path, plugin));
      }
      log.debug("coframe.merge op=extend_list plugin={} path={}", plugin, path);
      return extend(el, il, plugin);
    }
    if (existing instanceof Node.ScalarNode es && incoming instanceof Node.ScalarNode is) {
      if (Objects.equals(es.value(), is.value())) return existing;
      if (options.strictScalars()) throw new ScalarOverrideException(path, plugin, es.value(), is.value());
      log.warn("coframe.merge op=override plugin={} previous={} path={} value={} -> {}",
          plugin, previous, path, es.value(), is.value());
      return incoming;
    }
    // an explicit null (e.g. "columns:" with nothing under it) is absence, not a shape
    if (isNull(existing)) return Nodes.tagUntagged(incoming, plugin);
    if (isNull(incoming)) return existing;
    throw new TypeConflictException(path, previous, existing.shape(), plugin, incoming.shape());
  }

  /** Named list items are recorded under {@code path.<name>}, the path a name-keyed handler merges them at. */
  private void recordSubtree(Node n, String plugin, String path) {
    if (n instanceof Node.MapNode m) {
      for (var e : m.entries().entrySet()) {
        String child = path + "." + e.getKey();
        history.record(child, plugin);
        recordSubtree(e.getValue(), plugin, child);
      }
    } else if (n instanceof Node.ListNode l) {
      for (Node item : l.items()) {
        if (item instanceof Node.MapNode m && m.string("name") != null) {
          recordSubtree(m, plugin, path + "." + m.string("name"));
        }
      }
    }
  }

  private static Node.ListNode extend(Node.ListNode existing, Node.ListNode incoming, String plugin) {
    List<Node> out = new ArrayList<>(existing.items());
    for (Node item : incoming.items()) {
      if (new Node.ListNode(out).containsContent(item)) continue;
      out.add(Nodes.tagUntagged(item, plugin));
    }
    return new Node.ListNode(out);
  }

  private static boolean isNull(Node n) {
    return n instanceof Node.ScalarNode s && s.value() == null;
  }

  private final class Context implements MergeContext {
    private final String path;
    private final String plugin;

    Context(String path, String plugin) {
      this.path = path;
      this.plugin = plugin;
    }

    @Override public String path() { return path; }
    @Override public String plugin() { return plugin; }

    @Override
    public Node.MapNode mergeMaps(Node.MapNode existing, Node.MapNode incoming, String path) {
      return MergeEngine.this.mergeMaps(existing, incoming, plugin, path);
    }

    @Override
    public void added(Node item, String path) {
      recordSubtree(item, plugin, path);
    }
  }
}
