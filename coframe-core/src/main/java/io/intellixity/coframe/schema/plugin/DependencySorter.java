package io.intellixity.coframe.schema.plugin;

import io.intellixity.coframe.schema.error.CircularDependencyException;
import io.intellixity.coframe.schema.error.UnknownDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders plugins so every plugin comes after all of its dependencies (Kahn's algorithm).
 * <p>
 * Ties are broken by discovery order: the input map's iteration order. When a cycle blocks the sort, only the
 * plugins that actually sit on a cycle are reported, not the plugins merely waiting behind one.
 */
public final class DependencySorter {
  private DependencySorter() {}

  public static List<Plugin> sort(PluginRegistry registry) {
    return registry.inOrder(sort(registry.dependencyGraph()));
  }

  public static List<String> sort(Map<String, Set<String>> graph) {
    Map<String, Set<String>> missing = new LinkedHashMap<>();
    for (var e : graph.entrySet()) {
      for (String dep : e.getValue()) {
        if (!graph.containsKey(dep)) missing.computeIfAbsent(e.getKey(), k -> new LinkedHashSet<>()).add(dep);
      }
    }
    if (!missing.isEmpty()) throw new UnknownDependencyException(missing);

    Map<String, Integer> inDegree = new LinkedHashMap<>();
    Map<String, List<String>> dependents = new HashMap<>();
    for (var e : graph.entrySet()) {
      inDegree.put(e.getKey(), e.getValue().size());
      for (String dep : e.getValue()) dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(e.getKey());
    }

    Deque<String> ready = new ArrayDeque<>();
    for (var e : inDegree.entrySet()) {
      if (e.getValue() == 0) ready.add(e.getKey());
    }

    List<String> result = new ArrayList<>(graph.size());
    while (!ready.isEmpty()) {
      String current = ready.poll();
      result.add(current);
      for (String d : dependents.getOrDefault(current, List.of())) {
        int left = inDegree.merge(d, -1, Integer::sum);
        if (left == 0) ready.add(d);
      }
    }

    if (result.size() != graph.size()) {
      Set<String> remaining = new LinkedHashSet<>(graph.keySet());
      result.forEach(remaining::remove);
      throw new CircularDependencyException(cyclic(graph, remaining));
    }
    return result;
  }

  /** Members of non-trivial strongly connected components (or self-loops) among {@code nodes} (Tarjan). */
  static Set<String> cyclic(Map<String, Set<String>> graph, Set<String> nodes) {
    Tarjan t = new Tarjan(graph, nodes);
    for (String n : nodes) {
      if (!t.index.containsKey(n)) t.visit(n);
    }
    return t.cyclic;
  }

  private static final class Tarjan {
    private final Map<String, Set<String>> graph;
    private final Set<String> nodes;
    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> low = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new LinkedHashSet<>();
    private final Set<String> cyclic = new LinkedHashSet<>();
    private int counter;

    Tarjan(Map<String, Set<String>> graph, Set<String> nodes) {
      this.graph = graph;
      this.nodes = nodes;
    }

    void visit(String v) {
      index.put(v, counter);
      low.put(v, counter);
      counter++;
      stack.push(v);
      onStack.add(v);

      for (String w : graph.get(v)) {
        if (!nodes.contains(w)) continue;
        if (!index.containsKey(w)) {
          visit(w);
          low.put(v, Math.min(low.get(v), low.get(w)));
        } else if (onStack.contains(w)) {
          low.put(v, Math.min(low.get(v), index.get(w)));
        }
      }

      if (low.get(v).equals(index.get(v))) {
        List<String> component = new ArrayList<>();
        String w;
        do {
          w = stack.pop();
          onStack.remove(w);
          component.add(w);
        } while (!w.equals(v));
        if (component.size() > 1 || graph.get(v).contains(v)) cyclic.addAll(component);
      }
    }
  }
}
