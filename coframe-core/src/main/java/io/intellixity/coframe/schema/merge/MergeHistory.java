package io.intellixity.coframe.schema.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Diagnostic log of which plugins contributed to every merged path, in contribution order. */
public final class MergeHistory {
  private final Map<String, List<String>> entries = new LinkedHashMap<>();

  void record(String path, String plugin) {
    entries.computeIfAbsent(path, k -> new ArrayList<>()).add(plugin);
  }

  public List<String> contributors(String path) {
    List<String> l = entries.get(path);
    return l == null ? List.of() : Collections.unmodifiableList(l);
  }

  /** Latest contributor of {@code path}, or {@code null} if nobody touched it yet. */
  public String lastContributor(String path) {
    List<String> l = entries.get(path);
    return l == null || l.isEmpty() ? null : l.get(l.size() - 1);
  }

  public Map<String, List<String>> asMap() {
    Map<String, List<String>> out = new LinkedHashMap<>();
    for (var e : entries.entrySet()) out.put(e.getKey(), List.copyOf(e.getValue()));
    return Collections.unmodifiableMap(out);
  }

  /** One line per path, sorted by path: {@code tables.User.columns: defined in [core, audit]}. */
  public String format() {
    StringBuilder sb = new StringBuilder();
    for (var e : new TreeMap<>(entries).entrySet()) {
      sb.append(e.getKey()).append(": defined in ").append(e.getValue()).append('\n');
    }
    return sb.toString();
  }

  MergeHistory copy() {
    MergeHistory h = new MergeHistory();
    for (var e : entries.entrySet()) h.entries.put(e.getKey(), new ArrayList<>(e.getValue()));
    return h;
  }
}
