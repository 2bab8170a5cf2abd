package io.intellixity.coframe.schema.plugin;

import io.intellixity.coframe.schema.error.DuplicatePluginException;

import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovered plugins keyed by name, in discovery order.
 * <p>
 * Useful for tests and tooling too: build one from in-memory {@link Plugin#of} instances.
 */
public final class PluginRegistry {
  private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final Map<String, Plugin> plugins;

  public PluginRegistry(List<Plugin> discovered) {
    Map<String, Plugin> m = new LinkedHashMap<>();
    for (Plugin p : discovered) {
      Plugin prev = m.putIfAbsent(p.name(), p);
      if (prev != null) throw new DuplicatePluginException(p.name(), prev.directory(), p.directory());
    }
    this.plugins = Collections.unmodifiableMap(m);
  }

  public Plugin get(String name) {
    Plugin p = plugins.get(name);
    if (p == null) throw new IllegalArgumentException("Unknown plugin: " + name);
    return p;
  }

  public Collection<Plugin> all() { return plugins.values(); }

  public int size() { return plugins.size(); }

  /** plugin name -> declared dependency names, in discovery order. */
  public Map<String, Set<String>> dependencyGraph() {
    Map<String, Set<String>> g = new LinkedHashMap<>();
    for (Plugin p : plugins.values()) g.put(p.name(), new LinkedHashSet<>(p.dependsOn()));
    return g;
  }

  public List<Plugin> inOrder(List<String> names) {
    List<Plugin> out = new ArrayList<>(names.size());
    for (String n : names) out.add(get(n));
    return out;
  }

  /** Most recent file modification across all plugins, {@link Instant#EPOCH} if none. */
  public Instant latestModification() {
    Instant latest = Instant.EPOCH;
    for (Plugin p : plugins.values()) {
      if (p.lastModified().isAfter(latest)) latest = p.lastModified();
    }
    return latest;
  }

  public String formattedLatestModification() {
    Instant ts = latestModification();
    if (!ts.isAfter(Instant.EPOCH)) return "Unknown";
    return TS.format(ts.atZone(ZoneId.systemDefault()));
  }

  public List<Path> allSourceRefs() {
    List<Path> out = new ArrayList<>();
    for (Plugin p : plugins.values()) out.addAll(p.sourceRefs());
    return out;
  }
}
