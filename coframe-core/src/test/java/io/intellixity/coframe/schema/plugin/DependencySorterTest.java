package io.intellixity.coframe.schema.plugin;

import io.intellixity.coframe.schema.error.CircularDependencyException;
import io.intellixity.coframe.schema.error.UnknownDependencyException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class DependencySorterTest {

  @Test
  void everyPluginComesAfterItsDependencies() {
    Map<String, Set<String>> g = new LinkedHashMap<>();
    g.put("shop", Set.of("core", "audit"));
    g.put("audit", Set.of("core"));
    g.put("core", Set.of());
    g.put("reports", Set.of("shop"));

    List<String> order = DependencySorter.sort(g);

    assertEquals(List.of("core", "audit", "shop", "reports"), order);
    for (var e : g.entrySet()) {
      for (String dep : e.getValue()) {
        assertTrue(order.indexOf(dep) < order.indexOf(e.getKey()), dep + " before " + e.getKey());
      }
    }
  }

  @Test
  void independentPluginsKeepDiscoveryOrder() {
    Map<String, Set<String>> g = new LinkedHashMap<>();
    g.put("b", Set.of());
    g.put("a", Set.of());
    g.put("c", Set.of());
    assertEquals(List.of("b", "a", "c"), DependencySorter.sort(g));
  }

  @Test
  void cycleReportsOnlyPluginsOnTheCycle() {
    Map<String, Set<String>> g = new LinkedHashMap<>();
    g.put("core", Set.of());
    g.put("a", Set.of("b"));
    g.put("b", Set.of("a"));
    g.put("waiting", Set.of("a"));

    CircularDependencyException ex = assertThrows(CircularDependencyException.class, () -> DependencySorter.sort(g));
    assertEquals(Set.of("a", "b"), ex.cycle());
  }

  @Test
  void selfDependencyIsACycle() {
    Map<String, Set<String>> g = new LinkedHashMap<>();
    g.put("solo", Set.of("solo"));
    CircularDependencyException ex = assertThrows(CircularDependencyException.class, () -> DependencySorter.sort(g));
    assertEquals(Set.of("solo"), ex.cycle());
  }

  @Test
  void unknownDependencyIsReportedPerPlugin() {
    Map<String, Set<String>> g = new LinkedHashMap<>();
    g.put("core", Set.of());
    g.put("shop", Set.of("core", "payments"));

    UnknownDependencyException ex = assertThrows(UnknownDependencyException.class, () -> DependencySorter.sort(g));
    assertEquals(Map.of("shop", Set.of("payments")), ex.missing());
  }

  @Test
  void sortsRegistryPlugins() {
    Plugin audit = Plugin.of("audit", Set.of("core"), List.of());
    Plugin core = Plugin.of("core", Set.of(), List.of());
    PluginRegistry reg = new PluginRegistry(List.of(audit, core));

    List<Plugin> sorted = DependencySorter.sort(reg);
    assertEquals(List.of(core, audit), sorted);
  }
}
