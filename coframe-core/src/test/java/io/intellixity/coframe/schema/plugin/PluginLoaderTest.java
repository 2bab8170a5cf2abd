package io.intellixity.coframe.schema.plugin;

import io.intellixity.coframe.schema.error.DuplicatePluginException;
import io.intellixity.coframe.schema.error.PluginLoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PluginLoaderTest {

  @TempDir
  Path root;

  private Path pluginDir(Path parent, String dir, String manifest) throws Exception {
    Path d = Files.createDirectories(parent.resolve(dir));
    Files.writeString(d.resolve(PluginLoader.MANIFEST), manifest);
    return d;
  }

  @Test
  void discoversPluginsWithManifests() throws Exception {
    Path core = pluginDir(root, "core", """
        name: core
        version: 1.2.0
        description: Core tables
        """);
    Files.writeString(core.resolve("b_tables.yaml"), "tables: {User: {columns: [{name: id, type: Integer}]}}");
    Files.writeString(core.resolve("a_types.yml"), "types: {Name: {base: String}}");
    Files.writeString(core.resolve("hooks.java"), "class Hooks {}");
    Files.writeString(core.resolve("README.md"), "docs");

    pluginDir(root, "audit-plugin", """
        name: audit
        depends_on: core
        source_imports: [java.time.Clock]
        """);
    Files.createDirectories(root.resolve("not-a-plugin"));

    PluginRegistry reg = new PluginLoader().load(List.of(root));

    assertEquals(2, reg.size());
    Plugin c = reg.get("core");
    assertEquals("1.2.0", c.version());
    assertEquals("Core tables", c.description());
    assertEquals(2, c.declarations().size());
    assertEquals(List.of(core.resolve("a_types.yml"), core.resolve("b_tables.yaml")), c.declarationFiles());
    assertTrue(c.declarations().get(0).has("types"));
    assertEquals(List.of(core.resolve("hooks.java")), c.sourceRefs());
    assertEquals(List.of(core.resolve("README.md")), c.otherFiles());

    Plugin a = reg.get("audit");
    assertEquals(Set.of("core"), a.dependsOn());
    assertEquals(Plugin.DEFAULT_VERSION, a.version());
    assertEquals(List.of("java.time.Clock"), a.sourceImports());
    assertEquals(List.of(core.resolve("hooks.java")), reg.allSourceRefs());
  }

  @Test
  void nameDefaultsToDirectory() throws Exception {
    pluginDir(root, "billing", "version: 0.2.0\n");
    assertEquals("billing", new PluginLoader().load(List.of(root)).get("billing").name());
  }

  @Test
  void lastModifiedIsNewestFile() throws Exception {
    Path core = pluginDir(root, "core", "name: core\n");
    Path tables = core.resolve("tables.yaml");
    Files.writeString(tables, "tables: {}");
    Instant older = Instant.parse("2024-01-01T00:00:00Z");
    Instant newer = Instant.parse("2024-06-01T12:00:00Z");
    Files.setLastModifiedTime(core.resolve(PluginLoader.MANIFEST), FileTime.from(older));
    Files.setLastModifiedTime(tables, FileTime.from(newer));

    PluginRegistry reg = new PluginLoader().load(List.of(root));
    assertEquals(newer, reg.get("core").lastModified());
    assertEquals(newer, reg.latestModification());
    assertNotEquals("Unknown", reg.formattedLatestModification());
  }

  @Test
  void duplicateNamesAcrossRootsFail() throws Exception {
    Path r1 = Files.createDirectories(root.resolve("r1"));
    Path r2 = Files.createDirectories(root.resolve("r2"));
    pluginDir(r1, "core", "name: core\n");
    pluginDir(r2, "core-copy", "name: core\n");

    DuplicatePluginException ex = assertThrows(DuplicatePluginException.class,
        () -> new PluginLoader().load(List.of(r1, r2)));
    assertEquals("core", ex.pluginName());
  }

  @Test
  void missingRootFails() {
    Path missing = root.resolve("nope");
    PluginLoadException ex = assertThrows(PluginLoadException.class, () -> new PluginLoader().load(List.of(missing)));
    assertEquals(missing, ex.path());
  }

  @Test
  void invalidYamlNamesTheFile() throws Exception {
    Path core = pluginDir(root, "core", "name: core\n");
    Path bad = core.resolve("tables.yaml");
    Files.writeString(bad, "tables: [unclosed");
    PluginLoadException ex = assertThrows(PluginLoadException.class, () -> new PluginLoader().load(List.of(root)));
    assertEquals(bad, ex.path());
  }

  @Test
  void inMemoryRegistryHasUnknownTimestamp() {
    PluginRegistry reg = new PluginRegistry(List.of(Plugin.of("core", Set.of(), List.of())));
    assertEquals("Unknown", reg.formattedLatestModification());
  }

  @Test
  void inMemoryRegistryRejectsDuplicateNames() {
    Plugin a = Plugin.of("core", Set.of(), List.of());
    Plugin b = Plugin.of("core", Set.of("base"), List.of());
    DuplicatePluginException ex = assertThrows(DuplicatePluginException.class, () -> new PluginRegistry(List.of(a, b)));
    assertEquals("core", ex.pluginName());
    assertEquals("Duplicate plugin name: core", ex.getMessage());
  }
}
