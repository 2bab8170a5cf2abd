package io.intellixity.coframe.schema.plugin;

import io.intellixity.coframe.schema.config.YamlDocuments;
import io.intellixity.coframe.schema.error.DuplicatePluginException;
import io.intellixity.coframe.schema.error.PluginLoadException;
import io.intellixity.coframe.schema.merge.Node;
import io.intellixity.coframe.schema.merge.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers plugins: every immediate subdirectory of a root that holds a {@value #MANIFEST} file.
 * <p>
 * Manifest keys: {@code name} (defaults to the directory name), {@code version}, {@code description},
 * {@code author}, {@code license}, {@code depends_on} (string or list) and {@code source_imports}. Other YAML
 * files in the directory are declaration documents; {@code .java}/{@code .py} files are source references.
 */
public final class PluginLoader {
  private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

  public static final String MANIFEST = "config.yaml";

  public PluginRegistry load(List<Path> roots) {
    Map<String, Plugin> found = new LinkedHashMap<>();
    for (Path root : roots) {
      if (!Files.isDirectory(root)) throw new PluginLoadException(root, "The plugins folder does not exist");
      for (Path dir : sortedChildren(root)) {
        if (!Files.isDirectory(dir) || !Files.isRegularFile(dir.resolve(MANIFEST))) continue;
        Plugin p = loadPlugin(dir);
        Plugin prev = found.putIfAbsent(p.name(), p);
        if (prev != null) throw new DuplicatePluginException(p.name(), prev.directory(), p.directory());
        log.info("coframe.plugin op=discovered name={} version={} dependsOn={} documents={} dir={}",
            p.name(), p.version(), p.dependsOn(), p.declarations().size(), dir);
      }
    }
    return new PluginRegistry(new ArrayList<>(found.values()));
  }

  public Plugin loadPlugin(Path dir) {
    Map<String, Object> manifest = YamlDocuments.readMap(dir.resolve(MANIFEST));

    List<Node.MapNode> declarations = new ArrayList<>();
    List<Path> declarationFiles = new ArrayList<>();
    List<Path> sources = new ArrayList<>();
    List<Path> others = new ArrayList<>();
    Instant latest = Instant.EPOCH;

    for (Path file : sortedChildren(dir)) {
      if (!Files.isRegularFile(file)) continue;
      Instant mtime = lastModified(file);
      if (mtime.isAfter(latest)) latest = mtime;

      String fileName = file.getFileName().toString();
      String lower = fileName.toLowerCase(Locale.ROOT);
      if (fileName.equals(MANIFEST)) continue;
      if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
        declarations.add(Nodes.mapFromPlain(YamlDocuments.readMap(file), null));
        declarationFiles.add(file);
      } else if (lower.endsWith(".java") || lower.endsWith(".py")) {
        sources.add(file);
      } else {
        others.add(file);
      }
    }

    return new Plugin(
        YamlDocuments.string(manifest, "name", dir.getFileName().toString()),
        YamlDocuments.string(manifest, "version", Plugin.DEFAULT_VERSION),
        YamlDocuments.string(manifest, "description", ""),
        YamlDocuments.string(manifest, "author", ""),
        YamlDocuments.string(manifest, "license", ""),
        new LinkedHashSet<>(YamlDocuments.stringList(manifest.get("depends_on"))),
        declarations,
        declarationFiles,
        sources,
        others,
        YamlDocuments.stringList(manifest.get("source_imports")),
        dir,
        latest);
  }

  private static List<Path> sortedChildren(Path dir) {
    try (Stream<Path> s = Files.list(dir)) {
      return s.sorted().collect(Collectors.toList());
    } catch (IOException e) {
      throw new PluginLoadException(dir, "Failed to list directory", e);
    }
  }

  private static Instant lastModified(Path file) {
    try {
      return Files.getLastModifiedTime(file).toInstant();
    } catch (IOException e) {
      throw new PluginLoadException(file, "Failed to read modification time", e);
    }
  }
}
