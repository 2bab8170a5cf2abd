package io.intellixity.coframe.schema.config;

import io.intellixity.coframe.schema.merge.MergeOptions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root application configuration ({@code config.yaml} next to the plugin folders).
 *
 * <pre>
 * name: mytestapp
 * version: 0.0.1
 * plugins: [plugins, plugins/libapp]
 * db_engine: "jdbc:h2:mem:test"
 * strict_merge: false
 * source_imports: [java.time.Clock]
 * source_add: |
 *   ...
 * </pre>
 *
 * Keys not listed here (e.g. {@code authentication}, {@code read_files}) are kept in {@link #extra()} for the
 * collaborators that consume them.
 */
public record CoframeConfig(
    Path baseDir,
    String name,
    String version,
    String description,
    String author,
    String license,
    List<String> plugins,
    String dbEngine,
    String logFile,
    List<String> sourceImports,
    String sourceAdd,
    boolean strictMerge,
    String generatedPackage,
    String generatedClass,
    Map<String, Object> extra
) {
  private static final Set<String> KNOWN = Set.of(
      "name", "version", "description", "author", "license", "plugins", "db_engine", "log_file",
      "source_imports", "source_add", "strict_merge", "generated_package", "generated_class");

  public CoframeConfig {
    baseDir = baseDir == null ? Path.of("") : baseDir;
    plugins = plugins == null || plugins.isEmpty() ? List.of("plugins") : List.copyOf(plugins);
    sourceImports = sourceImports == null ? List.of() : List.copyOf(sourceImports);
    generatedClass = generatedClass == null || generatedClass.isBlank() ? "Model" : generatedClass;
    generatedPackage = generatedPackage == null ? "" : generatedPackage;
    sourceAdd = sourceAdd == null ? "" : sourceAdd;
    extra = extra == null ? Map.of() : Map.copyOf(extra);
  }

  public static CoframeConfig load(Path file) {
    Path base = file.toAbsolutePath().getParent();
    return fromMap(base, YamlDocuments.readMap(file));
  }

  public static CoframeConfig fromMap(Path baseDir, Map<String, Object> m) {
    Map<String, Object> extra = new LinkedHashMap<>();
    for (var e : m.entrySet()) {
      if (!KNOWN.contains(e.getKey()) && e.getValue() != null) extra.put(e.getKey(), e.getValue());
    }
    return new CoframeConfig(
        baseDir,
        YamlDocuments.string(m, "name", "myapp"),
        YamlDocuments.string(m, "version", ""),
        YamlDocuments.string(m, "description", ""),
        YamlDocuments.string(m, "author", ""),
        YamlDocuments.string(m, "license", ""),
        YamlDocuments.stringList(m.get("plugins")),
        YamlDocuments.string(m, "db_engine", ""),
        YamlDocuments.string(m, "log_file", ""),
        YamlDocuments.stringList(m.get("source_imports")),
        YamlDocuments.string(m, "source_add", ""),
        YamlDocuments.bool(m, "strict_merge", false),
        YamlDocuments.string(m, "generated_package", ""),
        YamlDocuments.string(m, "generated_class", "Model"),
        extra);
  }

  /** Plugin root directories resolved against the config file's directory. */
  public List<Path> pluginRoots() {
    List<Path> out = new ArrayList<>(plugins.size());
    for (String p : plugins) out.add(baseDir.resolve(p).normalize());
    return out;
  }

  public MergeOptions mergeOptions() { return new MergeOptions(strictMerge); }
}
