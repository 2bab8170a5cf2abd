package io.intellixity.coframe.schema.plugin;

import io.intellixity.coframe.schema.merge.Node;
import io.intellixity.coframe.schema.merge.Nodes;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A self-contained declaration unit discovered from a plugin directory. Immutable for the whole composition
 * pass.
 */
public record Plugin(
    String name,
    String version,
    String description,
    String author,
    String license,
    /** Plugin names this plugin must be merged after, in declared order. */
    Set<String> dependsOn,
    /** Parsed declaration documents (every {@code *.yaml} except the manifest), in file-name order. */
    List<Node.MapNode> declarations,
    List<Path> declarationFiles,
    /** Non-declaration source files owned by the plugin. */
    List<Path> sourceRefs,
    List<Path> otherFiles,
    /** Extra imports the generated module needs for this plugin ({@code source_imports} in the manifest). */
    List<String> sourceImports,
    Path directory,
    Instant lastModified
) {
  public static final String DEFAULT_VERSION = "0.0.1";

  public Plugin {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("plugin name is required");
    version = version == null ? DEFAULT_VERSION : version;
    description = description == null ? "" : description;
    author = author == null ? "" : author;
    license = license == null ? "" : license;
    dependsOn = dependsOn == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
    declarations = declarations == null ? List.of() : List.copyOf(declarations);
    declarationFiles = declarationFiles == null ? List.of() : List.copyOf(declarationFiles);
    sourceRefs = sourceRefs == null ? List.of() : List.copyOf(sourceRefs);
    otherFiles = otherFiles == null ? List.of() : List.copyOf(otherFiles);
    sourceImports = sourceImports == null ? List.of() : List.copyOf(sourceImports);
    lastModified = lastModified == null ? Instant.EPOCH : lastModified;
  }

  /** In-memory plugin built from already parsed documents; no files, epoch timestamp. */
  public static Plugin of(String name, Set<String> dependsOn, List<Map<String, Object>> documents) {
    List<Node.MapNode> decls = new ArrayList<>(documents.size());
    for (Map<String, Object> d : documents) decls.add(Nodes.mapFromPlain(d, null));
    return new Plugin(name, DEFAULT_VERSION, "", "", "", dependsOn, decls,
        List.of(), List.of(), List.of(), List.of(), null, Instant.EPOCH);
  }

  @SafeVarargs
  public static Plugin of(String name, Set<String> dependsOn, Map<String, Object>... documents) {
    return of(name, dependsOn, Arrays.asList(documents));
  }

  @Override
  public String toString() {
    return name + "@" + version;
  }
}
