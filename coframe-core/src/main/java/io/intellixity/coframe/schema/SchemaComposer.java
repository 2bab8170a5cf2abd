package io.intellixity.coframe.schema;

import io.intellixity.coframe.schema.config.CoframeConfig;
import io.intellixity.coframe.schema.merge.ComposedDocument;
import io.intellixity.coframe.schema.merge.ListMergeHandler;
import io.intellixity.coframe.schema.merge.MergeEngine;
import io.intellixity.coframe.schema.model.Schema;
import io.intellixity.coframe.schema.model.TableDef;
import io.intellixity.coframe.schema.model.TypeCatalog;
import io.intellixity.coframe.schema.plugin.DependencySorter;
import io.intellixity.coframe.schema.plugin.Plugin;
import io.intellixity.coframe.schema.plugin.PluginLoader;
import io.intellixity.coframe.schema.plugin.PluginRegistry;
import io.intellixity.coframe.schema.resolve.ReferenceResolver;
import io.intellixity.coframe.schema.resolve.TableStructureBuilder;
import io.intellixity.coframe.schema.resolve.TypeCatalogResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the composition pipeline once: load plugins, sort by dependency, merge declarations, resolve types,
 * build tables, resolve references. Strictly sequential; the first error aborts the pass.
 *
 * <pre>
 * ComposedSchema composed = new SchemaComposer().compose(CoframeConfig.load(Path.of("config.yaml")));
 * TableDef user = composed.schema().table("User");
 * </pre>
 */
public final class SchemaComposer {
  private static final Logger log = LoggerFactory.getLogger(SchemaComposer.class);

  private final PluginLoader loader;
  private final Map<String, ListMergeHandler> mergeHandlers = new LinkedHashMap<>();

  public SchemaComposer() {
    this(new PluginLoader());
  }

  public SchemaComposer(PluginLoader loader) {
    this.loader = loader;
  }

  /** Extra list merge strategy, applied on top of the built-in column handler. */
  public SchemaComposer mergeHandler(String pattern, ListMergeHandler handler) {
    mergeHandlers.put(pattern, handler);
    return this;
  }

  public ComposedSchema compose(Path configFile) {
    return compose(CoframeConfig.load(configFile));
  }

  public ComposedSchema compose(CoframeConfig config) {
    PluginRegistry registry = loader.load(config.pluginRoots());
    return compose(config, registry);
  }

  public ComposedSchema compose(CoframeConfig config, PluginRegistry registry) {
    long started = System.nanoTime();
    List<Plugin> sorted = DependencySorter.sort(registry);
    log.info("coframe.compose op=sorted app={} plugins={}", config.name(), sorted);

    MergeEngine engine = new MergeEngine(config.mergeOptions());
    mergeHandlers.forEach(engine::registerHandler);
    engine.mergeAll(sorted);
    ComposedDocument document = engine.result();

    TypeCatalog types = new TypeCatalogResolver().build(sorted);
    List<TableDef> structural = new TableStructureBuilder(types).build(document, sorted);
    List<TableDef> tables = new ReferenceResolver(structural).resolveAll();
    Schema schema = new Schema(sorted, types, tables);

    log.info("coframe.compose_done app={} plugins={} types={} tables={} durationMs={}",
        config.name(), sorted.size(), types.size(), tables.size(), (System.nanoTime() - started) / 1_000_000);
    return new ComposedSchema(config, registry, document, engine.history(), schema);
  }
}
