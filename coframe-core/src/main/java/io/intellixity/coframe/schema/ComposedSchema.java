package io.intellixity.coframe.schema;

import io.intellixity.coframe.schema.config.CoframeConfig;
import io.intellixity.coframe.schema.merge.ComposedDocument;
import io.intellixity.coframe.schema.merge.MergeHistory;
import io.intellixity.coframe.schema.model.Schema;
import io.intellixity.coframe.schema.plugin.PluginRegistry;

/** Everything one composition pass produced. */
public record ComposedSchema(
    CoframeConfig config,
    PluginRegistry registry,
    ComposedDocument document,
    MergeHistory history,
    Schema schema
) {}
