package io.intellixity.coframe.schema.codegen;

import io.intellixity.coframe.schema.plugin.PluginRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Content-free freshness check: a generated artifact is stale when it is missing or older than the newest
 * file of any plugin.
 */
public final class RegenerationCheck {
  private RegenerationCheck() {}

  public static boolean shouldRegenerate(Path artifact, PluginRegistry registry) {
    return shouldRegenerate(artifact, registry.latestModification());
  }

  public static boolean shouldRegenerate(Path artifact, Instant latestPluginChange) {
    if (!Files.exists(artifact)) return true;
    try {
      return Files.getLastModifiedTime(artifact).toInstant().isBefore(latestPluginChange);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read modification time of " + artifact, e);
    }
  }
}
