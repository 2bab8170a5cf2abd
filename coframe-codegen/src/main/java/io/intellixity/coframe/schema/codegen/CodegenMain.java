package io.intellixity.coframe.schema.codegen;

import io.intellixity.coframe.schema.ComposedSchema;
import io.intellixity.coframe.schema.SchemaComposer;

import java.nio.file.*;
import java.util.*;

/**
 * CLI:
 *   CodegenMain <config.yaml> <generatedOutDir> [--force] [--history]
 */
public final class CodegenMain {
  public static void main(String[] args) throws Exception {
    List<String> positional = new ArrayList<>();
    boolean force = false;
    boolean history = false;
    for (String a : args) {
      switch (a) {
        case "--force" -> force = true;
        case "--history" -> history = true;
        default -> positional.add(a);
      }
    }
    if (positional.size() != 2) {
      System.err.println("Usage: CodegenMain <config.yaml> <generatedOutDir> [--force] [--history]");
      System.exit(2);
    }

    Path configFile = Paths.get(positional.get(0));
    Path outDir = Paths.get(positional.get(1));

    ComposedSchema composed = new SchemaComposer().compose(configFile);
    if (history) System.out.print(composed.history().format());

    SourceGenerator gen = new SourceGenerator(composed);
    boolean written = gen.writeIfStale(outDir, force);

    System.out.println((written ? "Generated: " : "Up to date: ") + composed.schema().tables().size()
        + " tables into: " + outDir);
  }
}
