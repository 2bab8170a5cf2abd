package io.intellixity.coframe.schema.codegen;

import io.intellixity.coframe.schema.codegen.internal.JavaFiles;

import java.nio.file.Path;

/** The generated storage-layer source: one Java file, never edited by hand. */
public record GeneratedModule(String packageName, String className, String source) {
  public Path path(Path outDir) {
    return JavaFiles.filePath(outDir, packageName, className);
  }

  public String qualifiedName() {
    return packageName == null || packageName.isBlank() ? className : packageName + "." + className;
  }
}
