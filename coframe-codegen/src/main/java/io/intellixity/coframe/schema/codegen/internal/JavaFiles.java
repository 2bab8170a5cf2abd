package io.intellixity.coframe.schema.codegen.internal;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

public final class JavaFiles {
  private JavaFiles() {}

  public static Path filePath(Path outDir, String pkg, String simpleName) {
    Path dir = outDir;
    if (pkg != null && !pkg.isBlank()) dir = outDir.resolve(pkg.replace('.', '/'));
    return dir.resolve(simpleName + ".java");
  }

  public static void write(Path file, String source) throws IOException {
    Files.createDirectories(file.getParent());
    Files.writeString(file, source, StandardCharsets.UTF_8);
  }

  /** Two-space indenting line writer used to render generated source. */
  public static final class IndentedWriter implements Closeable {
    private final Writer w;
    private int indent;

    public IndentedWriter(Writer w) { this.w = w; }

    public void println(String s) throws IOException {
      for (int i = 0; i < indent; i++) w.write("  ");
      w.write(s);
      w.write("\n");
    }

    /** Each line of {@code block} at the current indent; blank lines stay empty. */
    public void block(String block) throws IOException {
      for (String line : block.split("\n", -1)) {
        if (line.isBlank()) blank();
        else println(line.stripTrailing());
      }
    }

    public void blank() throws IOException { w.write("\n"); }

    public void indent() { indent++; }
    public void outdent() { indent = Math.max(0, indent - 1); }

    @Override public void close() throws IOException { w.close(); }
  }
}
