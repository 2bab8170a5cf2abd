package io.intellixity.coframe.schema.codegen;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/** Import requirements gathered while rendering, by why they are needed. */
final class ImportSet {
  enum Category {
    /** Entity mapping annotations and the module's own infrastructure. */
    CORE,
    /** Java types of resolved column types. */
    NATIVE,
    /** Relationship mapping, needed once any foreign key or many-to-many exists. */
    RELATIONSHIP,
    /** {@code source_imports} from the root config and the plugins' manifests. */
    CUSTOM
  }

  private final Map<Category, Set<String>> imports = new EnumMap<>(Category.class);

  void add(Category category, String fqcn) {
    String name = normalize(fqcn);
    if (name == null) return;
    imports.computeIfAbsent(category, k -> new TreeSet<>()).add(name);
  }

  void addAll(Category category, List<String> fqcns) {
    for (String s : fqcns) add(category, s);
  }

  Set<String> get(Category category) {
    return imports.getOrDefault(category, Set.of());
  }

  /** Every import once, sorted. */
  Set<String> sorted() {
    Set<String> out = new TreeSet<>();
    for (Set<String> s : imports.values()) out.addAll(s);
    return out;
  }

  /** Accepts {@code a.b.C}, {@code import a.b.C;} and {@code static a.b.C.X}. */
  static String normalize(String s) {
    if (s == null) return null;
    String t = s.trim();
    if (t.startsWith("import ")) t = t.substring("import ".length()).trim();
    if (t.endsWith(";")) t = t.substring(0, t.length() - 1).trim();
    if (t.isEmpty() || t.startsWith("java.lang.") && t.indexOf('.', "java.lang.".length()) < 0) return null;
    return t;
  }
}
