package io.intellixity.coframe.schema.codegen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.coframe.schema.ComposedSchema;
import io.intellixity.coframe.schema.codegen.ImportSet.Category;
import io.intellixity.coframe.schema.codegen.internal.JavaFiles;
import io.intellixity.coframe.schema.config.CoframeConfig;
import io.intellixity.coframe.schema.config.YamlDocuments;
import io.intellixity.coframe.schema.model.ColumnDef;
import io.intellixity.coframe.schema.model.ForeignKeyRef;
import io.intellixity.coframe.schema.model.ManyToManyDef;
import io.intellixity.coframe.schema.model.NativeType;
import io.intellixity.coframe.schema.model.Schema;
import io.intellixity.coframe.schema.model.TableDef;
import io.intellixity.coframe.schema.model.TypeDef;
import io.intellixity.coframe.schema.plugin.Plugin;
import io.intellixity.coframe.schema.plugin.PluginRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders the resolved {@link Schema} as one Java source file of JPA entities.
 * <p>
 * Layout: header, sorted imports, then inside the module class the universal {@value #BASE_CLASS}, one
 * {@code @Embeddable} per mixin in use, one entity per table in first-declaration order, the
 * {@code initializeDb} entry point and the raw {@code source_add} block from the root config.
 * <p>
 * Relationships are planned for the whole schema before any table is rendered and appended after each table's
 * own fields, so a table can declare the inverse side of a foreign key declared on a later table.
 */
public final class SourceGenerator {
  private static final Logger log = LoggerFactory.getLogger(SourceGenerator.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  static final String BASE_CLASS = "BaseEntity";
  private static final String JPA = "jakarta.persistence.";

  private final CoframeConfig config;
  private final PluginRegistry registry;
  private final Schema schema;

  public SourceGenerator(ComposedSchema composed) {
    this(composed.config(), composed.registry(), composed.schema());
  }

  public SourceGenerator(CoframeConfig config, PluginRegistry registry, Schema schema) {
    this.config = config;
    this.registry = registry;
    this.schema = schema;
  }

  /**
   * Write the module under {@code outDir} unless it is newer than every plugin file.
   *
   * @return whether the file was (re)written
   */
  public boolean writeIfStale(Path outDir, boolean force) throws IOException {
    Path file = JavaFiles.filePath(outDir, config.generatedPackage(), config.generatedClass());
    if (!force && !RegenerationCheck.shouldRegenerate(file, registry)) {
      log.info("coframe.codegen op=skip reason=fresh file={}", file);
      return false;
    }
    GeneratedModule module = generate();
    JavaFiles.write(file, module.source());
    log.info("coframe.codegen op=write class={} tables={} file={}",
        module.qualifiedName(), schema.tables().size(), file);
    return true;
  }

  public GeneratedModule generate() {
    ImportSet imports = new ImportSet();
    imports.add(Category.CORE, JPA + "Column");
    imports.add(Category.CORE, JPA + "Entity");
    imports.add(Category.CORE, JPA + "Table");
    imports.add(Category.CORE, JPA + "MappedSuperclass");
    imports.add(Category.CORE, JPA + "EntityManagerFactory");
    imports.add(Category.CORE, JPA + "Persistence");
    imports.add(Category.CORE, "java.io.Serializable");
    imports.add(Category.CORE, "java.util.Map");

    Map<String, List<Field>> relations = planRelations(imports);

    StringWriter body = new StringWriter();
    try (JavaFiles.IndentedWriter w = new JavaFiles.IndentedWriter(body)) {
      w.indent();
      w.println("private " + config.generatedClass() + "() {}");
      w.blank();
      w.println("@MappedSuperclass");
      w.println("public abstract static class " + BASE_CLASS + " implements Serializable {");
      w.println("}");

      for (TypeDef mixin : schema.usedMixins()) {
        w.blank();
        renderMixin(w, mixin, imports);
      }
      for (TableDef t : schema.tables()) {
        w.blank();
        renderTable(w, t, relations.getOrDefault(t.name(), List.of()), imports);
      }

      w.blank();
      w.println("/** Entity manager factory for the given JDBC url, e.g. {@code jdbc:h2:mem:test}. */");
      w.println("public static EntityManagerFactory initializeDb(String url) {");
      w.indent();
      w.println("return Persistence.createEntityManagerFactory(\"" + JavaNames.escape(config.name())
          + "\", Map.of(\"jakarta.persistence.jdbc.url\", url));");
      w.outdent();
      w.println("}");

      if (!config.sourceAdd().isBlank()) {
        w.blank();
        w.block(config.sourceAdd().stripTrailing());
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }

    imports.addAll(Category.CUSTOM, config.sourceImports());
    imports.addAll(Category.CUSTOM, schema.pluginSourceImports());

    StringWriter out = new StringWriter();
    try (JavaFiles.IndentedWriter w = new JavaFiles.IndentedWriter(out)) {
      List<String> pluginNames = new ArrayList<>();
      for (Plugin p : schema.plugins()) pluginNames.add(p.name() + "@" + p.version());
      w.println("// Generated by coframe for " + config.name() + (config.version().isBlank() ? "" : " " + config.version())
          + ". Do not edit: regenerate from the plugin declarations.");
      w.println("// Plugins: " + String.join(", ", pluginNames));
      w.println("// Latest plugin change: " + registry.formattedLatestModification());
      if (!config.generatedPackage().isBlank()) {
        w.println("package " + config.generatedPackage() + ";");
      }
      w.blank();
      for (String imp : imports.sorted()) w.println("import " + imp + ";");
      w.blank();
      w.println("public final class " + config.generatedClass() + " {");
      out.write(body.toString());
      w.println("}");
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return new GeneratedModule(config.generatedPackage(), config.generatedClass(), out.toString());
  }

  private record Field(List<String> annotations, String type, String name, String initializer) {}

  // ---------------------------------------------------------------------------------------------------------
  // relationships

  private Map<String, List<Field>> planRelations(ImportSet imports) {
    Map<String, Set<String>> names = new HashMap<>();
    for (TableDef t : schema.tables()) names.put(t.name(), baseFieldNames(t));
    Map<String, List<Field>> out = new HashMap<>();

    for (TableDef t : schema.tables()) {
      for (ColumnDef c : t.ownColumns()) {
        if (!c.isForeignKey()) continue;
        ForeignKeyRef fk = c.foreignKey();
        TableDef target = schema.targetOf(fk);
        relationImports(imports);
        if (!c.relationParameters().isEmpty()) imports.add(Category.RELATIONSHIP, JPA + "ForeignKey");

        String forward = unique(names.get(t.name()), JavaNames.field(relationName(c.name())));
        add(out, t, new Field(List.of(
            "@ManyToOne(fetch = FetchType.LAZY)",
            joinColumn(c.name(), fk.targetColumnName(), foreignKeyDefinition(c, fk))), target.name(), forward, null));

        String backward = unique(names.get(target.name()), JavaNames.plural(JavaNames.field(t.name())));
        add(out, target, new Field(List.of("@OneToMany(mappedBy = \"" + forward + "\")"),
            "List<" + t.name() + ">", backward, null));
      }

      if (t.isManyToMany()) {
        ManyToManyDef m2m = t.manyToMany();
        TableDef left = schema.table(m2m.target1().tableName());
        TableDef right = schema.table(m2m.target2().tableName());
        relationImports(imports);
        imports.add(Category.RELATIONSHIP, JPA + "ManyToMany");
        imports.add(Category.RELATIONSHIP, JPA + "JoinTable");
        imports.add(Category.RELATIONSHIP, JPA + "IdClass");
        imports.add(Category.RELATIONSHIP, JPA + "Id");
        imports.add(Category.RELATIONSHIP, "java.util.Objects");

        for (ManyToManyDef.Target target : List.of(m2m.target1(), m2m.target2())) {
          String field = unique(names.get(t.name()), JavaNames.field(target.tableName()));
          add(out, t, new Field(List.of(
              "@ManyToOne(fetch = FetchType.LAZY)",
              joinColumn(target.joinColumn(), target.columnName(), null)), target.tableName(), field, null));
        }

        String owning = unique(names.get(left.name()), JavaNames.plural(JavaNames.field(right.name())));
        add(out, left, new Field(List.of(
            "@ManyToMany",
            "@JoinTable(name = \"" + t.physicalName() + "\", joinColumns = @JoinColumn(name = \""
                + m2m.target1().joinColumn() + "\", referencedColumnName = \"" + m2m.target1().columnName()
                + "\"), inverseJoinColumns = @JoinColumn(name = \"" + m2m.target2().joinColumn()
                + "\", referencedColumnName = \"" + m2m.target2().columnName() + "\"))"),
            "List<" + right.name() + ">", owning, null));

        String inverse = unique(names.get(right.name()), JavaNames.plural(JavaNames.field(left.name())));
        add(out, right, new Field(List.of("@ManyToMany(mappedBy = \"" + owning + "\")"),
            "List<" + left.name() + ">", inverse, null));
      }
    }
    return out;
  }

  private static void relationImports(ImportSet imports) {
    imports.add(Category.RELATIONSHIP, JPA + "ManyToOne");
    imports.add(Category.RELATIONSHIP, JPA + "OneToMany");
    imports.add(Category.RELATIONSHIP, JPA + "JoinColumn");
    imports.add(Category.RELATIONSHIP, JPA + "FetchType");
    imports.add(Category.RELATIONSHIP, "java.util.List");
  }

  private static void add(Map<String, List<Field>> out, TableDef t, Field f) {
    out.computeIfAbsent(t.name(), k -> new ArrayList<>()).add(f);
  }

  private static Set<String> baseFieldNames(TableDef t) {
    Set<String> out = new LinkedHashSet<>();
    for (ColumnDef c : t.columns()) {
      if (c.mixin() == null) out.add(JavaNames.field(c.name()));
    }
    for (String m : t.mixins()) out.add(JavaNames.field(m));
    return out;
  }

  private static String unique(Set<String> taken, String wanted) {
    String name = wanted;
    int n = 2;
    while (!taken.add(name)) name = wanted + n++;
    return name;
  }

  /** {@code user_id} -> {@code user}; other names get a {@code _ref} suffix. */
  private static String relationName(String column) {
    if (column.length() > 3 && column.endsWith("_id")) return column.substring(0, column.length() - 3);
    return column + "_ref";
  }

  private static String joinColumn(String column, String referenced, String fkDefinition) {
    String s = "@JoinColumn(name = \"" + column + "\", referencedColumnName = \"" + referenced
        + "\", insertable = false, updatable = false";
    if (fkDefinition != null) s += ", foreignKey = @ForeignKey(foreignKeyDefinition = \"" + JavaNames.escape(fkDefinition) + "\")";
    return s + ")";
  }

  private static String foreignKeyDefinition(ColumnDef c, ForeignKeyRef fk) {
    if (c.relationParameters().isEmpty()) return null;
    StringBuilder sb = new StringBuilder("FOREIGN KEY (" + c.name() + ") REFERENCES " + fk.targetPhysicalName()
        + " (" + fk.targetColumnName() + ")");
    Object onUpdate = c.relationParameters().get("onupdate");
    Object onDelete = c.relationParameters().get("ondelete");
    if (onUpdate != null) sb.append(" ON UPDATE ").append(unquote(onUpdate));
    if (onDelete != null) sb.append(" ON DELETE ").append(unquote(onDelete));
    return sb.toString();
  }

  private static String unquote(Object v) {
    String s = String.valueOf(v).trim();
    if (s.length() >= 2 && (s.startsWith("'") && s.endsWith("'") || s.startsWith("\"") && s.endsWith("\""))) {
      return s.substring(1, s.length() - 1);
    }
    return s;
  }

  // ---------------------------------------------------------------------------------------------------------
  // classes

  private void renderMixin(JavaFiles.IndentedWriter w, TypeDef mixin, ImportSet imports) throws IOException {
    imports.add(Category.CORE, JPA + "Embeddable");
    List<Field> fields = new ArrayList<>();
    for (ColumnDef c : mixin.embeddedColumns()) fields.add(columnField(c, imports, false));

    w.println("@Embeddable");
    w.println("public static class " + mixin.name() + " {");
    w.indent();
    renderFields(w, fields);
    w.outdent();
    w.println("}");
  }

  private void renderTable(JavaFiles.IndentedWriter w, TableDef t, List<Field> relations, ImportSet imports)
      throws IOException {
    List<String> indexes = indexes(t);
    if (!indexes.isEmpty()) imports.add(Category.CORE, JPA + "Index");

    List<Field> fields = new ArrayList<>();
    for (ColumnDef c : t.columns()) {
      if (c.manyToManyTag() != null) fields.add(columnField(c, imports, true));
    }
    for (ColumnDef c : t.ownColumns()) fields.add(columnField(c, imports, false));
    for (String mixin : t.mixins()) {
      imports.add(Category.CORE, JPA + "Embedded");
      fields.add(new Field(List.of("@Embedded"), mixin, JavaNames.field(mixin), "new " + mixin + "()"));
    }
    fields.addAll(relations);

    w.println("@Entity");
    if (indexes.isEmpty()) {
      w.println("@Table(name = \"" + t.physicalName() + "\")");
    } else {
      w.println("@Table(name = \"" + t.physicalName() + "\", indexes = {");
      w.indent();
      w.indent();
      for (int i = 0; i < indexes.size(); i++) {
        w.println(indexes.get(i) + (i + 1 < indexes.size() ? "," : ""));
      }
      w.outdent();
      w.outdent();
      w.println("})");
    }
    if (t.isManyToMany()) w.println("@IdClass(" + t.name() + ".Pk.class)");
    w.println("public static class " + t.name() + " extends " + BASE_CLASS + " {");
    w.indent();
    renderFields(w, fields);
    if (t.isManyToMany()) renderPk(w, t, imports);
    w.outdent();
    w.println("}");
  }

  private void renderPk(JavaFiles.IndentedWriter w, TableDef t, ImportSet imports) throws IOException {
    ManyToManyDef m2m = t.manyToMany();
    String a = JavaNames.field(m2m.target1().joinColumn());
    String b = JavaNames.field(m2m.target2().joinColumn());
    w.blank();
    w.println("public static class Pk implements Serializable {");
    w.indent();
    w.println("private " + javaType(m2m.target1().resolvedType(), Map.of(), imports) + " " + a + ";");
    w.println("private " + javaType(m2m.target2().resolvedType(), Map.of(), imports) + " " + b + ";");
    w.blank();
    w.println("@Override");
    w.println("public boolean equals(Object o) {");
    w.indent();
    w.println("if (this == o) return true;");
    w.println("if (!(o instanceof Pk)) return false;");
    w.println("Pk other = (Pk) o;");
    w.println("return Objects.equals(" + a + ", other." + a + ") && Objects.equals(" + b + ", other." + b + ");");
    w.outdent();
    w.println("}");
    w.blank();
    w.println("@Override");
    w.println("public int hashCode() {");
    w.indent();
    w.println("return Objects.hash(" + a + ", " + b + ");");
    w.outdent();
    w.println("}");
    w.outdent();
    w.println("}");
  }

  private static void renderFields(JavaFiles.IndentedWriter w, List<Field> fields) throws IOException {
    for (Field f : fields) {
      for (String a : f.annotations()) w.println(a);
      w.println("private " + f.type() + " " + f.name() + (f.initializer() == null ? "" : " = " + f.initializer()) + ";");
      w.blank();
    }
    for (int i = 0; i < fields.size(); i++) {
      Field f = fields.get(i);
      String suffix = JavaNames.cap(f.name());
      w.println("public " + f.type() + " get" + suffix + "() {");
      w.indent();
      w.println("return " + f.name() + ";");
      w.outdent();
      w.println("}");
      w.blank();
      w.println("public void set" + suffix + "(" + f.type() + " " + f.name() + ") {");
      w.indent();
      w.println("this." + f.name() + " = " + f.name() + ";");
      w.outdent();
      w.println("}");
      if (i + 1 < fields.size()) w.blank();
    }
  }

  // ---------------------------------------------------------------------------------------------------------
  // columns

  private Field columnField(ColumnDef c, ImportSet imports, boolean joinKey) {
    List<String> annotations = new ArrayList<>();
    if (c.isPrimaryKey()) {
      imports.add(Category.CORE, JPA + "Id");
      annotations.add("@Id");
    }
    if (c.isAutoincrement() && !joinKey) {
      imports.add(Category.CORE, JPA + "GeneratedValue");
      imports.add(Category.CORE, JPA + "GenerationType");
      annotations.add("@GeneratedValue(strategy = GenerationType.IDENTITY)");
    }

    List<String> args = new ArrayList<>();
    args.add("name = \"" + c.name() + "\"");
    if (!c.isNullable()) args.add("nullable = false");
    if (c.isUnique()) args.add("unique = true");
    for (String key : List.of("length", "precision", "scale")) {
      Object v = c.typeParameter(key);
      if (v != null) args.add(key + " = " + v);
    }
    annotations.add("@Column(" + String.join(", ", args) + ")");

    Object dflt = c.fieldConstraints().get("default");
    if (dflt != null) {
      imports.add(Category.CORE, "org.hibernate.annotations.ColumnDefault");
      annotations.add("@ColumnDefault(\"" + JavaNames.escape(defaultLiteral(dflt)) + "\")");
    }

    Map<String, Object> typeParams = new HashMap<>();
    Object tz = c.typeParameter("timezone");
    if (tz != null) typeParams.put("timezone", tz);
    return new Field(annotations, javaType(effectiveType(c), typeParams, imports), JavaNames.field(c.name()), null);
  }

  private TypeDef effectiveType(ColumnDef c) {
    TypeDef t = c.effectiveType();
    if (t != null) return t;
    if (c.isForeignKey()) {
      // mixin columns keep their structural foreign-key stub; the target column is resolved in the schema
      ForeignKeyRef fk = c.foreignKey();
      ColumnDef target = schema.table(fk.targetTableName()).column(fk.targetColumnName()).orElse(null);
      if (target != null && target.effectiveType() != null) return target.effectiveType();
    }
    throw new IllegalStateException("Column " + c.name() + " has no resolved type");
  }

  private static String javaType(TypeDef type, Map<String, Object> typeParams, ImportSet imports) {
    NativeType nt = type.nativeType();
    if (nt == null) throw new IllegalStateException("Type " + type.name() + " has no native type");
    if ("java.time.LocalDateTime".equals(nt.javaType()) && YamlDocuments.bool(typeParams, "timezone", false)) {
      nt = NativeType.of("java.time.OffsetDateTime");
    }
    imports.add(Category.NATIVE, nt.importName());
    return nt.simpleName();
  }

  private static String defaultLiteral(Object v) {
    if (v instanceof String s) return s;
    if (v instanceof Boolean || v instanceof Number) return String.valueOf(v);
    try {
      return JSON.writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to JSON-encode default value: " + v, e);
    }
  }

  private static List<String> indexes(TableDef t) {
    List<String> out = new ArrayList<>();
    for (ColumnDef c : t.columns()) {
      if (c.isIndexed()) {
        out.add("@Index(name = \"ix_" + t.physicalName() + "_" + c.name() + "\", columnList = \"" + c.name() + "\")");
      }
    }
    Object declared = t.attributes().get("indexes");
    if (declared instanceof List<?> l) {
      for (Object o : l) {
        if (!(o instanceof Map<?, ?> m)) continue;
        List<String> cols = YamlDocuments.stringList(m.get("columns"));
        if (cols.isEmpty()) continue;
        String name = m.get("name") != null ? String.valueOf(m.get("name"))
            : "ix_" + t.physicalName() + "_" + String.join("_", cols);
        String s = "@Index(name = \"" + name + "\", columnList = \"" + String.join(", ", cols) + "\"";
        Object unique = m.get("unique");
        if (unique instanceof Boolean b && b) s += ", unique = true";
        out.add(s + ")");
      }
    }
    return out;
  }
}
