package io.intellixity.coframe.schema.codegen;

import io.intellixity.coframe.schema.ComposedSchema;
import io.intellixity.coframe.schema.SchemaComposer;
import io.intellixity.coframe.schema.model.ColumnDef;
import io.intellixity.coframe.schema.model.Schema;
import io.intellixity.coframe.schema.model.TableDef;
import io.intellixity.coframe.schema.plugin.Plugin;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CodegenMainTest {

  private static Path devtestConfig() throws Exception {
    return Path.of(CodegenMainTest.class.getResource("/devtest/config.yaml").toURI());
  }

  @Test
  void composesDevtestPlugins() throws Exception {
    ComposedSchema composed = new SchemaComposer().compose(devtestConfig());
    Schema schema = composed.schema();

    assertEquals(List.of("common", "users", "books", "library"), schema.plugins().stream().map(Plugin::name).toList());
    assertEquals(List.of("Config", "User", "UserLog", "Author", "Book", "BookAuthor", "Review", "Loan"),
        schema.tables().stream().map(TableDef::name).toList());

    TableDef user = schema.table("User");
    assertEquals("users", user.physicalName());
    assertEquals(List.of("users", "library"), user.owningPluginNames());
    List<String> cols = user.columns().stream().map(ColumnDef::name).toList();
    assertTrue(cols.containsAll(List.of("id", "a_address", "a_country", "is_student", "created_at", "updated_at")));
    assertFalse(user.column("name").orElseThrow().isIndexed());
    assertTrue(user.column("id").orElseThrow().isAutoincrement());

    ColumnDef bookId = schema.table("BookAuthor").column("book_id").orElseThrow();
    assertEquals("Integer", bookId.effectiveType().nativeType().javaType());
    assertEquals("books", schema.table("Review").column("book_id").orElseThrow().foreignKey().targetPhysicalName());
    assertEquals(1, composed.registry().allSourceRefs().size());
    assertTrue(composed.config().extra().containsKey("authentication"));
  }

  @Test
  void generatesModuleFile(@TempDir Path out) throws Exception {
    CodegenMain.main(new String[] {devtestConfig().toString(), out.toString(), "--force"});

    Path file = out.resolve("com/example/devtest/Model.java");
    assertTrue(Files.isRegularFile(file));
    String src = Files.readString(file);
    assertTrue(src.contains("package com.example.devtest;"));
    assertTrue(src.contains("import java.util.Optional;"));
    assertTrue(src.contains("public static class Loan extends BaseEntity {"));
    assertTrue(src.contains("@Table(name = \"books_authors\")"));
    assertTrue(src.contains("FOREIGN KEY (user_id) REFERENCES users (id) ON UPDATE SET NULL"));
    assertTrue(src.contains("private List<Review> reviews;"));
    assertTrue(src.contains("private TimeStamp timeStamp = new TimeStamp();"));
    assertTrue(src.contains("@ColumnDefault(\"CURRENT_TIMESTAMP\")"));
    assertTrue(src.contains("public static Optional<String> appName() {"));
  }

  @Test
  void freshModuleIsNotRewritten(@TempDir Path out) throws Exception {
    SourceGenerator gen = new SourceGenerator(new SchemaComposer().compose(devtestConfig()));
    assertTrue(gen.writeIfStale(out, false));
    assertFalse(gen.writeIfStale(out, false));
  }
}
