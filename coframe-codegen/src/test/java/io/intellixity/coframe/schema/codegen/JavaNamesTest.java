package io.intellixity.coframe.schema.codegen;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JavaNamesTest {

  @Test
  void fieldNames() {
    assertEquals("isActive", JavaNames.field("is_active"));
    assertEquals("id", JavaNames.field("ID"));
    assertEquals("shipStreet", JavaNames.field("ship_street"));
    assertEquals("bookAuthor", JavaNames.field("BookAuthor"));
    assertEquals("class_", JavaNames.field("class"));
    assertEquals("_2fa", JavaNames.field("2fa"));
  }

  @Test
  void plurals() {
    assertEquals("books", JavaNames.plural("book"));
    assertEquals("categories", JavaNames.plural("category"));
    assertEquals("boxes", JavaNames.plural("box"));
    assertEquals("keys", JavaNames.plural("key"));
  }

  @Test
  void escapesStringLiterals() {
    assertEquals("say \\\"hi\\\"\\n", JavaNames.escape("say \"hi\"\n"));
  }

  @Test
  void importNormalization() {
    ImportSet imports = new ImportSet();
    imports.addAll(ImportSet.Category.CUSTOM, List.of("import java.time.Clock;", "java.time.Clock", "java.lang.String"));
    imports.add(ImportSet.Category.NATIVE, null);
    assertEquals(List.of("java.time.Clock"), List.copyOf(imports.sorted()));
    assertTrue(imports.get(ImportSet.Category.NATIVE).isEmpty());
  }
}
