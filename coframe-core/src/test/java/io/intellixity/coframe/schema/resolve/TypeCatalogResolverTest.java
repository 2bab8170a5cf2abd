package io.intellixity.coframe.schema.resolve;

import io.intellixity.coframe.schema.config.YamlDocuments;
import io.intellixity.coframe.schema.error.CircularTypeInheritanceException;
import io.intellixity.coframe.schema.error.DuplicateTypeException;
import io.intellixity.coframe.schema.error.UnknownBaseTypeException;
import io.intellixity.coframe.schema.model.ColumnDef;
import io.intellixity.coframe.schema.model.TypeCatalog;
import io.intellixity.coframe.schema.model.TypeDef;
import io.intellixity.coframe.schema.plugin.Plugin;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class TypeCatalogResolverTest {

  private static Plugin plugin(String name, String yaml) {
    return Plugin.of(name, Set.of(), YamlDocuments.parse(yaml));
  }

  @Test
  void builtinsAreSeeded() {
    TypeCatalog types = new TypeCatalogResolver().build(List.of());
    assertTrue(types.get("Integer").isBuiltin());
    assertEquals("java.time.LocalDateTime", types.get("DateTime").nativeType().javaType());
    assertEquals("byte[]", types.get("LargeBinary").nativeType().javaType());
  }

  @Test
  void resolvingTwiceGivesTheSameChain() {
    Plugin core = plugin("core", """
        types:
          B: {base: Integer, nullable: false}
          C: {base: B, index: true}
        """);
    TypeCatalogResolver resolver = new TypeCatalogResolver();
    TypeCatalog types = resolver.build(List.of(core));

    TypeDef c = types.get("C");
    assertEquals(List.of("B", "Integer"), c.inheritanceChain());
    assertEquals("Integer", c.nativeType().javaType());
    assertEquals(false, c.resolvedAttributes().get("nullable"));
    assertEquals(true, c.resolvedAttributes().get("index"));

    Map<String, TypeDef> byName = new LinkedHashMap<>();
    for (TypeDef t : types.all()) byName.put(t.name(), t);
    TypeDef again = resolver.resolve(c, byName);
    TypeDef thrice = resolver.resolve(again, byName);
    assertEquals(c.inheritanceChain(), again.inheritanceChain());
    assertEquals(c.resolvedAttributes(), thrice.resolvedAttributes());
    assertEquals(2, thrice.inheritanceChain().size());
  }

  @Test
  void ownAttributesWinOverInherited() {
    Plugin core = plugin("core", """
        types:
          Name: {base: String, length: 50, nullable: false}
          ShortName: {inherits: Name, length: 10}
        """);
    TypeDef t = new TypeCatalogResolver().build(List.of(core)).get("ShortName");
    assertEquals(10, t.resolvedAttributes().get("length"));
    assertEquals(false, t.resolvedAttributes().get("nullable"));
    assertEquals("String", t.storageTypeName());
  }

  @Test
  void laterPluginMayUseEarlierTypes() {
    Plugin core = plugin("core", "types: {Email: {base: String, length: 254}}");
    Plugin crm = plugin("crm", "types: {WorkEmail: {base: Email}}");
    TypeDef t = new TypeCatalogResolver().build(List.of(core, crm)).get("WorkEmail");
    assertEquals("crm", t.owningPlugin());
    assertEquals(254, t.resolvedAttributes().get("length"));
  }

  @Test
  void duplicateTypeAcrossPluginsFails() {
    Plugin core = plugin("core", "types: {Email: {base: String}}");
    Plugin crm = plugin("crm", "types: {Email: {base: Text}}");
    DuplicateTypeException ex = assertThrows(DuplicateTypeException.class,
        () -> new TypeCatalogResolver().build(List.of(core, crm)));
    assertEquals("Email", ex.typeName());
    assertEquals("crm", ex.plugin());
  }

  @Test
  void redeclaringABuiltinFails() {
    Plugin core = plugin("core", "types: {String: {base: Text}}");
    assertThrows(DuplicateTypeException.class, () -> new TypeCatalogResolver().build(List.of(core)));
  }

  @Test
  void unknownBaseNamesDeclaringPlugin() {
    Plugin core = plugin("core", "types: {Money: {base: Decimal}}");
    UnknownBaseTypeException ex = assertThrows(UnknownBaseTypeException.class,
        () -> new TypeCatalogResolver().build(List.of(core)));
    assertEquals("Money", ex.typeName());
    assertEquals("Decimal", ex.baseTypeName());
    assertEquals("core", ex.plugin());
  }

  @Test
  void inheritanceCycleFails() {
    Plugin core = plugin("core", """
        types:
          A: {base: B}
          B: {base: A}
        """);
    CircularTypeInheritanceException ex = assertThrows(CircularTypeInheritanceException.class,
        () -> new TypeCatalogResolver().build(List.of(core)));
    assertTrue(ex.chain().containsAll(List.of("A", "B")));
  }

  @Test
  void compositeTypeEmbedsColumns() {
    Plugin core = plugin("core", """
        types:
          Address:
            columns:
              - {name: street, type: String, length: 120}
              - {name: city, type: String}
              - {name: zip, type: String, length: 10}
        """);
    TypeDef address = new TypeCatalogResolver().build(List.of(core)).get("Address");
    assertTrue(address.isComposite());
    assertEquals(List.of("street", "city", "zip"), address.embeddedColumns().stream().map(ColumnDef::name).toList());
    assertEquals(120, address.embeddedColumns().get(0).typeParameters().get("length"));
  }

  @Test
  void typeSplitAcrossDocumentsOfOnePluginIsMerged() {
    Plugin core = Plugin.of("core", Set.of(),
        YamlDocuments.parse("""
            types:
              Address:
                columns:
                  - {name: street, type: String}
                  - {name: zip, type: String}
            """),
        YamlDocuments.parse("""
            types:
              Address:
                columns:
                  - {name: zip, length: 10}
                  - {name: city, type: String}
            """));
    TypeDef address = new TypeCatalogResolver().build(List.of(core)).get("Address");
    assertEquals(List.of("street", "zip", "city"), address.embeddedColumns().stream().map(ColumnDef::name).toList());
    assertEquals(10, address.embeddedColumns().get(1).typeParameters().get("length"));
    assertEquals("core", address.owningPlugin());
  }
}
