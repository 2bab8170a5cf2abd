package io.intellixity.coframe.schema.resolve;

import io.intellixity.coframe.schema.config.YamlDocuments;
import io.intellixity.coframe.schema.error.DuplicateColumnException;
import io.intellixity.coframe.schema.error.InvalidForeignReferenceException;
import io.intellixity.coframe.schema.error.InvalidManyToManyException;
import io.intellixity.coframe.schema.error.InvalidMixinException;
import io.intellixity.coframe.schema.error.UnknownForeignTableException;
import io.intellixity.coframe.schema.merge.MergeEngine;
import io.intellixity.coframe.schema.merge.Node;
import io.intellixity.coframe.schema.model.ColumnDef;
import io.intellixity.coframe.schema.model.ManyToManyDef;
import io.intellixity.coframe.schema.model.TableDef;
import io.intellixity.coframe.schema.model.TypeCatalog;
import io.intellixity.coframe.schema.plugin.Plugin;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class TableResolutionTest {

  private static Plugin plugin(String name, String yaml) {
    return Plugin.of(name, Set.of(), YamlDocuments.parse(yaml));
  }

  private static List<TableDef> structure(List<Plugin> plugins) {
    MergeEngine engine = new MergeEngine();
    engine.mergeAll(plugins);
    TypeCatalog types = new TypeCatalogResolver().build(plugins);
    return new TableStructureBuilder(types).build(engine.result(), plugins);
  }

  private static Map<String, TableDef> resolve(Plugin... plugins) {
    List<TableDef> tables = new ReferenceResolver(structure(List.of(plugins))).resolveAll();
    Map<String, TableDef> out = new LinkedHashMap<>();
    for (TableDef t : tables) out.put(t.name(), t);
    return out;
  }

  private static List<String> names(List<ColumnDef> cols) {
    return cols.stream().map(ColumnDef::name).toList();
  }

  private static final String ORDERS = """
      tables:
        Orders:
          columns:
            - {name: id, type: BigInteger, primary_key: true, autoincrement: true}
      """;
  private static final String LINE_ITEM = """
      tables:
        LineItem:
          columns:
            - {name: id, type: Integer, primary_key: true}
            - {name: order_id, type: Orders.id, nullable: false}
      """;

  @Test
  void foreignKeyTakesTargetTypeWhateverTheDeclarationOrder() {
    for (List<Plugin> order : List.of(
        List.of(plugin("a", ORDERS), plugin("b", LINE_ITEM)),
        List.of(plugin("a", LINE_ITEM), plugin("b", ORDERS)))) {
      Map<String, TableDef> tables = resolve(order.toArray(new Plugin[0]));
      ColumnDef fk = tables.get("LineItem").column("order_id").orElseThrow();
      assertTrue(fk.isForeignKey());
      assertTrue(fk.foreignKey().isResolved());
      assertEquals("BigInteger", fk.effectiveType().name());
      assertEquals("Long", fk.effectiveType().nativeType().javaType());
      assertEquals("orders", fk.foreignKey().targetPhysicalName());
      assertFalse(fk.isNullable());
    }
  }

  @Test
  void structuralPassLeavesStubs() {
    List<TableDef> structural = structure(List.of(plugin("a", LINE_ITEM), plugin("b", ORDERS)));
    ColumnDef fk = structural.get(0).column("order_id").orElseThrow();
    assertFalse(fk.foreignKey().isResolved());
    assertNull(fk.effectiveType());
    assertFalse(structural.get(0).isResolved());
  }

  @Test
  void explicitForeignKeyCarriesRelationOptions() {
    Plugin p = plugin("core", ORDERS + """
          LineItem:
            columns:
              - name: order_id
                foreign_key: {target: Orders.id, ondelete: CASCADE}
        """);
    ColumnDef fk = resolve(p).get("LineItem").column("order_id").orElseThrow();
    assertEquals("CASCADE", fk.relationParameters().get("ondelete"));
    assertEquals("Orders.id", fk.foreignKey().target());
    assertFalse(fk.foreignKey().options().containsKey(Node.PLUGIN_KEY));
  }

  @Test
  void foreignKeyChainResolvesToTerminalType() {
    Plugin p = plugin("core", ORDERS + """
          Shipment:
            columns:
              - {name: id, type: Integer, primary_key: true}
              - {name: order_id, type: Orders.id}
          Parcel:
            columns:
              - {name: order_id, type: Shipment.order_id}
        """);
    ColumnDef c = resolve(p).get("Parcel").column("order_id").orElseThrow();
    assertEquals("BigInteger", c.effectiveType().name());
  }

  @Test
  void unknownTargetTableFails() {
    UnknownForeignTableException ex = assertThrows(UnknownForeignTableException.class,
        () -> resolve(plugin("core", LINE_ITEM)));
    assertEquals("LineItem", ex.tableName());
    assertEquals("order_id", ex.columnName());
    assertEquals("Orders", ex.targetTableName());
  }

  @Test
  void unknownTargetColumnFails() {
    Plugin p = plugin("core", ORDERS + """
          Refund:
            columns:
              - {name: order_ref, type: Orders.number}
        """);
    InvalidForeignReferenceException ex = assertThrows(InvalidForeignReferenceException.class, () -> resolve(p));
    assertEquals("Refund", ex.tableName());
  }

  @Test
  void unknownTypeThatIsNotAReferenceFails() {
    Plugin p = plugin("core", """
        tables:
          User:
            columns:
              - {name: id, type: Strin}
        """);
    assertThrows(InvalidForeignReferenceException.class, () -> structure(List.of(p)));
  }

  private static final String ADDRESS = """
      types:
        Address:
          columns:
            - {name: street, type: String}
            - {name: city, type: String}
            - {name: zip, type: String, length: 10}
      """;

  @Test
  void compositeColumnExpandsWithPrefix() {
    Plugin p = plugin("core", ADDRESS + """
        tables:
          Order:
            columns:
              - {name: id, type: Integer, primary_key: true}
              - {name: shipping, type: Address, prefix: ship_}
        """);
    TableDef order = resolve(p).get("Order");
    assertEquals(List.of("id", "ship_street", "ship_city", "ship_zip"), names(order.columns()));
    assertEquals(10, order.column("ship_zip").orElseThrow().typeParameter("length"));
  }

  @Test
  void prefixedColumnClashingWithAnotherPluginFails() {
    Plugin core = plugin("core", ADDRESS + """
        tables:
          Order:
            columns:
              - {name: id, type: Integer, primary_key: true}
              - {name: shipping, type: Address, prefix: ship_}
        """);
    Plugin shop = plugin("shop", """
        tables:
          Order:
            columns:
              - {name: ship_street, type: Text}
        """);
    DuplicateColumnException ex = assertThrows(DuplicateColumnException.class, () -> structure(List.of(core, shop)));
    assertEquals("Order", ex.tableName());
    assertEquals("ship_street", ex.columnName());
  }

  @Test
  void mixinColumnsAreAppendedAndTagged() {
    Plugin p = plugin("core", """
        types:
          Audited:
            columns:
              - {name: created_at, type: DateTime, nullable: false}
              - {name: updated_at, type: DateTime}
        tables:
          User:
            mixins: [Audited]
            columns:
              - {name: id, type: Integer, primary_key: true}
        """);
    TableDef user = resolve(p).get("User");
    assertEquals(List.of("id", "created_at", "updated_at"), names(user.columns()));
    assertEquals(List.of("id"), names(user.ownColumns()));
    assertEquals("Audited", user.column("created_at").orElseThrow().mixin());
    assertFalse(user.attributes().containsKey("columns"));
  }

  @Test
  void scalarMixinIsRejected() {
    Plugin p = plugin("core", """
        tables:
          User:
            mixins: [String]
            columns:
              - {name: id, type: Integer}
        """);
    InvalidMixinException ex = assertThrows(InvalidMixinException.class, () -> structure(List.of(p)));
    assertEquals("String", ex.mixin());
  }

  private static final String LIBRARY = """
      tables:
        Book:
          columns:
            - {name: id, type: Integer, primary_key: true}
        Author:
          columns:
            - {name: id, type: Uuid, primary_key: true}
        BookAuthor:
          many_to_many:
            target1: Book.id
            target2: Author.id
      """;

  @Test
  void manyToManyGeneratesTypedJoinColumns() {
    TableDef ba = resolve(plugin("core", LIBRARY)).get("BookAuthor");
    assertTrue(ba.isManyToMany());
    assertTrue(ba.isResolved());

    ManyToManyDef m2m = ba.manyToMany();
    assertEquals("book_id", m2m.target1().joinColumn());
    assertEquals("author_id", m2m.target2().joinColumn());

    ColumnDef bookId = ba.column("book_id").orElseThrow();
    ColumnDef authorId = ba.column("author_id").orElseThrow();
    assertEquals("Integer", bookId.effectiveType().nativeType().javaType());
    assertEquals("java.util.UUID", authorId.effectiveType().nativeType().javaType());
    assertTrue(bookId.isPrimaryKey());
    assertFalse(authorId.isNullable());
    assertEquals("target1", bookId.manyToManyTag());
    assertEquals("target2", authorId.manyToManyTag());
  }

  @Test
  void manyToManyTargetMayNameItsJoinColumn() {
    Plugin p = plugin("core", LIBRARY.replace("target2: Author.id", "target2: {table: Author.id, column: writer}"));
    TableDef ba = resolve(p).get("BookAuthor");
    assertTrue(ba.column("writer").isPresent());
  }

  @Test
  void manyToManyUnknownColumnFails() {
    Plugin p = plugin("core", LIBRARY.replace("target2: Author.id", "target2: Author.uuid"));
    InvalidManyToManyException ex = assertThrows(InvalidManyToManyException.class, () -> resolve(p));
    assertEquals("BookAuthor", ex.tableName());
  }

  @Test
  void selfManyToManyGetsDistinctJoinColumns() {
    Plugin p = plugin("core", """
        tables:
          Tag:
            columns:
              - {name: id, type: Integer, primary_key: true}
          TagLink:
            many_to_many:
              target1: Tag.id
              target2: Tag.id
        """);
    TableDef link = resolve(p).get("TagLink");
    assertEquals("tag_id", link.manyToMany().target1().joinColumn());
    assertEquals("tag_id_2", link.manyToMany().target2().joinColumn());
    assertEquals(List.of("tag_id", "tag_id_2"), names(link.columns()));
    assertEquals("Integer", link.column("tag_id_2").orElseThrow().effectiveType().name());
  }

  @Test
  void selfManyToManyKeepsNamedJoinColumn() {
    Plugin p = plugin("core", """
        tables:
          Tag:
            columns:
              - {name: id, type: Integer, primary_key: true}
          TagLink:
            many_to_many:
              target1: {table: Tag.id, column: tag_id}
              target2: Tag.id
        """);
    assertEquals(List.of("tag_id", "tag_id_2"), names(resolve(p).get("TagLink").columns()));
  }

  @Test
  void sameNamedJoinColumnsFail() {
    Plugin p = plugin("core", """
        tables:
          Tag:
            columns:
              - {name: id, type: Integer, primary_key: true}
          TagLink:
            many_to_many:
              target1: {table: Tag.id, column: tag}
              target2: {table: Tag.id, column: tag}
        """);
    InvalidManyToManyException ex = assertThrows(InvalidManyToManyException.class, () -> structure(List.of(p)));
    assertEquals("TagLink", ex.tableName());
  }

  @Test
  void foreignKeyToJoinColumnFollowsItsTarget() {
    Plugin p = plugin("core", LIBRARY + """
          Royalty:
            columns:
              - {name: id, type: Integer, primary_key: true}
              - {name: author_ref, type: BookAuthor.author_id}
        """);
    ColumnDef ref = resolve(p).get("Royalty").column("author_ref").orElseThrow();
    assertEquals("Uuid", ref.effectiveType().name());
    assertEquals("bookauthor", ref.foreignKey().targetPhysicalName());
  }

  @Test
  void physicalNameDefaultsToLowercase() {
    Plugin p = plugin("core", """
        tables:
          Person:
            name: people
            columns:
              - {name: id, type: Integer}
          Pet:
            columns:
              - {name: id, type: Integer}
        """);
    Map<String, TableDef> tables = resolve(p);
    assertEquals("people", tables.get("Person").physicalName());
    assertEquals("pet", tables.get("Pet").physicalName());
  }
}
