package io.segmentlite.segment.catalog;

import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.store.EventTable;
import io.segmentlite.segment.model.DataType;
import io.segmentlite.segment.model.Operator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldCatalogLoaderTest {

    private FieldCatalogLoader loader;

    @BeforeEach
    void setUp() {
        loader = new FieldCatalogLoader(EventSchema.standard());
    }

    @Test
    @DisplayName("Bundled catalog binds fields to their owning tables")
    void testDefaultCatalog() {
        // WHEN
        FieldCatalog catalog = loader.loadDefault();

        // THEN: hit dimensions, session and visitor rollups
        FieldDefinition device = catalog.resolve("device_type").orElseThrow();
        assertEquals(EventTable.HITS, device.owningTable());
        assertEquals(DataType.STRING, device.dataType());
        assertEquals(List.of("Desktop", "Mobile", "Tablet"), device.values());

        FieldDefinition lifetimeRevenue = catalog.resolve("lifetime_revenue").orElseThrow();
        assertEquals(EventTable.USERS, lifetimeRevenue.owningTable());
        assertEquals("total_revenue", lifetimeRevenue.column());
        assertTrue(lifetimeRevenue.isNumeric());

        assertEquals(EventTable.SESSIONS, catalog.resolve("pages_viewed").orElseThrow().owningTable());
        assertEquals(EventTable.USERS, catalog.resolve("user_type").orElseThrow().owningTable());
        assertFalse(catalog.contains("no_such_field"));
    }

    @Test
    @DisplayName("Groups keep their configured order and kind")
    void testGroups() {
        FieldCatalog catalog = loader.loadDefault();

        assertEquals("Page", catalog.groups(FieldKind.DIMENSION).get(0).category());
        assertEquals("Commerce", catalog.groups(FieldKind.METRIC).get(0).category());
        assertEquals(catalog.size(), catalog.fields().size());
        assertTrue(catalog.fieldsOwnedBy(EventTable.SESSIONS).stream().allMatch(FieldDefinition::isNumeric));
        assertTrue(catalog.operatorsFor(DataType.NUMBER).contains(Operator.BETWEEN));
    }

    @Test
    @DisplayName("Data type defaults follow the section: dimensions are strings, metrics numbers")
    void testDataTypeDefaults() {
        FieldCatalog catalog = loader.parse("""
                {
                  "dimensions": [ { "category": "Geo", "items": [ { "field": "country" } ] } ],
                  "metrics": [ { "category": "Money", "items": [ { "field": "revenue", "name": "Revenue" } ] } ]
                }
                """);

        assertEquals(DataType.STRING, catalog.resolve("country").orElseThrow().dataType());
        assertEquals("country", catalog.resolve("country").orElseThrow().name());
        assertEquals(DataType.NUMBER, catalog.resolve("revenue").orElseThrow().dataType());
    }

    @Test
    @DisplayName("A column missing from the schema is a configuration error")
    void testUnknownColumn() {
        FieldCatalogException e = assertThrows(FieldCatalogException.class, () -> loader.parse("""
                { "dimensions": [ { "category": "X", "items": [ { "field": "shoe_size" } ] } ] }
                """));
        assertTrue(e.getMessage().contains("shoe_size"), e.getMessage());
    }

    @Test
    @DisplayName("Duplicate fields, unknown tables and bad JSON are rejected")
    void testInvalidCatalogs() {
        assertThrows(FieldCatalogException.class, () -> loader.parse("""
                { "dimensions": [ { "category": "A", "items": [ { "field": "country" }, { "field": "country" } ] } ] }
                """));
        assertThrows(FieldCatalogException.class, () -> loader.parse("""
                { "metrics": [ { "category": "A", "items": [ { "field": "x", "table": "orders", "column": "hit_id" } ] } ] }
                """));
        assertThrows(FieldCatalogException.class, () -> loader.parse("{ \"dimensions\": [ "));
        assertThrows(FieldCatalogException.class, () -> loader.parse("{}"));
        assertThrows(FieldCatalogException.class, () -> loader.loadResource("missing-catalog.json"));
    }
}
