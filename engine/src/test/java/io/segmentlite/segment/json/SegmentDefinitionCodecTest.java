package io.segmentlite.segment.json;

import io.segmentlite.segment.model.Combinator;
import io.segmentlite.segment.model.Condition;
import io.segmentlite.segment.model.Container;
import io.segmentlite.segment.model.DataType;
import io.segmentlite.segment.model.Operator;
import io.segmentlite.segment.model.Scope;
import io.segmentlite.segment.model.SegmentDefinition;
import io.segmentlite.segment.model.Sign;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reading and writing segment definitions as builder JSON.
 */
class SegmentDefinitionCodecTest {

    private static final String MOBILE_BUYERS = """
            {
              "name": "Mobile buyers",
              "description": "Bought on a phone",
              "container_type": "visitor",
              "logic": "or",
              "containers": [
                {
                  "type": "visitor",
                  "include": false,
                  "logic": "and",
                  "conditions": [
                    {"field": "revenue", "name": "Revenue", "operator": ">", "value": 500, "data_type": "number"}
                  ],
                  "children": [
                    {
                      "type": "hit",
                      "conditions": [
                        {"field": "device_type", "operator": "equals", "value": "Mobile", "combinator": "or"},
                        {"field": "revenue", "operator": "between", "value": "10", "value2": "20"}
                      ]
                    }
                  ]
                }
              ]
            }
            """;

    // ==================== Reading ====================

    @Test
    @DisplayName("Reads the full builder shape")
    void testRead() {
        // WHEN
        SegmentDefinition definition = SegmentDefinitionCodec.read(MOBILE_BUYERS);

        // THEN
        assertEquals("Mobile buyers", definition.name());
        assertEquals("Bought on a phone", definition.description());
        assertEquals(Scope.VISITOR, definition.rootScope());
        assertEquals(Combinator.OR, definition.combinator());

        Container visitor = definition.containers().get(0);
        assertEquals(Scope.VISITOR, visitor.scope());
        assertEquals(Sign.EXCLUDE, visitor.sign());
        Condition revenue = visitor.conditions().get(0);
        assertEquals(Operator.GREATER_THAN, revenue.operator());
        assertEquals("500", revenue.value());
        assertEquals(DataType.NUMBER, revenue.dataType());
        assertEquals("Revenue", revenue.displayName());

        Container hit = visitor.children().get(0);
        assertEquals(Scope.HIT, hit.scope());
        assertEquals(Sign.INCLUDE, hit.sign());
        assertEquals(Combinator.AND, hit.combinator());
        assertEquals(Combinator.OR, hit.conditions().get(0).combinator());
        assertEquals("20", hit.conditions().get(1).secondValue());
    }

    @Test
    @DisplayName("Missing keys take the builder defaults")
    void testDefaults() {
        SegmentDefinition definition = SegmentDefinitionCodec.read("{\"name\": \"Bare\", \"containers\": [{}]}");

        assertEquals("", definition.description());
        assertEquals(Scope.HIT, definition.rootScope());
        assertEquals(Combinator.AND, definition.combinator());
        assertEquals(Container.of(Scope.HIT), definition.containers().get(0));
    }

    @Test
    @DisplayName("Library and backup wrappers are unwrapped")
    void testUnwrap() {
        SegmentDefinition fromLibrary = SegmentDefinitionCodec.read(
                "{\"id\": \"abc\", \"name\": \"Outer\", \"definition\": {\"containers\": []}}");
        assertEquals("Outer", fromLibrary.name());

        SegmentDefinition fromBackup = SegmentDefinitionCodec.read(
                "{\"segment\": {\"name\": \"Inner\", \"containers\": []}}");
        assertEquals("Inner", fromBackup.name());
    }

    @Test
    @DisplayName("Invalid documents are rejected with a path")
    void testInvalid() {
        SegmentJsonException noName = assertThrows(SegmentJsonException.class,
                () -> SegmentDefinitionCodec.read("{\"containers\": []}"));
        assertEquals("Invalid segment: missing name", noName.getMessage());

        SegmentJsonException badScope = assertThrows(SegmentJsonException.class,
                () -> SegmentDefinitionCodec.read("{\"name\": \"X\", \"containers\": [{\"type\": \"galaxy\"}]}"));
        assertEquals("Unknown value 'galaxy' at containers[0].type", badScope.getMessage());

        SegmentJsonException badOperator = assertThrows(SegmentJsonException.class,
                () -> SegmentDefinitionCodec.read("{\"name\": \"X\", \"containers\": [{\"conditions\": "
                        + "[{\"field\": \"a\", \"operator\": \"resembles\"}]}]}"));
        assertEquals("Unknown value 'resembles' at containers[0].conditions[0].operator", badOperator.getMessage());
    }

    // ==================== Writing ====================

    @Test
    @DisplayName("Writing then reading gives back an equal definition")
    void testWriteRead() {
        SegmentDefinition original = SegmentDefinitionCodec.read(MOBILE_BUYERS);

        String json = SegmentDefinitionCodec.write(original);

        assertEquals(original, SegmentDefinitionCodec.read(json));
    }

    @Test
    @DisplayName("Writing fills in defaults and omits unset optional keys")
    void testToMap() {
        SegmentDefinition definition = SegmentDefinition.of("Plain",
                new Container(null, null, null, List.of(Condition.of("browser", Operator.EQUALS, "Chrome")), null));

        Map<String, Object> map = SegmentDefinitionCodec.toMap(definition);

        @SuppressWarnings("unchecked")
        Map<String, Object> container = (Map<String, Object>) ((List<Object>) map.get("containers")).get(0);
        assertEquals("hit", container.get("type"));
        assertEquals(true, container.get("include"));
        assertEquals("and", container.get("logic"));
        @SuppressWarnings("unchecked")
        Map<String, Object> condition = (Map<String, Object>) ((List<Object>) container.get("conditions")).get(0);
        assertEquals(List.of("field", "operator", "value"), List.copyOf(condition.keySet()));
        assertEquals("equals", condition.get("operator"));
    }

    @Test
    @DisplayName("Export adds metadata and names the file after the segment")
    void testExport() {
        SegmentDefinition definition = SegmentDefinition.of("Mobile Buyers",
                Container.hit(Condition.of("device_type", Operator.EQUALS, "Mobile")));
        LocalDateTime at = LocalDateTime.of(2024, 1, 31, 9, 30, 0);

        Map<String, Object> exported = SegmentJson.parseObject(SegmentDefinitionCodec.export(definition, at));

        assertEquals("2024-01-31T09:30", exported.get("exported_at"));
        assertEquals("segment_builder", exported.get("exported_by"));
        assertEquals("2.0", exported.get("version"));
        assertEquals(definition, SegmentDefinitionCodec.fromMap(exported));
        assertEquals("mobile_buyers_20240131_093000.json", SegmentDefinitionCodec.exportFileName(definition, at));
    }
}
