package io.segmentlite.segment.validation;

import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.segment.catalog.FieldCatalog;
import io.segmentlite.segment.catalog.FieldCatalogLoader;
import io.segmentlite.segment.model.Condition;
import io.segmentlite.segment.model.Container;
import io.segmentlite.segment.model.DataType;
import io.segmentlite.segment.model.Operator;
import io.segmentlite.segment.model.Scope;
import io.segmentlite.segment.model.SegmentDefinition;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SegmentValidator: every problem is reported with its path.
 */
class SegmentValidatorTest {

    private static SegmentValidator validator;

    @BeforeAll
    static void setUp() {
        FieldCatalog catalog = new FieldCatalogLoader(EventSchema.standard()).loadDefault();
        validator = new SegmentValidator(catalog);
    }

    private static List<String> messages(ValidationResult result) {
        return result.errors().stream().map(ValidationIssue::message).toList();
    }

    private static final Condition MOBILE = Condition.of("device_type", Operator.EQUALS, "Mobile");

    @Test
    @DisplayName("A well-formed segment passes")
    void testValidSegment() {
        SegmentDefinition definition = SegmentDefinition.of("Mobile buyers",
                Container.visitor(Condition.of("revenue", Operator.GREATER_THAN, "0"))
                        .addChild(Container.hit(MOBILE)));

        ValidationResult result = validator.validate(definition);

        assertTrue(result.ok(), result.toString());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    @DisplayName("Name must be present and not the placeholder")
    void testName() {
        assertTrue(validator.validate(SegmentDefinition.of(" ", Container.hit(MOBILE)))
                .errorMessages().contains("name: Segment name is required"));
        assertTrue(validator.validate(SegmentDefinition.of("New Segment", Container.hit(MOBILE)))
                .errorMessages().contains("name: Segment name cannot be 'New Segment'"));
    }

    @Test
    @DisplayName("No containers, or no conditions anywhere, is an error")
    void testNoContainersOrConditions() {
        ValidationResult empty = validator.validate(SegmentDefinition.named("Empty"));
        assertEquals(List.of("At least one container is required"), messages(empty));

        ValidationResult noConditions = validator.validate(SegmentDefinition.of("Shell", Container.visit()));
        assertTrue(messages(noConditions).contains("At least one container must have conditions"));
        assertTrue(noConditions.warnings().stream()
                .anyMatch(w -> w.path().equals("containers[0]")
                        && w.message().equals("Container has neither conditions nor children")));
    }

    @Test
    @DisplayName("Hit containing visitor fails; visitor containing hit passes")
    void testNestingRule() {
        ValidationResult widening = validator.validate(SegmentDefinition.of("Bad",
                Container.hit(MOBILE).addChild(Container.visitor(MOBILE))));
        assertTrue(widening.hasErrorAt("containers[0].children[0]"), widening.toString());
        assertTrue(messages(widening).contains("Cannot nest a visitor container inside a hit container"));

        ValidationResult narrowing = validator.validate(SegmentDefinition.of("Good",
                Container.visitor(MOBILE).addChild(Container.hit(MOBILE))));
        assertTrue(narrowing.ok(), narrowing.toString());
    }

    @Test
    @DisplayName("Missing scope and sign are reported")
    void testMissingScopeAndSign() {
        ValidationResult result = validator.validate(SegmentDefinition.of("Loose",
                new Container(null, null, null, List.of(MOBILE), List.of())));

        assertTrue(messages(result).contains("Container type is required (hit, visit or visitor)"));
        assertTrue(messages(result).contains("Container must be set to include or exclude"));
    }

    @Test
    @DisplayName("Condition problems are collected, each at its own path")
    void testConditionErrors() {
        // GIVEN: four broken conditions in one container
        Container container = Container.of(Scope.HIT).withConditions(List.of(
                Condition.of("", Operator.EQUALS, "x"),
                Condition.of("shoe_size", Operator.EQUALS, "42"),
                Condition.of("revenue", Operator.CONTAINS, "5"),
                Condition.of("device_type", Operator.EQUALS, "")));

        // WHEN
        ValidationResult result = validator.validate(SegmentDefinition.of("Broken", container));

        // THEN
        assertFalse(result.ok());
        assertTrue(result.hasErrorAt("containers[0].conditions[0]"));
        assertTrue(result.hasErrorAt("containers[0].conditions[1]"));
        assertTrue(result.hasErrorAt("containers[0].conditions[2]"));
        assertTrue(result.hasErrorAt("containers[0].conditions[3]"));
        assertTrue(messages(result).contains("Field is required"));
        assertTrue(messages(result).contains("Unknown field 'shoe_size'"));
        assertTrue(messages(result).contains("Operator 'contains' is not valid for number fields"));
        assertTrue(messages(result).contains("Value is required for operator 'equals'"));
    }

    @Test
    @DisplayName("Numeric fields need numeric values; between needs both bounds")
    void testNumericValues() {
        ValidationResult notNumber = validator.validate(SegmentDefinition.of("N",
                Container.hit(Condition.of("revenue", Operator.GREATER_THAN, "lots"))));
        assertTrue(messages(notNumber).contains("Value must be a number for numeric fields"));

        ValidationResult oneBound = validator.validate(SegmentDefinition.of("N",
                Container.hit(Condition.of("revenue", Operator.BETWEEN, "10"))));
        assertTrue(messages(oneBound).contains("Second value is required for 'between' operator"));

        ValidationResult badUpper = validator.validate(SegmentDefinition.of("N",
                Container.hit(Condition.between("revenue", "10", "many"))));
        assertEquals(List.of("Second value must be a number for numeric fields"), messages(badUpper));

        assertTrue(validator.validate(SegmentDefinition.of("N",
                Container.hit(Condition.of("revenue", Operator.BETWEEN, "10,20")))).ok());
    }

    @Test
    @DisplayName("Declared data type must agree with the catalog")
    void testDataTypeMismatch() {
        ValidationResult result = validator.validate(SegmentDefinition.of("T",
                Container.hit(MOBILE.withDataType(DataType.NUMBER))));

        assertFalse(result.ok());
        assertTrue(result.hasErrorAt("containers[0].conditions[0]"));
    }

    @Test
    @DisplayName("Existence operators need no value")
    void testExistenceNeedsNoValue() {
        assertTrue(validator.validate(SegmentDefinition.of("Campaign traffic",
                Container.hit(Condition.exists("campaign")))).ok());
    }

    @Test
    @DisplayName("Overlong values and many root containers are reported")
    void testLimits() {
        ValidationResult longValue = validator.validate(SegmentDefinition.of("Long",
                Container.hit(Condition.of("page_url", Operator.CONTAINS, "x".repeat(1001)))));
        assertTrue(messages(longValue).contains("Value is too long (max 1000 characters)"));

        ValidationResult many = validator.validate(SegmentDefinition.of("Many",
                Container.hit(MOBILE), Container.hit(MOBILE), Container.hit(MOBILE), Container.hit(MOBILE)));
        assertTrue(many.ok());
        assertEquals("Complex segment with many containers may be slow", many.warnings().get(0).message());
    }
}
