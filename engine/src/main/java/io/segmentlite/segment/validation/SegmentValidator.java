package io.segmentlite.segment.validation;

import io.segmentlite.segment.catalog.FieldCatalog;
import io.segmentlite.segment.catalog.FieldDefinition;
import io.segmentlite.segment.model.Condition;
import io.segmentlite.segment.model.Container;
import io.segmentlite.segment.model.DataType;
import io.segmentlite.segment.model.Operator;
import io.segmentlite.segment.model.Scope;
import io.segmentlite.segment.model.SegmentDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Strict structural check run before a segment is saved.
 *
 * Unlike the compiler, which drops what it cannot use, the validator reports every
 * problem in the tree, each with its path.
 */
public final class SegmentValidator {

    static final int MAX_VALUE_LENGTH = 1000;
    static final int ROOT_CONTAINER_WARNING_THRESHOLD = 3;

    private final FieldCatalog catalog;
    private final String placeholderName;

    public SegmentValidator(FieldCatalog catalog, String placeholderName) {
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        this.placeholderName = Objects.requireNonNull(placeholderName, "Placeholder name cannot be null");
    }

    public SegmentValidator(FieldCatalog catalog) {
        this(catalog, SegmentDefinition.DEFAULT_NAME);
    }

    public ValidationResult validate(SegmentDefinition definition) {
        Objects.requireNonNull(definition, "Segment definition cannot be null");
        Collector issues = new Collector();

        String name = definition.name() == null ? "" : definition.name().trim();
        if (name.isEmpty()) {
            issues.error("name", "Segment name is required");
        } else if (name.equals(placeholderName)) {
            issues.error("name", "Segment name cannot be '" + placeholderName + "'");
        }

        List<Container> containers = definition.containers();
        if (containers.isEmpty()) {
            issues.error("containers", "At least one container is required");
            return issues.result();
        }
        if (containers.size() > ROOT_CONTAINER_WARNING_THRESHOLD) {
            issues.warning("containers", "Complex segment with many containers may be slow");
        }

        boolean anyConditions = false;
        for (int i = 0; i < containers.size(); i++) {
            anyConditions |= validateContainer(containers.get(i), "containers[" + i + "]", null, issues);
        }
        if (!anyConditions) {
            issues.error("containers", "At least one container must have conditions");
        }
        return issues.result();
    }

    /**
     * @return true if this container or one of its descendants has a condition
     */
    private boolean validateContainer(Container container, String path, Scope parentScope, Collector issues) {
        if (container.scope() == null) {
            issues.error(path, "Container type is required (hit, visit or visitor)");
        }
        if (container.sign() == null) {
            issues.error(path, "Container must be set to include or exclude");
        }
        Scope scope = container.effectiveScope();
        if (parentScope != null && !parentScope.canContain(scope)) {
            issues.error(path, "Cannot nest a " + scope.id() + " container inside a " + parentScope.id() + " container");
        }
        if (container.isEmpty()) {
            issues.warning(path, "Container has neither conditions nor children");
        }

        boolean anyConditions = !container.conditions().isEmpty();
        for (int i = 0; i < container.conditions().size(); i++) {
            validateCondition(container.conditions().get(i), path + ".conditions[" + i + "]", issues);
        }
        for (int i = 0; i < container.children().size(); i++) {
            anyConditions |= validateContainer(container.children().get(i), path + ".children[" + i + "]",
                    scope, issues);
        }
        return anyConditions;
    }

    private void validateCondition(Condition condition, String path, Collector issues) {
        Optional<FieldDefinition> field = Optional.empty();
        if (!condition.hasField()) {
            issues.error(path, "Field is required");
        } else {
            field = catalog.resolve(condition.field());
            if (field.isEmpty()) {
                issues.error(path, "Unknown field '" + condition.field() + "'");
            }
        }

        DataType dataType = condition.dataType();
        if (field.isPresent()) {
            DataType fieldType = field.get().dataType();
            if (dataType != null && dataType != fieldType) {
                issues.error(path, "Data type '" + dataType.id() + "' does not match field '"
                        + field.get().field() + "', which is a " + fieldType.id() + " field");
            }
            dataType = fieldType;
        }
        if (dataType == null) {
            dataType = DataType.STRING;
        }

        Operator operator = condition.operator();
        if (operator == null) {
            issues.error(path, "Operator is required");
        } else if (!operator.appliesTo(dataType)) {
            issues.error(path, "Operator '" + operator.label() + "' is not valid for " + dataType.id() + " fields");
        }

        if (operator != null && operator.isExistence()) {
            return;
        }
        if (!condition.hasValue()) {
            issues.error(path, "Value is required"
                    + (operator == null ? "" : " for operator '" + operator.label() + "'"));
            return;
        }
        if (condition.value().length() > MAX_VALUE_LENGTH) {
            issues.error(path, "Value is too long (max " + MAX_VALUE_LENGTH + " characters)");
        }

        if (operator == Operator.BETWEEN) {
            Optional<Condition.Range> range = condition.range();
            if (range.isEmpty()) {
                issues.error(path, "Second value is required for 'between' operator");
            } else if (dataType == DataType.NUMBER) {
                if (!isNumber(range.get().lower())) {
                    issues.error(path, "Value must be a number for numeric fields");
                }
                if (!isNumber(range.get().upper())) {
                    issues.error(path, "Second value must be a number for numeric fields");
                }
            }
        } else if (dataType == DataType.NUMBER && !isNumber(condition.value())) {
            issues.error(path, "Value must be a number for numeric fields");
        }
    }

    private static boolean isNumber(String value) {
        try {
            double parsed = Double.parseDouble(value.trim());
            return !Double.isNaN(parsed) && !Double.isInfinite(parsed);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static final class Collector {
        private final List<ValidationIssue> errors = new ArrayList<>();
        private final List<ValidationIssue> warnings = new ArrayList<>();

        void error(String path, String message) {
            errors.add(new ValidationIssue(path, message));
        }

        void warning(String path, String message) {
            warnings.add(new ValidationIssue(path, message));
        }

        ValidationResult result() {
            return new ValidationResult(errors, warnings);
        }
    }
}
