package io.segmentlite.segment.model;

import java.util.Optional;

/**
 * A single leaf predicate: field, operator and value.
 *
 * Every component may be missing while the condition is being authored. A condition
 * with a blank field, or without a value for an operator that needs one, is incomplete
 * and compiles to nothing.
 *
 * @param field       Field identifier, resolved through the field catalog
 * @param operator    The operator, null until chosen
 * @param value       The value as typed; for BETWEEN also accepts {@code "min,max"}
 * @param secondValue Upper bound for BETWEEN
 * @param dataType    Declared value domain; null means the catalog type applies
 * @param combinator  Joins this condition to the previous one in its container
 * @param displayName The field's display name as shown when the condition was authored
 */
public record Condition(
        String field,
        Operator operator,
        String value,
        String secondValue,
        DataType dataType,
        Combinator combinator,
        String displayName) {

    public static Condition of(String field, Operator operator, String value) {
        return new Condition(field, operator, value, null, null, null, null);
    }

    public static Condition exists(String field) {
        return of(field, Operator.EXISTS, null);
    }

    public static Condition between(String field, String lower, String upper) {
        return new Condition(field, Operator.BETWEEN, lower, upper, DataType.NUMBER, null, null);
    }

    public Condition withField(String field) {
        return new Condition(field, operator, value, secondValue, dataType, combinator, displayName);
    }

    public Condition withOperator(Operator operator) {
        return new Condition(field, operator, value, secondValue, dataType, combinator, displayName);
    }

    public Condition withValue(String value) {
        return new Condition(field, operator, value, secondValue, dataType, combinator, displayName);
    }

    public Condition withSecondValue(String secondValue) {
        return new Condition(field, operator, value, secondValue, dataType, combinator, displayName);
    }

    public Condition withDataType(DataType dataType) {
        return new Condition(field, operator, value, secondValue, dataType, combinator, displayName);
    }

    public Condition withCombinator(Combinator combinator) {
        return new Condition(field, operator, value, secondValue, dataType, combinator, displayName);
    }

    public Condition withDisplayName(String displayName) {
        return new Condition(field, operator, value, secondValue, dataType, combinator, displayName);
    }

    public boolean hasValue() {
        return value != null && !value.isBlank();
    }

    public boolean hasField() {
        return field != null && !field.isBlank();
    }

    /**
     * A condition is complete when it names a field and, unless it tests existence,
     * carries a value. A missing operator does not make it incomplete.
     */
    public boolean isComplete() {
        if (!hasField()) {
            return false;
        }
        return (operator != null && operator.isExistence()) || hasValue();
    }

    /**
     * @return The combinator joining this condition to its predecessor, AND when unset
     */
    public Combinator effectiveCombinator() {
        return combinator == null ? Combinator.AND : combinator;
    }

    /**
     * The bounds of a range: value and secondValue, or value split on its first comma.
     *
     * @return empty when only one bound is available
     */
    public Optional<Range> range() {
        if (!hasValue()) {
            return Optional.empty();
        }
        if (secondValue != null && !secondValue.isBlank()) {
            return Optional.of(new Range(value.trim(), secondValue.trim()));
        }
        int comma = value.indexOf(',');
        if (comma < 0) {
            return Optional.empty();
        }
        String lower = value.substring(0, comma).trim();
        String upper = value.substring(comma + 1).trim();
        if (lower.isEmpty() || upper.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Range(lower, upper));
    }

    /**
     * Inclusive bounds of a BETWEEN condition, as typed.
     */
    public record Range(String lower, String upper) {
    }
}
