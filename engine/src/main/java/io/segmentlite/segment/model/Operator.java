package io.segmentlite.segment.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Comparison operators a condition can apply, partitioned by data type.
 *
 * Each operator has a stable id (snake case) and the display label the builder shows.
 * {@link #parse} accepts either, along with a few common spellings.
 */
public enum Operator {
    EQUALS("equals", "equals", "equal", "="),
    NOT_EQUALS("not_equals", "does not equal", "not equal", "!=", "<>"),
    CONTAINS("contains", "contains"),
    NOT_CONTAINS("not_contains", "does not contain"),
    STARTS_WITH("starts_with", "starts with"),
    ENDS_WITH("ends_with", "ends with"),
    GREATER_THAN("greater_than", "is greater than", "greater than", ">"),
    LESS_THAN("less_than", "is less than", "less than", "<"),
    GREATER_OR_EQUAL("greater_equal", "is greater than or equal to",
            "greater or equal", "greater than or equal", "greater than or equal to", ">="),
    LESS_OR_EQUAL("less_equal", "is less than or equal to",
            "less or equal", "less than or equal", "less than or equal to", "<="),
    BETWEEN("between", "is between"),
    EXISTS("exists", "exists"),
    NOT_EXISTS("not_exists", "does not exist");

    private static final Set<Operator> STRING_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
            EQUALS, NOT_EQUALS, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, EXISTS, NOT_EXISTS));

    private static final Set<Operator> NUMBER_OPERATORS = Collections.unmodifiableSet(EnumSet.of(
            EQUALS, NOT_EQUALS, GREATER_THAN, LESS_THAN, GREATER_OR_EQUAL, LESS_OR_EQUAL, BETWEEN,
            EXISTS, NOT_EXISTS));

    private static final Map<String, Operator> BY_SPELLING = new HashMap<>();

    static {
        for (Operator operator : values()) {
            BY_SPELLING.put(normalize(operator.id), operator);
            BY_SPELLING.put(normalize(operator.label), operator);
            for (String alias : operator.aliases) {
                BY_SPELLING.put(normalize(alias), operator);
            }
        }
    }

    private final String id;
    private final String label;
    private final List<String> aliases;

    Operator(String id, String label, String... aliases) {
        this.id = id;
        this.label = label;
        this.aliases = List.of(aliases);
    }

    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    /**
     * @return true for EXISTS and NOT_EXISTS, which take no value
     */
    public boolean isExistence() {
        return this == EXISTS || this == NOT_EXISTS;
    }

    /**
     * @return true for the operators that compare magnitudes
     */
    public boolean isNumeric() {
        return this == GREATER_THAN || this == LESS_THAN || this == GREATER_OR_EQUAL
                || this == LESS_OR_EQUAL || this == BETWEEN;
    }

    public boolean appliesTo(DataType dataType) {
        return allowedFor(dataType).contains(this);
    }

    public static Set<Operator> allowedFor(DataType dataType) {
        return dataType == DataType.NUMBER ? NUMBER_OPERATORS : STRING_OPERATORS;
    }

    /**
     * Parses an id, a display label or an alias. Case, underscores and repeated
     * whitespace are ignored.
     */
    public static Optional<Operator> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_SPELLING.get(normalize(text)));
    }

    private static String normalize(String text) {
        return text.trim()
                .toLowerCase(Locale.ROOT)
                .replace('_', ' ')
                .replaceAll("\\s+", " ");
    }
}
