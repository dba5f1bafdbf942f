package io.segmentlite.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Orders a relation, e.g. top values by count descending or preview rows newest first.
 */
public record SortNode(RelationNode source, List<SortColumn> columns) implements RelationNode {

    public SortNode {
        Objects.requireNonNull(source, "Sort needs a source relation");
        columns = List.copyOf(Objects.requireNonNull(columns, "Sort keys cannot be null"));
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Sort needs at least one key");
        }
    }

    public static SortNode of(RelationNode source, SortColumn... columns) {
        return new SortNode(source, List.of(columns));
    }

    /** One ORDER BY key. */
    public record SortColumn(Expression expression, SortDirection direction) {

        public SortColumn {
            Objects.requireNonNull(expression, "Sort key cannot be null");
            Objects.requireNonNull(direction, "Sort direction cannot be null");
        }

        public static SortColumn asc(Expression expression) {
            return new SortColumn(expression, SortDirection.ASC);
        }

        public static SortColumn desc(Expression expression) {
            return new SortColumn(expression, SortDirection.DESC);
        }
    }

    public enum SortDirection {
        ASC,
        DESC
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
