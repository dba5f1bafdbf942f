package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * Keeps the rows of {@code source} for which {@code condition} holds.
 *
 * Stacked filters collapse into one WHERE clause joined with AND when SQL is generated.
 */
public record FilterNode(RelationNode source, Expression condition) implements RelationNode {

    public FilterNode {
        Objects.requireNonNull(source, "Filter needs a source relation");
        Objects.requireNonNull(condition, "Filter needs a condition");
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "where " + condition + " over " + source;
    }
}
