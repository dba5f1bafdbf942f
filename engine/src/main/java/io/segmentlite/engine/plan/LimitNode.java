package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * Caps the number of rows a relation returns. Used for preview samples.
 */
public record LimitNode(RelationNode source, int limit) implements RelationNode {

    public LimitNode {
        Objects.requireNonNull(source, "Limit needs a source relation");
        if (limit < 0) {
            throw new IllegalArgumentException("Row limit must be zero or more, got " + limit);
        }
    }

    public static LimitNode limit(RelationNode source, int limit) {
        return new LimitNode(source, limit);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
