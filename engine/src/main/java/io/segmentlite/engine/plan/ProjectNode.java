package io.segmentlite.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Selects the output columns of a relation, for example the key column of a
 * membership subquery or the listed columns of a preview sample.
 */
public record ProjectNode(RelationNode source, List<Projection> projections) implements RelationNode {

    public ProjectNode {
        Objects.requireNonNull(source, "Projection needs a source relation");
        Objects.requireNonNull(projections, "Projection list cannot be null");
        if (projections.isEmpty()) {
            throw new IllegalArgumentException("At least one projected column is required");
        }
        projections = List.copyOf(projections);
    }

    public static ProjectNode of(RelationNode source, Projection... projections) {
        return new ProjectNode(source, List.of(projections));
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "select " + projections + " from " + source;
    }
}
