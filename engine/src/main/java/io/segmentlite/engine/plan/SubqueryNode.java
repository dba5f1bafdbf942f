package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * A derived table: {@code FROM (<source>) AS alias}.
 *
 * @param source The relation producing the derived rows
 * @param alias  The name the derived table is known by
 */
public record SubqueryNode(
        RelationNode source,
        String alias) implements RelationNode {

    public SubqueryNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(alias, "Alias cannot be null");
        if (alias.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be blank");
        }
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "SubqueryNode(" + source + " AS " + alias + ")";
    }
}
