package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * Attaches a rollup table to the hits scan: {@code hits LEFT OUTER JOIN sessions ON ...}.
 *
 * The join is outer so a hit whose session or user row is missing still counts;
 * its rollup columns read as NULL. Joins chain on the left, so {@code left} is the
 * hits table or an earlier join.
 */
public record JoinNode(RelationNode left, TableNode right, Expression condition) implements RelationNode {

    public JoinNode {
        Objects.requireNonNull(left, "Join needs a left relation");
        Objects.requireNonNull(right, "Join needs a table to attach");
        Objects.requireNonNull(condition, "Join needs an ON condition");
        if (!(left instanceof TableNode || left instanceof JoinNode)) {
            throw new IllegalArgumentException("Joins attach to a table or another join, not " + left);
        }
    }

    public static JoinNode leftOuter(RelationNode left, TableNode right, Expression condition) {
        return new JoinNode(left, right, condition);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
