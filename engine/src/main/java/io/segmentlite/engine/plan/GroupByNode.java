package io.segmentlite.engine.plan;

import java.util.List;
import java.util.Objects;

/**
 * Represents an aggregation in the logical plan.
 *
 * With grouping expressions this is a GROUP BY; without any it is a global
 * aggregation producing exactly one row.
 *
 * SQL output:
 * <pre>
 * SELECT h.device_type AS value, COUNT(*) AS count
 * FROM hits AS h ... GROUP BY h.device_type
 * </pre>
 *
 * @param source       The relation being aggregated
 * @param groupingKeys Expressions to group by (empty for a global aggregate)
 * @param projections  Output columns: grouping keys and aggregates with their aliases
 */
public record GroupByNode(
        RelationNode source,
        List<Expression> groupingKeys,
        List<Projection> projections) implements RelationNode {

    public GroupByNode {
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(groupingKeys, "Grouping keys cannot be null");
        Objects.requireNonNull(projections, "Projections cannot be null");
        if (projections.isEmpty()) {
            throw new IllegalArgumentException("At least one projection is required");
        }
        groupingKeys = List.copyOf(groupingKeys);
        projections = List.copyOf(projections);
    }

    /**
     * A global aggregation (no GROUP BY clause).
     */
    public static GroupByNode global(RelationNode source, List<Projection> aggregates) {
        return new GroupByNode(source, List.of(), aggregates);
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
