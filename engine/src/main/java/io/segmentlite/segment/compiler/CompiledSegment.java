package io.segmentlite.segment.compiler;

import io.segmentlite.engine.plan.RelationNode;
import io.segmentlite.engine.transpiler.SqlQuery;

import java.util.List;
import java.util.Objects;

/**
 * The result of compiling a segment definition.
 *
 * @param plan            The ordered SELECT plan
 * @param query           SQL with {@code ?} markers and their values
 * @param matchesNothing  True when no container contributed a predicate
 */
public record CompiledSegment(
        RelationNode plan,
        SqlQuery query,
        boolean matchesNothing) {

    public CompiledSegment {
        Objects.requireNonNull(plan, "Plan cannot be null");
        Objects.requireNonNull(query, "Query cannot be null");
    }

    public String sql() {
        return query.sql();
    }

    public List<Object> parameters() {
        return query.parameters();
    }
}
