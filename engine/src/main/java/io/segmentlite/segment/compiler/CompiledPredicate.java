package io.segmentlite.segment.compiler;

import io.segmentlite.engine.plan.Expression;
import io.segmentlite.engine.store.EventTable;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled container: its predicate and the tables the enclosing query must
 * join for the predicate to resolve.
 *
 * @param expression     The scoped, signed predicate
 * @param requiredTables Tables referenced at the enclosing level; empty for visit and
 *                       visitor containers, whose subqueries join for themselves
 */
public record CompiledPredicate(
        Expression expression,
        Set<EventTable> requiredTables) {

    public CompiledPredicate {
        Objects.requireNonNull(expression, "Expression cannot be null");
        Objects.requireNonNull(requiredTables, "Required tables cannot be null");
        requiredTables = requiredTables.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(requiredTables));
    }
}
