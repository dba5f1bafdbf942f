package io.segmentlite.segment.compiler;

import io.segmentlite.engine.plan.Expression;
import io.segmentlite.engine.store.EventTable;

import java.util.Objects;

/**
 * A compiled leaf predicate and the table its column lives in.
 */
public record CompiledCondition(
        Expression predicate,
        EventTable table) {

    public CompiledCondition {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        Objects.requireNonNull(table, "Table cannot be null");
    }
}
