package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * One SELECT list entry, rendered as {@code expression AS "alias"}.
 */
public record Projection(Expression expression, String alias) {

    public Projection {
        Objects.requireNonNull(expression, "Projected expression cannot be null");
        Objects.requireNonNull(alias, "Output column name cannot be null");
        if (alias.isBlank()) {
            throw new IllegalArgumentException("Output column name cannot be blank");
        }
    }

    /** A column passed through under its own name, e.g. {@code "h"."hit_id" AS "hit_id"}. */
    public static Projection column(String tableAlias, String columnName) {
        return new Projection(ColumnReference.of(tableAlias, columnName), columnName);
    }

    public static Projection of(Expression expression, String alias) {
        return new Projection(expression, alias);
    }

    @Override
    public String toString() {
        return expression + " AS " + alias;
    }
}
