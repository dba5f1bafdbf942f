package io.segmentlite.engine.plan;

import io.segmentlite.engine.store.Table;

import java.util.Objects;

/**
 * A scan of one event table under an alias, e.g. {@code "hits" AS "h"}.
 */
public record TableNode(Table table, String alias) implements RelationNode {

    public TableNode {
        Objects.requireNonNull(table, "Scanned table cannot be null");
        Objects.requireNonNull(alias, "Table alias cannot be null");
        if (alias.isBlank()) {
            throw new IllegalArgumentException("Table alias cannot be blank for " + table.name());
        }
    }

    /**
     * References a column through this scan's alias.
     *
     * @throws IllegalArgumentException if the table has no such column
     */
    public ColumnReference column(String columnName) {
        return ColumnReference.of(alias, table.getColumn(columnName).name());
    }

    @Override
    public <T> T accept(RelationNodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return table.name() + " " + alias;
    }
}
