package io.segmentlite.engine.plan;

import java.util.Objects;

/**
 * Represents a reference to a column in the logical plan.
 *
 * @param tableAlias The alias of the table containing the column (empty for an unqualified reference)
 * @param columnName The column name
 */
public record ColumnReference(
        String tableAlias,
        String columnName) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(tableAlias, "Table alias cannot be null");
        Objects.requireNonNull(columnName, "Column name cannot be null");

        if (columnName.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    public static ColumnReference of(String tableAlias, String columnName) {
        return new ColumnReference(tableAlias, columnName);
    }

    /**
     * Creates a column reference without a table alias, e.g. a column of a derived table.
     */
    public static ColumnReference of(String columnName) {
        return new ColumnReference("", columnName);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public String toString() {
        return tableAlias.isEmpty() ? columnName : tableAlias + "." + columnName;
    }
}
