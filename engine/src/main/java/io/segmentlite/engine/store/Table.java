package io.segmentlite.engine.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One of the event tables: its name and columns in declaration order.
 *
 * Column lookup is exact; the event schema names every column in snake case.
 */
public record Table(String name, List<Column> columns) {

    public Table {
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }
        columns = List.copyOf(columns);
        Map<String, Column> seen = new LinkedHashMap<>();
        for (Column column : columns) {
            if (seen.put(column.name(), column) != null) {
                throw new IllegalArgumentException("Duplicate column '" + column.name() + "' in table " + name);
            }
        }
    }

    public Optional<Column> findColumn(String columnName) {
        for (Column column : columns) {
            if (column.name().equals(columnName)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /**
     * @throws IllegalArgumentException if the table has no such column
     */
    public Column getColumn(String columnName) {
        return findColumn(columnName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Table " + name + " has no column '" + columnName + "'"));
    }
}
