package io.segmentlite.engine.store;

import java.util.Objects;

/**
 * A column of an event table.
 *
 * @param name     Column name as it appears in SQL
 * @param dataType Storage type; decides whether comparisons are numeric or textual
 * @param nullable False for key and timestamp columns every row carries
 */
public record Column(String name, SqlDataType dataType, boolean nullable) {

    public Column {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(dataType, "Column data type cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    public static Column required(String name, SqlDataType dataType) {
        return new Column(name, dataType, false);
    }

    public static Column nullable(String name, SqlDataType dataType) {
        return new Column(name, dataType, true);
    }
}
