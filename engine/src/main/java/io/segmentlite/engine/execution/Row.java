package io.segmentlite.engine.execution;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A row of values in a query result.
 */
public record Row(List<Object> values) {

    public Row {
        // Values may contain SQL NULLs
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Gets the value at the specified index.
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Reads a numeric value as a long; SQL NULL reads as 0.
     *
     * @throws IllegalStateException if the value is not numeric
     */
    public long getLong(int index) {
        Object value = values.get(index);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalStateException("Value at " + index + " is not numeric: " + value);
    }

    /**
     * Reads a numeric value as a Double, keeping SQL NULL as null.
     */
    public Double getDouble(int index) {
        Object value = values.get(index);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalStateException("Value at " + index + " is not numeric: " + value);
    }

    /**
     * Creates a Row from the current position of a ResultSet.
     */
    public static Row fromResultSet(ResultSet rs, int columnCount) throws SQLException {
        List<Object> values = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            values.add(rs.getObject(i));
        }
        return new Row(values);
    }
}
