package io.segmentlite.engine.execution;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rows of a finished query held in memory, so counts and samples outlive the statement.
 *
 * Column lookup by name ignores case because engines differ in how they report labels.
 */
public record BufferedResult(List<Column> columns, List<Row> rows) {

    private static final BufferedResult EMPTY = new BufferedResult(List.of(), List.of());

    public BufferedResult {
        Objects.requireNonNull(columns, "Result columns cannot be null");
        Objects.requireNonNull(rows, "Result rows cannot be null");
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public static BufferedResult empty() {
        return EMPTY;
    }

    public int rowCount() {
        return rows.size();
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        columns.forEach(column -> names.add(column.name()));
        return names;
    }

    public Object getValue(int row, int column) {
        return rows.get(row).get(column);
    }

    public Object getValue(int row, String columnName) {
        return getValue(row, columnIndex(columnName));
    }

    /**
     * @throws IllegalArgumentException if the result has no such column
     */
    public int columnIndex(String columnName) {
        int index = 0;
        for (Column column : columns) {
            if (column.name().equalsIgnoreCase(columnName)) {
                return index;
            }
            index++;
        }
        throw new IllegalArgumentException("Result has no column '" + columnName + "', columns are " + columnNames());
    }

    /**
     * Drains a result set. The caller still owns and closes it.
     */
    public static BufferedResult fromResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int width = meta.getColumnCount();
        List<Column> columns = new ArrayList<>(width);
        for (int i = 1; i <= width; i++) {
            columns.add(new Column(meta.getColumnLabel(i), meta.getColumnTypeName(i)));
        }
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            rows.add(Row.fromResultSet(rs, width));
        }
        return new BufferedResult(columns, rows);
    }
}
