package io.segmentlite.engine.transpiler;

import java.util.List;
import java.util.Objects;

/**
 * SQL text with {@code ?} markers and the values bound to them, in marker order.
 *
 * @param sql        The SQL text
 * @param parameters One String or Number per marker
 */
public record SqlQuery(
        String sql,
        List<Object> parameters) {

    public SqlQuery {
        Objects.requireNonNull(sql, "SQL cannot be null");
        Objects.requireNonNull(parameters, "Parameters cannot be null");
        parameters = List.copyOf(parameters);
    }

    public static SqlQuery of(String sql) {
        return new SqlQuery(sql, List.of());
    }

    @Override
    public String toString() {
        return parameters.isEmpty() ? sql : sql + " " + parameters;
    }
}
