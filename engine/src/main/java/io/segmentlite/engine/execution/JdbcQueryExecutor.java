package io.segmentlite.engine.execution;

import io.segmentlite.engine.transpiler.SqlQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Executes queries as JDBC prepared statements, binding parameters in order.
 *
 * The connection is borrowed; this executor never closes it.
 */
public final class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    private final Connection connection;

    public JdbcQueryExecutor(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
    }

    @Override
    public BufferedResult execute(SqlQuery query) throws SQLException {
        logger.debug("Executing: {}", query);
        long start = System.nanoTime();
        try (PreparedStatement stmt = connection.prepareStatement(query.sql())) {
            bind(stmt, query.parameters());
            try (ResultSet rs = stmt.executeQuery()) {
                BufferedResult result = BufferedResult.fromResultSet(rs);
                logger.debug("Fetched {} rows in {} ms", result.rowCount(), (System.nanoTime() - start) / 1_000_000);
                return result;
            }
        }
    }

    private static void bind(PreparedStatement stmt, List<Object> parameters) throws SQLException {
        for (int i = 0; i < parameters.size(); i++) {
            Object value = parameters.get(i);
            int index = i + 1;
            if (value instanceof String text) {
                stmt.setString(index, text);
            } else if (value instanceof Integer || value instanceof Long) {
                stmt.setLong(index, ((Number) value).longValue());
            } else if (value instanceof Number number) {
                stmt.setDouble(index, number.doubleValue());
            } else {
                throw new IllegalArgumentException("Unsupported parameter type at " + index + ": "
                        + value.getClass().getSimpleName());
            }
        }
    }
}
