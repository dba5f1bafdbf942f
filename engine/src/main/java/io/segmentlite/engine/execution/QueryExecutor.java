package io.segmentlite.engine.execution;

import io.segmentlite.engine.transpiler.SqlQuery;

import java.sql.SQLException;

/**
 * Runs a parameterised query and materializes its rows.
 *
 * This is the only blocking call on the query path.
 */
@FunctionalInterface
public interface QueryExecutor {

    BufferedResult execute(SqlQuery query) throws SQLException;
}
