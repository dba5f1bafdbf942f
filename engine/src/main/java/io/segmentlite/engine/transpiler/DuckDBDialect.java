package io.segmentlite.engine.transpiler;

import io.segmentlite.engine.store.SqlDataType;

/**
 * DuckDB, the default engine for event analytics. Has native booleans and
 * accepts the declared column type names as cast targets.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    private DuckDBDialect() {
    }

    @Override
    public String name() {
        return "DuckDB";
    }

    @Override
    public String formatBoolean(boolean value) {
        return String.valueOf(value).toUpperCase();
    }

    @Override
    public String castTypeName(SqlDataType type) {
        return type.name();
    }
}
