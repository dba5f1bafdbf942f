package io.segmentlite.engine.transpiler;

import io.segmentlite.engine.store.SqlDataType;

/**
 * SQLite, used for file-backed event stores. Booleans are stored as 1/0 and
 * casts target storage classes.
 */
public final class SQLiteDialect implements SQLDialect {

    public static final SQLiteDialect INSTANCE = new SQLiteDialect();

    private SQLiteDialect() {
    }

    @Override
    public String name() {
        return "SQLite";
    }

    @Override
    public String formatBoolean(boolean value) {
        return value ? "1" : "0";
    }

    @Override
    public String castTypeName(SqlDataType type) {
        return switch (type) {
            case VARCHAR, TIMESTAMP -> "TEXT";
            case DOUBLE -> "REAL";
            case INTEGER, BIGINT, BOOLEAN -> "INTEGER";
        };
    }
}
