package io.segmentlite.engine.transpiler;

import io.segmentlite.engine.store.SqlDataType;

/**
 * What differs between the engines segment SQL runs on.
 *
 * Both supported engines accept ANSI quoting, so identifier and string quoting
 * are shared here; dialects differ in booleans and cast targets.
 */
public interface SQLDialect {

    /** Display name, also used to pick the dialect from configuration. */
    String name();

    /** Renders a boolean literal. */
    String formatBoolean(boolean value);

    /** Type name written after {@code AS} in a CAST. */
    String castTypeName(SqlDataType type);

    /**
     * Wraps a table, column or alias name in double quotes, doubling embedded quotes,
     * so {@code device_type} becomes {@code "device_type"}.
     */
    default String quoteIdentifier(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    /** Wraps text in single quotes, doubling embedded ones. */
    default String quoteStringLiteral(String value) {
        return '\'' + value.replace("'", "''") + '\'';
    }

    default String formatNull() {
        return "NULL";
    }
}
