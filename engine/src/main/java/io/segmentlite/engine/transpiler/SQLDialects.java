package io.segmentlite.engine.transpiler;

import java.util.Locale;

/**
 * Lookup of the built-in dialects by name.
 */
public final class SQLDialects {

    private SQLDialects() {
    }

    /**
     * @param name "duckdb" or "sqlite", case-insensitive
     * @throws IllegalArgumentException for any other name
     */
    public static SQLDialect forName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "duckdb" -> DuckDBDialect.INSTANCE;
            case "sqlite" -> SQLiteDialect.INSTANCE;
            default -> throw new IllegalArgumentException("Unsupported SQL dialect: '" + name + "'");
        };
    }
}
