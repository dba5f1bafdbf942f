package io.segmentlite.engine.store;

import java.util.Locale;

/**
 * The three tables of the event store, one per grain.
 *
 * Sessions and users are rollups joined to the event table on their key.
 */
public enum EventTable {
    HITS("hits", "h", "hit_id"),
    SESSIONS("sessions", "s", "session_id"),
    USERS("users", "u", "user_id");

    private final String tableName;
    private final String aliasPrefix;
    private final String keyColumn;

    EventTable(String tableName, String aliasPrefix, String keyColumn) {
        this.tableName = tableName;
        this.aliasPrefix = aliasPrefix;
        this.keyColumn = keyColumn;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * @return The alias used for this table in the outermost query; nested queries append their depth
     */
    public String aliasPrefix() {
        return aliasPrefix;
    }

    /**
     * @return The primary key, which for sessions and users is also the join column on hits
     */
    public String keyColumn() {
        return keyColumn;
    }

    /**
     * Resolves a table by its SQL name, case-insensitively.
     *
     * @throws IllegalArgumentException for a name that is not one of the event tables
     */
    public static EventTable fromTableName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (EventTable table : values()) {
            if (table.tableName.equals(normalized)) {
                return table;
            }
        }
        throw new IllegalArgumentException("Unknown event table: '" + name + "'");
    }
}
