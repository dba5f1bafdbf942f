package io.segmentlite.engine.store;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.segmentlite.engine.store.Column.nullable;
import static io.segmentlite.engine.store.Column.required;

/**
 * The fixed three-table schema segments are evaluated against.
 *
 * @param hits     The event table, one row per hit
 * @param sessions The session rollup, keyed by session_id
 * @param users    The user rollup, keyed by user_id
 */
public record EventSchema(
        Table hits,
        Table sessions,
        Table users) {

    public EventSchema {
        Objects.requireNonNull(hits, "Hits table cannot be null");
        Objects.requireNonNull(sessions, "Sessions table cannot be null");
        Objects.requireNonNull(users, "Users table cannot be null");

        hits.getColumn(EventTable.HITS.keyColumn());
        hits.getColumn(EventTable.SESSIONS.keyColumn());
        hits.getColumn(EventTable.USERS.keyColumn());
        sessions.getColumn(EventTable.SESSIONS.keyColumn());
        users.getColumn(EventTable.USERS.keyColumn());
    }

    /**
     * The web-analytics schema: page-view hits with session and user rollups.
     */
    public static EventSchema standard() {
        Table hits = new Table("hits", List.of(
                required("hit_id", SqlDataType.BIGINT),
                required("timestamp", SqlDataType.TIMESTAMP),
                required("user_id", SqlDataType.VARCHAR),
                required("session_id", SqlDataType.VARCHAR),
                nullable("page_url", SqlDataType.VARCHAR),
                nullable("page_title", SqlDataType.VARCHAR),
                nullable("page_type", SqlDataType.VARCHAR),
                nullable("browser_name", SqlDataType.VARCHAR),
                nullable("browser_version", SqlDataType.VARCHAR),
                nullable("device_type", SqlDataType.VARCHAR),
                nullable("country", SqlDataType.VARCHAR),
                nullable("city", SqlDataType.VARCHAR),
                nullable("traffic_source", SqlDataType.VARCHAR),
                nullable("traffic_medium", SqlDataType.VARCHAR),
                nullable("campaign", SqlDataType.VARCHAR),
                nullable("revenue", SqlDataType.DOUBLE),
                nullable("products_viewed", SqlDataType.INTEGER),
                nullable("cart_additions", SqlDataType.INTEGER),
                nullable("time_on_page", SqlDataType.INTEGER),
                nullable("bounce", SqlDataType.INTEGER)));

        Table sessions = new Table("sessions", List.of(
                required("session_id", SqlDataType.VARCHAR),
                required("user_id", SqlDataType.VARCHAR),
                required("start_time", SqlDataType.TIMESTAMP),
                required("end_time", SqlDataType.TIMESTAMP),
                nullable("total_hits", SqlDataType.INTEGER),
                nullable("total_revenue", SqlDataType.DOUBLE),
                nullable("session_duration", SqlDataType.INTEGER),
                nullable("pages_viewed", SqlDataType.INTEGER)));

        Table users = new Table("users", List.of(
                required("user_id", SqlDataType.VARCHAR),
                required("first_seen", SqlDataType.TIMESTAMP),
                required("last_seen", SqlDataType.TIMESTAMP),
                nullable("user_type", SqlDataType.VARCHAR),
                nullable("total_sessions", SqlDataType.INTEGER),
                nullable("total_revenue", SqlDataType.DOUBLE),
                nullable("total_orders", SqlDataType.INTEGER),
                nullable("avg_session_duration", SqlDataType.INTEGER)));

        return new EventSchema(hits, sessions, users);
    }

    public Table table(EventTable eventTable) {
        return switch (eventTable) {
            case HITS -> hits;
            case SESSIONS -> sessions;
            case USERS -> users;
        };
    }

    public Map<EventTable, Table> tables() {
        Map<EventTable, Table> tables = new EnumMap<>(EventTable.class);
        for (EventTable eventTable : EventTable.values()) {
            tables.put(eventTable, table(eventTable));
        }
        return tables;
    }
}
