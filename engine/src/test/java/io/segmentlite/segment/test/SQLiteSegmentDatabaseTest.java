package io.segmentlite.segment.test;

import io.segmentlite.engine.store.SqlDataType;
import io.segmentlite.segment.model.Condition;
import io.segmentlite.segment.model.Container;
import io.segmentlite.segment.model.Operator;
import io.segmentlite.segment.model.SegmentDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.DriverManager;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Segment scenarios against in-memory SQLite.
 */
@DisplayName("SQLite Segment Tests")
class SQLiteSegmentDatabaseTest extends AbstractSegmentDatabaseTest {

    @Override
    protected String getDialect() {
        return "sqlite";
    }

    @Override
    protected String getJdbcUrl() {
        return "jdbc:sqlite::memory:";
    }

    @Override
    protected String columnType(SqlDataType type) {
        return switch (type) {
            case VARCHAR, TIMESTAMP -> "TEXT";
            case INTEGER, BIGINT, BOOLEAN -> "INTEGER";
            case DOUBLE -> "REAL";
        };
    }

    @BeforeEach
    void setUp() throws SQLException {
        connection = DriverManager.getConnection(getJdbcUrl());
        setupDatabase(10);
    }

    @Test
    @DisplayName("Text casts use SQLite's TEXT type")
    void testTextCast() {
        SegmentDefinition definition = SegmentDefinition.of("Odd",
                Container.hit(Condition.of("revenue", Operator.GREATER_THAN, "abc")));

        String sql = engine.compile(definition).sql();

        assertTrue(sql.contains("CAST(\"h\".\"revenue\" AS TEXT) > ?"), sql);
        assertTrue(engine.statistics(definition).ok());
    }
}
