package io.segmentlite.engine.transpiler;

import io.segmentlite.engine.plan.*;
import io.segmentlite.engine.store.Column;
import io.segmentlite.engine.store.SqlDataType;
import io.segmentlite.engine.store.Table;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SQLGenerator: clause collapsing, parameter order and dialect rendering.
 */
class SQLGeneratorTest {

    private static final Table HITS = new Table("hits", List.of(
            Column.required("hit_id", SqlDataType.BIGINT),
            Column.required("session_id", SqlDataType.VARCHAR),
            Column.nullable("device_type", SqlDataType.VARCHAR),
            Column.nullable("revenue", SqlDataType.DOUBLE)));

    private static final Table SESSIONS = new Table("sessions", List.of(
            Column.required("session_id", SqlDataType.VARCHAR),
            Column.nullable("total_hits", SqlDataType.INTEGER)));

    private SQLGenerator sqlGenerator;

    @BeforeEach
    void setUp() {
        sqlGenerator = new SQLGenerator(DuckDBDialect.INSTANCE);
    }

    // ==================== SELECT collapsing ====================

    @Test
    @DisplayName("Project over filter over table renders one SELECT with bound values")
    void testProjectFilterTable() {
        // GIVEN: hits filtered on device type, projecting the id
        TableNode table = new TableNode(HITS, "h");
        FilterNode filter = new FilterNode(table,
                ComparisonExpression.equals(table.column("device_type"), Parameter.of("Mobile")));
        ProjectNode project = ProjectNode.of(filter, Projection.column("h", "hit_id"));

        // WHEN
        SqlQuery query = sqlGenerator.generate(project);

        // THEN
        assertEquals("SELECT \"h\".\"hit_id\" AS \"hit_id\" FROM \"hits\" AS \"h\" WHERE \"h\".\"device_type\" = ?",
                query.sql());
        assertEquals(List.of("Mobile"), query.parameters());
    }

    @Test
    @DisplayName("Stacked filters are combined with AND, innermost first")
    void testStackedFilters() {
        TableNode table = new TableNode(HITS, "h");
        FilterNode inner = new FilterNode(table,
                ComparisonExpression.equals(table.column("device_type"), Parameter.of("Mobile")));
        FilterNode outer = new FilterNode(inner,
                ComparisonExpression.of(table.column("revenue"),
                        ComparisonExpression.ComparisonOperator.GREATER_THAN, Parameter.of(10.0)));

        SqlQuery query = sqlGenerator.generate(outer);

        assertEquals("SELECT * FROM \"hits\" AS \"h\" WHERE (\"h\".\"device_type\" = ? AND \"h\".\"revenue\" > ?)",
                query.sql());
        assertEquals(List.of("Mobile", 10.0), query.parameters());
    }

    @Test
    @DisplayName("Limit, sort and group by collapse into one statement")
    void testGroupBySortLimit() {
        // GIVEN: top device types by count
        TableNode table = new TableNode(HITS, "h");
        ColumnReference device = table.column("device_type");
        AggregateExpression count = AggregateExpression.countAll();
        GroupByNode grouped = new GroupByNode(table, List.of(device), List.of(
                Projection.of(device, "value"),
                Projection.of(count, "count")));
        LimitNode limited = LimitNode.limit(SortNode.of(grouped, SortNode.SortColumn.desc(count)), 5);

        // WHEN
        SqlQuery query = sqlGenerator.generate(limited);

        // THEN
        assertEquals("SELECT \"h\".\"device_type\" AS \"value\", COUNT(*) AS \"count\" FROM \"hits\" AS \"h\""
                + " GROUP BY \"h\".\"device_type\" ORDER BY COUNT(*) DESC LIMIT 5", query.sql());
        assertTrue(query.parameters().isEmpty());
    }

    @Test
    @DisplayName("Global aggregate over a derived table uses the subquery alias")
    void testAggregateOverSubquery() {
        TableNode table = new TableNode(HITS, "h");
        ProjectNode inner = ProjectNode.of(table, Projection.column("h", "session_id"));
        GroupByNode counts = GroupByNode.global(new SubqueryNode(inner, "segment_data"), List.of(
                Projection.of(AggregateExpression.countAll(), "hits"),
                Projection.of(AggregateExpression.countDistinct(ColumnReference.of("segment_data", "session_id")),
                        "sessions")));

        String sql = sqlGenerator.generate(counts).sql();

        assertEquals("SELECT COUNT(*) AS \"hits\", COUNT(DISTINCT \"segment_data\".\"session_id\") AS \"sessions\""
                + " FROM (SELECT \"h\".\"session_id\" AS \"session_id\" FROM \"hits\" AS \"h\") AS \"segment_data\"",
                sql);
    }

    @Test
    @DisplayName("Filter over a limit is wrapped as a derived table")
    void testFilterOverLimitIsWrapped() {
        TableNode table = new TableNode(HITS, "h");
        FilterNode filter = new FilterNode(LimitNode.limit(table, 10),
                ComparisonExpression.isNotNull(ColumnReference.of("subq", "device_type")));

        String sql = sqlGenerator.generate(filter).sql();

        assertEquals("SELECT * FROM (SELECT * FROM \"hits\" AS \"h\" LIMIT 10) AS \"subq\""
                + " WHERE \"subq\".\"device_type\" IS NOT NULL", sql);
    }

    // ==================== Joins and subqueries ====================

    @Test
    @DisplayName("Left outer join renders its ON condition")
    void testLeftOuterJoin() {
        TableNode hits = new TableNode(HITS, "h");
        TableNode sessions = new TableNode(SESSIONS, "s");
        JoinNode join = JoinNode.leftOuter(hits, sessions,
                ComparisonExpression.equals(hits.column("session_id"), sessions.column("session_id")));

        String sql = sqlGenerator.generate(join).sql();

        assertEquals("SELECT * FROM \"hits\" AS \"h\" LEFT OUTER JOIN \"sessions\" AS \"s\""
                + " ON \"h\".\"session_id\" = \"s\".\"session_id\"", sql);
    }

    @Test
    @DisplayName("Parameters are collected in textual order across an IN subquery")
    void testParameterOrderWithSubquery() {
        // GIVEN: outer predicate before the subquery, one after
        TableNode outer = new TableNode(HITS, "h");
        TableNode inner = new TableNode(HITS, "h1");
        ProjectNode keys = ProjectNode.of(
                new FilterNode(inner, ComparisonExpression.equals(inner.column("device_type"), Parameter.of("second"))),
                Projection.column("h1", "session_id"));
        Expression where = LogicalExpression.and(
                ComparisonExpression.equals(outer.column("device_type"), Parameter.of("first")),
                InSubqueryExpression.of(outer.column("session_id"), keys),
                ComparisonExpression.equals(outer.column("revenue"), Parameter.of(3.0)));

        // WHEN
        SqlQuery query = sqlGenerator.generate(new FilterNode(outer, where));

        // THEN
        assertEquals(List.of("first", "second", 3.0), query.parameters());
        assertTrue(query.sql().contains("\"h\".\"session_id\" IN (SELECT \"h1\".\"session_id\" FROM \"hits\" AS \"h1\""
                + " WHERE \"h1\".\"device_type\" = ?)"), query.sql());
    }

    // ==================== Expressions ====================

    @Test
    @DisplayName("LIKE carries an explicit escape character")
    void testLikeEscape() {
        SqlQuery query = sqlGenerator.generateExpression(LikeExpression.of(
                SqlFunctionCall.lower(ColumnReference.of("h", "device_type")),
                Parameter.of(LikeExpression.containsPattern("50%_off"))));

        assertEquals("LOWER(\"h\".\"device_type\") LIKE ? ESCAPE '\\'", query.sql());
        assertEquals(List.of("%50\\%\\_off%"), query.parameters());
    }

    @Test
    @DisplayName("NOT, OR and BETWEEN render with explicit grouping")
    void testLogicalAndBetween() {
        Expression expression = LogicalExpression.not(LogicalExpression.or(
                new BetweenExpression(ColumnReference.of("h", "revenue"), Parameter.of(1.0), Parameter.of(2.0)),
                ComparisonExpression.isNull(ColumnReference.of("h", "revenue"))));

        SqlQuery query = sqlGenerator.generateExpression(expression);

        assertEquals("NOT ((\"h\".\"revenue\" BETWEEN ? AND ? OR \"h\".\"revenue\" IS NULL))", query.sql());
        assertEquals(List.of(1.0, 2.0), query.parameters());
    }

    @Test
    @DisplayName("Casts use the dialect's text type")
    void testCastPerDialect() {
        Expression cast = CastExpression.toText(ColumnReference.of("h", "revenue"));

        assertEquals("CAST(\"h\".\"revenue\" AS VARCHAR)", sqlGenerator.generateExpression(cast).sql());
        assertEquals("CAST(\"h\".\"revenue\" AS TEXT)",
                new SQLGenerator(SQLiteDialect.INSTANCE).generateExpression(cast).sql());
    }

    @Test
    @DisplayName("Inlined SQL quotes string values and leaves numbers bare")
    void testInlined() {
        TableNode table = new TableNode(HITS, "h");
        FilterNode filter = new FilterNode(table, LogicalExpression.and(
                ComparisonExpression.equals(table.column("device_type"), Parameter.of("O'Brien")),
                ComparisonExpression.of(table.column("revenue"),
                        ComparisonExpression.ComparisonOperator.GREATER_THAN_OR_EQUALS, Parameter.of(500.0))));

        String sql = sqlGenerator.generateInlined(filter);

        assertEquals("SELECT * FROM \"hits\" AS \"h\""
                + " WHERE (\"h\".\"device_type\" = 'O''Brien' AND \"h\".\"revenue\" >= 500.0)", sql);
    }

    @Test
    @DisplayName("Always-false predicate renders as 1 = 0")
    void testAlwaysFalse() {
        assertEquals("1 = 0", sqlGenerator.generateExpression(ComparisonExpression.alwaysFalse()).sql());
    }

    @Test
    @DisplayName("Standard queries render identically across dialects")
    void testCrossDialectCompatibility() {
        TableNode table = new TableNode(HITS, "h");
        ProjectNode project = ProjectNode.of(
                new FilterNode(table, ComparisonExpression.equals(table.column("device_type"), Parameter.of("Mobile"))),
                Projection.column("h", "hit_id"));

        assertEquals(sqlGenerator.generate(project), new SQLGenerator(SQLiteDialect.INSTANCE).generate(project));
    }

    @Test
    @DisplayName("Unknown column on a table node is rejected")
    void testUnknownColumn() {
        TableNode table = new TableNode(HITS, "h");
        assertThrows(IllegalArgumentException.class, () -> table.column("no_such_column"));
    }
}
