package io.segmentlite.segment.test;

import io.segmentlite.engine.execution.JdbcQueryExecutor;
import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.store.SqlDataType;
import io.segmentlite.engine.store.Table;
import io.segmentlite.segment.SegmentEngine;
import io.segmentlite.segment.SegmentEngineConfig;
import io.segmentlite.segment.compiler.CombinatorMode;
import io.segmentlite.segment.library.InMemorySegmentRepository;
import io.segmentlite.segment.model.Combinator;
import io.segmentlite.segment.model.Condition;
import io.segmentlite.segment.model.Container;
import io.segmentlite.segment.model.DataType;
import io.segmentlite.segment.model.Operator;
import io.segmentlite.segment.model.SegmentDefinition;
import io.segmentlite.segment.preview.SegmentPreview;
import io.segmentlite.segment.stats.NumericSummary;
import io.segmentlite.segment.stats.PopulationTotals;
import io.segmentlite.segment.stats.SegmentStatistics;
import io.segmentlite.segment.stats.ValueCount;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Segment scenarios run end to end against a real database.
 *
 * The event data: 10 users (u1..u10), 2 sessions each, 100 hits.
 * <ul>
 *   <li>Hit i belongs to user {@code u(i % 10 + 1)}, session {@code k = (i / 10) % 2 + 1}</li>
 *   <li>Hits 0..29 are Mobile, the rest Desktop</li>
 *   <li>Hit 0 is a checkout page; hit 40 (same session) is the only Firefox hit</li>
 *   <li>Hit 5 (user u6) has revenue 600; every fourth hit has revenue 10; the rest none</li>
 *   <li>Users u1..u3 are Returning; sessions k = 2 viewed 8 pages, k = 1 viewed 3</li>
 * </ul>
 */
public abstract class AbstractSegmentDatabaseTest {

    protected static final int HITS = 100;
    protected static final int USERS = 10;
    protected static final int SESSIONS = 20;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 10, 0, 0);

    protected Connection connection;
    protected SegmentEngine engine;

    // ==================== Database (Abstract) ====================

    /**
     * @return The dialect name the engine renders with ("duckdb" or "sqlite")
     */
    protected abstract String getDialect();

    protected abstract String getJdbcUrl();

    /**
     * @return The column type this database declares for a schema type
     */
    protected abstract String columnType(SqlDataType type);

    // ==================== Setup ====================

    /**
     * Creates and fills the event tables on {@link #connection}, then wires the engine over it.
     */
    protected void setupDatabase(int previewSampleSize) throws SQLException {
        EventSchema schema = EventSchema.standard();
        try (Statement stmt = connection.createStatement()) {
            for (Table table : List.of(schema.hits(), schema.sessions(), schema.users())) {
                stmt.execute(createTable(table));
            }
            for (int u = 1; u <= USERS; u++) {
                stmt.execute(insert("users", user(u)));
                for (int k = 1; k <= 2; k++) {
                    stmt.execute(insert("sessions", session(u, k)));
                }
            }
            for (int i = 0; i < HITS; i++) {
                stmt.execute(insert("hits", hit(i)));
            }
        }
        SegmentEngineConfig config = new SegmentEngineConfig(getDialect(), getJdbcUrl(), "field-catalog.json",
                previewSampleSize, CombinatorMode.UNIFORM, SegmentDefinition.DEFAULT_NAME);
        engine = new SegmentEngine(config, schema, new JdbcQueryExecutor(connection),
                new InMemorySegmentRepository(), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() throws SQLException {
        if (engine != null) {
            engine.close();
        }
        if (connection != null && !connection.isClosed()) {
            connection.close();
        }
    }

    private String createTable(Table table) {
        return "CREATE TABLE " + quote(table.name()) + " (" + table.columns().stream()
                .map(c -> quote(c.name()) + " " + columnType(c.dataType()) + (c.nullable() ? "" : " NOT NULL"))
                .collect(Collectors.joining(", ")) + ")";
    }

    private static String insert(String table, Map<String, Object> row) {
        return "INSERT INTO " + quote(table) + " ("
                + row.keySet().stream().map(AbstractSegmentDatabaseTest::quote).collect(Collectors.joining(", "))
                + ") VALUES ("
                + row.values().stream().map(AbstractSegmentDatabaseTest::literal).collect(Collectors.joining(", "))
                + ")";
    }

    private static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }

    private static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        return "'" + value.toString().replace("'", "''") + "'";
    }

    private static String userId(int u) {
        return "u" + u;
    }

    private static String sessionId(int u, int k) {
        return "s" + u + "_" + k;
    }

    private static Map<String, Object> user(int u) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("user_id", userId(u));
        row.put("first_seen", TIMESTAMP.format(START));
        row.put("last_seen", TIMESTAMP.format(START.plusDays(1)));
        row.put("user_type", u <= 3 ? "Returning" : "New");
        row.put("total_sessions", 2);
        return row;
    }

    private static Map<String, Object> session(int u, int k) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("session_id", sessionId(u, k));
        row.put("user_id", userId(u));
        row.put("start_time", TIMESTAMP.format(START));
        row.put("end_time", TIMESTAMP.format(START.plusHours(2)));
        row.put("total_hits", 5);
        row.put("pages_viewed", k == 2 ? 8 : 3);
        return row;
    }

    private static Map<String, Object> hit(int i) {
        int u = i % 10 + 1;
        int k = (i / 10) % 2 + 1;
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("hit_id", i);
        row.put("timestamp", TIMESTAMP.format(START.plusMinutes(i)));
        row.put("user_id", userId(u));
        row.put("session_id", sessionId(u, k));
        row.put("page_url", "https://shop.example.com/p/" + i);
        row.put("page_type", i == 0 ? "checkout" : "product");
        row.put("browser_name", i == 40 ? "Firefox" : "Chrome");
        row.put("device_type", i < 30 ? "Mobile" : "Desktop");
        row.put("country", "US");
        row.put("revenue", i == 5 ? Double.valueOf(600.0) : i % 4 == 0 ? Double.valueOf(10.0) : null);
        return row;
    }

    private static SegmentDefinition segment(Container... containers) {
        return SegmentDefinition.of("Test segment", containers);
    }

    private static Condition condition(String field, Operator operator, String value) {
        return Condition.of(field, operator, value);
    }

    // ==================== Statistics ====================

    @Test
    @DisplayName("Population totals count every hit, session and user")
    void testTotals() throws SQLException {
        PopulationTotals totals = engine.statisticsEngine().totals();

        assertEquals(HITS, totals.hits());
        assertEquals(SESSIONS, totals.sessions());
        assertEquals(USERS, totals.visitors());
    }

    @Test
    @DisplayName("Hit segment counts matching hits; string matching ignores case")
    void testHitSegment() {
        SegmentStatistics stats = engine.statistics(
                segment(Container.hit(condition("device_type", Operator.EQUALS, "Mobile"))));
        SegmentStatistics lower = engine.statistics(
                segment(Container.hit(condition("device_type", Operator.EQUALS, "mobile"))));

        assertTrue(stats.ok(), stats.error());
        assertEquals(30, stats.hits());
        assertEquals(20, stats.sessions());
        assertEquals(10, stats.visitors());
        assertEquals(30.0, stats.hitPercentage(), 1e-9);
        assertEquals(stats, lower);
    }

    @Test
    @DisplayName("Comparisons follow the column type, whatever type the condition declares")
    void testDeclaredTypeMismatch() {
        // GIVEN: a text field declared as a number, and a numeric operator on a text field
        Condition declaredNumber = condition("device_type", Operator.EQUALS, "Mobile").withDataType(DataType.NUMBER);
        Condition greaterOnText = condition("device_type", Operator.GREATER_THAN, "5");

        // WHEN
        SegmentStatistics declared = engine.statistics(segment(Container.hit(declaredNumber)));
        SegmentStatistics greater = engine.statistics(segment(Container.hit(greaterOnText)));

        // THEN: both run as text comparisons; letters sort after digits
        assertTrue(declared.ok(), declared.error());
        assertEquals(30, declared.hits());
        assertTrue(greater.ok(), greater.error());
        assertEquals(HITS, greater.hits());
    }

    @Test
    @DisplayName("Counts are ordered visitors <= sessions <= hits")
    void testCountOrdering() {
        for (SegmentDefinition definition : List.of(
                segment(Container.hit(condition("browser_name", Operator.EQUALS, "Firefox"))),
                segment(Container.visit(condition("page_type", Operator.EQUALS, "checkout"))),
                segment(Container.visitor(condition("revenue", Operator.GREATER_THAN, "100"))))) {
            SegmentStatistics stats = engine.statistics(definition);
            assertTrue(stats.ok(), stats.error());
            assertTrue(stats.visitors() <= stats.sessions(), stats.toString());
            assertTrue(stats.sessions() <= stats.hits(), stats.toString());
        }
    }

    @Test
    @DisplayName("Conditions of one container must hold on the same hit at every scope")
    void testCombinedConditionsAtEachScope() {
        // GIVEN: hit 0 is the checkout and hit 40 the Firefox hit, both in session s1_1
        Condition checkout = condition("page_type", Operator.EQUALS, "checkout");
        Condition firefox = condition("browser_name", Operator.EQUALS, "Firefox");

        // WHEN
        SegmentStatistics hit = engine.statistics(segment(Container.hit(checkout, firefox)));
        SegmentStatistics visit = engine.statistics(segment(Container.visit(checkout, firefox)));
        SegmentStatistics visitor = engine.statistics(segment(Container.visitor(checkout, firefox)));

        // THEN: no single hit is both
        assertEquals(0, hit.hits());
        assertEquals(0, visit.hits());
        assertEquals(0, visitor.hits());
    }

    @Test
    @DisplayName("Nested visit containers let each condition match a different hit of the session")
    void testNestedVisitsMatchDifferentHits() {
        Condition checkout = condition("page_type", Operator.EQUALS, "checkout");
        Condition firefox = condition("browser_name", Operator.EQUALS, "Firefox");

        SegmentStatistics visit = engine.statistics(segment(Container.visit()
                .addChild(Container.visit(checkout))
                .addChild(Container.visit(firefox))));
        SegmentStatistics visitor = engine.statistics(segment(Container.visitor()
                .addChild(Container.visit(checkout))
                .addChild(Container.visit(firefox))));

        assertEquals(5, visit.hits());
        assertEquals(1, visit.sessions());
        assertEquals(10, visitor.hits());
        assertEquals(2, visitor.sessions());
        assertEquals(1, visitor.visitors());
    }

    @Test
    @DisplayName("Visitor exclude drops every hit of a matching user")
    void testVisitorExclude() {
        Container bigSpender = Container.visitor(condition("revenue", Operator.GREATER_THAN, "500"));

        SegmentStatistics included = engine.statistics(segment(bigSpender));
        SegmentStatistics excluded = engine.statistics(segment(bigSpender.excluded()));

        assertEquals(10, included.hits());
        assertEquals(1, included.visitors());
        assertEquals(90, excluded.hits());
        assertEquals(18, excluded.sessions());
        assertEquals(9, excluded.visitors());
    }

    @Test
    @DisplayName("Include and exclude of the same container partition the hits")
    void testExcludeComplementsInclude() {
        for (Container container : List.of(
                Container.hit(condition("device_type", Operator.EQUALS, "Mobile")),
                Container.visit(condition("page_type", Operator.EQUALS, "checkout")),
                Container.visitor(condition("revenue", Operator.GREATER_THAN, "500")))) {
            long included = engine.statistics(segment(container)).hits();
            long excluded = engine.statistics(segment(container.excluded())).hits();
            assertEquals(HITS, included + excluded, container.toString());
        }
    }

    @Test
    @DisplayName("Rollup fields join their table")
    void testRollupFields() {
        SegmentStatistics returning = engine.statistics(
                segment(Container.hit(condition("user_type", Operator.EQUALS, "returning"))));
        SegmentStatistics longSessions = engine.statistics(
                segment(Container.hit(condition("pages_viewed", Operator.GREATER_THAN, "5"))));

        assertEquals(30, returning.hits());
        assertEquals(3, returning.visitors());
        assertEquals(50, longSessions.hits());
        assertEquals(10, longSessions.sessions());
    }

    @Test
    @DisplayName("Root containers combine with OR when asked")
    void testRootOr() {
        SegmentDefinition either = segment(
                Container.hit(condition("device_type", Operator.EQUALS, "Mobile")),
                Container.hit(condition("browser_name", Operator.EQUALS, "Firefox")))
                .withCombinator(Combinator.OR);

        assertEquals(31, engine.statistics(either).hits());
    }

    @Test
    @DisplayName("Empty segment matches nothing")
    void testEmptySegment() {
        SegmentDefinition empty = SegmentDefinition.named("Empty");

        SegmentStatistics stats = engine.statistics(empty);
        SegmentPreview preview = engine.preview(empty);

        assertTrue(stats.ok(), stats.error());
        assertEquals(0, stats.hits());
        assertEquals(HITS, stats.totalHits());
        assertEquals(0, preview.sampleRows().rowCount());
    }

    @Test
    @DisplayName("Running the same segment twice gives the same counts")
    void testIdempotent() {
        SegmentDefinition definition = segment(Container.visit(
                condition("page_url", Operator.CONTAINS, "/p/1"),
                condition("device_type", Operator.NOT_EQUALS, "Tablet")));

        assertEquals(engine.statistics(definition), engine.statistics(definition));
        assertEquals(engine.compile(definition), engine.compile(definition));
    }

    // ==================== Preview ====================

    @Test
    @DisplayName("Preview returns the most recent matching hits, bounded by the sample size")
    void testPreviewSample() {
        SegmentPreview preview = engine.preview(segment(Container.hit(condition("device_type", Operator.EQUALS, "Mobile"))));

        assertTrue(preview.ok(), preview.error());
        assertEquals(10, preview.sampleRows().rowCount());
        assertEquals(29L, ((Number) preview.sampleRows().getValue(0, "hit_id")).longValue());
        assertEquals(30, preview.statistics().hits());
        assertTrue(preview.displaySql().contains("'mobile'"));
    }

    // ==================== Profiling ====================

    @Test
    @DisplayName("Top values are ordered by frequency")
    void testTopValues() throws SQLException {
        List<ValueCount> devices = engine.profiler().topValues("device_type");
        List<ValueCount> first = engine.profiler().topValues("device_type", 1);

        assertEquals(2, devices.size());
        assertEquals("Desktop", devices.get(0).value());
        assertEquals(70, devices.get(0).count());
        assertEquals(new ValueCount("Mobile", 30), devices.get(1));
        assertEquals(1, first.size());
    }

    @Test
    @DisplayName("Top values skip null and empty values")
    void testTopValuesSkipsMissing() throws SQLException {
        List<ValueCount> campaigns = engine.profiler().topValues("campaign");

        assertTrue(campaigns.isEmpty());
    }

    @Test
    @DisplayName("Numeric summary covers non-null values only")
    void testNumericSummary() throws SQLException {
        NumericSummary revenue = engine.profiler().numericSummary("revenue");

        assertEquals(26, revenue.count());
        assertEquals(10.0, revenue.min(), 1e-9);
        assertEquals(600.0, revenue.max(), 1e-9);
        assertEquals(850.0 / 26, revenue.avg(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> engine.profiler().numericSummary("device_type"));
    }

}
