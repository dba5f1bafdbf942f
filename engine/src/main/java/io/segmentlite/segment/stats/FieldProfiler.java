package io.segmentlite.segment.stats;

import io.segmentlite.engine.execution.BufferedResult;
import io.segmentlite.engine.execution.QueryExecutor;
import io.segmentlite.engine.execution.Row;
import io.segmentlite.engine.plan.AggregateExpression;
import io.segmentlite.engine.plan.AggregateExpression.AggregateFunction;
import io.segmentlite.engine.plan.CastExpression;
import io.segmentlite.engine.plan.ColumnReference;
import io.segmentlite.engine.plan.ComparisonExpression;
import io.segmentlite.engine.plan.Expression;
import io.segmentlite.engine.plan.FilterNode;
import io.segmentlite.engine.plan.GroupByNode;
import io.segmentlite.engine.plan.LimitNode;
import io.segmentlite.engine.plan.Literal;
import io.segmentlite.engine.plan.LogicalExpression;
import io.segmentlite.engine.plan.Projection;
import io.segmentlite.engine.plan.RelationNode;
import io.segmentlite.engine.plan.SortNode;
import io.segmentlite.engine.plan.TableNode;
import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.transpiler.SQLGenerator;
import io.segmentlite.segment.catalog.FieldCatalog;
import io.segmentlite.segment.catalog.FieldDefinition;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Profiles catalog fields against their owning table: the most frequent values of a
 * field, and the range of a numeric one.
 */
public final class FieldProfiler {

    public static final int DEFAULT_VALUE_LIMIT = 100;

    private final FieldCatalog catalog;
    private final EventSchema schema;
    private final SQLGenerator generator;
    private final QueryExecutor executor;

    public FieldProfiler(FieldCatalog catalog, EventSchema schema, SQLGenerator generator, QueryExecutor executor) {
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.generator = Objects.requireNonNull(generator, "Generator cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
    }

    /**
     * Most frequent non-empty values of a field, highest count first.
     *
     * <pre>
     * SELECT "h"."device_type" AS "value", COUNT(*) AS "count"
     * FROM "hits" AS "h"
     * WHERE "h"."device_type" IS NOT NULL AND CAST("h"."device_type" AS VARCHAR) &lt;&gt; ''
     * GROUP BY "h"."device_type"
     * ORDER BY COUNT(*) DESC, "h"."device_type" ASC
     * LIMIT 100
     * </pre>
     *
     * @throws IllegalArgumentException if the field is unknown or the limit is not positive
     */
    public List<ValueCount> topValues(String field, int limit) throws SQLException {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        FieldDefinition definition = require(field);
        TableNode table = tableOf(definition);
        ColumnReference column = table.column(definition.column());

        RelationNode filtered = new FilterNode(table, LogicalExpression.and(
                ComparisonExpression.isNotNull(column),
                ComparisonExpression.notEquals(CastExpression.toText(column), Literal.string(""))));
        Expression count = AggregateExpression.countAll();
        RelationNode grouped = new GroupByNode(filtered, List.of(column), List.of(
                Projection.of(column, "value"),
                Projection.of(count, "count")));
        RelationNode sorted = SortNode.of(grouped,
                SortNode.SortColumn.desc(count),
                SortNode.SortColumn.asc(column));

        BufferedResult result = executor.execute(generator.generate(LimitNode.limit(sorted, limit)));
        List<ValueCount> values = new ArrayList<>(result.rowCount());
        for (Row row : result.rows()) {
            values.add(new ValueCount(row.get(0), row.getLong(1)));
        }
        return values;
    }

    public List<ValueCount> topValues(String field) throws SQLException {
        return topValues(field, DEFAULT_VALUE_LIMIT);
    }

    /**
     * MIN, MAX, AVG and COUNT over the non-null values of a numeric field.
     *
     * @throws IllegalArgumentException if the field is unknown or not numeric
     */
    public NumericSummary numericSummary(String field) throws SQLException {
        FieldDefinition definition = require(field);
        if (!definition.isNumeric()) {
            throw new IllegalArgumentException("Field '" + field + "' is not numeric");
        }
        TableNode table = tableOf(definition);
        ColumnReference column = table.column(definition.column());

        RelationNode plan = GroupByNode.global(
                new FilterNode(table, ComparisonExpression.isNotNull(column)),
                List.of(
                        Projection.of(AggregateExpression.of(AggregateFunction.MIN, column), "min_value"),
                        Projection.of(AggregateExpression.of(AggregateFunction.MAX, column), "max_value"),
                        Projection.of(AggregateExpression.of(AggregateFunction.AVG, column), "avg_value"),
                        Projection.of(AggregateExpression.countAll(), "count")));

        BufferedResult result = executor.execute(generator.generate(plan));
        if (result.rowCount() == 0) {
            return new NumericSummary(null, null, null, 0);
        }
        Row row = result.rows().get(0);
        return new NumericSummary(row.getDouble(0), row.getDouble(1), row.getDouble(2), row.getLong(3));
    }

    private FieldDefinition require(String field) {
        return catalog.resolve(field)
                .orElseThrow(() -> new IllegalArgumentException("Unknown field '" + field + "'"));
    }

    private TableNode tableOf(FieldDefinition definition) {
        return new TableNode(schema.table(definition.owningTable()), definition.owningTable().aliasPrefix());
    }
}
