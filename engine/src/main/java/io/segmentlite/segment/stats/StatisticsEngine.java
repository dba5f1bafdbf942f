package io.segmentlite.segment.stats;

import io.segmentlite.engine.execution.BufferedResult;
import io.segmentlite.engine.execution.QueryExecutor;
import io.segmentlite.engine.execution.Row;
import io.segmentlite.engine.plan.AggregateExpression;
import io.segmentlite.engine.plan.ColumnReference;
import io.segmentlite.engine.plan.GroupByNode;
import io.segmentlite.engine.plan.Projection;
import io.segmentlite.engine.plan.RelationNode;
import io.segmentlite.engine.plan.SubqueryNode;
import io.segmentlite.engine.plan.TableNode;
import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.store.EventTable;
import io.segmentlite.engine.transpiler.SqlQuery;
import io.segmentlite.segment.compiler.SegmentCompiler;
import io.segmentlite.segment.model.SegmentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counts the events, sessions and visitors a segment matches.
 *
 * <pre>
 * SELECT COUNT(*) AS "hits",
 *        COUNT(DISTINCT "segment_data"."session_id") AS "sessions",
 *        COUNT(DISTINCT "segment_data"."user_id") AS "visitors"
 * FROM (&lt;segment&gt;) AS "segment_data"
 * </pre>
 *
 * Population totals are computed on first use and cached until {@link #refreshTotals()}.
 * Failures never escape {@link #statistics}: they come back as zeroed counts with the
 * error text.
 */
public final class StatisticsEngine {

    private static final Logger logger = LoggerFactory.getLogger(StatisticsEngine.class);

    static final String SEGMENT_ALIAS = "segment_data";

    private final SegmentCompiler compiler;
    private final QueryExecutor executor;
    private final EventSchema schema;
    private final AtomicReference<PopulationTotals> totals = new AtomicReference<>();

    public StatisticsEngine(SegmentCompiler compiler, QueryExecutor executor, EventSchema schema) {
        this.compiler = Objects.requireNonNull(compiler, "Compiler cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
    }

    public SegmentStatistics statistics(SegmentDefinition definition) {
        PopulationTotals population = PopulationTotals.ZERO;
        try {
            population = totals();
            SqlQuery query = compiler.generator().generate(countPlan(definition));
            Row row = singleRow(executor.execute(query));
            return SegmentStatistics.of(row.getLong(0), row.getLong(1), row.getLong(2), population);
        } catch (SQLException | RuntimeException e) {
            logger.warn("Statistics failed for segment '{}': {}",
                    definition == null ? null : definition.name(), e.getMessage());
            return SegmentStatistics.failed(e.getMessage(), population);
        }
    }

    /**
     * Cached population totals, computed on first call.
     *
     * @throws SQLException if the totals query fails
     */
    public PopulationTotals totals() throws SQLException {
        PopulationTotals cached = totals.get();
        if (cached != null) {
            return cached;
        }
        PopulationTotals computed = computeTotals();
        // A concurrent caller may have won; either value is current
        totals.compareAndSet(null, computed);
        return totals.get();
    }

    /**
     * Recomputes the population totals, for use after the event tables change.
     */
    public PopulationTotals refreshTotals() throws SQLException {
        PopulationTotals computed = computeTotals();
        totals.set(computed);
        logger.info("Population totals refreshed: {}", computed);
        return computed;
    }

    /**
     * The count query over the segment, without running it.
     */
    public RelationNode countPlan(SegmentDefinition definition) {
        RelationNode segment = new SubqueryNode(compiler.plan(definition, false), SEGMENT_ALIAS);
        return countsOf(segment, SEGMENT_ALIAS);
    }

    private PopulationTotals computeTotals() throws SQLException {
        String alias = EventTable.HITS.aliasPrefix();
        RelationNode plan = countsOf(new TableNode(schema.hits(), alias), alias);
        Row row = singleRow(executor.execute(compiler.generator().generate(plan)));
        return new PopulationTotals(row.getLong(0), row.getLong(1), row.getLong(2));
    }

    private static RelationNode countsOf(RelationNode source, String alias) {
        return GroupByNode.global(source, List.of(
                Projection.of(AggregateExpression.countAll(), "hits"),
                Projection.of(AggregateExpression.countDistinct(
                        ColumnReference.of(alias, EventTable.SESSIONS.keyColumn())), "sessions"),
                Projection.of(AggregateExpression.countDistinct(
                        ColumnReference.of(alias, EventTable.USERS.keyColumn())), "visitors")));
    }

    private static Row singleRow(BufferedResult result) {
        if (result.rowCount() != 1) {
            throw new IllegalStateException("Expected one row of counts, got " + result.rowCount());
        }
        return result.rows().get(0);
    }
}
