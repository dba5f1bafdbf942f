package io.segmentlite.segment.preview;

import io.segmentlite.engine.execution.BufferedResult;
import io.segmentlite.engine.execution.QueryExecutor;
import io.segmentlite.engine.plan.LimitNode;
import io.segmentlite.engine.transpiler.SqlQuery;
import io.segmentlite.segment.compiler.SegmentCompiler;
import io.segmentlite.segment.model.SegmentDefinition;
import io.segmentlite.segment.stats.PopulationTotals;
import io.segmentlite.segment.stats.SegmentStatistics;
import io.segmentlite.segment.stats.StatisticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Objects;

/**
 * Compiles a segment, fetches a sample of matching events and counts its matches.
 *
 * Never throws for a bad segment or a failing query; the failure is reported in the
 * returned {@link SegmentPreview}.
 */
public final class PreviewService {

    private static final Logger logger = LoggerFactory.getLogger(PreviewService.class);

    public static final int DEFAULT_SAMPLE_SIZE = 100;

    private final SegmentCompiler compiler;
    private final QueryExecutor executor;
    private final StatisticsEngine statisticsEngine;
    private final int sampleSize;

    public PreviewService(SegmentCompiler compiler, QueryExecutor executor, StatisticsEngine statisticsEngine,
            int sampleSize) {
        this.compiler = Objects.requireNonNull(compiler, "Compiler cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.statisticsEngine = Objects.requireNonNull(statisticsEngine, "Statistics engine cannot be null");
        if (sampleSize <= 0) {
            throw new IllegalArgumentException("Sample size must be positive: " + sampleSize);
        }
        this.sampleSize = sampleSize;
    }

    public PreviewService(SegmentCompiler compiler, QueryExecutor executor, StatisticsEngine statisticsEngine) {
        this(compiler, executor, statisticsEngine, DEFAULT_SAMPLE_SIZE);
    }

    public int sampleSize() {
        return sampleSize;
    }

    public SegmentPreview preview(SegmentDefinition definition) {
        String displaySql;
        SqlQuery sampleQuery;
        try {
            displaySql = compiler.toSql(definition);
            sampleQuery = compiler.generator().generate(LimitNode.limit(compiler.plan(definition, true), sampleSize));
        } catch (RuntimeException e) {
            logger.warn("Preview compilation failed: {}", e.getMessage());
            return new SegmentPreview("", null, BufferedResult.empty(),
                    SegmentStatistics.failed(e.getMessage(), PopulationTotals.ZERO), e.getMessage());
        }

        BufferedResult sample = BufferedResult.empty();
        String error = null;
        try {
            sample = executor.execute(sampleQuery);
        } catch (SQLException | RuntimeException e) {
            logger.warn("Preview sample query failed: {}", e.getMessage());
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }
        if (Thread.currentThread().isInterrupted()) {
            // Superseded; skip the counts
            return new SegmentPreview(displaySql, sampleQuery, sample,
                    SegmentStatistics.failed("Preview cancelled", PopulationTotals.ZERO), error);
        }
        SegmentStatistics statistics = statisticsEngine.statistics(definition);
        return new SegmentPreview(displaySql, sampleQuery, sample, statistics, error);
    }
}
