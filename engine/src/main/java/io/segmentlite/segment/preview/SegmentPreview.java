package io.segmentlite.segment.preview;

import io.segmentlite.engine.execution.BufferedResult;
import io.segmentlite.engine.transpiler.SqlQuery;
import io.segmentlite.segment.stats.SegmentStatistics;

import java.util.Objects;

/**
 * What the builder shows for a segment while it is edited.
 *
 * @param displaySql SQL with values inlined, empty if compilation failed
 * @param query      The executed sample query, null if compilation failed
 * @param sampleRows Most recent matching events, empty on failure
 * @param statistics Match counts; carry their own error when counting failed
 * @param error      Failure text for compilation or the sample query, otherwise null
 */
public record SegmentPreview(
        String displaySql,
        SqlQuery query,
        BufferedResult sampleRows,
        SegmentStatistics statistics,
        String error) {

    public SegmentPreview {
        Objects.requireNonNull(sampleRows, "Sample rows cannot be null");
        Objects.requireNonNull(statistics, "Statistics cannot be null");
        displaySql = displaySql == null ? "" : displaySql;
    }

    public boolean ok() {
        return error == null && statistics.ok();
    }
}
