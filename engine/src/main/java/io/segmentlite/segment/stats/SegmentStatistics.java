package io.segmentlite.segment.stats;

import java.util.Optional;

/**
 * How much of the event population a segment matches.
 *
 * @param hits          Matched events
 * @param sessions      Distinct sessions among matched events
 * @param visitors      Distinct users among matched events
 * @param totalHits     Events in the population
 * @param totalSessions Sessions in the population
 * @param totalVisitors Users in the population
 * @param error         Failure text when the counts could not be computed, otherwise null
 */
public record SegmentStatistics(
        long hits,
        long sessions,
        long visitors,
        long totalHits,
        long totalSessions,
        long totalVisitors,
        String error) {

    public static SegmentStatistics of(long hits, long sessions, long visitors, PopulationTotals totals) {
        return new SegmentStatistics(hits, sessions, visitors,
                totals.hits(), totals.sessions(), totals.visitors(), null);
    }

    /**
     * Zeroed counts carrying the failure text.
     */
    public static SegmentStatistics failed(String error, PopulationTotals totals) {
        return new SegmentStatistics(0, 0, 0,
                totals.hits(), totals.sessions(), totals.visitors(),
                error == null ? "Unknown error" : error);
    }

    public boolean ok() {
        return error == null;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    public double hitPercentage() {
        return percentage(hits, totalHits);
    }

    public double sessionPercentage() {
        return percentage(sessions, totalSessions);
    }

    public double visitorPercentage() {
        return percentage(visitors, totalVisitors);
    }

    private static double percentage(long part, long total) {
        if (total == 0) {
            return 0.0;
        }
        return part * 100.0 / total;
    }
}
