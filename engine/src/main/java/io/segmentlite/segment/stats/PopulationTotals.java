package io.segmentlite.segment.stats;

/**
 * Size of the unfiltered event population.
 */
public record PopulationTotals(long hits, long sessions, long visitors) {

    public static final PopulationTotals ZERO = new PopulationTotals(0, 0, 0);

    public PopulationTotals {
        if (hits < 0 || sessions < 0 || visitors < 0) {
            throw new IllegalArgumentException("Totals cannot be negative");
        }
    }
}
