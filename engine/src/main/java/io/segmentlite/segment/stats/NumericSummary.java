package io.segmentlite.segment.stats;

/**
 * Range and mean of a numeric field over its non-null values.
 *
 * @param min   Smallest value, null when the field has no values
 * @param max   Largest value, null when the field has no values
 * @param avg   Mean, null when the field has no values
 * @param count Number of non-null values
 */
public record NumericSummary(Double min, Double max, Double avg, long count) {

    public boolean isEmpty() {
        return count == 0;
    }
}
