package io.segmentlite.segment.stats;

/**
 * A distinct value of a field and how many rows carry it.
 */
public record ValueCount(Object value, long count) {
}
