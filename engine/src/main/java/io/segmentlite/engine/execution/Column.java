package io.segmentlite.engine.execution;

/**
 * Name and engine type name of one result column, as reported by the driver.
 */
public record Column(String name, String sqlType) {
}
