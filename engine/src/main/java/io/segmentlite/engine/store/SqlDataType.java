package io.segmentlite.engine.store;

/**
 * Column types of the event tables. Dialects map them to cast targets.
 */
public enum SqlDataType {
    VARCHAR,
    INTEGER,
    BIGINT,
    BOOLEAN,
    TIMESTAMP,
    DOUBLE
}
