package io.segmentlite.segment.compiler;

/**
 * Thrown when a segment cannot be compiled against the configured schema, for
 * example when the catalog binds a field to a column the schema does not have.
 *
 * Incomplete or unknown conditions never raise this; they are dropped.
 */
public class SegmentCompileException extends RuntimeException {

    public SegmentCompileException(String message) {
        super(message);
    }

    public SegmentCompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
