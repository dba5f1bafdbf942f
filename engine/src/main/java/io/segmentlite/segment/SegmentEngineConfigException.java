package io.segmentlite.segment;

/**
 * Thrown when the engine configuration cannot be read or holds an invalid value.
 */
public class SegmentEngineConfigException extends RuntimeException {

    public SegmentEngineConfigException(String message) {
        super(message);
    }

    public SegmentEngineConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
