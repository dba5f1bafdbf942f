package io.segmentlite.segment.json;

/**
 * Thrown when JSON text is malformed or does not describe a segment.
 */
public class SegmentJsonException extends RuntimeException {

    private final int position;

    public SegmentJsonException(String message) {
        super(message);
        this.position = -1;
    }

    public SegmentJsonException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    /**
     * @return Character offset of the error in the input, or -1 when the text parsed
     *         but its content is invalid
     */
    public int getPosition() {
        return position;
    }
}
