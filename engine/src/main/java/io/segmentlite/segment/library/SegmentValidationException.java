package io.segmentlite.segment.library;

import io.segmentlite.segment.validation.ValidationResult;

/**
 * Thrown when a segment that fails validation is saved.
 */
public class SegmentValidationException extends RuntimeException {

    private final ValidationResult result;

    public SegmentValidationException(ValidationResult result) {
        super("Segment is not valid: " + String.join("; ", result.errorMessages()));
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }
}
