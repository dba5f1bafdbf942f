package io.segmentlite.segment.validation;

import java.util.Objects;

/**
 * One problem found in a segment definition.
 *
 * @param path    Location in the tree, e.g. {@code containers[0].children[1].conditions[2]}
 * @param message What is wrong
 */
public record ValidationIssue(String path, String message) {

    public ValidationIssue {
        Objects.requireNonNull(path, "Path cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
