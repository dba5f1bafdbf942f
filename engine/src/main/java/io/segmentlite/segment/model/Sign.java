package io.segmentlite.segment.model;

/**
 * Whether a container's compiled predicate is kept or negated.
 */
public enum Sign {
    INCLUDE,
    EXCLUDE;

    public static Sign of(boolean include) {
        return include ? INCLUDE : EXCLUDE;
    }

    public boolean isInclude() {
        return this == INCLUDE;
    }
}
