package io.segmentlite.segment.compiler;

/**
 * How the elements of a container are joined.
 */
public enum CombinatorMode {
    /**
     * The container's combinator joins every condition and child alike.
     * Per-condition combinators are ignored.
     */
    UNIFORM,
    /**
     * Conditions fold left to right, each joined to its predecessor by its own
     * combinator; the folded group is then joined with the children by the
     * container's combinator.
     */
    PAIRWISE
}
