package io.segmentlite.segment.compiler;

import java.util.Objects;

/**
 * Options for compiling segments.
 *
 * @param combinatorMode How conditions and children of a container are joined
 */
public record CompilerOptions(CombinatorMode combinatorMode) {

    private static final CompilerOptions DEFAULTS = new CompilerOptions(CombinatorMode.UNIFORM);

    public CompilerOptions {
        Objects.requireNonNull(combinatorMode, "Combinator mode cannot be null");
    }

    public static CompilerOptions defaults() {
        return DEFAULTS;
    }

    public CompilerOptions withCombinatorMode(CombinatorMode combinatorMode) {
        return new CompilerOptions(combinatorMode);
    }
}
