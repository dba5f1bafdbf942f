package io.segmentlite.segment.compiler;

import io.segmentlite.engine.store.EventTable;

/**
 * Table aliases for one query level.
 *
 * The outermost query uses {@code h}, {@code s} and {@code u}. A visit or visitor
 * subquery opens the next level, whose aliases carry the depth ({@code h1}, {@code s1},
 * {@code u1}, then {@code h2}...), so a nested predicate never binds to an outer row.
 *
 * @param depth Nesting level, 0 for the outermost query
 */
public record TableAliases(int depth) {

    private static final TableAliases ROOT = new TableAliases(0);

    public TableAliases {
        if (depth < 0) {
            throw new IllegalArgumentException("Depth cannot be negative");
        }
    }

    public static TableAliases root() {
        return ROOT;
    }

    public TableAliases nested() {
        return new TableAliases(depth + 1);
    }

    public String alias(EventTable table) {
        return depth == 0 ? table.aliasPrefix() : table.aliasPrefix() + depth;
    }
}
