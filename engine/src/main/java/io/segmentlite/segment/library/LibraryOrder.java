package io.segmentlite.segment.library;

import java.util.Comparator;

/**
 * Orderings for listing the library.
 */
public enum LibraryOrder {
    NAME(Comparator.comparing(SavedSegment::name)),
    CREATED(Comparator.comparing(SavedSegment::createdAt).reversed()),
    MODIFIED(Comparator.comparing(SavedSegment::updatedAt).reversed()),
    USAGE(Comparator.comparingInt(SavedSegment::usageCount).reversed());

    private final Comparator<SavedSegment> comparator;

    LibraryOrder(Comparator<SavedSegment> comparator) {
        this.comparator = comparator;
    }

    public Comparator<SavedSegment> comparator() {
        return comparator;
    }
}
