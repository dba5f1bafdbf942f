package io.segmentlite.segment.library;

import io.segmentlite.segment.model.SegmentDefinition;

import java.time.Instant;
import java.util.Objects;

/**
 * A segment definition stored in the library.
 *
 * @param id         Library identifier
 * @param definition The stored definition; its name is the segment's name
 * @param createdAt  When the segment was first saved
 * @param updatedAt  When the segment was last saved
 * @param usageCount How many times the segment has been loaded
 */
public record SavedSegment(
        String id,
        SegmentDefinition definition,
        Instant createdAt,
        Instant updatedAt,
        int usageCount) {

    public SavedSegment {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(definition, "Definition cannot be null");
        Objects.requireNonNull(createdAt, "Created time cannot be null");
        Objects.requireNonNull(updatedAt, "Updated time cannot be null");
        if (usageCount < 0) {
            throw new IllegalArgumentException("Usage count cannot be negative");
        }
    }

    public String name() {
        return definition.name();
    }

    public String description() {
        return definition.description() == null ? "" : definition.description();
    }

    public SavedSegment withDefinition(SegmentDefinition definition, Instant updatedAt) {
        return new SavedSegment(id, definition, createdAt, updatedAt, usageCount);
    }

    public SavedSegment used() {
        return new SavedSegment(id, definition, createdAt, updatedAt, usageCount + 1);
    }
}
