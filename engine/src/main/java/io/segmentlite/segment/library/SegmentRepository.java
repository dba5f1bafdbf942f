package io.segmentlite.segment.library;

import java.util.List;
import java.util.Optional;

/**
 * Storage for saved segments. Implementations must be safe for concurrent use.
 */
public interface SegmentRepository {

    /**
     * Inserts or replaces the segment with the same id.
     */
    void save(SavedSegment segment);

    Optional<SavedSegment> findById(String id);

    Optional<SavedSegment> findByName(String name);

    /**
     * @return Every saved segment, in insertion order
     */
    List<SavedSegment> findAll();

    /**
     * @return true if a segment was removed
     */
    boolean deleteById(String id);
}
