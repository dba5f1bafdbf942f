package io.segmentlite.segment.library;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps saved segments in memory, for tests and single-process use.
 */
public final class InMemorySegmentRepository implements SegmentRepository {

    private final Map<String, SavedSegment> segments = new LinkedHashMap<>();

    @Override
    public synchronized void save(SavedSegment segment) {
        Objects.requireNonNull(segment, "Segment cannot be null");
        segments.put(segment.id(), segment);
    }

    @Override
    public synchronized Optional<SavedSegment> findById(String id) {
        return Optional.ofNullable(segments.get(id));
    }

    @Override
    public synchronized Optional<SavedSegment> findByName(String name) {
        return segments.values().stream()
                .filter(s -> s.name().equals(name))
                .findFirst();
    }

    @Override
    public synchronized List<SavedSegment> findAll() {
        return new ArrayList<>(segments.values());
    }

    @Override
    public synchronized boolean deleteById(String id) {
        return segments.remove(id) != null;
    }
}
