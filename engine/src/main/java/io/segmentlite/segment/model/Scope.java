package io.segmentlite.segment.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The grain at which a container's predicate must hold.
 * Ranked so that an inner container may narrow scope but never widen it.
 */
public enum Scope {
    HIT("hit", 1),
    VISIT("visit", 2),
    VISITOR("visitor", 3);

    private final String id;
    private final int rank;

    Scope(String id, int rank) {
        this.id = id;
        this.rank = rank;
    }

    public String id() {
        return id;
    }

    public int rank() {
        return rank;
    }

    /**
     * @return true if a container of this scope may hold a child of the given scope
     */
    public boolean canContain(Scope child) {
        return child.rank <= rank;
    }

    public static Optional<Scope> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Scope scope : values()) {
            if (scope.id.equals(normalized)) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
