package io.segmentlite.segment.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Logical joiner between sibling elements.
 * THEN carries no sequential meaning here and combines like AND.
 */
public enum Combinator {
    AND,
    OR,
    THEN;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return true for OR, the only combinator that does not conjoin
     */
    public boolean isDisjunctive() {
        return this == OR;
    }

    public static Optional<Combinator> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT);
        for (Combinator combinator : values()) {
            if (combinator.name().equals(normalized)) {
                return Optional.of(combinator);
            }
        }
        return Optional.empty();
    }
}
