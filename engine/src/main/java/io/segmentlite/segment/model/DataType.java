package io.segmentlite.segment.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Value domain of a field, which decides the operators it accepts.
 */
public enum DataType {
    STRING("string"),
    NUMBER("number");

    private final String id;

    DataType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<DataType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (DataType type : values()) {
            if (type.id.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
