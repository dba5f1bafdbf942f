package io.segmentlite.segment.catalog;

import java.util.List;
import java.util.Objects;

/**
 * An ordered group of fields under one category.
 */
public record FieldGroup(
        String category,
        FieldKind kind,
        List<FieldDefinition> items) {

    public FieldGroup {
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(items, "Items cannot be null");
        items = List.copyOf(items);
    }
}
