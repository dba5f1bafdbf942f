package io.segmentlite.segment.catalog;

import io.segmentlite.engine.store.EventTable;
import io.segmentlite.segment.model.DataType;
import io.segmentlite.segment.model.Operator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup of the fields segments can reference.
 *
 * Built once from configuration and passed explicitly to whatever compiles or
 * validates segments.
 */
public final class FieldCatalog {

    private final List<FieldGroup> groups;
    private final Map<String, FieldDefinition> byField;

    /**
     * @throws FieldCatalogException if two items declare the same field
     */
    public FieldCatalog(List<FieldGroup> groups) {
        this.groups = List.copyOf(groups);
        Map<String, FieldDefinition> index = new LinkedHashMap<>();
        for (FieldGroup group : this.groups) {
            for (FieldDefinition definition : group.items()) {
                if (index.putIfAbsent(definition.field(), definition) != null) {
                    throw new FieldCatalogException("Duplicate field '" + definition.field() + "'");
                }
            }
        }
        this.byField = Collections.unmodifiableMap(index);
    }

    public Optional<FieldDefinition> resolve(String field) {
        if (field == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byField.get(field.trim()));
    }

    public boolean contains(String field) {
        return resolve(field).isPresent();
    }

    public Set<Operator> operatorsFor(DataType dataType) {
        return Operator.allowedFor(dataType);
    }

    public List<FieldGroup> groups() {
        return groups;
    }

    public List<FieldGroup> groups(FieldKind kind) {
        return groups.stream().filter(g -> g.kind() == kind).toList();
    }

    /**
     * @return Every field, in configuration order
     */
    public List<FieldDefinition> fields() {
        return List.copyOf(byField.values());
    }

    public List<FieldDefinition> fieldsOwnedBy(EventTable table) {
        return byField.values().stream()
                .filter(f -> f.owningTable() == table)
                .toList();
    }

    public int size() {
        return byField.size();
    }
}
