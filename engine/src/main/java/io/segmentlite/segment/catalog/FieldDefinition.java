package io.segmentlite.segment.catalog;

import io.segmentlite.engine.store.EventTable;
import io.segmentlite.segment.model.DataType;

import java.util.List;
import java.util.Objects;

/**
 * One field an analyst can build conditions on.
 *
 * @param name        Display name
 * @param field       Identifier used by conditions
 * @param column      Column holding the field in its owning table
 * @param owningTable Table the column lives in
 * @param dataType    Value domain
 * @param kind        Dimension or metric
 * @param category    Group the field is listed under
 * @param description Free text, may be empty
 * @param values      Suggested values for the authoring surface, may be empty
 */
public record FieldDefinition(
        String name,
        String field,
        String column,
        EventTable owningTable,
        DataType dataType,
        FieldKind kind,
        String category,
        String description,
        List<String> values) {

    public FieldDefinition {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(column, "Column cannot be null");
        Objects.requireNonNull(owningTable, "Owning table cannot be null");
        Objects.requireNonNull(dataType, "Data type cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        Objects.requireNonNull(category, "Category cannot be null");
        if (field.isBlank()) {
            throw new IllegalArgumentException("Field cannot be blank");
        }
        if (column.isBlank()) {
            throw new IllegalArgumentException("Column cannot be blank");
        }
        description = description == null ? "" : description;
        values = values == null ? List.of() : List.copyOf(values);
    }

    /**
     * A field on the event table whose column has the same name.
     */
    public static FieldDefinition hitField(String name, String field, DataType dataType, FieldKind kind,
            String category) {
        return new FieldDefinition(name, field, field, EventTable.HITS, dataType, kind, category, "", List.of());
    }

    public boolean isNumeric() {
        return dataType == DataType.NUMBER;
    }
}
