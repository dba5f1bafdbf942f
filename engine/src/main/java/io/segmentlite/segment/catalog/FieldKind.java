package io.segmentlite.segment.catalog;

import io.segmentlite.segment.model.DataType;

/**
 * Whether a field describes a hit (dimension) or measures it (metric).
 */
public enum FieldKind {
    DIMENSION("dimensions", DataType.STRING),
    METRIC("metrics", DataType.NUMBER);

    private final String sectionName;
    private final DataType defaultDataType;

    FieldKind(String sectionName, DataType defaultDataType) {
        this.sectionName = sectionName;
        this.defaultDataType = defaultDataType;
    }

    /**
     * @return The top-level key of the catalog configuration listing groups of this kind
     */
    public String sectionName() {
        return sectionName;
    }

    /**
     * @return The data type assumed for an item that does not declare one
     */
    public DataType defaultDataType() {
        return defaultDataType;
    }
}
