package io.segmentlite.segment.catalog;

import io.segmentlite.engine.store.EventSchema;
import io.segmentlite.engine.store.EventTable;
import io.segmentlite.engine.store.Table;
import io.segmentlite.segment.json.SegmentJson;
import io.segmentlite.segment.json.SegmentJsonException;
import io.segmentlite.segment.model.DataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a {@link FieldCatalog} from its JSON configuration.
 *
 * <pre>
 * {
 *   "dimensions": [
 *     { "category": "Technology",
 *       "items": [ { "name": "Device Type", "field": "device_type", "dataType": "string",
 *                    "values": ["Desktop", "Mobile", "Tablet"] } ] }
 *   ],
 *   "metrics": [
 *     { "category": "Session",
 *       "items": [ { "name": "Pages Viewed", "field": "pages_viewed", "table": "sessions" } ] }
 *   ]
 * }
 * </pre>
 *
 * An item without {@code table} lives on the event table; without {@code column} its
 * column is named like the field; without a data type it is a string for dimensions and
 * a number for metrics. Every column is checked against the event schema.
 */
public final class FieldCatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(FieldCatalogLoader.class);

    public static final String DEFAULT_RESOURCE = "field-catalog.json";

    private final EventSchema schema;

    public FieldCatalogLoader(EventSchema schema) {
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
    }

    /**
     * Loads the catalog bundled on the classpath.
     */
    public FieldCatalog loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * @throws FieldCatalogException if the resource is missing or invalid
     */
    public FieldCatalog loadResource(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = FieldCatalogLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new FieldCatalogException("Field catalog resource not found: " + resource);
            }
            FieldCatalog catalog = load(new InputStreamReader(in, StandardCharsets.UTF_8));
            logger.info("Loaded {} fields in {} groups from {}", catalog.size(), catalog.groups().size(), resource);
            return catalog;
        } catch (IOException e) {
            throw new FieldCatalogException("Failed to read field catalog " + resource, e);
        }
    }

    public FieldCatalog load(Reader reader) throws IOException {
        StringWriter buffer = new StringWriter();
        reader.transferTo(buffer);
        return parse(buffer.toString());
    }

    /**
     * @throws FieldCatalogException if the JSON is malformed or describes an invalid catalog
     */
    public FieldCatalog parse(String json) {
        Map<String, Object> root;
        try {
            root = SegmentJson.parseObject(json);
        } catch (SegmentJsonException e) {
            throw new FieldCatalogException("Malformed field catalog: " + e.getMessage(), e);
        }

        List<FieldGroup> groups = new ArrayList<>();
        try {
            for (FieldKind kind : FieldKind.values()) {
                List<Object> sections = SegmentJson.getList(root, kind.sectionName());
                for (int i = 0; i < sections.size(); i++) {
                    String path = kind.sectionName() + "[" + i + "]";
                    groups.add(parseGroup(SegmentJson.asObject(sections.get(i), path), kind, path));
                }
            }
        } catch (SegmentJsonException e) {
            throw new FieldCatalogException("Invalid field catalog: " + e.getMessage(), e);
        }
        if (groups.isEmpty()) {
            throw new FieldCatalogException("Field catalog declares no field groups");
        }
        return new FieldCatalog(groups);
    }

    private FieldGroup parseGroup(Map<String, Object> json, FieldKind kind, String path) {
        String category = SegmentJson.getString(json, "category");
        if (category == null || category.isBlank()) {
            throw new FieldCatalogException(path + ": category is required");
        }
        List<Object> itemsJson = SegmentJson.getList(json, "items");
        List<FieldDefinition> items = new ArrayList<>(itemsJson.size());
        for (int i = 0; i < itemsJson.size(); i++) {
            String itemPath = path + ".items[" + i + "]";
            items.add(parseItem(SegmentJson.asObject(itemsJson.get(i), itemPath), kind, category, itemPath));
        }
        return new FieldGroup(category, kind, items);
    }

    private FieldDefinition parseItem(Map<String, Object> json, FieldKind kind, String category, String path) {
        String field = SegmentJson.getString(json, "field");
        if (field == null || field.isBlank()) {
            throw new FieldCatalogException(path + ": field is required");
        }
        field = field.trim();
        String name = SegmentJson.getString(json, "name");
        if (name == null || name.isBlank()) {
            name = field;
        }

        EventTable owningTable = EventTable.HITS;
        String tableName = SegmentJson.getString(json, "table");
        if (tableName != null && !tableName.isBlank()) {
            try {
                owningTable = EventTable.fromTableName(tableName);
            } catch (IllegalArgumentException e) {
                throw new FieldCatalogException(path + ": " + e.getMessage(), e);
            }
        }

        String column = SegmentJson.getString(json, "column");
        if (column == null || column.isBlank()) {
            column = field;
        }
        Table table = schema.table(owningTable);
        if (table.findColumn(column).isEmpty()) {
            throw new FieldCatalogException(path + ": column '" + column + "' does not exist in table "
                    + table.name());
        }

        DataType dataType = readDataType(json, kind, path);

        List<String> values = new ArrayList<>();
        for (Object value : SegmentJson.getList(json, "values")) {
            if (value != null) {
                values.add(String.valueOf(value));
            }
        }

        return new FieldDefinition(name, field, column, owningTable, dataType, kind, category,
                SegmentJson.getString(json, "description"), values);
    }

    private static DataType readDataType(Map<String, Object> json, FieldKind kind, String path) {
        String declared = SegmentJson.getString(json, "dataType");
        if (declared == null) {
            declared = SegmentJson.getString(json, "data_type");
        }
        if (declared != null) {
            String typeId = declared;
            return DataType.fromId(typeId)
                    .orElseThrow(() -> new FieldCatalogException(path + ": unknown data type '" + typeId + "'"));
        }
        // Older catalogs put the data type under "type", which newer ones use for the kind
        String type = SegmentJson.getString(json, "type");
        return DataType.fromId(type).orElse(kind.defaultDataType());
    }
}
