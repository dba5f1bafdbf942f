package io.segmentlite.segment.json;

import io.segmentlite.segment.model.Combinator;
import io.segmentlite.segment.model.Condition;
import io.segmentlite.segment.model.Container;
import io.segmentlite.segment.model.DataType;
import io.segmentlite.segment.model.Operator;
import io.segmentlite.segment.model.Scope;
import io.segmentlite.segment.model.SegmentDefinition;
import io.segmentlite.segment.model.Sign;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads and writes segment definitions in the builder's JSON shape.
 *
 * <pre>
 * {
 *   "name": "Mobile buyers",
 *   "description": "",
 *   "container_type": "hit",
 *   "logic": "and",
 *   "containers": [
 *     {
 *       "type": "visit",
 *       "include": true,
 *       "logic": "and",
 *       "conditions": [
 *         {"field": "device_type", "name": "Device Type", "operator": "equals",
 *          "value": "Mobile", "data_type": "string"}
 *       ],
 *       "children": []
 *     }
 *   ]
 * }
 * </pre>
 *
 * Missing container keys take the builder's defaults: type hit, include true, logic and,
 * no conditions, no children. A document wrapping the definition under {@code definition}
 * or {@code segment} is unwrapped.
 */
public final class SegmentDefinitionCodec {

    public static final String FORMAT_VERSION = "2.0";
    public static final String EXPORTED_BY = "segment_builder";

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private SegmentDefinitionCodec() {
    }

    // ========== READING ==========

    /**
     * @throws SegmentJsonException if the text is not JSON, the name is missing, or a
     *                              scope, combinator, operator or data type is unknown
     */
    public static SegmentDefinition read(String json) {
        return fromMap(SegmentJson.parseObject(json));
    }

    public static SegmentDefinition fromMap(Map<String, Object> document) {
        Map<String, Object> map = unwrap(document);
        String name = SegmentJson.getString(map, "name");
        if (name == null || name.isBlank()) {
            throw new SegmentJsonException("Invalid segment: missing name");
        }
        Scope rootScope = parse(map, "container_type", "container_type", Scope::fromId).orElse(Scope.HIT);
        Combinator combinator = parse(map, "logic", "logic", Combinator::fromId).orElse(Combinator.AND);

        List<Container> containers = new ArrayList<>();
        List<Object> items = SegmentJson.getList(map, "containers");
        for (int i = 0; i < items.size(); i++) {
            String path = "containers[" + i + "]";
            containers.add(readContainer(SegmentJson.asObject(items.get(i), path), path));
        }
        String description = SegmentJson.getString(map, "description");
        return new SegmentDefinition(name, description == null ? "" : description, rootScope, combinator, containers);
    }

    private static Map<String, Object> unwrap(Map<String, Object> document) {
        for (String key : List.of("definition", "segment")) {
            Map<String, Object> inner = SegmentJson.getObject(document, key);
            if (inner != null) {
                if (!inner.containsKey("name") && document.containsKey("name")) {
                    Map<String, Object> named = new LinkedHashMap<>(inner);
                    named.put("name", document.get("name"));
                    return named;
                }
                return inner;
            }
        }
        return document;
    }

    private static Container readContainer(Map<String, Object> map, String path) {
        Scope scope = parse(map, "type", path + ".type", Scope::fromId).orElse(Scope.HIT);
        Sign sign = Sign.of(SegmentJson.getBoolean(map, "include", true));
        Combinator combinator = parse(map, "logic", path + ".logic", Combinator::fromId).orElse(Combinator.AND);

        List<Condition> conditions = new ArrayList<>();
        List<Object> conditionItems = SegmentJson.getList(map, "conditions");
        for (int i = 0; i < conditionItems.size(); i++) {
            String conditionPath = path + ".conditions[" + i + "]";
            conditions.add(readCondition(SegmentJson.asObject(conditionItems.get(i), conditionPath), conditionPath));
        }

        List<Container> children = new ArrayList<>();
        List<Object> childItems = SegmentJson.getList(map, "children");
        for (int i = 0; i < childItems.size(); i++) {
            String childPath = path + ".children[" + i + "]";
            children.add(readContainer(SegmentJson.asObject(childItems.get(i), childPath), childPath));
        }
        return new Container(scope, sign, combinator, conditions, children);
    }

    private static Condition readCondition(Map<String, Object> map, String path) {
        Operator operator = parse(map, "operator", path + ".operator", Operator::parse).orElse(null);
        String dataTypeKey = map.containsKey("data_type") ? "data_type" : "dataType";
        DataType dataType = parse(map, dataTypeKey, path + "." + dataTypeKey, DataType::fromId).orElse(null);
        Combinator combinator = parse(map, "combinator", path + ".combinator", Combinator::fromId).orElse(null);
        return new Condition(
                SegmentJson.getString(map, "field"),
                operator,
                SegmentJson.getString(map, "value"),
                SegmentJson.getString(map, "value2"),
                dataType,
                combinator,
                SegmentJson.getString(map, "name"));
    }

    /**
     * Absent or blank reads as empty; present but unrecognised is an error.
     */
    private static <T> Optional<T> parse(Map<String, Object> map, String key, String path,
            Function<String, Optional<T>> parser) {
        String text = SegmentJson.getString(map, key);
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<T> parsed = parser.apply(text);
        if (parsed.isEmpty()) {
            throw new SegmentJsonException("Unknown value '" + text + "' at " + path);
        }
        return parsed;
    }

    // ========== WRITING ==========

    public static String write(SegmentDefinition definition) {
        return SegmentJson.toPrettyJson(toMap(definition));
    }

    /**
     * The definition with export metadata: {@code exported_at}, {@code exported_by}
     * and {@code version}.
     */
    public static String export(SegmentDefinition definition, LocalDateTime exportedAt) {
        Map<String, Object> map = toMap(definition);
        map.put("exported_at", exportedAt.toString());
        map.put("exported_by", EXPORTED_BY);
        map.put("version", FORMAT_VERSION);
        return SegmentJson.toPrettyJson(map);
    }

    /**
     * File name for an export, e.g. {@code mobile_buyers_20240131_093000.json}.
     */
    public static String exportFileName(SegmentDefinition definition, LocalDateTime exportedAt) {
        String name = definition.name() == null || definition.name().isBlank() ? "segment" : definition.name();
        return name.toLowerCase(Locale.ROOT).replace(' ', '_') + "_" + FILE_TIMESTAMP.format(exportedAt) + ".json";
    }

    public static Map<String, Object> toMap(SegmentDefinition definition) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", definition.name());
        map.put("description", definition.description() == null ? "" : definition.description());
        map.put("container_type", definition.effectiveRootScope().id());
        map.put("logic", definition.effectiveCombinator().id());
        List<Object> containers = new ArrayList<>();
        for (Container container : definition.containers()) {
            containers.add(containerToMap(container));
        }
        map.put("containers", containers);
        return map;
    }

    private static Map<String, Object> containerToMap(Container container) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", container.effectiveScope().id());
        map.put("include", container.effectiveSign().isInclude());
        map.put("logic", container.effectiveCombinator().id());
        List<Object> conditions = new ArrayList<>();
        for (Condition condition : container.conditions()) {
            conditions.add(conditionToMap(condition));
        }
        map.put("conditions", conditions);
        List<Object> children = new ArrayList<>();
        for (Container child : container.children()) {
            children.add(containerToMap(child));
        }
        map.put("children", children);
        return map;
    }

    private static Map<String, Object> conditionToMap(Condition condition) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("field", condition.field());
        if (condition.displayName() != null) {
            map.put("name", condition.displayName());
        }
        map.put("operator", condition.operator() == null ? null : condition.operator().id());
        map.put("value", condition.value());
        if (condition.secondValue() != null) {
            map.put("value2", condition.secondValue());
        }
        if (condition.dataType() != null) {
            map.put("data_type", condition.dataType().id());
        }
        if (condition.combinator() != null) {
            map.put("combinator", condition.combinator().id());
        }
        return map;
    }
}
