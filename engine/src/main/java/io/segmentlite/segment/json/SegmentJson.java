package io.segmentlite.segment.json;

import java.util.*;

/**
 * Zero-dependency JSON parser and writer for segment definitions and the field catalog.
 *
 * Objects parse to insertion-ordered Maps, arrays to Lists, integral numbers to Long and
 * other numbers to Double. No reflection.
 */
public final class SegmentJson {

    private SegmentJson() {
    }

    // ========== PARSING ==========

    /**
     * Parse a JSON document into a Map (for objects) or List (for arrays) or a scalar.
     *
     * @throws SegmentJsonException if the text is empty or malformed
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new SegmentJsonException("Empty JSON document");
        }
        Parser parser = new Parser(json);
        Object value = parser.parseValue();
        parser.expectEnd();
        return value;
    }

    /**
     * Parse JSON whose top level must be an object.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> parseObject(String json) {
        Object result = parse(json);
        if (!(result instanceof Map)) {
            throw new SegmentJsonException("Expected a JSON object at the top level");
        }
        return (Map<String, Object>) result;
    }

    // ========== SERIALIZATION ==========

    /**
     * Serialize an object to compact JSON.
     */
    public static String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value, -1, 0);
        return sb.toString();
    }

    /**
     * Serialize an object to JSON indented by two spaces per level.
     */
    public static String toPrettyJson(Object value) {
        StringBuilder sb = new StringBuilder();
        writeValue(sb, value, 2, 0);
        return sb.toString();
    }

    @SuppressWarnings("unchecked")
    private static void writeValue(StringBuilder sb, Object value, int indent, int depth) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof Boolean b) {
            sb.append(b ? "true" : "false");
        } else if (value instanceof Map<?, ?> m) {
            writeObject(sb, (Map<String, Object>) m, indent, depth);
        } else if (value instanceof List<?> l) {
            writeArray(sb, l, indent, depth);
        } else {
            writeString(sb, value.toString());
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }

    private static void writeObject(StringBuilder sb, Map<String, Object> map, int indent, int depth) {
        if (map.isEmpty()) {
            sb.append("{}");
            return;
        }
        sb.append('{');
        boolean first = true;
        for (var entry : map.entrySet()) {
            if (!first)
                sb.append(',');
            first = false;
            newline(sb, indent, depth + 1);
            writeString(sb, entry.getKey());
            sb.append(indent < 0 ? ":" : ": ");
            writeValue(sb, entry.getValue(), indent, depth + 1);
        }
        newline(sb, indent, depth);
        sb.append('}');
    }

    private static void writeArray(StringBuilder sb, List<?> list, int indent, int depth) {
        if (list.isEmpty()) {
            sb.append("[]");
            return;
        }
        sb.append('[');
        boolean first = true;
        for (Object item : list) {
            if (!first)
                sb.append(',');
            first = false;
            newline(sb, indent, depth + 1);
            writeValue(sb, item, indent, depth + 1);
        }
        newline(sb, indent, depth);
        sb.append(']');
    }

    private static void newline(StringBuilder sb, int indent, int depth) {
        if (indent < 0) {
            return;
        }
        sb.append('\n');
        sb.append(" ".repeat(indent * depth));
    }

    // ========== PARSER IMPLEMENTATION ==========

    private static class Parser {
        private final String json;
        private int pos = 0;

        Parser(String json) {
            this.json = json;
        }

        Object parseValue() {
            skipWhitespace();
            if (pos >= json.length())
                throw new SegmentJsonException("Unexpected end of input", pos);

            char c = json.charAt(pos);
            return switch (c) {
                case '{' -> parseObject();
                case '[' -> parseArray();
                case '"' -> parseString();
                case 't', 'f' -> parseBoolean();
                case 'n' -> parseNull();
                default -> parseNumber();
            };
        }

        void expectEnd() {
            skipWhitespace();
            if (pos < json.length()) {
                throw new SegmentJsonException("Unexpected trailing content", pos);
            }
        }

        private Map<String, Object> parseObject() {
            Map<String, Object> map = new LinkedHashMap<>();
            pos++; // skip '{'
            skipWhitespace();

            if (pos < json.length() && json.charAt(pos) == '}') {
                pos++;
                return map;
            }

            while (true) {
                skipWhitespace();
                if (pos >= json.length() || json.charAt(pos) != '"') {
                    throw new SegmentJsonException("Expected a property name", pos);
                }
                String key = parseString();
                skipWhitespace();
                expect(':');
                Object value = parseValue();
                map.put(key, value);
                skipWhitespace();

                if (pos >= json.length())
                    throw new SegmentJsonException("Unterminated object", pos);
                char c = json.charAt(pos++);
                if (c == '}') {
                    return map;
                } else if (c != ',') {
                    throw new SegmentJsonException("Expected ',' or '}'", pos - 1);
                }
            }
        }

        private List<Object> parseArray() {
            List<Object> list = new ArrayList<>();
            pos++; // skip '['
            skipWhitespace();

            if (pos < json.length() && json.charAt(pos) == ']') {
                pos++;
                return list;
            }

            while (true) {
                list.add(parseValue());
                skipWhitespace();

                if (pos >= json.length())
                    throw new SegmentJsonException("Unterminated array", pos);
                char c = json.charAt(pos++);
                if (c == ']') {
                    return list;
                } else if (c != ',') {
                    throw new SegmentJsonException("Expected ',' or ']'", pos - 1);
                }
            }
        }

        private String parseString() {
            int start = pos;
            pos++; // skip opening quote
            StringBuilder sb = new StringBuilder();
            while (pos < json.length()) {
                char c = json.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                } else if (c == '\\' && pos < json.length()) {
                    char escaped = json.charAt(pos++);
                    switch (escaped) {
                        case '"' -> sb.append('"');
                        case '\\' -> sb.append('\\');
                        case '/' -> sb.append('/');
                        case 'b' -> sb.append('\b');
                        case 'f' -> sb.append('\f');
                        case 'n' -> sb.append('\n');
                        case 'r' -> sb.append('\r');
                        case 't' -> sb.append('\t');
                        case 'u' -> sb.append(parseUnicodeEscape());
                        default -> throw new SegmentJsonException("Invalid escape '\\" + escaped + "'", pos - 2);
                    }
                } else {
                    sb.append(c);
                }
            }
            throw new SegmentJsonException("Unterminated string", start);
        }

        private char parseUnicodeEscape() {
            if (pos + 4 > json.length()) {
                throw new SegmentJsonException("Truncated unicode escape", pos);
            }
            String hex = json.substring(pos, pos + 4);
            try {
                char c = (char) Integer.parseInt(hex, 16);
                pos += 4;
                return c;
            } catch (NumberFormatException e) {
                throw new SegmentJsonException("Invalid unicode escape '" + hex + "'", pos);
            }
        }

        private Number parseNumber() {
            int start = pos;
            if (pos < json.length() && json.charAt(pos) == '-')
                pos++;
            while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                pos++;

            boolean isFloat = false;
            if (pos < json.length() && json.charAt(pos) == '.') {
                isFloat = true;
                pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }
            if (pos < json.length() && (json.charAt(pos) == 'e' || json.charAt(pos) == 'E')) {
                isFloat = true;
                pos++;
                if (pos < json.length() && (json.charAt(pos) == '+' || json.charAt(pos) == '-'))
                    pos++;
                while (pos < json.length() && Character.isDigit(json.charAt(pos)))
                    pos++;
            }

            String num = json.substring(start, pos);
            try {
                return isFloat ? Double.parseDouble(num) : Long.parseLong(num);
            } catch (NumberFormatException e) {
                throw new SegmentJsonException("Invalid value '" + (num.isEmpty() ? json.charAt(start) : num) + "'", start);
            }
        }

        private Boolean parseBoolean() {
            if (json.startsWith("true", pos)) {
                pos += 4;
                return true;
            } else if (json.startsWith("false", pos)) {
                pos += 5;
                return false;
            }
            throw new SegmentJsonException("Invalid boolean", pos);
        }

        private Object parseNull() {
            if (json.startsWith("null", pos)) {
                pos += 4;
                return null;
            }
            throw new SegmentJsonException("Invalid null", pos);
        }

        private void skipWhitespace() {
            while (pos < json.length() && Character.isWhitespace(json.charAt(pos))) {
                pos++;
            }
        }

        private void expect(char expected) {
            if (pos < json.length() && json.charAt(pos) == expected) {
                pos++;
            } else {
                throw new SegmentJsonException("Expected '" + expected + "'", pos);
            }
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Get a string value from a map. Numbers and booleans are rendered as text,
     * since the builder stores values either way.
     */
    public static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Long || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Double d) {
            // 500.0 was typed as 500
            return d == Math.rint(d) && !Double.isInfinite(d) ? String.valueOf(d.longValue()) : d.toString();
        }
        return null;
    }

    /**
     * Get a boolean value from a map, or the default when absent.
     *
     * @throws SegmentJsonException if the value is present but not a boolean
     */
    public static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        throw new SegmentJsonException("'" + key + "' must be true or false, got " + value);
    }

    /**
     * Get a nested object from a map.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getObject(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    /**
     * Get a list from a map; absent reads as empty.
     *
     * @throws SegmentJsonException if the value is present but not an array
     */
    @SuppressWarnings("unchecked")
    public static List<Object> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List) {
            return (List<Object>) value;
        }
        throw new SegmentJsonException("'" + key + "' must be an array");
    }

    /**
     * Casts a list element that must be an object.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> asObject(Object value, String path) {
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        throw new SegmentJsonException(path + " must be an object");
    }
}
