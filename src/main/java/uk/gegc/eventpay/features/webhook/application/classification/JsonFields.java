package uk.gegc.eventpay.features.webhook.application.classification;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Null-tolerant accessors over provider JSON. Missing and JSON-null fields read as {@code null}.
 */
final class JsonFields {

    private JsonFields() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    /** Follows a path of object fields, e.g. {@code at(resource, "amount", "value")}. */
    static String at(JsonNode node, String... path) {
        JsonNode current = node;
        for (int i = 0; i < path.length - 1; i++) {
            if (current == null) {
                return null;
            }
            current = current.get(path[i]);
        }
        return text(current, path[path.length - 1]);
    }

    static long longVal(JsonNode node, String field) {
        if (node == null) {
            return 0L;
        }
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? 0L : value.asLong(0L);
    }

    static Integer intOrNull(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asInt();
    }

    static boolean bool(JsonNode node, String field) {
        return node != null && node.path(field).asBoolean(false);
    }

    static JsonNode first(JsonNode array) {
        if (array == null || !array.isArray() || array.isEmpty()) {
            return null;
        }
        return array.get(0);
    }

    /** Flattens a JSON object's scalar fields into strings; nested objects, nulls and blanks are skipped. */
    static Map<String, String> toStringMap(JsonNode object) {
        Map<String, String> result = new LinkedHashMap<>();
        if (object == null || !object.isObject()) {
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                result.put(field.getKey(), value.asText());
            }
        }
        return result;
    }
}
