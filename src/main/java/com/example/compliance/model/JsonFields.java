package com.example.compliance.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lenient field readers shared by the entity deserializers.
 * Wrongly typed values degrade to empty instead of failing the request.
 */
final class JsonFields {

    private JsonFields() {
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : "";
    }

    static Long id(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isIntegralNumber()) return value.asLong();
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /** Array of scalars as strings; anything that is not an array yields an empty list. */
    static List<String> textList(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isArray()) return List.of();
        List<String> items = new ArrayList<>();
        for (JsonNode element : value) {
            if (element.isValueNode() && !element.isNull()) {
                items.add(element.asText());
            }
        }
        return items;
    }

    static Map<String, Object> object(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) return Map.of();
        Map<String, Object> result = new LinkedHashMap<>();
        value.fields().forEachRemaining(e -> {
            JsonNode v = e.getValue();
            if (!v.isNull()) {
                result.put(e.getKey(), v.isValueNode() ? v.asText() : v.toString());
            }
        });
        return result;
    }

    /** Request bodies may carry {@code null} array entries; they are dropped. */
    static <T> List<T> nonNullElements(List<T> items) {
        return items != null ? items.stream().filter(Objects::nonNull).toList() : List.of();
    }
}
