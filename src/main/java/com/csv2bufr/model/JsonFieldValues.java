package com.csv2bufr.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts JSON literals (mapping {@code value} entries, station metadata) into {@link FieldValue}s.
 */
public final class JsonFieldValues {

    private JsonFieldValues() {
        // Utility class
    }

    public static FieldValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return FieldValue.missing();
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                return FieldValue.of(node.asDouble());
            }
            return FieldValue.of(node.longValue());
        }
        if (node.isNumber()) {
            return FieldValue.of(node.doubleValue());
        }
        if (node.isBoolean()) {
            return FieldValue.of(node.booleanValue() ? 1L : 0L);
        }
        if (node.isTextual()) {
            return FieldValue.of(node.textValue());
        }
        if (node.isArray()) {
            List<FieldValue> elements = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                elements.add(fromJson(element));
            }
            return FieldValue.sequence(elements);
        }
        // objects have no encoder representation; keep their JSON text
        return FieldValue.of(node.toString());
    }
}
