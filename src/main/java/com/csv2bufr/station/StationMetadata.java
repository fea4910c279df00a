package com.csv2bufr.station;

import com.csv2bufr.exception.StationMergeException;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.JsonFieldValues;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static per-station values merged into every row before field resolution.
 *
 * The document is kept as received; its {@code data} object is only checked when a row is merged,
 * so a bad document fails row processing with a {@link StationMergeException}.
 */
public class StationMetadata {

    private final JsonNode document;
    private volatile Map<String, FieldValue> data;

    public StationMetadata(JsonNode document) {
        this.document = document != null ? document : JsonNodeFactory.instance.nullNode();
    }

    public static StationMetadata empty() {
        return of(Map.of());
    }

    public static StationMetadata of(Map<String, FieldValue> data) {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.putObject("data");
        StationMetadata metadata = new StationMetadata(document);
        metadata.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        return metadata;
    }

    /**
     * The {@code data} entries in document order.
     *
     * @throws StationMergeException if the document has no {@code data} object
     */
    public Map<String, FieldValue> getData() {
        Map<String, FieldValue> result = data;
        if (result == null) {
            result = convert();
            data = result;
        }
        return result;
    }

    /**
     * Optional human readable station name, for log output.
     */
    public String getName() {
        JsonNode name = document.path("name");
        return name.isTextual() ? name.textValue() : null;
    }

    public JsonNode getDocument() {
        return document;
    }

    private Map<String, FieldValue> convert() {
        if (!document.isObject()) {
            throw new StationMergeException("station metadata must be a JSON object but was "
                    + document.getNodeType());
        }
        JsonNode dataNode = document.get("data");
        if (dataNode == null || !dataNode.isObject()) {
            throw new StationMergeException("station metadata has no 'data' object");
        }
        Map<String, FieldValue> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = dataNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            values.put(entry.getKey(), JsonFieldValues.fromJson(entry.getValue()));
        }
        return Collections.unmodifiableMap(values);
    }
}
