package com.csv2bufr.mapping;

import com.csv2bufr.exception.MappingSchemaException;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.JsonFieldValues;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser for JSON mapping documents.
 *
 * Format:
 * <pre>
 * {
 *   "inputDelayedDescriptorReplicationFactor": [2, 3],
 *   "sequence": [
 *     {"key": "edition", "value": 4},
 *     {"key": "airTemperature", "column": "temp", "valid-min": 193.15, "valid-max": 333.15,
 *      "scale": 0, "offset": 273.15}
 *   ]
 * }
 * </pre>
 * Every document is validated with {@link MappingSchemaValidator} before it is converted, so a
 * {@link MappingSpec} returned from here always satisfies the schema rules.
 */
public class MappingParser {
    private static final Logger log = LoggerFactory.getLogger(MappingParser.class);

    static final String REPLICATION_KEY = "inputDelayedDescriptorReplicationFactor";

    private final ObjectMapper objectMapper;
    private final MappingSchemaValidator validator;

    public MappingParser() {
        this(new ObjectMapper(), new MappingSchemaValidator());
    }

    public MappingParser(ObjectMapper objectMapper, MappingSchemaValidator validator) {
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    public MappingSpec parse(Path mappingFile) throws IOException {
        return parse(objectMapper.readTree(Files.readString(mappingFile)));
    }

    public MappingSpec parse(String json) {
        try {
            return parse(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new MappingSchemaException(null, "$", "mapping document is not valid JSON: " + e.getOriginalMessage());
        }
    }

    public MappingSpec parse(JsonNode document) {
        validator.validate(document);

        MappingSpec.MappingSpecBuilder builder = MappingSpec.builder()
                .delayedReplicationFactors(parseReplicationFactors(document.get(REPLICATION_KEY)));

        for (JsonNode element : document.get("sequence")) {
            FieldMapping field = parseElement(element);
            builder.field(field);
            log.debug("Parsed mapping: {} <- {}", field.getKey(), field.getSource());
        }
        return builder.build();
    }

    private FieldMapping parseElement(JsonNode element) {
        return FieldMapping.builder()
                .key(element.get("key").textValue())
                .source(parseSource(element))
                .validMin(optionalNumber(element, "valid-min"))
                .validMax(optionalNumber(element, "valid-max"))
                .scale(optionalNumber(element, "scale"))
                .offset(optionalNumber(element, "offset"))
                .build();
    }

    /**
     * A non-null {@code value} wins over {@code column}; neither means the field stays missing.
     */
    private FieldSource parseSource(JsonNode element) {
        JsonNode value = element.get("value");
        if (value != null && !value.isNull()) {
            FieldValue literal = JsonFieldValues.fromJson(value);
            return FieldSource.literal(literal);
        }
        JsonNode column = element.get("column");
        if (column != null && !column.isNull()) {
            return FieldSource.column(column.textValue());
        }
        return FieldSource.unset();
    }

    private static List<Integer> parseReplicationFactors(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        List<Integer> factors = new ArrayList<>(node.size());
        for (JsonNode factor : node) {
            factors.add(factor.intValue());
        }
        return List.copyOf(factors);
    }

    private static Double optionalNumber(JsonNode element, String property) {
        JsonNode node = element.get(property);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.doubleValue();
    }
}
