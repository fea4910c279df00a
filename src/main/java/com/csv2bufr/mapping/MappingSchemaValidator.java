package com.csv2bufr.mapping;

import com.csv2bufr.exception.MappingSchemaException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Set;

/**
 * Validates a mapping document before any row is processed.
 *
 * Rules are applied top down and the first failure wins:
 * <ol>
 *   <li>the document matches {@code schema/mapping-document.schema.json} and every delayed replication
 *       factor fits a non-negative int;</li>
 *   <li>each {@code sequence} element matches {@code schema/mapping-element.schema.json};</li>
 *   <li>{@code scale} and {@code offset} are either both set or both null/absent.</li>
 * </ol>
 * Unknown properties are tolerated at both levels.
 */
public class MappingSchemaValidator {
    private static final Logger log = LoggerFactory.getLogger(MappingSchemaValidator.class);

    static final String DOCUMENT_SCHEMA = "schema/mapping-document.schema.json";
    static final String ELEMENT_SCHEMA = "schema/mapping-element.schema.json";

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);

    private final JsonSchema documentSchema;
    private final JsonSchema elementSchema;

    public MappingSchemaValidator() {
        ObjectMapper mapper = new ObjectMapper();
        this.documentSchema = SCHEMA_FACTORY.getSchema(readResource(mapper, DOCUMENT_SCHEMA));
        this.elementSchema = SCHEMA_FACTORY.getSchema(readResource(mapper, ELEMENT_SCHEMA));
    }

    /**
     * @throws MappingSchemaException describing the first rule the document breaks
     */
    public void validate(JsonNode document) {
        if (document == null || !document.isObject()) {
            fail(null, "$", "mapping document must be a JSON object");
        }

        Set<ValidationMessage> documentErrors = documentSchema.validate(document);
        if (!documentErrors.isEmpty()) {
            ValidationMessage first = documentErrors.iterator().next();
            fail(null, first.getPath(), first.getMessage());
        }

        checkReplicationFactors(document.get("inputDelayedDescriptorReplicationFactor"));

        JsonNode sequence = document.get("sequence");
        for (int i = 0; i < sequence.size(); i++) {
            JsonNode element = sequence.get(i);
            String elementPath = "$.sequence[" + i + "]";
            String key = keyOf(element, i);

            Set<ValidationMessage> elementErrors = elementSchema.validate(element);
            if (!elementErrors.isEmpty()) {
                ValidationMessage first = elementErrors.iterator().next();
                fail(key, elementPath + first.getPath().substring(1), first.getMessage());
            }

            boolean scaleMissing = isNull(element, "scale");
            boolean offsetMissing = isNull(element, "offset");
            if (scaleMissing != offsetMissing) {
                fail(key, elementPath + (scaleMissing ? ".scale" : ".offset"),
                        "scale and offset should either both be present or both set to missing for "
                                + key + " in mapping file");
            }
        }
        log.debug("mapping dictionary validated ({} elements)", sequence.size());
    }

    private static void checkReplicationFactors(JsonNode factors) {
        if (factors == null || factors.isNull()) {
            return;
        }
        for (int i = 0; i < factors.size(); i++) {
            JsonNode factor = factors.get(i);
            if (!factor.canConvertToInt() || factor.intValue() < 0) {
                fail(null, "$.inputDelayedDescriptorReplicationFactor[" + i + "]",
                        "delayed replication factor must be a non-negative int but was " + factor.asText());
            }
        }
    }

    private static boolean isNull(JsonNode element, String property) {
        JsonNode node = element.get(property);
        return node == null || node.isNull();
    }

    private static String keyOf(JsonNode element, int index) {
        if (element != null && element.hasNonNull("key") && element.get("key").isTextual()) {
            return element.get("key").textValue();
        }
        return "sequence element #" + index;
    }

    private static void fail(String key, String path, String message) {
        MappingSchemaException e = new MappingSchemaException(key, path, message);
        log.error(e.getMessage());
        throw e;
    }

    private static JsonNode readResource(ObjectMapper mapper, String resource) {
        try (InputStream in = MappingSchemaValidator.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found on classpath: " + resource);
            }
            return mapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read schema resource " + resource, e);
        }
    }
}
