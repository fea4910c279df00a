package com.csv2bufr.station;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads station metadata documents, typically {@code <config-dir>/<wigos-id>.json}.
 */
public class StationMetadataParser {
    private static final Logger log = LoggerFactory.getLogger(StationMetadataParser.class);

    private final ObjectMapper objectMapper;

    public StationMetadataParser() {
        this(new ObjectMapper());
    }

    public StationMetadataParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public StationMetadata parse(Path file) throws IOException {
        JsonNode document = objectMapper.readTree(Files.readString(file));
        StationMetadata metadata = new StationMetadata(document);
        log.debug("Loaded station metadata from {} ({})", file,
                metadata.getName() != null ? metadata.getName() : "unnamed");
        return metadata;
    }

    public StationMetadata parse(String json) throws IOException {
        return new StationMetadata(objectMapper.readTree(json));
    }

    /**
     * Station metadata file for a WIGOS station identifier inside a configuration directory.
     */
    public static Path resolve(Path configDir, String wigosId) {
        return configDir.resolve(wigosId + ".json");
    }
}
