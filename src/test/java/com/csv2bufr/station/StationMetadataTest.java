package com.csv2bufr.station;

import com.csv2bufr.exception.StationMergeException;
import com.csv2bufr.model.FieldValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StationMetadata and StationMetadataParser.
 */
class StationMetadataTest {

    private final StationMetadataParser parser = new StationMetadataParser();

    @TempDir
    Path tempDir;

    @Test
    void testDataEntriesKeepDocumentOrder() throws IOException {
        StationMetadata station = parser.parse("""
                {"name": "Test station", "wigosIds": [{"wid": "0-20000-0-ABCDEF"}],
                 "data": {"station_name": "Test", "height": 12.5, "block": 1}}
                """);

        assertThat(station.getName()).isEqualTo("Test station");
        assertThat(station.getData()).containsExactly(
                entry("station_name", FieldValue.of("Test")),
                entry("height", FieldValue.of(12.5)),
                entry("block", FieldValue.of(1L)));
    }

    @Test
    void testMissingDataObjectFailsOnAccess() throws IOException {
        StationMetadata station = parser.parse("{\"name\": \"x\"}");

        assertThatThrownBy(station::getData)
                .isInstanceOf(StationMergeException.class)
                .hasMessageContaining("'data'");
    }

    @Test
    void testNonObjectDataIsRejected() throws IOException {
        StationMetadata station = parser.parse("{\"data\": [1, 2]}");

        assertThatThrownBy(station::getData).isInstanceOf(StationMergeException.class);
    }

    @Test
    void testNonObjectDocumentIsRejected() throws IOException {
        StationMetadata station = parser.parse("\"just text\"");

        assertThatThrownBy(station::getData).isInstanceOf(StationMergeException.class);
    }

    @Test
    void testResolveAndParseFromConfigDirectory() throws IOException {
        Path file = StationMetadataParser.resolve(tempDir, "0-20000-0-ABCDEF");
        Files.writeString(file, "{\"data\": {\"wsi_local\": \"ABCDEF\"}}");

        StationMetadata station = parser.parse(file);

        assertThat(file.getFileName().toString()).isEqualTo("0-20000-0-ABCDEF.json");
        assertThat(station.getData()).containsEntry("wsi_local", FieldValue.of("ABCDEF"));
    }

    @Test
    void testEmptyMetadata() {
        assertThat(StationMetadata.empty().getData()).isEmpty();
    }
}
