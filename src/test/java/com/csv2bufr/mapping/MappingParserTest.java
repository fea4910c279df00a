package com.csv2bufr.mapping;

import com.csv2bufr.exception.MappingSchemaException;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.ValueKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MappingParser.
 */
class MappingParserTest {

    private final MappingParser parser = new MappingParser();

    @TempDir
    Path tempDir;

    @Test
    void testParseLiteralAndColumnFields() {
        MappingSpec spec = parser.parse("""
                {"sequence": [
                  {"key": "edition", "value": 4},
                  {"key": "airTemperature", "column": "temp", "valid-min": -50, "valid-max": 60,
                   "scale": 0, "offset": 273.15}
                ]}
                """);

        assertThat(spec.size()).isEqualTo(2);
        assertThat(spec.hasDelayedReplication()).isFalse();

        FieldMapping edition = spec.getSequence().get(0);
        assertThat(edition.getKey()).isEqualTo("edition");
        assertThat(edition.getSource().isLiteral()).isTrue();
        assertThat(edition.getSource().getLiteral()).isEqualTo(FieldValue.of(4L));

        FieldMapping temperature = spec.getSequence().get(1);
        assertThat(temperature.getSource().isColumn()).isTrue();
        assertThat(temperature.getSource().getColumn()).isEqualTo("temp");
        assertThat(temperature.getValidMin()).isEqualTo(-50.0);
        assertThat(temperature.getValidMax()).isEqualTo(60.0);
        assertThat(temperature.hasScaling()).isTrue();
        assertThat(temperature.getOffset()).isEqualTo(273.15);
    }

    @Test
    void testLiteralTakesPrecedenceOverColumn() {
        MappingSpec spec = parser.parse("""
                {"sequence": [{"key": "stationName", "value": "Fixed", "column": "name"}]}
                """);

        FieldSource source = spec.getSequence().get(0).getSource();
        assertThat(source.getType()).isEqualTo(FieldSource.SourceType.LITERAL);
        assertThat(source.getLiteral()).isEqualTo(FieldValue.of("Fixed"));
    }

    @Test
    void testNullValueFallsBackToColumn() {
        MappingSpec spec = parser.parse("""
                {"sequence": [{"key": "stationName", "value": null, "column": "name"}]}
                """);

        assertThat(spec.getSequence().get(0).getSource().getColumn()).isEqualTo("name");
    }

    @Test
    void testNeitherValueNorColumnIsUnset() {
        MappingSpec spec = parser.parse("{\"sequence\": [{\"key\": \"stationName\"}]}");

        assertThat(spec.getSequence().get(0).getSource().getType()).isEqualTo(FieldSource.SourceType.UNSET);
    }

    @Test
    void testLiteralTypes() {
        MappingSpec spec = parser.parse("""
                {"sequence": [
                  {"key": "a", "value": 1.5},
                  {"key": "b", "value": [1, 2, null]},
                  {"key": "c", "value": true}
                ]}
                """);

        assertThat(spec.getSequence().get(0).getSource().getLiteral().getKind()).isEqualTo(ValueKind.FLOAT);
        FieldValue array = spec.getSequence().get(1).getSource().getLiteral();
        assertThat(array.getKind()).isEqualTo(ValueKind.SEQUENCE);
        assertThat(spec.getSequence().get(2).getSource().getLiteral()).isEqualTo(FieldValue.of(1L));
    }

    @Test
    void testReplicationFactorsArePreserved() {
        MappingSpec spec = parser.parse("""
                {"inputDelayedDescriptorReplicationFactor": [2, 3],
                 "sequence": [{"key": "edition", "value": 4}]}
                """);

        assertThat(spec.hasDelayedReplication()).isTrue();
        assertThat(spec.getDelayedReplicationFactors()).containsExactly(2, 3);
    }

    @Test
    void testRepeatedKeysKeepOrder() {
        MappingSpec spec = parser.parse("""
                {"sequence": [
                  {"key": "#1#timePeriod", "value": -10},
                  {"key": "#2#timePeriod", "value": -60},
                  {"key": "#1#timePeriod", "value": -10}
                ]}
                """);

        assertThat(spec.getSequence()).extracting(FieldMapping::getKey)
                .containsExactly("#1#timePeriod", "#2#timePeriod", "#1#timePeriod");
    }

    @Test
    void testInvalidJsonIsSchemaError() {
        assertThatThrownBy(() -> parser.parse("{\"sequence\": ["))
                .isInstanceOf(MappingSchemaException.class)
                .hasMessageContaining("not valid JSON");
    }

    @Test
    void testInvalidMappingIsRejectedBeforeConversion() {
        assertThatThrownBy(() -> parser.parse("{\"sequence\": [{\"key\": \"x\", \"column\": \"c\", \"offset\": 1}]}"))
                .isInstanceOf(MappingSchemaException.class);
    }

    @Test
    void testParseFromFile() throws IOException {
        Path file = tempDir.resolve("mapping.json");
        Files.writeString(file, "{\"sequence\": [{\"key\": \"edition\", \"value\": 4}]}");

        MappingSpec spec = parser.parse(file);

        assertThat(spec.size()).isEqualTo(1);
    }
}
