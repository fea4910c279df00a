package com.csv2bufr.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for JsonFieldValues.
 */
class JsonFieldValuesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testScalarLiterals() throws Exception {
        assertThat(JsonFieldValues.fromJson(mapper.readTree("4"))).isEqualTo(FieldValue.of(4L));
        assertThat(JsonFieldValues.fromJson(mapper.readTree("4.25"))).isEqualTo(FieldValue.of(4.25));
        assertThat(JsonFieldValues.fromJson(mapper.readTree("\"abc\""))).isEqualTo(FieldValue.of("abc"));
        assertThat(JsonFieldValues.fromJson(mapper.readTree("null")).isMissing()).isTrue();
        assertThat(JsonFieldValues.fromJson(null).isMissing()).isTrue();
    }

    @Test
    void testBooleansBecomeIntegers() throws Exception {
        assertThat(JsonFieldValues.fromJson(mapper.readTree("true"))).isEqualTo(FieldValue.of(1L));
        assertThat(JsonFieldValues.fromJson(mapper.readTree("false"))).isEqualTo(FieldValue.of(0L));
    }

    @Test
    void testArrayBecomesSequence() throws Exception {
        FieldValue value = JsonFieldValues.fromJson(mapper.readTree("[1, 2.5, null]"));

        assertThat(value.getKind()).isEqualTo(ValueKind.SEQUENCE);
        assertThat(((SequenceValue) value).getElements())
                .containsExactly(FieldValue.of(1L), FieldValue.of(2.5), FieldValue.missing());
    }

    @Test
    void testObjectKeepsJsonText() throws Exception {
        FieldValue value = JsonFieldValues.fromJson(mapper.readTree("{\"a\": 1}"));

        assertThat(value.getKind()).isEqualTo(ValueKind.STRING);
        assertThat(value.asText()).isEqualTo("{\"a\":1}");
    }

    @Test
    void testHugeIntegerFallsBackToFloat() throws Exception {
        FieldValue value = JsonFieldValues.fromJson(mapper.readTree("123456789012345678901234567890"));

        assertThat(value.getKind()).isEqualTo(ValueKind.FLOAT);
    }
}
