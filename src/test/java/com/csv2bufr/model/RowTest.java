package com.csv2bufr.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Row and FieldValue basics.
 */
class RowTest {

    @Test
    void testOfZipsColumnsAndCells() {
        Row row = Row.of(2, List.of("a", "b"), List.of(FieldValue.of(1L), FieldValue.of("x")));

        assertThat(row.getLineNumber()).isEqualTo(2);
        assertThat(row.asMap()).containsOnlyKeys("a", "b");
        assertThat(row.get("b")).isEqualTo(FieldValue.of("x"));
    }

    @Test
    void testAbsentColumnReadsAsMissing() {
        Row row = new Row(1);

        assertThat(row.contains("x")).isFalse();
        assertThat(row.get("x").isMissing()).isTrue();
    }

    @Test
    void testPutAllOverridesExistingEntries() {
        Row row = Row.of(2, List.of("name", "temp"), List.of(FieldValue.of("csv"), FieldValue.of(10L)));

        row.putAll(Map.of("name", FieldValue.of("station"), "height", FieldValue.of(12.5)));

        assertThat(row.get("name")).isEqualTo(FieldValue.of("station"));
        assertThat(row.get("temp")).isEqualTo(FieldValue.of(10L));
        assertThat(row.size()).isEqualTo(3);
    }

    @Test
    void testMismatchedSizesAreRejected() {
        assertThatThrownBy(() -> Row.of(2, List.of("a"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testMissingValueText() {
        assertThat(FieldValue.missing().asText()).isEqualTo("None");
        assertThat(FieldValue.of((String) null).isMissing()).isTrue();
    }

    @Test
    void testNonNumericHasNoDouble() {
        assertThatThrownBy(() -> FieldValue.of("abc").asDouble()).isInstanceOf(IllegalStateException.class);
    }
}
