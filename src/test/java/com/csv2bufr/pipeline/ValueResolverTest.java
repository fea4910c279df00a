package com.csv2bufr.pipeline;

import com.csv2bufr.exception.MissingColumnException;
import com.csv2bufr.mapping.FieldMapping;
import com.csv2bufr.mapping.FieldSource;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.Row;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ValueResolver.
 */
class ValueResolverTest {

    private final ValueResolver resolver = new ValueResolver();
    private final TransformDiagnostics diagnostics = TransformDiagnostics.detached();

    @Test
    void testLiteralIgnoresRow() {
        FieldMapping field = FieldMapping.builder().key("edition").source(FieldSource.literal(FieldValue.of(4L)))
                .build();
        Row row = new Row(2);

        assertThat(resolver.resolve(field, row, diagnostics)).isEqualTo(FieldValue.of(4L));
        assertThat(row.size()).isZero();
    }

    @Test
    void testColumnValue() {
        FieldMapping field = column("airTemperature", "temp");
        Row row = new Row(2);
        row.put("temp", FieldValue.of(10L));

        assertThat(resolver.resolve(field, row, diagnostics)).isEqualTo(FieldValue.of(10L));
    }

    @ParameterizedTest
    @ValueSource(strings = { "NA", "NaN", "NAN", "None" })
    void testMissingSentinelsResolveToMissing(String sentinel) {
        Row row = new Row(2);
        row.put("temp", FieldValue.of(sentinel));

        assertThat(resolver.resolve(column("airTemperature", "temp"), row, diagnostics).isMissing()).isTrue();
    }

    @Test
    void testOtherStringsAreKept() {
        Row row = new Row(2);
        row.put("name", FieldValue.of("nan"));

        assertThat(resolver.resolve(column("stationName", "name"), row, diagnostics))
                .isEqualTo(FieldValue.of("nan"));
    }

    @Test
    void testFloatNaNIsMissing() {
        Row row = new Row(2);
        row.put("temp", FieldValue.of(Double.NaN));

        assertThat(resolver.resolve(column("airTemperature", "temp"), row, diagnostics).isMissing()).isTrue();
    }

    @Test
    void testMissingColumnThrows() {
        Row row = new Row(7);
        row.put("temp", FieldValue.of(10L));

        assertThatThrownBy(() -> resolver.resolve(column("pressure", "press"), row, diagnostics))
                .isInstanceOfSatisfying(MissingColumnException.class, e -> {
                    assertThat(e.getColumn()).isEqualTo("press");
                    assertThat(e.getElementKey()).isEqualTo("pressure");
                });
    }

    @Test
    void testUnsetIsMissing() {
        FieldMapping field = FieldMapping.builder().key("stationName").build();

        assertThat(resolver.resolve(field, new Row(2), diagnostics).isMissing()).isTrue();
    }

    private static FieldMapping column(String key, String column) {
        return FieldMapping.builder().key(key).source(FieldSource.column(column)).build();
    }
}
