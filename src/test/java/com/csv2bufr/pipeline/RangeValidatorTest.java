package com.csv2bufr.pipeline;

import com.csv2bufr.exception.ValueRangeException;
import com.csv2bufr.model.FieldValue;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RangeValidator.
 */
class RangeValidatorTest {

    private final RangeValidator validator = new RangeValidator();

    @Test
    void testInRangeValueIsKept() {
        TransformDiagnostics diagnostics = TransformDiagnostics.detached();

        FieldValue result = validator.validate("rh", FieldValue.of(50L), 0.0, 100.0, true, diagnostics);

        assertThat(result).isEqualTo(FieldValue.of(50L));
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testAboveMaxIsNullifiedWithWarning() {
        TransformDiagnostics diagnostics = TransformDiagnostics.detached();

        FieldValue result = validator.validate("rh", FieldValue.of(150L), 0.0, 100.0, true, diagnostics);

        assertThat(result.isMissing()).isTrue();
        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0))
                .isEqualTo("rh: Value (150) > valid max (100.0). Element set to missing");
    }

    @Test
    void testAboveMaxThrowsWhenNotNullifying() {
        TransformDiagnostics diagnostics = TransformDiagnostics.detached();

        assertThatThrownBy(() -> validator.validate("rh", FieldValue.of(150L), 0.0, 100.0, false, diagnostics))
                .isInstanceOfSatisfying(ValueRangeException.class, e -> {
                    assertThat(e.getElementKey()).isEqualTo("rh");
                    assertThat(e.getBound()).isEqualTo(ValueRangeException.Bound.MAX);
                    assertThat(e.getLimit()).isEqualTo(100.0);
                });
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    void testBelowMin() {
        TransformDiagnostics diagnostics = TransformDiagnostics.detached();

        FieldValue result = validator.validate("airTemperature", FieldValue.of(-80.5), -50.0, null, true,
                diagnostics);

        assertThat(result.isMissing()).isTrue();
        assertThat(diagnostics.getWarnings().get(0)).contains("< valid min (-50.0)");
    }

    @Test
    void testBoundsAreInclusive() {
        TransformDiagnostics diagnostics = TransformDiagnostics.detached();

        assertThat(validator.validate("rh", FieldValue.of(0L), 0.0, 100.0, false, diagnostics))
                .isEqualTo(FieldValue.of(0L));
        assertThat(validator.validate("rh", FieldValue.of(100L), 0.0, 100.0, false, diagnostics))
                .isEqualTo(FieldValue.of(100L));
    }

    @Test
    void testMissingAndStringsPassThrough() {
        TransformDiagnostics diagnostics = TransformDiagnostics.detached();

        assertThat(validator.validate("rh", FieldValue.missing(), 0.0, 100.0, false, diagnostics).isMissing())
                .isTrue();
        assertThat(validator.validate("rh", FieldValue.of("high"), 0.0, 100.0, false, diagnostics))
                .isEqualTo(FieldValue.of("high"));
    }
}
