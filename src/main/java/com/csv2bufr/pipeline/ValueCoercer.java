package com.csv2bufr.pipeline;

import com.csv2bufr.encoder.NativeType;
import com.csv2bufr.exception.EncoderException;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.ValueKind;

/**
 * Converts a resolved value to the wire type the encoder reports for its key.
 *
 * Upstream data often carries integers as numeric strings ({@code "0"}) or floats ({@code 3.0}); these are
 * converted with a warning. Floats are rounded half-even when an integer is expected.
 */
public class ValueCoercer {

    public FieldValue coerce(String key, FieldValue value, NativeType target, TransformDiagnostics diagnostics) {
        return switch (target) {
            case INTEGER -> toInteger(key, value, diagnostics);
            case FLOAT -> toFloat(key, value, diagnostics);
            case OTHER -> value;
        };
    }

    private FieldValue toInteger(String key, FieldValue value, TransformDiagnostics diagnostics) {
        if (value.getKind() == ValueKind.INTEGER || value.isMissing()) {
            return value;
        }
        FieldValue converted;
        if (value.getKind() == ValueKind.FLOAT) {
            double rounded = Math.rint(value.asDouble());
            if (!Double.isFinite(rounded) || rounded >= 0x1p63 || rounded < -0x1p63) {
                throw new EncoderException(key, value.asText(), "int expected but value cannot be represented as int");
            }
            converted = FieldValue.of((long) rounded);
        } else if (value.getKind() == ValueKind.STRING) {
            try {
                converted = FieldValue.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                throw new EncoderException(key, value.asText(), "int expected but received non-numeric string", e);
            }
        } else {
            return value;
        }
        diagnostics.warn("int expected for " + key + " but received " + kindName(value) + " (" + value.asText()
                + "), value converted to int (" + converted.asText() + ")");
        return converted;
    }

    private FieldValue toFloat(String key, FieldValue value, TransformDiagnostics diagnostics) {
        if (value.getKind() == ValueKind.FLOAT || value.isMissing()) {
            return value;
        }
        FieldValue converted;
        if (value.getKind() == ValueKind.INTEGER) {
            converted = FieldValue.of(value.asDouble());
        } else if (value.getKind() == ValueKind.STRING) {
            try {
                converted = FieldValue.of(Double.parseDouble(value.asText().trim()));
            } catch (NumberFormatException e) {
                throw new EncoderException(key, value.asText(), "float expected but received non-numeric string", e);
            }
        } else {
            return value;
        }
        diagnostics.warn("float expected for " + key + " but received " + kindName(value) + " (" + value.asText()
                + "), value converted to float (" + converted.asText() + ")");
        return converted;
    }

    private static String kindName(FieldValue value) {
        return value.getKind().name().toLowerCase();
    }
}
