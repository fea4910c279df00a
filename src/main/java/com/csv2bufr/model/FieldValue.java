package com.csv2bufr.model;

import java.util.List;

/**
 * A typed value flowing from a CSV cell or a mapping literal into the encoder.
 *
 * Subclasses form a closed set selected by {@link #getKind()}; callers switch on the kind
 * instead of inspecting runtime types.
 */
public abstract class FieldValue {

    public abstract ValueKind getKind();

    /**
     * The textual form of the value, used for missing-value sentinel matching and diagnostics.
     */
    public abstract String asText();

    public boolean isMissing() {
        return getKind() == ValueKind.MISSING;
    }

    public boolean isNumeric() {
        return getKind() == ValueKind.INTEGER || getKind() == ValueKind.FLOAT;
    }

    /**
     * Numeric view of an INTEGER or FLOAT value.
     *
     * @throws IllegalStateException for any other kind
     */
    public double asDouble() {
        throw new IllegalStateException(getKind() + " value has no numeric representation: " + asText());
    }

    @Override
    public String toString() {
        return asText();
    }

    public static FieldValue of(long value) {
        return new IntegerValue(value);
    }

    public static FieldValue of(double value) {
        return new FloatValue(value);
    }

    public static FieldValue of(String value) {
        return value == null ? MissingValue.INSTANCE : new StringValue(value);
    }

    public static FieldValue sequence(List<FieldValue> elements) {
        return new SequenceValue(elements);
    }

    public static FieldValue missing() {
        return MissingValue.INSTANCE;
    }
}
