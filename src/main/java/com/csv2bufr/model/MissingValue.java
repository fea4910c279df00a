package com.csv2bufr.model;

/**
 * Explicitly missing value. The encoder leaves the corresponding element unset.
 */
public final class MissingValue extends FieldValue {

    static final MissingValue INSTANCE = new MissingValue();

    private MissingValue() {
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.MISSING;
    }

    @Override
    public String asText() {
        return "None";
    }
}
