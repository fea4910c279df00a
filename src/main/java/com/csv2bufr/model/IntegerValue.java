package com.csv2bufr.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode(callSuper = false)
public class IntegerValue extends FieldValue {

    private final long value;

    public IntegerValue(long value) {
        this.value = value;
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.INTEGER;
    }

    @Override
    public String asText() {
        return Long.toString(value);
    }

    @Override
    public double asDouble() {
        return value;
    }
}
