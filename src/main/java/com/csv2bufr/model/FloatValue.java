package com.csv2bufr.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode(callSuper = false)
public class FloatValue extends FieldValue {

    private final double value;

    public FloatValue(double value) {
        this.value = value;
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.FLOAT;
    }

    @Override
    public String asText() {
        return Double.toString(value);
    }

    @Override
    public double asDouble() {
        return value;
    }
}
