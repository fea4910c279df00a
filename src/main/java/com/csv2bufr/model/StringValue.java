package com.csv2bufr.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

@Getter
@EqualsAndHashCode(callSuper = false)
public class StringValue extends FieldValue {

    private final String value;

    public StringValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.STRING;
    }

    @Override
    public String asText() {
        return value;
    }
}
