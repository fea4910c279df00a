package com.csv2bufr.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An array value, written to the encoder in a single array-set call.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class SequenceValue extends FieldValue {

    private final List<FieldValue> elements;

    public SequenceValue(List<FieldValue> elements) {
        this.elements = List.copyOf(elements);
    }

    @Override
    public ValueKind getKind() {
        return ValueKind.SEQUENCE;
    }

    @Override
    public String asText() {
        return elements.stream()
                .map(FieldValue::asText)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    public int size() {
        return elements.size();
    }
}
