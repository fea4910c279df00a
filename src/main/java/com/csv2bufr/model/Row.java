package com.csv2bufr.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One CSV data row keyed by column name. Owned by exactly one pipeline run and mutated in place
 * as values are corrected.
 */
public class Row {

    private final int lineNumber;
    private final Map<String, FieldValue> values;

    public Row(int lineNumber) {
        this.lineNumber = lineNumber;
        this.values = new LinkedHashMap<>();
    }

    /**
     * Zips column names with cell values positionally. Both lists must have the same size.
     */
    public static Row of(int lineNumber, List<String> columns, List<FieldValue> cells) {
        if (columns.size() != cells.size()) {
            throw new IllegalArgumentException("columns and cells differ in size");
        }
        Row row = new Row(lineNumber);
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i), cells.get(i));
        }
        return row;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public boolean contains(String column) {
        return values.containsKey(column);
    }

    public FieldValue get(String column) {
        FieldValue value = values.get(column);
        return value != null ? value : FieldValue.missing();
    }

    public void put(String column, FieldValue value) {
        values.put(Objects.requireNonNull(column, "column"), value != null ? value : FieldValue.missing());
    }

    /**
     * Copies every entry of {@code other} into this row; entries of {@code other} win on conflicts.
     */
    public void putAll(Map<String, FieldValue> other) {
        other.forEach(this::put);
    }

    public Map<String, FieldValue> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "Row[line=" + lineNumber + ", " + values + "]";
    }
}
