package com.csv2bufr.exception;

import com.csv2bufr.model.FieldValue;

/**
 * A numeric value fell outside its valid-min / valid-max bounds and the nullify policy is off.
 */
public class ValueRangeException extends Csv2BufrException {

    private static final long serialVersionUID = 1L;

    public enum Bound {
        MIN,
        MAX
    }

    private final String elementKey;
    private final transient FieldValue value;
    private final double limit;
    private final Bound bound;

    public ValueRangeException(String elementKey, FieldValue value, double limit, Bound bound) {
        super(describe(elementKey, value, limit, bound));
        this.elementKey = elementKey;
        this.value = value;
        this.limit = limit;
        this.bound = bound;
    }

    public static String describe(String elementKey, FieldValue value, double limit, Bound bound) {
        String op = bound == Bound.MIN ? "<" : ">";
        String name = bound == Bound.MIN ? "valid min" : "valid max";
        return elementKey + ": Value (" + value + ") " + op + " " + name + " (" + limit + ").";
    }

    public String getElementKey() {
        return elementKey;
    }

    public FieldValue getValue() {
        return value;
    }

    public double getLimit() {
        return limit;
    }

    public Bound getBound() {
        return bound;
    }
}
