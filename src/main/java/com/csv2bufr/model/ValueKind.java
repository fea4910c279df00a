package com.csv2bufr.model;

/**
 * Tag of a {@link FieldValue}.
 */
public enum ValueKind {
    INTEGER,
    FLOAT,
    STRING,
    SEQUENCE,
    MISSING
}
