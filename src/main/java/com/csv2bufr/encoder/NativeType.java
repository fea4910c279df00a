package com.csv2bufr.encoder;

/**
 * Wire type the encoder reports for a key.
 */
public enum NativeType {
    INTEGER,
    FLOAT,
    OTHER;

    public static NativeType fromName(String name) {
        if (name == null) {
            return OTHER;
        }
        return switch (name.trim().toLowerCase()) {
            case "int", "integer", "long" -> INTEGER;
            case "float", "double", "real" -> FLOAT;
            default -> OTHER;
        };
    }
}
