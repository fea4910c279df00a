package com.csv2bufr.exception;

/**
 * Scale/offset arithmetic produced a non-finite or overflowing value.
 */
public class ScalingException extends Csv2BufrException {

    private static final long serialVersionUID = 1L;

    private final String elementKey;

    public ScalingException(String elementKey, String message) {
        super(elementKey + ": " + message);
        this.elementKey = elementKey;
    }

    public ScalingException(String elementKey, String message, Throwable cause) {
        super(elementKey + ": " + message, cause);
        this.elementKey = elementKey;
    }

    public String getElementKey() {
        return elementKey;
    }
}
