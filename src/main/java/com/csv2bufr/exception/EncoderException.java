package com.csv2bufr.exception;

/**
 * Raised by, or on behalf of, the message encoder. Carries the key and value being written, when known.
 */
public class EncoderException extends Csv2BufrException {

    private static final long serialVersionUID = 1L;

    private final String elementKey;
    private final String value;

    public EncoderException(String message) {
        this(null, null, message, null);
    }

    public EncoderException(String elementKey, String value, String message) {
        this(elementKey, value, message, null);
    }

    public EncoderException(String elementKey, String value, String message, Throwable cause) {
        super(elementKey == null ? message : "error setting " + elementKey + " = " + value + ": " + message, cause);
        this.elementKey = elementKey;
        this.value = value;
    }

    public String getElementKey() {
        return elementKey;
    }

    public String getValue() {
        return value;
    }
}
