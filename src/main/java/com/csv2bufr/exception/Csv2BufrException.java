package com.csv2bufr.exception;

/**
 * Base type for every failure raised while turning CSV rows into BUFR messages.
 */
public class Csv2BufrException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public Csv2BufrException(String message) {
        super(message);
    }

    public Csv2BufrException(String message, Throwable cause) {
        super(message, cause);
    }
}
