package com.csv2bufr.exception;

/**
 * Wraps the failure of a single data row so callers know which line to look at.
 */
public class RowTransformException extends Csv2BufrException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;

    public RowTransformException(int lineNumber, Csv2BufrException cause) {
        super("row at line " + lineNumber + " failed: " + cause.getMessage(), cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
