package com.csv2bufr.exception;

public class MalformedRowException extends Csv2BufrException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final int expectedColumns;
    private final int actualColumns;

    public MalformedRowException(int lineNumber, int expectedColumns, int actualColumns) {
        super("line " + lineNumber + ": expected " + expectedColumns + " columns but found " + actualColumns);
        this.lineNumber = lineNumber;
        this.expectedColumns = expectedColumns;
        this.actualColumns = actualColumns;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getExpectedColumns() {
        return expectedColumns;
    }

    public int getActualColumns() {
        return actualColumns;
    }
}
