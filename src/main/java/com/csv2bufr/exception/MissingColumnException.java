package com.csv2bufr.exception;

public class MissingColumnException extends Csv2BufrException {

    private static final long serialVersionUID = 1L;

    private final String column;
    private final String elementKey;

    public MissingColumnException(String column, String elementKey) {
        super("column '" + column + "' not found in data dictionary (required by " + elementKey + ")");
        this.column = column;
        this.elementKey = elementKey;
    }

    public String getColumn() {
        return column;
    }

    public String getElementKey() {
        return elementKey;
    }
}
