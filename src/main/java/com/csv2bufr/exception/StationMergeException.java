package com.csv2bufr.exception;

/**
 * Station metadata could not be merged into a row.
 */
public class StationMergeException extends Csv2BufrException {

    private static final long serialVersionUID = 1L;

    public StationMergeException(String message) {
        super("issue merging station and data dictionaries: " + message);
    }
}
