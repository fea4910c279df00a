package com.csv2bufr.pipeline;

import lombok.Value;

/**
 * A data row that could not be encoded.
 */
@Value
public class RowError {
    int lineNumber;
    String errorType;
    String message;
}
