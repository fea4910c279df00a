package com.csv2bufr.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A single field read by the {@link CsvTokenizer}.
 */
@Data
@AllArgsConstructor
public class CsvToken {
    private TokenType type;
    private String value;
    private int line;
    private int column;

    public enum TokenType {
        /**
         * Field enclosed in quotes; always kept as text.
         */
        QUOTED,

        /**
         * Bare field; numeric-looking values are typed as numbers.
         */
        UNQUOTED
    }

    public boolean isQuoted() {
        return type == TokenType.QUOTED;
    }

    public boolean isEmpty() {
        return type == TokenType.UNQUOTED && value.isEmpty();
    }
}
