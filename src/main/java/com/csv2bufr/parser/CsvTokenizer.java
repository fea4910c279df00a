package com.csv2bufr.parser;

import com.csv2bufr.parser.CsvToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tokenizer for comma-delimited text with double-quote quoting.
 *
 * Quoted fields may contain delimiters, line breaks and doubled quotes ({@code ""}). Each field
 * remembers whether it was quoted so the table parser can keep quoted numbers as text.
 */
public class CsvTokenizer {
    private static final Logger log = LoggerFactory.getLogger(CsvTokenizer.class);

    private static final char QUOTE = '"';

    private final String source;
    private final char delimiter;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    public CsvTokenizer(String source) {
        this(source, ',');
    }

    public CsvTokenizer(String source, char delimiter) {
        this.source = source != null ? source : "";
        this.delimiter = delimiter;
    }

    /**
     * Tokenize the entire source into records. Blank lines produce no record.
     */
    public List<CsvRecordTokens> tokenize() {
        List<CsvRecordTokens> records = new ArrayList<>();

        while (pos < source.length()) {
            int recordLine = line;
            List<CsvToken> fields = readRecord();
            if (fields.size() == 1 && fields.get(0).isEmpty()) {
                // also covers an empty cell in a single-column file
                log.debug("Skipping blank line {}", recordLine);
                continue;
            }
            records.add(new CsvRecordTokens(recordLine, fields));
        }

        log.debug("Tokenized {} records from {} lines", records.size(), line);
        return records;
    }

    private List<CsvToken> readRecord() {
        List<CsvToken> fields = new ArrayList<>();
        while (true) {
            fields.add(readField());
            if (pos >= source.length()) {
                return fields;
            }
            char c = source.charAt(pos);
            if (c == delimiter) {
                advance();
                if (pos >= source.length()) {
                    // trailing delimiter at end of input still opens an empty field
                    fields.add(new CsvToken(TokenType.UNQUOTED, "", line, column));
                    return fields;
                }
                continue;
            }
            // end of line
            consumeLineBreak();
            return fields;
        }
    }

    private CsvToken readField() {
        int startLine = line;
        int startCol = column;

        int lookahead = pos;
        while (lookahead < source.length() && (source.charAt(lookahead) == ' ' || source.charAt(lookahead) == '\t')) {
            lookahead++;
        }
        if (lookahead < source.length() && source.charAt(lookahead) == QUOTE) {
            while (pos < lookahead) {
                advance();
            }
            return readQuoted(startLine, startCol);
        }
        return readUnquoted(startLine, startCol);
    }

    private CsvToken readQuoted(int startLine, int startCol) {
        StringBuilder sb = new StringBuilder();
        advance(); // opening quote

        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == QUOTE) {
                advance();
                // Doubled quote is an escaped quote
                if (pos < source.length() && source.charAt(pos) == QUOTE) {
                    sb.append(QUOTE);
                    advance();
                } else {
                    break;
                }
            } else if (c == '\n') {
                sb.append(c);
                pos++;
                line++;
                column = 1;
            } else {
                sb.append(c);
                advance();
            }
        }

        // Anything between the closing quote and the next delimiter is kept
        while (pos < source.length() && !isFieldEnd(source.charAt(pos))) {
            sb.append(source.charAt(pos));
            advance();
        }

        return new CsvToken(TokenType.QUOTED, sb.toString(), startLine, startCol);
    }

    private CsvToken readUnquoted(int startLine, int startCol) {
        int start = pos;
        while (pos < source.length() && !isFieldEnd(source.charAt(pos))) {
            advance();
        }
        return new CsvToken(TokenType.UNQUOTED, source.substring(start, pos), startLine, startCol);
    }

    private boolean isFieldEnd(char c) {
        return c == delimiter || c == '\n' || c == '\r';
    }

    private void consumeLineBreak() {
        if (pos < source.length() && source.charAt(pos) == '\r') {
            pos++;
        }
        if (pos < source.length() && source.charAt(pos) == '\n') {
            pos++;
        }
        line++;
        column = 1;
    }

    private void advance() {
        pos++;
        column++;
    }

    /**
     * The fields of one record together with the line the record starts on.
     */
    public static class CsvRecordTokens {
        private final int line;
        private final List<CsvToken> fields;

        public CsvRecordTokens(int line, List<CsvToken> fields) {
            this.line = line;
            this.fields = List.copyOf(fields);
        }

        public int getLine() {
            return line;
        }

        public List<CsvToken> getFields() {
            return fields;
        }
    }
}
