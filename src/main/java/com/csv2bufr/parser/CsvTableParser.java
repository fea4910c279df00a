package com.csv2bufr.parser;

import com.csv2bufr.model.FieldValue;
import com.csv2bufr.parser.CsvTokenizer.CsvRecordTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses a single-table CSV document whose first record is the header.
 *
 * Typing follows "quote non-numeric" conventions: unquoted numeric tokens become INTEGER or FLOAT
 * values, quoted tokens always stay STRING, other unquoted tokens are STRING and an empty unquoted
 * token is MISSING.
 */
public class CsvTableParser {
    private static final Logger log = LoggerFactory.getLogger(CsvTableParser.class);

    private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final char delimiter;

    public CsvTableParser() {
        this(',');
    }

    public CsvTableParser(char delimiter) {
        this.delimiter = delimiter;
    }

    public CsvTable parse(String text) {
        List<CsvRecordTokens> tokenized = new CsvTokenizer(text, delimiter).tokenize();
        if (tokenized.isEmpty()) {
            log.warn("CSV input is empty, no header row found");
            return new CsvTable(List.of(), List.of());
        }

        List<String> columns = new ArrayList<>();
        for (CsvToken token : tokenized.get(0).getFields()) {
            columns.add(token.getValue().trim());
        }

        List<CsvTable.CsvRecord> records = new ArrayList<>(tokenized.size() - 1);
        for (CsvRecordTokens record : tokenized.subList(1, tokenized.size())) {
            List<FieldValue> cells = new ArrayList<>(record.getFields().size());
            for (CsvToken token : record.getFields()) {
                cells.add(toValue(token));
            }
            records.add(new CsvTable.CsvRecord(record.getLine(), List.copyOf(cells)));
        }

        log.debug("Parsed CSV with {} columns and {} data rows", columns.size(), records.size());
        return new CsvTable(List.copyOf(columns), List.copyOf(records));
    }

    static FieldValue toValue(CsvToken token) {
        if (token.isQuoted()) {
            return FieldValue.of(token.getValue());
        }
        String text = token.getValue().trim();
        if (text.isEmpty()) {
            return FieldValue.missing();
        }
        if (INTEGER_PATTERN.matcher(text).matches()) {
            try {
                return FieldValue.of(Long.parseLong(text));
            } catch (NumberFormatException e) {
                // too large for a long, keep it numeric
                return FieldValue.of(Double.parseDouble(text));
            }
        }
        if (DECIMAL_PATTERN.matcher(text).matches()) {
            return FieldValue.of(Double.parseDouble(text));
        }
        return FieldValue.of(text);
    }
}
