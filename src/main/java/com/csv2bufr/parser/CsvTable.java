package com.csv2bufr.parser;

import com.csv2bufr.exception.MalformedRowException;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.Row;
import lombok.Value;

import java.util.List;

/**
 * A parsed CSV document: the header row plus typed data records.
 */
@Value
public class CsvTable {

    List<String> columns;
    List<CsvRecord> records;

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Builds a fresh {@link Row} for one record.
     *
     * @throws MalformedRowException if the record's field count differs from the header
     */
    public Row toRow(CsvRecord record) {
        if (record.getCells().size() != columns.size()) {
            throw new MalformedRowException(record.getLine(), columns.size(), record.getCells().size());
        }
        return Row.of(record.getLine(), columns, record.getCells());
    }

    @Value
    public static class CsvRecord {
        int line;
        List<FieldValue> cells;
    }
}
