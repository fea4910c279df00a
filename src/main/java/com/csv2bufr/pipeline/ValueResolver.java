package com.csv2bufr.pipeline;

import com.csv2bufr.exception.MissingColumnException;
import com.csv2bufr.mapping.FieldMapping;
import com.csv2bufr.mapping.FieldSource;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.Row;

import java.util.Set;

/**
 * Decides the raw value of a mapped field for one row.
 */
public class ValueResolver {

    /**
     * Cell texts that mean "no observation".
     */
    public static final Set<String> MISSING_SENTINELS = Set.of("NA", "NaN", "NAN", "None");

    /**
     * Literal values are returned as is and never touch the row. Column values equal to a missing
     * sentinel resolve to missing. Fields without a source resolve to missing.
     *
     * @throws MissingColumnException if the referenced column is not part of the row
     */
    public FieldValue resolve(FieldMapping field, Row row, TransformDiagnostics diagnostics) {
        FieldSource source = field.getSource();
        return switch (source.getType()) {
            case LITERAL -> source.getLiteral();
            case COLUMN -> resolveColumn(field.getKey(), source.getColumn(), row);
            case UNSET -> {
                diagnostics.debug("value and column both None for element {}", field.getKey());
                yield FieldValue.missing();
            }
        };
    }

    private static FieldValue resolveColumn(String key, String column, Row row) {
        if (!row.contains(column)) {
            throw new MissingColumnException(column, key);
        }
        FieldValue value = row.get(column);
        return isMissing(value) ? FieldValue.missing() : value;
    }

    public static boolean isMissing(FieldValue value) {
        return value.isMissing() || MISSING_SENTINELS.contains(value.asText());
    }
}
