package com.csv2bufr.pipeline;

import com.csv2bufr.exception.ValueRangeException;
import com.csv2bufr.model.FieldValue;

/**
 * Checks numeric values against optional valid-min / valid-max bounds.
 */
public class RangeValidator {

    /**
     * @param min lower bound, {@code null} for none
     * @param max upper bound, {@code null} for none
     * @param nullifyOnFail return missing (and warn) instead of throwing
     * @return the value, or missing if it was out of range and {@code nullifyOnFail} is set
     * @throws ValueRangeException if the value is out of range and {@code nullifyOnFail} is not set
     */
    public FieldValue validate(String key, FieldValue value, Double min, Double max, boolean nullifyOnFail,
                               TransformDiagnostics diagnostics) {
        if (value.isMissing() || !value.isNumeric()) {
            return value;
        }
        double number = value.asDouble();
        if (min != null && number < min) {
            return reject(key, value, min, ValueRangeException.Bound.MIN, nullifyOnFail, diagnostics);
        }
        if (max != null && number > max) {
            return reject(key, value, max, ValueRangeException.Bound.MAX, nullifyOnFail, diagnostics);
        }
        return value;
    }

    private static FieldValue reject(String key, FieldValue value, double limit, ValueRangeException.Bound bound,
                                     boolean nullifyOnFail, TransformDiagnostics diagnostics) {
        String message = ValueRangeException.describe(key, value, limit, bound);
        if (nullifyOnFail) {
            diagnostics.warn(message + " Element set to missing");
            return FieldValue.missing();
        }
        diagnostics.error(message);
        throw new ValueRangeException(key, value, limit, bound);
    }
}
