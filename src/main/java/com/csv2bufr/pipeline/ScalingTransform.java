package com.csv2bufr.pipeline;

import com.csv2bufr.exception.ScalingException;
import com.csv2bufr.mapping.FieldMapping;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.IntegerValue;
import com.csv2bufr.model.ValueKind;

/**
 * Linear unit correction {@code value * 10^scale + offset} for column-sourced numeric values.
 */
public class ScalingTransform {

    private static final int MAX_EXACT_SCALE = 18;

    /**
     * Returns the corrected value. Non-numeric values, missing values and fields without scale/offset
     * are returned unchanged. Integers stay integers while the arithmetic is exact.
     *
     * @throws ScalingException if the input or the result is not finite, or integer arithmetic overflows
     */
    public FieldValue apply(FieldValue value, FieldMapping field) {
        if (!value.isNumeric() || !field.hasScaling()) {
            return value;
        }
        double scale = field.getScale();
        double offset = field.getOffset();

        if (value.getKind() == ValueKind.INTEGER && isExactIntegerScaling(scale, offset)) {
            long input = ((IntegerValue) value).getValue();
            try {
                long factor = pow10((int) scale);
                return FieldValue.of(Math.addExact(Math.multiplyExact(input, factor), (long) offset));
            } catch (ArithmeticException e) {
                throw new ScalingException(field.getKey(),
                        "integer overflow scaling " + input + " by 10^" + (int) scale + " + " + (long) offset, e);
            }
        }

        double input = value.asDouble();
        if (!Double.isFinite(input)) {
            throw new ScalingException(field.getKey(), "cannot scale non-finite value " + input);
        }
        double result = input * Math.pow(10, scale) + offset;
        if (!Double.isFinite(result)) {
            throw new ScalingException(field.getKey(),
                    "scaling " + input + " by 10^" + scale + " + " + offset + " is not finite");
        }
        return FieldValue.of(result);
    }

    private static boolean isExactIntegerScaling(double scale, double offset) {
        return scale >= 0 && scale <= MAX_EXACT_SCALE && scale == Math.rint(scale)
                && offset == Math.rint(offset) && Math.abs(offset) < 0x1p53;
    }

    private static long pow10(int exponent) {
        long result = 1;
        for (int i = 0; i < exponent; i++) {
            result *= 10;
        }
        return result;
    }
}
