package com.csv2bufr.mapping;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One entry of the mapping {@code sequence}: an encoder key and how to obtain its value.
 */
@Value
@Builder
public class FieldMapping {

    @NonNull
    String key;

    @NonNull
    @Builder.Default
    FieldSource source = FieldSource.unset();

    Double validMin;
    Double validMax;
    Double scale;
    Double offset;

    /**
     * Scale and offset are validated to be jointly present, so checking both is only a guard.
     */
    public boolean hasScaling() {
        return scale != null && offset != null;
    }

    public boolean hasRange() {
        return validMin != null || validMax != null;
    }
}
