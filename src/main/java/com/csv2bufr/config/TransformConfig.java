package com.csv2bufr.config;

import lombok.Builder;
import lombok.Value;

/**
 * Settings shared by every row of a transform run.
 */
@Value
@Builder(toBuilder = true)
public class TransformConfig {

    public static final String DEFAULT_TEMPLATE = "BUFR4";

    /**
     * Out-of-range values become missing (with a warning) instead of failing the row.
     */
    @Builder.Default
    boolean nullifyOnFail = true;

    @Builder.Default
    ErrorPolicy errorPolicy = ErrorPolicy.FAIL_FAST;

    /**
     * Template every message is created from.
     */
    @Builder.Default
    String template = DEFAULT_TEMPLATE;

    /**
     * Number of rows encoded concurrently; 1 keeps everything on the calling thread.
     */
    @Builder.Default
    int workers = 1;

    public static TransformConfig defaults() {
        return TransformConfig.builder().build();
    }
}
