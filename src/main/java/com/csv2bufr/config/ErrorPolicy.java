package com.csv2bufr.config;

/**
 * What the orchestrator does when a data row cannot be encoded.
 */
public enum ErrorPolicy {
    /**
     * Abort the whole transform on the first failing row; no messages are returned.
     */
    FAIL_FAST,

    /**
     * Record the failure against the row and continue with the remaining rows.
     */
    SKIP_AND_CONTINUE
}
