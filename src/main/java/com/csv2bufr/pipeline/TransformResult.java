package com.csv2bufr.pipeline;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of a transform run.
 */
@Value
@Builder
public class TransformResult {

    /**
     * Encoded messages keyed by content hash, in the order their rows were read.
     */
    Map<String, byte[]> messages;

    int rowsRead;
    int rowsEncoded;

    /**
     * Rows whose encoded bytes were identical to an earlier row's and were therefore collapsed.
     */
    int duplicateMessages;

    @Singular
    List<RowError> rowErrors;

    @Singular
    List<String> warnings;

    public boolean isSuccess() {
        return rowErrors.isEmpty();
    }

    public int getMessageCount() {
        return messages.size();
    }
}
