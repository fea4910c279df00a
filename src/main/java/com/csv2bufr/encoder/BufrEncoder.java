package com.csv2bufr.encoder;

import com.csv2bufr.exception.EncoderException;
import com.csv2bufr.model.FieldValue;

import java.util.List;

/**
 * Sequential BUFR message builder.
 *
 * A message is created from a template, optionally given its delayed replication counts, filled key by
 * key in descriptor order, packed, serialized and released. Replication counts must be set before any
 * field value because they decide how the following keys are grouped. All operations report failures
 * as {@link EncoderException}.
 */
public interface BufrEncoder {

    MessageHandle newMessage(String template);

    void setRepetitionCounts(MessageHandle handle, List<Integer> counts);

    void setScalar(MessageHandle handle, String key, FieldValue value);

    void setArray(MessageHandle handle, String key, List<FieldValue> values);

    NativeType nativeTypeOf(MessageHandle handle, String key);

    void pack(MessageHandle handle);

    byte[] serialize(MessageHandle handle);

    /**
     * Frees the message. Safe to call on a handle whose encoding failed.
     */
    void release(MessageHandle handle);
}
