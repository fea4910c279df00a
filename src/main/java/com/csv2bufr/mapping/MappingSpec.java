package com.csv2bufr.mapping;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A validated mapping document. The order of {@link #getSequence()} is the encoding order.
 */
@Value
@Builder
public class MappingSpec {

    /**
     * Values for {@code inputDelayedDescriptorReplicationFactor}; {@code null} when the mapping has none.
     */
    List<Integer> delayedReplicationFactors;

    @NonNull
    @Singular("field")
    List<FieldMapping> sequence;

    public boolean hasDelayedReplication() {
        return delayedReplicationFactors != null;
    }

    public int size() {
        return sequence.size();
    }
}
