package com.csv2bufr.pipeline;

import com.csv2bufr.encoder.BufrEncoder;
import com.csv2bufr.encoder.MessageHandle;
import com.csv2bufr.encoder.NativeType;
import com.csv2bufr.exception.EncoderException;
import com.csv2bufr.model.FieldValue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test double that records every encoder call in order and serializes to the call log of its message.
 */
class RecordingBufrEncoder implements BufrEncoder {

    final List<String> calls = new ArrayList<>();
    final Map<String, NativeType> types = new HashMap<>();
    final Map<String, FieldValue> scalars = new HashMap<>();
    int released;
    String failOnKey;

    private long nextId = 1;

    RecordingBufrEncoder type(String key, NativeType type) {
        types.put(key, type);
        return this;
    }

    @Override
    public MessageHandle newMessage(String template) {
        calls.add("new " + template);
        long id = nextId++;
        return new MessageHandle() {
            @Override
            public long getId() {
                return id;
            }

            @Override
            public String getTemplate() {
                return template;
            }
        };
    }

    @Override
    public void setRepetitionCounts(MessageHandle handle, List<Integer> counts) {
        calls.add("repetitions " + counts);
    }

    @Override
    public void setScalar(MessageHandle handle, String key, FieldValue value) {
        if (key.equals(failOnKey)) {
            throw new IllegalStateException("boom");
        }
        calls.add("scalar " + key + "=" + value.getKind() + ":" + value.asText());
        scalars.put(key, value);
    }

    @Override
    public void setArray(MessageHandle handle, String key, List<FieldValue> values) {
        calls.add("array " + key + "=" + values);
    }

    @Override
    public NativeType nativeTypeOf(MessageHandle handle, String key) {
        NativeType type = types.get(key);
        if (type == null) {
            throw new EncoderException("unknown key " + key);
        }
        return type;
    }

    @Override
    public void pack(MessageHandle handle) {
        calls.add("pack");
    }

    @Override
    public byte[] serialize(MessageHandle handle) {
        calls.add("serialize");
        return String.join("|", calls).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void release(MessageHandle handle) {
        released++;
    }
}
