package com.csv2bufr.encoder.template;

import com.csv2bufr.encoder.MessageHandle;
import com.csv2bufr.model.FieldValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state behind a {@link MessageHandle} issued by {@link TemplateBufrEncoder}.
 */
class TemplateMessage implements MessageHandle {

    enum State {
        OPEN,
        PACKED,
        RELEASED
    }

    private final long id;
    private final MessageTemplate template;
    private final List<Entry> entries = new ArrayList<>();
    private List<Integer> repetitionCounts;
    private State state = State.OPEN;
    private byte[] packed;

    TemplateMessage(long id, MessageTemplate template) {
        this.id = id;
        this.template = template;
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public String getTemplate() {
        return template.getName();
    }

    MessageTemplate template() {
        return template;
    }

    State state() {
        return state;
    }

    void state(State state) {
        this.state = state;
    }

    List<Entry> entries() {
        return entries;
    }

    List<Integer> repetitionCounts() {
        return repetitionCounts;
    }

    void repetitionCounts(List<Integer> counts) {
        this.repetitionCounts = List.copyOf(counts);
    }

    byte[] packed() {
        return packed;
    }

    void packed(byte[] bytes) {
        this.packed = bytes;
    }

    @Override
    public String toString() {
        return "message#" + id + "[" + template.getName() + ", " + state + "]";
    }

    /**
     * One key written to the message, in the order it was set.
     */
    static class Entry {
        final String key;
        final List<FieldValue> values;
        final boolean array;

        Entry(String key, List<FieldValue> values, boolean array) {
            this.key = key;
            this.values = List.copyOf(values);
            this.array = array;
        }
    }
}
