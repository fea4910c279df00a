package com.csv2bufr.encoder.template;

import com.csv2bufr.encoder.BufrEncoder;
import com.csv2bufr.encoder.MessageHandle;
import com.csv2bufr.encoder.NativeType;
import com.csv2bufr.exception.EncoderException;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reference {@link BufrEncoder} driven by {@link MessageTemplate}s.
 *
 * It enforces the encoder contract (known keys, matching wire types, replication counts before values,
 * pack before serialize, no use after release) and serializes to a deterministic BUFR-framed layout,
 * see {@link BufrSectionWriter}. It does not perform table-driven bit packing.
 *
 * Handles are independent, so one instance can serve several threads as long as each handle is used by
 * a single thread.
 */
public class TemplateBufrEncoder implements BufrEncoder {
    private static final Logger log = LoggerFactory.getLogger(TemplateBufrEncoder.class);

    private final MessageTemplateRegistry templates;
    private final AtomicLong nextId = new AtomicLong(1);

    public TemplateBufrEncoder() {
        this(new MessageTemplateRegistry());
    }

    public TemplateBufrEncoder(MessageTemplateRegistry templates) {
        this.templates = templates;
    }

    @Override
    public MessageHandle newMessage(String template) {
        TemplateMessage message = new TemplateMessage(nextId.getAndIncrement(), templates.get(template));
        log.trace("Created {}", message);
        return message;
    }

    @Override
    public void setRepetitionCounts(MessageHandle handle, List<Integer> counts) {
        TemplateMessage message = open(handle);
        if (!message.entries().isEmpty()) {
            throw new EncoderException("replication factors must be set before any element value ("
                    + message.entries().size() + " already set)");
        }
        for (Integer count : counts) {
            if (count == null || count < 0 || count > 0xFFFF) {
                throw new EncoderException("invalid delayed replication factor: " + count);
            }
        }
        message.repetitionCounts(counts);
    }

    @Override
    public void setScalar(MessageHandle handle, String key, FieldValue value) {
        TemplateMessage message = open(handle);
        NativeType type = requireKey(message, key);
        if (value.getKind() == ValueKind.SEQUENCE) {
            throw new EncoderException(key, value.asText(), "array value passed to scalar set");
        }
        checkType(key, type, value);
        message.entries().add(new TemplateMessage.Entry(key, List.of(value), false));
    }

    @Override
    public void setArray(MessageHandle handle, String key, List<FieldValue> values) {
        TemplateMessage message = open(handle);
        NativeType type = requireKey(message, key);
        for (FieldValue value : values) {
            if (value.getKind() == ValueKind.SEQUENCE) {
                throw new EncoderException(key, value.asText(), "nested arrays are not supported");
            }
            if (!value.isMissing()) {
                checkType(key, type, value);
            }
        }
        message.entries().add(new TemplateMessage.Entry(key, values, true));
    }

    @Override
    public NativeType nativeTypeOf(MessageHandle handle, String key) {
        return requireKey(open(handle), key);
    }

    @Override
    public void pack(MessageHandle handle) {
        TemplateMessage message = open(handle);
        try {
            message.packed(BufrSectionWriter.write(message));
        } catch (IOException e) {
            throw new EncoderException(null, null, "failed to pack " + message + ": " + e.getMessage(), e);
        }
        message.state(TemplateMessage.State.PACKED);
    }

    @Override
    public byte[] serialize(MessageHandle handle) {
        TemplateMessage message = cast(handle);
        if (message.state() != TemplateMessage.State.PACKED) {
            throw new EncoderException("message must be packed before it is serialized: " + message);
        }
        return message.packed().clone();
    }

    @Override
    public void release(MessageHandle handle) {
        if (handle == null
                || handle instanceof TemplateMessage released && released.state() == TemplateMessage.State.RELEASED) {
            return;
        }
        TemplateMessage message = cast(handle);
        message.state(TemplateMessage.State.RELEASED);
        message.entries().clear();
        message.packed(null);
    }

    private static TemplateMessage open(MessageHandle handle) {
        TemplateMessage message = cast(handle);
        if (message.state() != TemplateMessage.State.OPEN) {
            throw new EncoderException("message is no longer open: " + message);
        }
        return message;
    }

    private static TemplateMessage cast(MessageHandle handle) {
        if (!(handle instanceof TemplateMessage message)) {
            throw new EncoderException("handle was not issued by this encoder: " + handle);
        }
        if (message.state() == TemplateMessage.State.RELEASED) {
            throw new EncoderException("message has been released: " + message);
        }
        return message;
    }

    private static NativeType requireKey(TemplateMessage message, String key) {
        NativeType type = message.template().typeOf(key);
        if (type == null) {
            throw new EncoderException(key, null, "key not defined in template " + message.getTemplate());
        }
        return type;
    }

    /**
     * Integers widen to float; every other mismatch is rejected.
     */
    private static void checkType(String key, NativeType type, FieldValue value) {
        boolean ok = switch (type) {
            case INTEGER -> value.getKind() == ValueKind.INTEGER;
            case FLOAT -> value.getKind() == ValueKind.FLOAT || value.getKind() == ValueKind.INTEGER;
            case OTHER -> value.getKind() == ValueKind.STRING;
        };
        if (!ok) {
            throw new EncoderException(key, value.asText(),
                    type.name().toLowerCase() + " expected but received " + value.getKind().name().toLowerCase());
        }
    }
}
