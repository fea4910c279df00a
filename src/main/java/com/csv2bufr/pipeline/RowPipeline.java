package com.csv2bufr.pipeline;

import com.csv2bufr.config.TransformConfig;
import com.csv2bufr.encoder.BufrEncoder;
import com.csv2bufr.encoder.MessageHandle;
import com.csv2bufr.encoder.NativeType;
import com.csv2bufr.exception.Csv2BufrException;
import com.csv2bufr.exception.EncoderException;
import com.csv2bufr.exception.StationMergeException;
import com.csv2bufr.mapping.FieldMapping;
import com.csv2bufr.mapping.FieldSource;
import com.csv2bufr.mapping.MappingSpec;
import com.csv2bufr.model.FieldValue;
import com.csv2bufr.model.Row;
import com.csv2bufr.model.SequenceValue;
import com.csv2bufr.model.ValueKind;
import com.csv2bufr.station.StationMetadata;

/**
 * Turns one {@link Row} into one encoded message.
 *
 * <ol>
 *   <li>merge station metadata into the row (station values win);</li>
 *   <li>per column-sourced field, in sequence order: resolve, scale, range check and write the corrected
 *       value back into the row;</li>
 *   <li>create a message from the configured template and set the delayed replication factors, if any,
 *       before any element;</li>
 *   <li>set every non-missing value in sequence order, arrays as arrays, scalars coerced to the key's
 *       wire type;</li>
 *   <li>pack, serialize and release the message.</li>
 * </ol>
 * Stateless apart from its collaborators, so one instance may encode several rows concurrently as long as
 * each call gets its own row and diagnostics.
 */
public class RowPipeline {

    private final BufrEncoder encoder;
    private final TransformConfig config;
    private final ValueResolver resolver;
    private final ScalingTransform scaling;
    private final RangeValidator rangeValidator;
    private final ValueCoercer coercer;

    public RowPipeline(BufrEncoder encoder, TransformConfig config) {
        this(encoder, config, new ValueResolver(), new ScalingTransform(), new RangeValidator(), new ValueCoercer());
    }

    public RowPipeline(BufrEncoder encoder, TransformConfig config, ValueResolver resolver, ScalingTransform scaling,
                       RangeValidator rangeValidator, ValueCoercer coercer) {
        this.encoder = encoder;
        this.config = config;
        this.resolver = resolver;
        this.scaling = scaling;
        this.rangeValidator = rangeValidator;
        this.coercer = coercer;
    }

    public byte[] encodeRow(MappingSpec mapping, Row row, StationMetadata station, TransformDiagnostics diagnostics) {
        mergeStation(row, station);
        correctValues(mapping, row, diagnostics);
        return encode(mapping, row, diagnostics);
    }

    void mergeStation(Row row, StationMetadata station) {
        if (station == null) {
            throw new StationMergeException("no station metadata supplied");
        }
        row.putAll(station.getData());
    }

    void correctValues(MappingSpec mapping, Row row, TransformDiagnostics diagnostics) {
        for (FieldMapping field : mapping.getSequence()) {
            if (!field.getSource().isColumn()) {
                continue;
            }
            String column = field.getSource().getColumn();
            FieldValue value = resolver.resolve(field, row, diagnostics);
            value = scaling.apply(value, field);
            diagnostics.debug("validating value {} for element {}", value, field.getKey());
            value = rangeValidator.validate(field.getKey(), value, field.getValidMin(), field.getValidMax(),
                    config.isNullifyOnFail(), diagnostics);
            row.put(column, value);
        }
    }

    byte[] encode(MappingSpec mapping, Row row, TransformDiagnostics diagnostics) {
        MessageHandle handle = call(null, null, () -> encoder.newMessage(config.getTemplate()));
        try {
            if (mapping.hasDelayedReplication()) {
                call(null, mapping.getDelayedReplicationFactors().toString(), () -> {
                    encoder.setRepetitionCounts(handle, mapping.getDelayedReplicationFactors());
                    return null;
                });
            }

            for (FieldMapping field : mapping.getSequence()) {
                FieldValue value = valueToEncode(field.getSource(), row);
                if (value.isMissing()) {
                    continue;
                }
                setValue(handle, field.getKey(), value, diagnostics);
            }

            call(null, null, () -> {
                encoder.pack(handle);
                return null;
            });
            return call(null, null, () -> encoder.serialize(handle));
        } finally {
            release(handle, diagnostics);
        }
    }

    private void setValue(MessageHandle handle, String key, FieldValue value, TransformDiagnostics diagnostics) {
        diagnostics.debug("setting value {} for element {}", value, key);
        if (value.getKind() == ValueKind.SEQUENCE) {
            call(key, value.asText(), () -> {
                encoder.setArray(handle, key, ((SequenceValue) value).getElements());
                return null;
            });
            return;
        }
        NativeType nativeType = call(key, value.asText(), () -> encoder.nativeTypeOf(handle, key));
        FieldValue coerced = coercer.coerce(key, value, nativeType, diagnostics);
        call(key, coerced.asText(), () -> {
            encoder.setScalar(handle, key, coerced);
            return null;
        });
    }

    private static FieldValue valueToEncode(FieldSource source, Row row) {
        return switch (source.getType()) {
            case LITERAL -> source.getLiteral();
            case COLUMN -> row.get(source.getColumn());
            case UNSET -> FieldValue.missing();
        };
    }

    private void release(MessageHandle handle, TransformDiagnostics diagnostics) {
        try {
            encoder.release(handle);
        } catch (RuntimeException e) {
            diagnostics.warn("failed to release " + handle + ": " + e.getMessage());
        }
    }

    /**
     * Runs an encoder call and reports any failure as an {@link EncoderException} naming the key and value.
     */
    private static <T> T call(String key, String value, EncoderCall<T> call) {
        try {
            return call.run();
        } catch (EncoderException e) {
            if (key == null || e.getElementKey() != null) {
                throw e;
            }
            throw new EncoderException(key, value, e.getMessage(), e);
        } catch (Csv2BufrException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EncoderException(key, value, e.toString(), e);
        }
    }

    @FunctionalInterface
    private interface EncoderCall<T> {
        T run();
    }
}
