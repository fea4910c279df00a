package com.csv2bufr.pipeline;

import com.csv2bufr.config.ErrorPolicy;
import com.csv2bufr.config.TransformConfig;
import com.csv2bufr.encoder.BufrEncoder;
import com.csv2bufr.exception.Csv2BufrException;
import com.csv2bufr.exception.RowTransformException;
import com.csv2bufr.mapping.MappingParser;
import com.csv2bufr.mapping.MappingSpec;
import com.csv2bufr.parser.CsvTable;
import com.csv2bufr.parser.CsvTableParser;
import com.csv2bufr.station.StationMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Converts a whole CSV document into messages keyed by content hash.
 *
 * The mapping is validated before any row is read. Each data row then runs through its own
 * {@link RowPipeline} invocation; rows do not depend on each other, so with more than one worker they are
 * encoded concurrently and merged back in input order. Rows whose encoded bytes are identical share one
 * entry in the result.
 */
public class TransformOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(TransformOrchestrator.class);

    private final MappingParser mappingParser;
    private final CsvTableParser csvParser;
    private final RowPipeline pipeline;
    private final TransformConfig config;

    public TransformOrchestrator(BufrEncoder encoder, TransformConfig config) {
        this(new MappingParser(), new CsvTableParser(), new RowPipeline(encoder, config), config);
    }

    public TransformOrchestrator(MappingParser mappingParser, CsvTableParser csvParser, RowPipeline pipeline,
                                 TransformConfig config) {
        this.mappingParser = mappingParser;
        this.csvParser = csvParser;
        this.pipeline = pipeline;
        this.config = config;
    }

    /**
     * Validates {@code mapping} and transforms {@code rawText}.
     *
     * @throws com.csv2bufr.exception.MappingSchemaException if the mapping is invalid; no row is processed
     * @throws RowTransformException on the first failing row under {@link ErrorPolicy#FAIL_FAST}
     */
    public TransformResult transform(String rawText, JsonNode mapping, StationMetadata station) {
        MappingSpec spec = mappingParser.parse(mapping);
        return transform(rawText, spec, station);
    }

    public TransformResult transform(String rawText, MappingSpec mapping, StationMetadata station) {
        CsvTable table = csvParser.parse(rawText);
        List<RowOutcome> outcomes = config.getWorkers() > 1
                ? encodeConcurrently(mapping, table, station)
                : encodeSequentially(mapping, table, station);
        return collect(table, outcomes);
    }

    private List<RowOutcome> encodeSequentially(MappingSpec mapping, CsvTable table, StationMetadata station) {
        List<RowOutcome> outcomes = new ArrayList<>(table.getRecords().size());
        for (CsvTable.CsvRecord record : table.getRecords()) {
            RowOutcome outcome = encodeRecord(mapping, table, record, station);
            outcomes.add(outcome);
            if (outcome.failed() && config.getErrorPolicy() == ErrorPolicy.FAIL_FAST) {
                break;
            }
        }
        return outcomes;
    }

    private List<RowOutcome> encodeConcurrently(MappingSpec mapping, CsvTable table, StationMetadata station) {
        ExecutorService executor = Executors.newFixedThreadPool(config.getWorkers());
        try {
            List<Future<RowOutcome>> futures = new ArrayList<>(table.getRecords().size());
            for (CsvTable.CsvRecord record : table.getRecords()) {
                futures.add(executor.submit(() -> encodeRecord(mapping, table, record, station)));
            }

            List<RowOutcome> outcomes = new ArrayList<>(futures.size());
            for (Future<RowOutcome> future : futures) {
                RowOutcome outcome = await(future);
                outcomes.add(outcome);
                if (outcome.failed() && config.getErrorPolicy() == ErrorPolicy.FAIL_FAST) {
                    break;
                }
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static RowOutcome await(Future<RowOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Csv2BufrException("interrupted while waiting for row encoding", e);
        } catch (ExecutionException | CancellationException e) {
            throw new Csv2BufrException("row encoding failed unexpectedly: " + e.getMessage(), e);
        }
    }

    private RowOutcome encodeRecord(MappingSpec mapping, CsvTable table, CsvTable.CsvRecord record,
                                    StationMetadata station) {
        TransformDiagnostics diagnostics = TransformDiagnostics.forRow(record.getLine());
        try {
            byte[] bytes = pipeline.encodeRow(mapping, table.toRow(record), station, diagnostics);
            return new RowOutcome(record.getLine(), bytes, null, diagnostics);
        } catch (Csv2BufrException e) {
            return new RowOutcome(record.getLine(), null, e, diagnostics);
        }
    }

    private TransformResult collect(CsvTable table, List<RowOutcome> outcomes) {
        Map<String, byte[]> messages = new LinkedHashMap<>();
        TransformResult.TransformResultBuilder result = TransformResult.builder();
        int encoded = 0;
        int duplicates = 0;

        for (RowOutcome outcome : outcomes) {
            for (String warning : outcome.diagnostics.getWarnings()) {
                result.warning("line " + outcome.line + ": " + warning);
            }
            if (outcome.failed()) {
                log.error("Row at line {} failed: {}", outcome.line, outcome.error.getMessage());
                if (config.getErrorPolicy() == ErrorPolicy.FAIL_FAST) {
                    throw new RowTransformException(outcome.line, outcome.error);
                }
                result.rowError(new RowError(outcome.line, outcome.error.getClass().getSimpleName(),
                        outcome.error.getMessage()));
                continue;
            }

            encoded++;
            String hash = ContentHash.of(outcome.bytes);
            if (messages.putIfAbsent(hash, outcome.bytes) != null) {
                duplicates++;
                log.debug("Row at line {} encodes identically to an earlier row ({})", outcome.line, hash);
            } else {
                log.debug("Row at line {} encoded as {}", outcome.line, hash);
            }
        }

        int rowsRead = table.getRecords().size();
        log.info("{} rows read and converted to BUFR ({} unique messages, {} failed)",
                rowsRead, messages.size(), rowsRead - encoded);

        return result
                .messages(Collections.unmodifiableMap(messages))
                .rowsRead(rowsRead)
                .rowsEncoded(encoded)
                .duplicateMessages(duplicates)
                .build();
    }

    private static final class RowOutcome {
        final int line;
        final byte[] bytes;
        final Csv2BufrException error;
        final TransformDiagnostics diagnostics;

        RowOutcome(int line, byte[] bytes, Csv2BufrException error, TransformDiagnostics diagnostics) {
            this.line = line;
            this.bytes = bytes;
            this.error = error;
            this.diagnostics = diagnostics;
        }

        boolean failed() {
            return error != null;
        }
    }
}
