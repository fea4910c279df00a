package com.csv2bufr.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.csv2bufr.cli.model.TransformOptions;
import com.csv2bufr.cli.model.ValidatedTransformOptions;
import com.csv2bufr.pipeline.RowError;
import com.csv2bufr.pipeline.TransformResult;

/**
 * Responsible only for printing CLI output for the "transform" command.
 * No validation, no execution.
 */
public class TransformResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TransformResultsPrinter.class);

    public void printBanner(TransformOptions o, ValidatedTransformOptions v) {
        log.info("=================================================");
        log.info("csv2bufr");
        log.info("=================================================");
        log.info("Input: {}", v.getInputFile().toAbsolutePath());
        log.info("Mapping: {}", v.getMappingFile().toAbsolutePath());
        log.info("Station Metadata: {}", v.getStationMetadataFile().toAbsolutePath());
        log.info("WIGOS Station Identifier: {}", o.getWigosId() != null ? o.getWigosId() : "None");
        log.info("Template: {}", o.getTemplate());
        log.info("Nullify Invalid Values: {}", o.isNullifyInvalid());
        log.info("Continue On Error: {}", o.isContinueOnError());
        log.info("Workers: {}", o.getWorkers());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printSummary(TransformResult result, List<Path> written) {
        log.info("");
        log.info("=================================================");
        log.info(result.isSuccess() ? "TRANSFORM SUCCESSFUL" : "TRANSFORM COMPLETED WITH ERRORS");
        log.info("=================================================");
        log.info("Rows Read: {}", result.getRowsRead());
        log.info("Rows Encoded: {}", result.getRowsEncoded());
        log.info("Unique Messages: {}", result.getMessageCount());
        if (result.getDuplicateMessages() > 0) {
            log.info("Identical Messages Collapsed: {}", result.getDuplicateMessages());
        }
        log.info("Warnings: {}", result.getWarnings().size());
        log.info("Files Written: {}", written.size());
        for (Path file : written) {
            log.info("  {}", file);
        }

        if (!result.isSuccess()) {
            log.info("");
            log.info("Failed Rows:");
            for (RowError error : result.getRowErrors()) {
                log.error("  line {}: {} - {}", error.getLineNumber(), error.getErrorType(), error.getMessage());
            }
        }
        log.info("=================================================");
    }

    public void printFailure(Exception e) {
        log.error("Transform failed: {}", e.getMessage());
        if (e.getCause() != null && e.getCause() != e) {
            log.error("Caused by: {}", e.getCause().getMessage());
        }
    }
}
