package com.csv2bufr.pipeline;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostics sink handed to a single pipeline invocation.
 *
 * Every message is logged through the supplied logger and kept, so a caller can report warnings
 * per row without reading shared logger state. Not thread-safe; use one instance per row.
 */
@Getter
public class TransformDiagnostics {

    private final Logger logger;
    private final String context;
    private final List<String> warnings = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    public TransformDiagnostics(Logger logger, String context) {
        this.logger = logger;
        this.context = context;
    }

    public static TransformDiagnostics forRow(int lineNumber) {
        return new TransformDiagnostics(LoggerFactory.getLogger(RowPipeline.class), "line " + lineNumber);
    }

    public static TransformDiagnostics detached() {
        return new TransformDiagnostics(LoggerFactory.getLogger(TransformDiagnostics.class), null);
    }

    public void debug(String format, Object... args) {
        if (logger.isDebugEnabled()) {
            logger.debug(prefix() + format, args);
        }
    }

    public void warn(String message) {
        warnings.add(message);
        logger.warn("{}{}", prefix(), message);
    }

    public void error(String message) {
        errors.add(message);
        logger.error("{}{}", prefix(), message);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    private String prefix() {
        return context == null ? "" : "[" + context + "] ";
    }
}
