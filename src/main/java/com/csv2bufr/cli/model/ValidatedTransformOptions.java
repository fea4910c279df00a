package com.csv2bufr.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps TransformCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedTransformOptions {
    Path mappingFile;
    Path inputFile;
    Path stationMetadataFile;
    Path normalizedOutputDir;
}
