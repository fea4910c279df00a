package com.csv2bufr.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "transform" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class TransformOptions {

	@Option(names = { "--mapping", "-m" }, required = true,
			description = "JSON file mapping from CSV to BUFR (resolved against --config-dir when relative and not found)")
	private Path mapping;

	@Option(names = { "--input", "-i" }, required = true, description = "CSV file containing data to encode")
	private Path input;

	@Option(names = { "--output-dir", "-o" }, description = "Directory for the BUFR files (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--wigos-id", "-w" },
			description = "WIGOS station identifier, hyphen separated, e.g. 0-20000-0-ABCDEF")
	private String wigosId;

	@Option(names = { "--config-dir", "-c" },
			description = "Directory holding the mapping file and <wigos-id>.json station metadata")
	private Path configDir;

	@Option(names = { "--station-metadata", "-s" },
			description = "Station metadata JSON file (overrides <config-dir>/<wigos-id>.json)")
	private Path stationMetadata;

	@Option(names = { "--nullify-invalid" }, arity = "1", defaultValue = "${env:CSV2BUFR_NULLIFY_INVALID:-true}",
			description = "true: set out-of-range values to missing; false: fail the row (default: ${DEFAULT-VALUE})")
	private boolean nullifyInvalid;

	@Option(names = { "--continue-on-error" },
			description = "Skip rows that fail to encode instead of aborting the whole file")
	private boolean continueOnError;

	@Option(names = { "--template", "-t" }, defaultValue = "BUFR4", description = "Message template name (default: ${DEFAULT-VALUE})")
	private String template;

	@Option(names = { "--template-file" }, description = "JSON template file to register before encoding")
	private Path templateFile;

	@Option(names = { "--workers" }, defaultValue = "1", description = "Rows encoded in parallel (default: ${DEFAULT-VALUE})")
	private int workers;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;
}
