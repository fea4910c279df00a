package com.csv2bufr.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.csv2bufr.cli.exception.OptionsValidationException;
import com.csv2bufr.cli.model.TransformOptions;
import com.csv2bufr.cli.model.ValidatedTransformOptions;
import com.csv2bufr.station.StationMetadataParser;

public class TransformOptionsValidator {

	// series-issuer-issue number-local identifier, e.g. 0-20000-0-ABCDEF
	private static final Pattern WIGOS_ID = Pattern.compile("^\\d+-\\d+-\\d+-[A-Za-z0-9_.]{1,16}$");

	public ValidatedTransformOptions validate(TransformOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getConfigDir() != null && !existsDirectory(o.getConfigDir())) {
			errors.add("Config directory does not exist or is not a directory: " + o.getConfigDir());
		}

		Path inputFile = o.getInput();
		if (inputFile == null) {
			errors.add("Input CSV file is required (--input / -i).");
		} else if (!existsFile(inputFile)) {
			errors.add("Input file does not exist: " + inputFile);
		}

		Path mappingFile = resolveMapping(o, errors);
		Path stationFile = resolveStationMetadata(o, errors);

		if (o.getWigosId() != null && !WIGOS_ID.matcher(o.getWigosId()).matches()) {
			errors.add("WIGOS station identifier must look like 0-20000-0-ABCDEF. Got: " + o.getWigosId());
		}

		if (isBlank(o.getTemplate())) {
			errors.add("Template name must not be blank (--template / -t).");
		}
		if (o.getTemplateFile() != null && !existsFile(o.getTemplateFile())) {
			errors.add("Template file does not exist: " + o.getTemplateFile());
		}

		if (o.getWorkers() < 1) {
			errors.add("Workers must be >= 1. Got: " + o.getWorkers());
		}

		// Normalize output dir
		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedTransformOptions(mappingFile, inputFile, stationFile, normalizedOutputDir);
	}

	private static Path resolveMapping(TransformOptions o, List<String> errors) {
		Path mapping = o.getMapping();
		if (mapping == null) {
			errors.add("Mapping file is required (--mapping / -m).");
			return null;
		}
		if (existsFile(mapping)) {
			return mapping;
		}
		if (o.getConfigDir() != null && !mapping.isAbsolute() && existsFile(o.getConfigDir().resolve(mapping))) {
			return o.getConfigDir().resolve(mapping);
		}
		errors.add("Mapping file does not exist: " + mapping
				+ (o.getConfigDir() != null ? " (also looked in " + o.getConfigDir() + ")" : ""));
		return null;
	}

	private static Path resolveStationMetadata(TransformOptions o, List<String> errors) {
		if (o.getStationMetadata() != null) {
			if (!existsFile(o.getStationMetadata())) {
				errors.add("Station metadata file does not exist: " + o.getStationMetadata());
				return null;
			}
			return o.getStationMetadata();
		}
		if (isBlank(o.getWigosId()) || o.getConfigDir() == null) {
			errors.add("Either --station-metadata or both --wigos-id and --config-dir must be provided.");
			return null;
		}
		Path stationFile = StationMetadataParser.resolve(o.getConfigDir(), o.getWigosId());
		if (!existsFile(stationFile)) {
			errors.add("Station metadata file does not exist: " + stationFile);
			return null;
		}
		return stationFile;
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.isRegularFile(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
