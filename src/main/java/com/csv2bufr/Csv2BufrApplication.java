package com.csv2bufr;

import com.csv2bufr.cli.TransformCommand;
import picocli.CommandLine;

/**
 * Main entry point for csv2bufr.
 * Converts tabular observation records into BUFR messages, one message per CSV row,
 * driven by a JSON mapping file and per-station metadata.
 */
public class Csv2BufrApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TransformCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
