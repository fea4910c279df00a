package com.csv2bufr.cli;

import com.csv2bufr.cli.exception.OptionsValidationException;
import com.csv2bufr.cli.model.TransformOptions;
import com.csv2bufr.cli.model.ValidatedTransformOptions;
import com.csv2bufr.cli.output.TransformResultsPrinter;
import com.csv2bufr.cli.validation.TransformOptionsValidator;
import com.csv2bufr.config.ErrorPolicy;
import com.csv2bufr.config.TransformConfig;
import com.csv2bufr.encoder.template.MessageTemplateRegistry;
import com.csv2bufr.encoder.template.TemplateBufrEncoder;
import com.csv2bufr.exception.Csv2BufrException;
import com.csv2bufr.mapping.MappingParser;
import com.csv2bufr.mapping.MappingSpec;
import com.csv2bufr.output.MessageFileWriter;
import com.csv2bufr.pipeline.TransformOrchestrator;
import com.csv2bufr.pipeline.TransformResult;
import com.csv2bufr.station.StationMetadata;
import com.csv2bufr.station.StationMetadataParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command converting a CSV file into one BUFR file per unique message.
 */
@Command(
        name = "transform",
        mixinStandardHelpOptions = true,
        version = "csv2bufr 0.1.0",
        description = "Converts rows of a CSV file into BUFR messages using a JSON mapping file and station metadata."
)
public class TransformCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TransformCommand.class);

    @Mixin
    private TransformOptions options = new TransformOptions();

    private final TransformOptionsValidator validator = new TransformOptionsValidator();
    private final TransformResultsPrinter printer = new TransformResultsPrinter();

    @Override
    public Integer call() {
        ValidatedTransformOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            TransformResult result = run(validated);
            List<Path> written = new MessageFileWriter(validated.getNormalizedOutputDir(), options.isForce())
                    .writeAll(result.getMessages());
            printer.printSummary(result, written);
            return result.isSuccess() ? 0 : 1;
        } catch (Csv2BufrException e) {
            printer.printFailure(e);
            return 1;
        } catch (IOException e) {
            log.error("I/O error", e);
            return 1;
        }
    }

    TransformResult run(ValidatedTransformOptions validated) throws IOException {
        MessageTemplateRegistry templates = new MessageTemplateRegistry();
        if (options.getTemplateFile() != null) {
            templates.register(options.getTemplateFile());
        }

        TransformConfig config = TransformConfig.builder()
                .nullifyOnFail(options.isNullifyInvalid())
                .errorPolicy(options.isContinueOnError() ? ErrorPolicy.SKIP_AND_CONTINUE : ErrorPolicy.FAIL_FAST)
                .template(options.getTemplate())
                .workers(options.getWorkers())
                .build();

        MappingSpec mapping = new MappingParser().parse(validated.getMappingFile());
        StationMetadata station = new StationMetadataParser().parse(validated.getStationMetadataFile());
        String csv = Files.readString(validated.getInputFile());

        TransformOrchestrator orchestrator = new TransformOrchestrator(new TemplateBufrEncoder(templates), config);
        return orchestrator.transform(csv, mapping, station);
    }
}
