package com.dataschema.decoder.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataschema.decoder.cli.exception.OptionsValidationException;
import com.dataschema.decoder.cli.model.DecodeOptions;
import com.dataschema.decoder.cli.model.DecodeResult;
import com.dataschema.decoder.cli.model.DecoderConfig;
import com.dataschema.decoder.cli.output.DecodeResultsPrinter;
import com.dataschema.decoder.cli.validation.DecodeOptionsValidator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that lists the sources of a schema or decodes the records of one source.
 */
@Command(
        name = "schema-decode",
        mixinStandardHelpOptions = true,
        version = "schema-record-decoder 1.0.0",
        description = "Compiles a schema description and decodes the delimited records of one of its sources."
)
public class DecodeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DecodeCommand.class);

    @Mixin
    private DecodeOptions options;

    private final DecodeOptionsValidator validator = new DecodeOptionsValidator();
    private final DecodeResultsPrinter printer = new DecodeResultsPrinter();

    @Override
    public Integer call() {
        DecoderConfig config;
        try {
            config = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 2;
        }

        try {
            printer.printBanner(config);

            DecodeResult result = new DecodeRunner(config, printer).run();
            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }
            if (!config.isListOnly()) {
                printer.printSuccess(result);
            }
            return 0;

        } catch (Exception e) {
            log.error("Decode failed with exception", e);
            return 1;
        }
    }
}
