package com.dataschema.decoder;

import com.dataschema.decoder.cli.DecodeCommand;
import picocli.CommandLine;

/**
 * Main entry point for the schema record decoder.
 * Loads a schema description, lists its data sources and decodes the records
 * of one source from the data root.
 */
public class DecoderApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DecodeCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
