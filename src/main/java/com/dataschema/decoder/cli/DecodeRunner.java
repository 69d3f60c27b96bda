package com.dataschema.decoder.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataschema.decoder.catalog.SchemaCatalog;
import com.dataschema.decoder.cli.model.DecodeResult;
import com.dataschema.decoder.cli.model.DecoderConfig;
import com.dataschema.decoder.cli.output.DecodeResultsPrinter;
import com.dataschema.decoder.decoder.RecordOutcome;
import com.dataschema.decoder.exception.SchemaException;
import com.dataschema.decoder.model.SourceSchema;
import com.dataschema.decoder.source.DirectoryLineSource;
import com.dataschema.decoder.source.LineSource;

import lombok.RequiredArgsConstructor;

/**
 * Loads the catalog and decodes one source from the data root. Acts as the
 * batch layer around the core: it supplies the lines and decides what happens
 * to records that fail to decode.
 */
@RequiredArgsConstructor
public class DecodeRunner {
    private static final Logger log = LoggerFactory.getLogger(DecodeRunner.class);

    private final DecoderConfig config;
    private final DecodeResultsPrinter printer;

    public DecodeResult run() {
        SchemaCatalog catalog;
        try {
            catalog = SchemaCatalog.builder()
                    .schemaFile(config.getSchemaFile())
                    .dataRoot(config.getDataRoot())
                    .conflictPolicy(config.getConflictPolicy())
                    .schemaDelimiter(config.getSchemaDelimiter())
                    .recordDelimiter(config.getRecordDelimiter())
                    .load();
        } catch (IOException e) {
            log.debug("Schema file could not be read", e);
            return DecodeResult.failure("Could not open schema file '" + config.getSchemaFile() + "': " + e.getMessage());
        } catch (SchemaException e) {
            return DecodeResult.failure("Invalid schema: " + e.getMessage());
        }

        if (config.isListOnly()) {
            printer.printSources(catalog.listSources());
            return DecodeResult.builder()
                    .success(true)
                    .availableSources(catalog.listSources())
                    .build();
        }

        String source = config.getSource();
        if (!catalog.hasSource(source)) {
            return DecodeResult.builder()
                    .success(false)
                    .errorMessage("No source '" + source + "' found in schema.")
                    .source(source)
                    .availableSources(catalog.listSources())
                    .build();
        }

        return decodeSource(catalog, source);
    }

    private DecodeResult decodeSource(SchemaCatalog catalog, String source) {
        SourceSchema schema = catalog.schemaFor(source);
        String sourceDirectory = catalog.sourceDirectory(source);
        LineSource lines = new DirectoryLineSource(Path.of(sourceDirectory), config.getCharset());

        DecodeResult.DecodeResultBuilder result = DecodeResult.builder()
                .source(source)
                .sourceDirectory(sourceDirectory)
                .availableSources(catalog.listSources());

        long linesRead = 0;
        long decoded = 0;
        long rejected = 0;

        try (Stream<RecordOutcome> outcomes = catalog.streamSource(source, lines)) {
            Iterator<RecordOutcome> it = outcomes.iterator();
            while (it.hasNext()) {
                RecordOutcome outcome = it.next();
                linesRead++;

                if (outcome.isSuccess()) {
                    decoded++;
                    printer.printRecord(schema, outcome.orElseThrow());
                    if (!config.isUnlimited() && decoded >= config.getLimit()) {
                        break;
                    }
                    continue;
                }

                rejected++;
                if (config.isFailFast()) {
                    return result.success(false)
                            .errorMessage(outcome.getError().map(Throwable::getMessage).orElse("record rejected"))
                            .linesRead(linesRead)
                            .recordsDecoded(decoded)
                            .recordsFailed(rejected)
                            .build();
                }
                printer.printRejected(outcome);
            }
        } catch (IOException | UncheckedIOException e) {
            log.debug("Data files could not be read", e);
            return result.success(false)
                    .errorMessage("Something went wrong while opening and parsing '" + sourceDirectory + "': "
                            + e.getMessage())
                    .linesRead(linesRead)
                    .recordsDecoded(decoded)
                    .recordsFailed(rejected)
                    .build();
        }

        return result.success(true)
                .linesRead(linesRead)
                .recordsDecoded(decoded)
                .recordsFailed(rejected)
                .build();
    }
}
