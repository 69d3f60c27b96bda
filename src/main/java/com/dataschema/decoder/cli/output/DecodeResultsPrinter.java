package com.dataschema.decoder.cli.output;

import java.util.List;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataschema.decoder.cli.model.DecodeResult;
import com.dataschema.decoder.cli.model.DecoderConfig;
import com.dataschema.decoder.decoder.RecordOutcome;
import com.dataschema.decoder.model.DecodedRecord;
import com.dataschema.decoder.model.FieldDescriptor;
import com.dataschema.decoder.model.SourceSchema;
import com.dataschema.decoder.model.TypedValue;

/**
 * Responsible only for printing CLI output for the decode command.
 * No validation, no execution.
 */
public class DecodeResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(DecodeResultsPrinter.class);

    public void printBanner(DecoderConfig config) {
        log.info("=================================================");
        log.info("Schema Record Decoder");
        log.info("=================================================");
        log.info("Schema File: {}", config.getSchemaFile().toAbsolutePath());
        log.info("Data Root: {}", config.getDataRoot() != null ? config.getDataRoot() : "schema file folder");
        log.info("Source: {}", config.isListOnly() ? "None (listing sources)" : config.getSource());
        if (!config.isListOnly()) {
            log.info("Limit: {}", config.isUnlimited() ? "all records" : config.getLimit());
            log.info("Fail Fast: {}", config.isFailFast());
        }
        log.info("File Pattern Conflicts: {}", config.getConflictPolicy());
        log.info("=================================================");
    }

    public void printSources(List<String> sources) {
        log.info("Sources present in schema:");
        for (String source : sources) {
            log.info("- {}", source);
        }
    }

    public void printRecord(SourceSchema schema, DecodedRecord record) {
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (FieldDescriptor field : schema.getFields()) {
            joiner.add(field.getLabel() + "=" + record.get(field.getPosition()).map(TypedValue::toText).orElse("-"));
        }
        log.info("line {}: {}", record.getLineNumber(), joiner);
    }

    public void printRejected(RecordOutcome outcome) {
        outcome.getError().ifPresent(e -> log.warn("Skipping record: {}", e.getMessage()));
    }

    public void printSuccess(DecodeResult result) {
        log.info("=================================================");
        log.info("DECODE SUMMARY");
        log.info("=================================================");
        log.info("Source: {}", result.getSource());
        log.info("Source Directory: {}", result.getSourceDirectory());
        log.info("Lines Read: {}", result.getLinesRead());
        log.info("Records Decoded: {}", result.getRecordsDecoded());
        log.info("Records Rejected: {}", result.getRecordsFailed());
        log.info("=================================================");
    }

    public void printFailure(DecodeResult result) {
        log.error("Decode failed: {}", result.getErrorMessage());
        if (result.getAvailableSources() != null && !result.getAvailableSources().isEmpty()) {
            printSources(result.getAvailableSources());
        }
    }
}
