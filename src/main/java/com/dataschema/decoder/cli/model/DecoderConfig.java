package com.dataschema.decoder.cli.model;

import java.nio.charset.Charset;
import java.nio.file.Path;

import com.dataschema.decoder.schema.PatternConflictPolicy;

import lombok.Builder;
import lombok.Data;

/**
 * Validated configuration of one decode run.
 */
@Data
@Builder
public class DecoderConfig {
    private Path schemaFile;
    /** {@code null} means the schema file's folder. */
    private String dataRoot;
    /** {@code null} means list the sources only. */
    private String source;
    private int limit;
    private boolean failFast;
    private PatternConflictPolicy conflictPolicy;
    private String recordDelimiter;
    private char schemaDelimiter;
    private Charset charset;

    public boolean isListOnly() {
        return source == null;
    }

    public boolean isUnlimited() {
        return limit == 0;
    }
}
