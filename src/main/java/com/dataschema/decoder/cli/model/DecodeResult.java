package com.dataschema.decoder.cli.model;

import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a decode run.
 */
@Data
@Builder
public class DecodeResult {
    private boolean success;
    private String errorMessage;
    private String source;
    private String sourceDirectory;
    private long linesRead;
    private long recordsDecoded;
    private long recordsFailed;
    private List<String> availableSources;

    public static DecodeResult failure(String message) {
        return DecodeResult.builder()
                .success(false)
                .errorMessage(message)
                .availableSources(List.of())
                .build();
    }
}
