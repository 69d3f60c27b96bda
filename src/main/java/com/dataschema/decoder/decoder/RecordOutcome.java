package com.dataschema.decoder.decoder;

import java.util.Optional;

import com.dataschema.decoder.exception.RecordDecodingException;
import com.dataschema.decoder.model.DecodedRecord;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of decoding one line of a stream: either a record or the error that
 * rejected it. The caller decides whether to skip, log or abort.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RecordOutcome {

    long lineNumber;
    String rawLine;
    DecodedRecord record;
    RecordDecodingException error;

    public static RecordOutcome success(long lineNumber, String rawLine, DecodedRecord record) {
        return new RecordOutcome(lineNumber, rawLine, record, null);
    }

    public static RecordOutcome failure(long lineNumber, String rawLine, RecordDecodingException error) {
        return new RecordOutcome(lineNumber, rawLine, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public Optional<DecodedRecord> getRecord() {
        return Optional.ofNullable(record);
    }

    public Optional<RecordDecodingException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the record, or rethrows the decoding error.
     */
    public DecodedRecord orElseThrow() {
        if (error != null) {
            throw error;
        }
        return record;
    }
}
