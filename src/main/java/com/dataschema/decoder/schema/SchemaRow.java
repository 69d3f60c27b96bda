package com.dataschema.decoder.schema;

import java.util.Map;
import java.util.Optional;

import com.dataschema.decoder.exception.SchemaException;

import lombok.NonNull;
import lombok.Value;

/**
 * One raw row of the schema description, keyed by column header.
 */
@Value
public class SchemaRow {

    public static final String FIELD_NUMBER = "field number";
    public static final String CONTENT = "content";
    public static final String FORMAT = "format";
    public static final String MANDATORY = "mandatory";
    public static final String FILE_PATTERN = "file pattern";

    /**
     * 1-based index of the row among the data rows (header excluded).
     */
    int rowNumber;

    @NonNull
    Map<String, String> columns;

    public Optional<String> get(String column) {
        return Optional.ofNullable(columns.get(column));
    }

    public String require(String column) {
        String value = columns.get(column);
        if (value == null) {
            throw error("missing column '" + column + "'");
        }
        return value;
    }

    public String requireNonBlank(String column) {
        String value = require(column);
        if (value.isBlank()) {
            throw error("column '" + column + "' is empty");
        }
        return value;
    }

    public SchemaException error(String message) {
        return new SchemaException("Schema row " + rowNumber + ": " + message);
    }

    public SchemaException error(String message, Throwable cause) {
        return new SchemaException("Schema row " + rowNumber + ": " + message, cause);
    }
}
