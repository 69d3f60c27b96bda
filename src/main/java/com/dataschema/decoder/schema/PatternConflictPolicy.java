package com.dataschema.decoder.schema;

/**
 * What to do when rows of the same source declare different file patterns.
 */
public enum PatternConflictPolicy {
    /**
     * Keep the pattern of the first row seen for the source and log a warning.
     */
    FIRST_WINS,

    /**
     * Reject the schema.
     */
    FAIL
}
