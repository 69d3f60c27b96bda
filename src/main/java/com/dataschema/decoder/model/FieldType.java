package com.dataschema.decoder.model;

import java.util.Optional;

/**
 * Declared field types accepted in the schema {@code format} column.
 */
public enum FieldType {
    /**
     * Free text or an opaque hash, kept as-is.
     */
    STRING_HASH,

    /**
     * Signed base-10 integer.
     */
    INTEGER,

    /**
     * Decimal floating point number.
     */
    FLOAT,

    /**
     * Integer flag: zero is false, anything else is true.
     */
    BOOLEAN,

    /**
     * Integer when the text parses as one, otherwise the raw text.
     */
    STRING_HASH_OR_INTEGER;

    public static Optional<FieldType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim();
        for (FieldType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
