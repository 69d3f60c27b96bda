package com.dataschema.decoder.decoder;

import com.dataschema.decoder.model.TypedValue;

/**
 * Turns the raw text of one field into a typed value.
 *
 * Implementations are pure. A {@code null} result means the field is absent.
 */
@FunctionalInterface
public interface ValueDecoder {

    TypedValue decode(String raw);
}
