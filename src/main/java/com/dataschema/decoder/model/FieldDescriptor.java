package com.dataschema.decoder.model;

import com.dataschema.decoder.decoder.ValueDecoder;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Compiled metadata for one column of a data source.
 */
@Value
@Builder(toBuilder = true)
public class FieldDescriptor {

    /**
     * Zero-based index of the field within a record.
     */
    int position;

    /**
     * Field name, taken from the schema {@code content} column.
     */
    @NonNull
    String label;

    @NonNull
    FieldType declaredType;

    @NonNull
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    ValueDecoder decoder;

    /**
     * Advisory: the schema says the field always carries a value.
     */
    boolean mandatory;

    /**
     * Decodes the raw token of this field; {@code null} means absent.
     */
    public TypedValue decode(String raw) {
        return decoder.decode(raw);
    }
}
