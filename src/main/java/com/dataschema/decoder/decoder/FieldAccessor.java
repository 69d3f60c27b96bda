package com.dataschema.decoder.decoder;

import java.util.List;
import java.util.Optional;

import com.dataschema.decoder.model.DecodedRecord;
import com.dataschema.decoder.model.TypedValue;

import lombok.NonNull;
import lombok.Value;

/**
 * Reads one named column out of an already decoded record. The position is
 * resolved when the accessor is built, not on every read.
 */
@Value
public class FieldAccessor {

    @NonNull
    String label;

    int position;

    public Optional<TypedValue> get(DecodedRecord record) {
        return record.get(position);
    }

    /**
     * Same as {@link #get(DecodedRecord)} for a plain ordered value list where
     * absent values are {@code null}.
     */
    public Optional<TypedValue> get(List<TypedValue> values) {
        return Optional.ofNullable(values.get(position));
    }
}
