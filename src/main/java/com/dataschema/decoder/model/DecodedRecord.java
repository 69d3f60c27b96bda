package com.dataschema.decoder.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One record decoded against a {@link SourceSchema}: values in position order,
 * absent fields held as {@code null}.
 */
@Getter
@ToString
@EqualsAndHashCode
public class DecodedRecord {

    private final String sourceKey;

    /**
     * 1-based line number in the line source, 0 when unknown.
     */
    private final long lineNumber;

    @Getter(AccessLevel.NONE)
    private final TypedValue[] values;

    public DecodedRecord(String sourceKey, long lineNumber, TypedValue[] values) {
        this.sourceKey = sourceKey;
        this.lineNumber = lineNumber;
        this.values = values.clone();
    }

    public int size() {
        return values.length;
    }

    public Optional<TypedValue> get(int position) {
        return Optional.ofNullable(values[position]);
    }

    public boolean isAbsent(int position) {
        return values[position] == null;
    }

    /**
     * Unmodifiable view of the values; absent fields are {@code null}.
     */
    public List<TypedValue> values() {
        return Collections.unmodifiableList(Arrays.asList(values));
    }
}
