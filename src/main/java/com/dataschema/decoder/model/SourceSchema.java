package com.dataschema.decoder.model;

import java.util.List;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * Compiled schema of one data source: its file pattern and its fields in
 * position order. Immutable.
 */
@Value
public class SourceSchema {

    @NonNull
    String sourceKey;

    @NonNull
    String filePattern;

    @NonNull
    List<FieldDescriptor> fields;

    public SourceSchema(@NonNull String sourceKey, @NonNull String filePattern, @NonNull List<FieldDescriptor> fields) {
        this.sourceKey = sourceKey;
        this.filePattern = filePattern;
        this.fields = List.copyOf(fields);
    }

    public int fieldCount() {
        return fields.size();
    }

    public FieldDescriptor field(int position) {
        return fields.get(position);
    }

    public List<String> labels() {
        return fields.stream().map(FieldDescriptor::getLabel).toList();
    }

    public Optional<FieldDescriptor> findField(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return fields.stream().filter(f -> f.getLabel().equals(label)).findFirst();
    }
}
