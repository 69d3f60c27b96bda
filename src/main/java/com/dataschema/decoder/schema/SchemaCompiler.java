package com.dataschema.decoder.schema;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataschema.decoder.decoder.TypeDecoderRegistry;
import com.dataschema.decoder.exception.SchemaException;
import com.dataschema.decoder.exception.UnknownTypeException;
import com.dataschema.decoder.model.FieldDescriptor;
import com.dataschema.decoder.model.FieldType;
import com.dataschema.decoder.model.SourceSchema;

import lombok.NonNull;

/**
 * Compiles flat schema rows into one {@link SourceSchema} per data source.
 *
 * Compilation is all-or-nothing: the first malformed row aborts it with a
 * {@link SchemaException} and nothing is returned.
 *
 * Rules:
 * - source key = part of {@code file pattern} before the first {@code /}
 * - position = {@code field number} - 1
 * - mandatory only for the literal {@code YES}
 * - per source, positions must be unique and contiguous from 0, labels unique
 */
public class SchemaCompiler {
    private static final Logger log = LoggerFactory.getLogger(SchemaCompiler.class);

    public static final String MANDATORY_YES = "YES";

    private final TypeDecoderRegistry registry;
    private final PatternConflictPolicy conflictPolicy;

    public SchemaCompiler() {
        this(TypeDecoderRegistry.standard(), PatternConflictPolicy.FIRST_WINS);
    }

    public SchemaCompiler(@NonNull TypeDecoderRegistry registry, @NonNull PatternConflictPolicy conflictPolicy) {
        this.registry = registry;
        this.conflictPolicy = conflictPolicy;
    }

    public Map<String, SourceSchema> compile(@NonNull List<Map<String, String>> rawRows) {
        Map<String, String> patternsBySource = new LinkedHashMap<>();
        Map<String, List<FieldDescriptor>> fieldsBySource = new LinkedHashMap<>();
        Map<FieldDescriptor, Integer> rowNumbers = new IdentityHashMap<>();

        int rowNum = 0;
        for (Map<String, String> rawRow : rawRows) {
            rowNum++;
            if (rawRow == null) {
                throw new SchemaException("Schema row " + rowNum + ": row is missing");
            }
            SchemaRow row = new SchemaRow(rowNum, rawRow);

            String filePattern = row.requireNonBlank(SchemaRow.FILE_PATTERN);
            String sourceKey = sourceKeyOf(filePattern);
            if (sourceKey.isBlank()) {
                throw row.error("file pattern '" + filePattern + "' has no source folder before the first '/'");
            }

            String knownPattern = patternsBySource.putIfAbsent(sourceKey, filePattern);
            if (knownPattern != null && !knownPattern.equals(filePattern)) {
                handlePatternConflict(row, sourceKey, knownPattern, filePattern);
            }

            FieldDescriptor field = compileField(row);
            fieldsBySource.computeIfAbsent(sourceKey, k -> new ArrayList<>()).add(field);
            rowNumbers.put(field, rowNum);
            log.debug("Schema row {}: {} -> position {} {} ({})", rowNum, sourceKey, field.getPosition(),
                    field.getLabel(), field.getDeclaredType());
        }

        Map<String, SourceSchema> sources = new LinkedHashMap<>();
        for (Map.Entry<String, List<FieldDescriptor>> entry : fieldsBySource.entrySet()) {
            String sourceKey = entry.getKey();
            List<FieldDescriptor> fields = entry.getValue();
            fields.sort(Comparator.comparingInt(FieldDescriptor::getPosition));
            checkFields(sourceKey, fields, rowNumbers);

            sources.put(sourceKey, new SourceSchema(sourceKey, patternsBySource.get(sourceKey), fields));
            log.debug("Compiled source '{}' ({}): {} field(s)", sourceKey, patternsBySource.get(sourceKey),
                    fields.size());
        }
        return sources;
    }

    /**
     * Part of a file pattern before its first {@code /}; the whole pattern when it has none.
     */
    public static String sourceKeyOf(String filePattern) {
        int slash = filePattern.indexOf('/');
        return slash < 0 ? filePattern : filePattern.substring(0, slash);
    }

    private FieldDescriptor compileField(SchemaRow row) {
        String label = row.requireNonBlank(SchemaRow.CONTENT);
        int position = parsePosition(row);
        String format = row.require(SchemaRow.FORMAT);

        FieldType type;
        try {
            type = FieldType.fromTag(format)
                    .orElseThrow(() -> new UnknownTypeException(format, registry.supportedTags()));
        } catch (UnknownTypeException e) {
            throw row.error(e.getMessage(), e);
        }

        boolean mandatory = row.get(SchemaRow.MANDATORY).map(MANDATORY_YES::equals).orElse(false);

        return FieldDescriptor.builder()
                .position(position)
                .label(label)
                .declaredType(type)
                .decoder(registry.decoderFor(type))
                .mandatory(mandatory)
                .build();
    }

    private int parsePosition(SchemaRow row) {
        String raw = row.require(SchemaRow.FIELD_NUMBER);
        int fieldNumber;
        try {
            fieldNumber = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw row.error("field number '" + raw + "' is not an integer", e);
        }
        if (fieldNumber < 1) {
            throw row.error("field number must be at least 1. Got: " + fieldNumber);
        }
        return fieldNumber - 1;
    }

    private void handlePatternConflict(SchemaRow row, String sourceKey, String knownPattern, String filePattern) {
        if (conflictPolicy == PatternConflictPolicy.FAIL) {
            throw row.error("source '" + sourceKey + "' declares file pattern '" + filePattern
                    + "' but an earlier row declared '" + knownPattern + "'");
        }
        log.warn("Schema row {}: source '{}' declares file pattern '{}'; keeping earlier pattern '{}'",
                row.getRowNumber(), sourceKey, filePattern, knownPattern);
    }

    /**
     * Expects {@code fields} sorted by position. Duplicates are reported before gaps.
     */
    private void checkFields(String sourceKey, List<FieldDescriptor> fields, Map<FieldDescriptor, Integer> rowNumbers) {
        Set<String> labels = new HashSet<>();
        for (int i = 0; i < fields.size(); i++) {
            FieldDescriptor field = fields.get(i);
            if (i > 0 && fields.get(i - 1).getPosition() == field.getPosition()) {
                throw new SchemaException(rowPrefix(rowNumbers, field, sourceKey) + "duplicate field number "
                        + (field.getPosition() + 1) + " ('" + fields.get(i - 1).getLabel() + "' and '"
                        + field.getLabel() + "')");
            }
            if (!labels.add(field.getLabel())) {
                throw new SchemaException(rowPrefix(rowNumbers, field, sourceKey) + "duplicate field label '"
                        + field.getLabel() + "'");
            }
        }
        for (int i = 0; i < fields.size(); i++) {
            FieldDescriptor field = fields.get(i);
            if (field.getPosition() != i) {
                throw new SchemaException(rowPrefix(rowNumbers, field, sourceKey) + "field number " + (i + 1)
                        + " is missing (next declared is " + (field.getPosition() + 1) + ")");
            }
        }
    }

    private static String rowPrefix(Map<FieldDescriptor, Integer> rowNumbers, FieldDescriptor field, String sourceKey) {
        return "Schema row " + rowNumbers.get(field) + ": source '" + sourceKey + "': ";
    }
}
