package com.dataschema.decoder.decoder;

import java.io.IOException;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.dataschema.decoder.exception.FieldCountException;
import com.dataschema.decoder.exception.FieldFormatException;
import com.dataschema.decoder.exception.RecordDecodingException;
import com.dataschema.decoder.model.DecodedRecord;
import com.dataschema.decoder.model.FieldDescriptor;
import com.dataschema.decoder.model.SourceSchema;
import com.dataschema.decoder.model.TypedValue;
import com.dataschema.decoder.source.LineSource;

import lombok.Getter;
import lombok.NonNull;
import lombok.Value;

/**
 * Decodes delimited text lines of one data source.
 *
 * The split pattern and the field table are resolved once per source; a
 * decoder holds no mutable state and may be shared between threads.
 */
public class RecordDecoder {

    public static final String DEFAULT_DELIMITER = ",";

    @Getter
    private final SourceSchema schema;
    private final FieldDescriptor[] fields;
    private final Pattern splitter;

    public RecordDecoder(@NonNull SourceSchema schema) {
        this(schema, DEFAULT_DELIMITER);
    }

    public RecordDecoder(@NonNull SourceSchema schema, @NonNull String delimiter) {
        if (delimiter.isEmpty()) {
            throw new IllegalArgumentException("Record delimiter must not be empty");
        }
        this.schema = schema;
        this.fields = schema.getFields().toArray(new FieldDescriptor[0]);
        this.splitter = Pattern.compile(Pattern.quote(delimiter));
    }

    public DecodedRecord decode(String rawLine) {
        return decode(rawLine, 0);
    }

    /**
     * @param lineNumber 1-based line number used in error messages, 0 if unknown
     * @throws FieldCountException  when the token count differs from the field count
     * @throws FieldFormatException when a token does not match its declared type
     */
    public DecodedRecord decode(@NonNull String rawLine, long lineNumber) {
        String[] tokens = splitter.split(rawLine, -1);
        if (tokens.length != fields.length) {
            throw new FieldCountException(schema.getSourceKey(), lineNumber, fields.length, tokens.length);
        }

        TypedValue[] values = new TypedValue[fields.length];
        for (int i = 0; i < fields.length; i++) {
            FieldDescriptor field = fields[i];
            try {
                values[i] = field.decode(tokens[i]);
            } catch (FieldFormatException e) {
                throw e.withField(schema.getSourceKey(), lineNumber, field.getLabel(), field.getPosition());
            }
        }
        return new DecodedRecord(schema.getSourceKey(), lineNumber, values);
    }

    /**
     * Lazily decodes every line of {@code lines}. A line that fails to decode
     * becomes a failed outcome; it never ends the stream. Line numbers follow
     * the encounter order of {@code lines} and are assigned before decoding,
     * so they stay correct if the returned stream is made parallel. Closing
     * the returned stream closes {@code lines}.
     */
    public Stream<RecordOutcome> decodeAll(@NonNull Stream<String> lines) {
        return number(lines).map(line -> decodeOutcome(line.getText(), line.getNumber()));
    }

    /**
     * Decodes the lines supplied by {@code source}. The result is finite when the
     * source is, and can be requested again only when
     * {@link LineSource#isRestartable()} holds.
     */
    public Stream<RecordOutcome> streamSource(@NonNull LineSource source) throws IOException {
        return decodeAll(source.lines());
    }

    private RecordOutcome decodeOutcome(String line, long lineNumber) {
        try {
            return RecordOutcome.success(lineNumber, line, decode(line, lineNumber));
        } catch (RecordDecodingException e) {
            return RecordOutcome.failure(lineNumber, line, e);
        }
    }

    private static Stream<NumberedLine> number(Stream<String> lines) {
        Iterator<String> it = lines.iterator();
        Iterator<NumberedLine> numbered = new Iterator<>() {
            private long lineNumber;

            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public NumberedLine next() {
                return new NumberedLine(++lineNumber, it.next());
            }
        };
        Spliterator<NumberedLine> spliterator = Spliterators.spliteratorUnknownSize(numbered,
                Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(lines::close);
    }

    @Value
    private static class NumberedLine {
        long number;
        String text;
    }
}
