package com.dataschema.decoder.catalog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataschema.decoder.decoder.FieldAccessor;
import com.dataschema.decoder.decoder.RecordDecoder;
import com.dataschema.decoder.decoder.RecordOutcome;
import com.dataschema.decoder.decoder.TypeDecoderRegistry;
import com.dataschema.decoder.exception.UnknownFieldException;
import com.dataschema.decoder.exception.UnknownSourceException;
import com.dataschema.decoder.model.DecodedRecord;
import com.dataschema.decoder.model.FieldDescriptor;
import com.dataschema.decoder.model.SourceSchema;
import com.dataschema.decoder.schema.PatternConflictPolicy;
import com.dataschema.decoder.schema.SchemaCompiler;
import com.dataschema.decoder.schema.SchemaRowReader;
import com.dataschema.decoder.source.LineSource;

import lombok.Getter;
import lombok.NonNull;

/**
 * All compiled data sources of one schema description, plus the data root
 * their files live under.
 *
 * Read-only once built. Every catalog owns its own source map and decoders;
 * nothing is shared between instances.
 */
public class SchemaCatalog {
    private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

    public static final String SEPARATOR = "/";

    /**
     * Base path of the source folders, always ending with {@code /}.
     */
    @Getter
    private final String dataRoot;

    private final Map<String, SourceSchema> sources;
    private final Map<String, RecordDecoder> decoders;

    private SchemaCatalog(String dataRoot, Map<String, SourceSchema> sources, String recordDelimiter) {
        this.dataRoot = dataRoot;
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));

        Map<String, RecordDecoder> byKey = new LinkedHashMap<>();
        for (SourceSchema schema : sources.values()) {
            byKey.put(schema.getSourceKey(), new RecordDecoder(schema, recordDelimiter));
        }
        this.decoders = Collections.unmodifiableMap(byKey);
    }

    /**
     * Loads a schema file; the data root is the folder holding the schema file.
     *
     * @throws IOException when the schema file cannot be read
     */
    public static SchemaCatalog load(Path schemaFile) throws IOException {
        return load(schemaFile, null);
    }

    public static SchemaCatalog load(Path schemaFile, String dataRoot) throws IOException {
        return load(schemaFile, dataRoot, PatternConflictPolicy.FIRST_WINS);
    }

    public static SchemaCatalog load(@NonNull Path schemaFile, String dataRoot, @NonNull PatternConflictPolicy policy)
            throws IOException {
        return builder()
                .schemaFile(schemaFile)
                .dataRoot(dataRoot)
                .conflictPolicy(policy)
                .load();
    }

    public static SchemaCatalog of(List<Map<String, String>> schemaRows, @NonNull String dataRoot) {
        return of(schemaRows, dataRoot, PatternConflictPolicy.FIRST_WINS);
    }

    public static SchemaCatalog of(List<Map<String, String>> schemaRows, @NonNull String dataRoot,
            @NonNull PatternConflictPolicy policy) {
        return builder()
                .dataRoot(dataRoot)
                .conflictPolicy(policy)
                .build(schemaRows);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Source keys in sorted order, for diagnostics.
     */
    public List<String> listSources() {
        return sources.keySet().stream().sorted().toList();
    }

    public boolean hasSource(String sourceKey) {
        return sources.containsKey(sourceKey);
    }

    /**
     * @throws UnknownSourceException carrying {@link #listSources()}
     */
    public SourceSchema schemaFor(String sourceKey) {
        SourceSchema schema = sources.get(sourceKey);
        if (schema == null) {
            throw new UnknownSourceException(sourceKey, listSources());
        }
        return schema;
    }

    /**
     * @throws UnknownFieldException when the source has no field with this label
     */
    public int indexOfField(String sourceKey, String label) {
        SourceSchema schema = schemaFor(sourceKey);
        return schema.findField(label)
                .map(FieldDescriptor::getPosition)
                .orElseThrow(() -> new UnknownFieldException(sourceKey, label, schema.labels()));
    }

    /**
     * One accessor per field, keyed by label, in position order.
     */
    public Map<String, FieldAccessor> fieldAccessors(String sourceKey) {
        Map<String, FieldAccessor> accessors = new LinkedHashMap<>();
        for (FieldDescriptor field : schemaFor(sourceKey).getFields()) {
            accessors.put(field.getLabel(), new FieldAccessor(field.getLabel(), field.getPosition()));
        }
        return Collections.unmodifiableMap(accessors);
    }

    public FieldAccessor fieldAccessor(String sourceKey, String label) {
        return new FieldAccessor(label, indexOfField(sourceKey, label));
    }

    /**
     * Decoder resolved when the catalog was built; repeated calls return the same instance.
     */
    public RecordDecoder decoderFor(String sourceKey) {
        RecordDecoder decoder = decoders.get(sourceKey);
        if (decoder == null) {
            throw new UnknownSourceException(sourceKey, listSources());
        }
        return decoder;
    }

    public DecodedRecord decode(String sourceKey, String rawLine) {
        return decoderFor(sourceKey).decode(rawLine);
    }

    /**
     * Lazy decode of every line of {@code lineSource}. See {@link RecordDecoder#streamSource(LineSource)}.
     */
    public Stream<RecordOutcome> streamSource(String sourceKey, LineSource lineSource) throws IOException {
        return decoderFor(sourceKey).streamSource(lineSource);
    }

    /**
     * Folder expected to hold the data files of a source: {@code dataRoot + sourceKey + "/"}.
     */
    public String sourceDirectory(String sourceKey) {
        schemaFor(sourceKey);
        return dataRoot + sourceKey + SEPARATOR;
    }

    static String normalizeDataRoot(String dataRoot) {
        if (dataRoot.isEmpty()) {
            return "." + SEPARATOR;
        }
        return dataRoot.endsWith(SEPARATOR) ? dataRoot : dataRoot + SEPARATOR;
    }

    static String dataRootOf(Path schemaFile) {
        Path parent = schemaFile.getParent();
        if (parent == null) {
            return "." + SEPARATOR;
        }
        return normalizeDataRoot(parent.toString().replace('\\', '/'));
    }

    /**
     * Assembles a catalog from a schema file or in-memory rows.
     */
    public static class Builder {
        private Path schemaFile;
        private String dataRoot;
        private PatternConflictPolicy conflictPolicy = PatternConflictPolicy.FIRST_WINS;
        private TypeDecoderRegistry registry = TypeDecoderRegistry.standard();
        private char schemaDelimiter = SchemaRowReader.DEFAULT_DELIMITER;
        private String recordDelimiter = RecordDecoder.DEFAULT_DELIMITER;

        public Builder schemaFile(Path schemaFile) {
            this.schemaFile = schemaFile;
            return this;
        }

        /**
         * Optional for {@link #load()}; {@code null} means the schema file's folder.
         */
        public Builder dataRoot(String dataRoot) {
            this.dataRoot = dataRoot;
            return this;
        }

        public Builder conflictPolicy(@NonNull PatternConflictPolicy conflictPolicy) {
            this.conflictPolicy = conflictPolicy;
            return this;
        }

        public Builder registry(@NonNull TypeDecoderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder schemaDelimiter(char schemaDelimiter) {
            this.schemaDelimiter = schemaDelimiter;
            return this;
        }

        public Builder recordDelimiter(@NonNull String recordDelimiter) {
            this.recordDelimiter = recordDelimiter;
            return this;
        }

        /**
         * Reads and compiles {@link #schemaFile(Path)}.
         *
         * @throws IOException when the schema file cannot be read
         */
        public SchemaCatalog load() throws IOException {
            Objects.requireNonNull(schemaFile, "schemaFile");
            List<Map<String, String>> rows = new SchemaRowReader(schemaDelimiter).read(schemaFile);
            String root = dataRoot != null ? normalizeDataRoot(dataRoot) : dataRootOf(schemaFile);
            SchemaCatalog catalog = compile(rows, root);
            log.info("Loaded schema {} with {} source(s); data root {}", schemaFile, catalog.sources.size(), root);
            return catalog;
        }

        /**
         * Compiles in-memory rows; a data root is required since there is no schema file to derive it from.
         */
        public SchemaCatalog build(@NonNull List<Map<String, String>> schemaRows) {
            Objects.requireNonNull(dataRoot, "dataRoot");
            return compile(schemaRows, normalizeDataRoot(dataRoot));
        }

        private SchemaCatalog compile(List<Map<String, String>> rows, String root) {
            Map<String, SourceSchema> sources = new SchemaCompiler(registry, conflictPolicy).compile(rows);
            return new SchemaCatalog(root, sources, recordDelimiter);
        }
    }
}
