package com.dataschema.decoder.catalog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dataschema.decoder.decoder.FieldAccessor;
import com.dataschema.decoder.decoder.RecordOutcome;
import com.dataschema.decoder.exception.SchemaException;
import com.dataschema.decoder.exception.UnknownFieldException;
import com.dataschema.decoder.exception.UnknownSourceException;
import com.dataschema.decoder.model.DecodedRecord;
import com.dataschema.decoder.model.TypedValue;
import com.dataschema.decoder.schema.PatternConflictPolicy;
import com.dataschema.decoder.source.LineSource;

import static com.dataschema.decoder.SchemaRows.row;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaCatalog.
 */
class SchemaCatalogTest {

    @TempDir
    Path tempDir;

    private static List<Map<String, String>> sampleRows() {
        return List.of(
                row(1, "id", "INTEGER", "YES", "events/part-0"),
                row(2, "name", "STRING_HASH", "NO", "events/part-0"),
                row(1, "a", "INTEGER", "YES", "pairs/x"),
                row(2, "b", "STRING_HASH_OR_INTEGER", "NO", "pairs/x")
        );
    }

    @Test
    void testEndToEndDecode() {
        SchemaCatalog catalog = SchemaCatalog.of(sampleRows(), "/data");

        DecodedRecord record = catalog.decode("events", "7,alice");

        assertThat(record.values()).containsExactly(TypedValue.ofInteger(7), TypedValue.ofString("alice"));
    }

    @Test
    void testListSourcesIsSorted() {
        SchemaCatalog catalog = SchemaCatalog.of(sampleRows(), "/data");

        assertThat(catalog.listSources()).containsExactly("events", "pairs");
        assertThat(catalog.hasSource("events")).isTrue();
        assertThat(catalog.hasSource("nope")).isFalse();
    }

    @Test
    void testUnknownSourceCarriesValidNames() {
        SchemaCatalog catalog = SchemaCatalog.of(sampleRows(), "/data");

        assertThatThrownBy(() -> catalog.schemaFor("machine_events"))
                .isInstanceOfSatisfying(UnknownSourceException.class, e -> {
                    assertThat(e.getSourceKey()).isEqualTo("machine_events");
                    assertThat(e.getAvailableSources()).containsExactly("events", "pairs");
                })
                .hasMessageContaining("events, pairs");
        assertThatThrownBy(() -> catalog.decode("machine_events", "1"))
                .isInstanceOf(UnknownSourceException.class);
    }

    @Test
    void testIndexOfField() {
        SchemaCatalog catalog = SchemaCatalog.of(sampleRows(), "/data");

        assertThat(catalog.indexOfField("pairs", "a")).isEqualTo(0);
        assertThat(catalog.indexOfField("pairs", "b")).isEqualTo(1);
        assertThatThrownBy(() -> catalog.indexOfField("pairs", "c"))
                .isInstanceOfSatisfying(UnknownFieldException.class, e -> {
                    assertThat(e.getLabel()).isEqualTo("c");
                    assertThat(e.getAvailableFields()).containsExactly("a", "b");
                });
    }

    @Test
    void testFieldAccessorsReadNamedColumns() {
        SchemaCatalog catalog = SchemaCatalog.of(sampleRows(), "/data");
        Map<String, FieldAccessor> accessors = catalog.fieldAccessors("pairs");

        DecodedRecord record = catalog.decode("pairs", "3,");

        assertThat(accessors.keySet()).containsExactly("a", "b");
        assertThat(accessors.get("a").get(record)).contains(TypedValue.ofInteger(3));
        assertThat(accessors.get("b").get(record)).isEmpty();
        assertThat(accessors.get("a").get(record.values())).contains(TypedValue.ofInteger(3));
        assertThat(catalog.fieldAccessor("pairs", "b").getPosition()).isEqualTo(1);
    }

    @Test
    void testDecoderIsResolvedOncePerSource() {
        SchemaCatalog catalog = SchemaCatalog.of(sampleRows(), "/data");

        assertThat(catalog.decoderFor("events")).isSameAs(catalog.decoderFor("events"));
        assertThat(catalog.decoderFor("events").getSchema()).isSameAs(catalog.schemaFor("events"));
    }

    @Test
    void testStreamSourceReportsBadLinesWithoutStopping() throws IOException {
        SchemaCatalog catalog = SchemaCatalog.of(sampleRows(), "/data");
        LineSource lines = LineSource.of(List.of("1,a", "x,b", "3,c"));

        try (Stream<RecordOutcome> outcomes = catalog.streamSource("events", lines)) {
            assertThat(outcomes.collect(Collectors.toList()))
                    .extracting(RecordOutcome::isSuccess)
                    .containsExactly(true, false, true);
        }
        assertThat(lines.isRestartable()).isTrue();
        try (Stream<RecordOutcome> again = catalog.streamSource("events", lines)) {
            assertThat(again.count()).isEqualTo(3);
        }
    }

    @Test
    void testDataRootIsNormalized() {
        assertThat(SchemaCatalog.of(sampleRows(), "/data").getDataRoot()).isEqualTo("/data/");
        assertThat(SchemaCatalog.of(sampleRows(), "/data/").getDataRoot()).isEqualTo("/data/");
        assertThat(SchemaCatalog.of(sampleRows(), "/data").sourceDirectory("events")).isEqualTo("/data/events/");
    }

    @Test
    void testLoadDerivesDataRootFromSchemaFile() throws IOException {
        Path schemaFile = writeSchema(tempDir.resolve("schema.csv"));

        SchemaCatalog catalog = SchemaCatalog.load(schemaFile);

        assertThat(catalog.getDataRoot()).isEqualTo(tempDir.toString().replace('\\', '/') + "/");
        assertThat(catalog.listSources()).containsExactly("events");
        assertThat(catalog.decode("events", "1,x").get(1)).contains(TypedValue.ofString("x"));
    }

    @Test
    void testLoadUsesGivenDataRoot() throws IOException {
        Path schemaFile = writeSchema(tempDir.resolve("schema.csv"));

        SchemaCatalog catalog = SchemaCatalog.load(schemaFile, "/mnt/traces");

        assertThat(catalog.getDataRoot()).isEqualTo("/mnt/traces/");
    }

    @Test
    void testDataRootOfBareFileName() {
        assertThat(SchemaCatalog.dataRootOf(Path.of("schema.csv"))).isEqualTo("./");
    }

    @Test
    void testLoadMissingFileSurfacesIoError() {
        Path missing = tempDir.resolve("missing.csv");

        assertThatThrownBy(() -> SchemaCatalog.load(missing))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void testMalformedSchemaExposesNoCatalog() throws IOException {
        Path schemaFile = tempDir.resolve("schema.csv");
        Files.writeString(schemaFile, """
                field number,content,format,mandatory,file pattern
                1,id,INTEGER,YES,events/part-0
                2,name,TEXT,NO,events/part-0
                """);

        assertThatThrownBy(() -> SchemaCatalog.load(schemaFile))
                .isInstanceOf(SchemaException.class)
                .hasMessageContaining("TEXT");
    }

    @Test
    void testStrictPatternPolicy() {
        List<Map<String, String>> rows = List.of(
                row(1, "a", "INTEGER", "YES", "t/one"),
                row(2, "b", "INTEGER", "YES", "t/two"));

        assertThat(SchemaCatalog.of(rows, "/data").schemaFor("t").getFilePattern()).isEqualTo("t/one");
        assertThatThrownBy(() -> SchemaCatalog.of(rows, "/data", PatternConflictPolicy.FAIL))
                .isInstanceOf(SchemaException.class);
    }

    @Test
    void testCatalogsDoNotShareState() {
        SchemaCatalog first = SchemaCatalog.of(sampleRows(), "/data");
        SchemaCatalog second = SchemaCatalog.of(List.of(row(1, "x", "FLOAT", "NO", "other/p")), "/data");

        assertThat(first.listSources()).containsExactly("events", "pairs");
        assertThat(second.listSources()).containsExactly("other");
    }

    @Test
    void testCustomRecordDelimiter() {
        SchemaCatalog catalog = SchemaCatalog.builder()
                .dataRoot("/data")
                .recordDelimiter("\t")
                .build(sampleRows());

        assertThat(catalog.decode("events", "5\tbob").get(0)).contains(TypedValue.ofInteger(5));
    }

    private static Path writeSchema(Path schemaFile) throws IOException {
        Files.writeString(schemaFile, """
                field number,content,format,mandatory,file pattern
                2,name,STRING_HASH,NO,events/part-0
                1,id,INTEGER,YES,events/part-0
                """);
        return schemaFile;
    }
}
