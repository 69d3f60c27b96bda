package com.dataschema.decoder.integration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.dataschema.decoder.cli.DecodeCommand;
import com.dataschema.decoder.cli.DecodeRunner;
import com.dataschema.decoder.cli.model.DecodeResult;
import com.dataschema.decoder.cli.model.DecoderConfig;
import com.dataschema.decoder.cli.output.DecodeResultsPrinter;
import com.dataschema.decoder.schema.PatternConflictPolicy;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for loading a schema and decoding sources from a data root.
 */
class DecodeIntegrationTest {

    @TempDir
    Path tempDir;

    private Path schemaFile;

    @BeforeEach
    void setUp() throws IOException {
        schemaFile = tempDir.resolve("schema.csv");
        Files.writeString(schemaFile, """
                file pattern,field number,content,format,mandatory
                machine_events/part-00000-of-00001.csv.gz,1,time,INTEGER,YES
                machine_events/part-00000-of-00001.csv.gz,2,machine ID,INTEGER,YES
                machine_events/part-00000-of-00001.csv.gz,3,event type,INTEGER,YES
                machine_events/part-00000-of-00001.csv.gz,4,platform ID,STRING_HASH,NO
                machine_events/part-00000-of-00001.csv.gz,5,CPUs,FLOAT,NO
                machine_events/part-00000-of-00001.csv.gz,6,Memory,FLOAT,NO
                machine_attributes/part-00000-of-00001.csv.gz,1,time,INTEGER,YES
                machine_attributes/part-00000-of-00001.csv.gz,2,machine ID,INTEGER,YES
                machine_attributes/part-00000-of-00001.csv.gz,3,attribute name,STRING_HASH,YES
                machine_attributes/part-00000-of-00001.csv.gz,4,attribute value,STRING_HASH_OR_INTEGER,NO
                machine_attributes/part-00000-of-00001.csv.gz,5,attribute deleted,BOOLEAN,YES
                """);

        Path events = Files.createDirectories(tempDir.resolve("machine_events"));
        Files.writeString(events.resolve("part-00000-of-00001.csv"), """
                0,5,0,HofLGzk1Or,0.5,0.2493
                0,6,0,HofLGzk1Or,0.5,0.2493
                835150655,6,1,,,
                not-a-time,7,0,HofLGzk1Or,0.5,0.2493
                0,8,0
                """);

        Path attributes = Files.createDirectories(tempDir.resolve("machine_attributes"));
        Files.writeString(attributes.resolve("part-00000-of-00001.csv"), """
                0,5,GKpJ,3,0
                0,5,Ql,ZbA2t,1
                """);
    }

    private DecoderConfig.DecoderConfigBuilder config(String source) {
        return DecoderConfig.builder()
                .schemaFile(schemaFile)
                .source(source)
                .limit(0)
                .conflictPolicy(PatternConflictPolicy.FIRST_WINS)
                .recordDelimiter(",")
                .schemaDelimiter(',')
                .charset(StandardCharsets.UTF_8);
    }

    @Test
    void testDecodeSourceSkipsBadRecords() {
        DecodeResult result = new DecodeRunner(config("machine_events").build(), new DecodeResultsPrinter()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLinesRead()).isEqualTo(5);
        assertThat(result.getRecordsDecoded()).isEqualTo(3);
        assertThat(result.getRecordsFailed()).isEqualTo(2);
        assertThat(result.getSourceDirectory()).endsWith("/machine_events/");
    }

    @Test
    void testLimitStopsEarly() {
        DecodeResult result = new DecodeRunner(config("machine_events").limit(2).build(),
                new DecodeResultsPrinter()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRecordsDecoded()).isEqualTo(2);
        assertThat(result.getLinesRead()).isEqualTo(2);
    }

    @Test
    void testFailFastStopsOnFirstBadRecord() {
        DecodeResult result = new DecodeRunner(config("machine_events").failFast(true).build(),
                new DecodeResultsPrinter()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("line 4", "time", "not-a-time");
        assertThat(result.getRecordsDecoded()).isEqualTo(3);
    }

    @Test
    void testUnknownSourceListsAvailableSources() {
        DecodeResult result = new DecodeRunner(config("task_events").build(), new DecodeResultsPrinter()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("task_events");
        assertThat(result.getAvailableSources()).containsExactly("machine_attributes", "machine_events");
    }

    @Test
    void testListOnly() {
        DecodeResult result = new DecodeRunner(config(null).build(), new DecodeResultsPrinter()).run();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAvailableSources()).containsExactly("machine_attributes", "machine_events");
    }

    @Test
    void testMissingSourceFolderFails() throws IOException {
        Files.writeString(schemaFile, "file pattern,field number,content,format,mandatory\n"
                + "task_events/part-*,1,time,INTEGER,YES\n");

        DecodeResult result = new DecodeRunner(config("task_events").build(), new DecodeResultsPrinter()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("task_events");
    }

    @Test
    void testInvalidSchemaFails() throws IOException {
        Files.writeString(schemaFile, "file pattern,field number,content,format,mandatory\n"
                + "events/p,1,time,INTEGER,YES\n"
                + "events/p,1,again,INTEGER,YES\n");

        DecodeResult result = new DecodeRunner(config(null).build(), new DecodeResultsPrinter()).run();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).startsWith("Invalid schema").contains("duplicate field number 1");
    }

    private static int execute(String... args) {
        return new CommandLine(new DecodeCommand()).execute(args);
    }

    @Test
    void testCommandExitCodes() {
        String schema = schemaFile.toString();

        assertThat(execute("--schema", schema)).isZero();
        assertThat(execute("--schema", schema, "--source", "machine_attributes")).isZero();
        assertThat(execute("--schema", schema, "--source", "machine_events", "--fail-fast")).isEqualTo(1);
        assertThat(execute("--schema", schema, "--source", "nope")).isEqualTo(1);
        assertThat(execute("--schema", tempDir.resolve("missing.csv").toString())).isEqualTo(2);
    }

    @Test
    void testCommandWithExplicitDataRoot() throws IOException {
        Path elsewhere = Files.createDirectories(tempDir.resolve("elsewhere").resolve("machine_attributes"));
        Files.writeString(elsewhere.resolve("part-0"), "1,2,a,b,0\n");

        int exitCode = execute(
                "-s", schemaFile.toString(),
                "-d", tempDir.resolve("elsewhere").toString(),
                "-t", "machine_attributes",
                "--fail-fast");

        assertThat(exitCode).isZero();
    }
}
