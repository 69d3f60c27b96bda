package com.dataschema.decoder.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the decode command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class DecodeOptions {

	@Option(names = { "--schema", "-s" }, required = true, description = "Path to the schema description file")
	private Path schemaFile;

	@Option(names = { "--data-root",
			"-d" }, description = "Folder holding one sub-folder per source (defaults to the schema file's folder)")
	private String dataRoot;

	@Option(names = { "--source",
			"-t" }, description = "Source to decode; when omitted the sources of the schema are listed")
	private String source;

	@Option(names = { "--limit",
			"-l" }, defaultValue = "5", description = "Number of decoded records to print, 0 for all (default: 5)")
	private int limit;

	@Option(names = { "--fail-fast" }, description = "Stop with an error on the first record that cannot be decoded")
	private boolean failFast;

	@Option(names = {
			"--strict-patterns" }, description = "Reject schemas whose rows give one source different file patterns")
	private boolean strictPatterns;

	@Option(names = { "--delimiter" }, defaultValue = ",", description = "Record field delimiter (default: ,)")
	private String recordDelimiter;

	@Option(names = { "--schema-delimiter" }, defaultValue = ",", description = "Schema file cell delimiter (default: ,)")
	private String schemaDelimiter;

	@Option(names = { "--encoding" }, defaultValue = "UTF-8", description = "Character encoding of the data files")
	private String encoding;

}
