package com.dataschema.decoder.cli.validation;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.dataschema.decoder.cli.exception.OptionsValidationException;
import com.dataschema.decoder.cli.model.DecodeOptions;
import com.dataschema.decoder.cli.model.DecoderConfig;
import com.dataschema.decoder.schema.PatternConflictPolicy;

public class DecodeOptionsValidator {

	public DecoderConfig validate(DecodeOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getSchemaFile() == null) {
			errors.add("Schema file is required (--schema / -s).");
		} else if (!Files.isRegularFile(o.getSchemaFile())) {
			errors.add("Schema file does not exist or is not a file: " + o.getSchemaFile());
		}

		if (o.getDataRoot() != null && !existsDirectory(Path.of(o.getDataRoot()))) {
			errors.add("Data root does not exist or is not a directory: " + o.getDataRoot());
		}

		if (o.getSource() != null && isBlank(o.getSource())) {
			errors.add("Source name must not be blank (--source / -t).");
		}

		if (o.getLimit() < 0) {
			errors.add("Limit must be >= 0. Got: " + o.getLimit());
		}

		if (o.getRecordDelimiter() == null || o.getRecordDelimiter().isEmpty()) {
			errors.add("Record delimiter must not be empty (--delimiter).");
		}

		String schemaDelimiter = o.getSchemaDelimiter();
		if (schemaDelimiter == null || schemaDelimiter.length() != 1) {
			errors.add("Schema delimiter must be a single character (--schema-delimiter). Got: " + schemaDelimiter);
		} else if (schemaDelimiter.charAt(0) == '"') {
			errors.add("Schema delimiter must not be the quote character.");
		}

		Charset charset = parseCharset(o.getEncoding(), errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return DecoderConfig.builder()
				.schemaFile(o.getSchemaFile())
				.dataRoot(o.getDataRoot())
				.source(o.getSource())
				.limit(o.getLimit())
				.failFast(o.isFailFast())
				.conflictPolicy(o.isStrictPatterns() ? PatternConflictPolicy.FAIL : PatternConflictPolicy.FIRST_WINS)
				.recordDelimiter(o.getRecordDelimiter())
				.schemaDelimiter(schemaDelimiter.charAt(0))
				.charset(charset)
				.build();
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static Charset parseCharset(String encoding, List<String> errors) {
		if (isBlank(encoding)) {
			errors.add("Encoding must not be blank (--encoding).");
			return null;
		}
		try {
			return Charset.forName(encoding.trim());
		} catch (IllegalArgumentException e) {
			errors.add("Unsupported encoding: " + encoding);
			return null;
		}
	}
}
