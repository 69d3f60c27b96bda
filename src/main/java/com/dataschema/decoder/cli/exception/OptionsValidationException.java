package com.dataschema.decoder.cli.exception;

import java.util.List;

/**
 * Every problem found in the decode command's options, reported together so
 * a single run shows them all. The command exits with code 2 on it.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(describe(errors));
		this.errors = List.copyOf(errors);
	}

	/**
	 * One message per rejected option, in the order the options were checked.
	 */
	public List<String> getErrors() {
		return errors;
	}

	private static String describe(List<String> errors) {
		StringBuilder sb = new StringBuilder();
		sb.append(errors.size()).append(errors.size() == 1 ? " invalid option" : " invalid options").append(':');
		for (String error : errors) {
			sb.append(System.lineSeparator()).append("  - ").append(error);
		}
		return sb.toString();
	}
}
