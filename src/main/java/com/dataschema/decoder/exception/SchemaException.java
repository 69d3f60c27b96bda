package com.dataschema.decoder.exception;

/**
 * Malformed schema description. Aborts the whole compile.
 */
public class SchemaException extends SchemaDecoderException {

	private static final long serialVersionUID = 1L;

	public SchemaException(String message) {
		super(message);
	}

	public SchemaException(String message, Throwable cause) {
		super(message, cause);
	}
}
