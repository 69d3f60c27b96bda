package com.dataschema.decoder.exception;

/**
 * Root of all errors raised while compiling a schema or decoding records against it.
 */
public class SchemaDecoderException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public SchemaDecoderException(String message) {
		super(message);
	}

	public SchemaDecoderException(String message, Throwable cause) {
		super(message, cause);
	}
}
