package com.dataschema.decoder.exception;

/**
 * The record's token count differs from the source's field count.
 */
public class FieldCountException extends RecordDecodingException {

	private static final long serialVersionUID = 1L;
	private final int expected;
	private final int actual;

	public FieldCountException(String sourceKey, long lineNumber, int expected, int actual) {
		super(location(sourceKey, lineNumber) + "expected " + expected + " fields but found " + actual,
				sourceKey, lineNumber, null);
		this.expected = expected;
		this.actual = actual;
	}

	public int getExpected() {
		return expected;
	}

	public int getActual() {
		return actual;
	}
}
