package com.dataschema.decoder.exception;

/**
 * A single record could not be decoded. Never aborts a stream by itself.
 */
public abstract class RecordDecodingException extends SchemaDecoderException {

	private static final long serialVersionUID = 1L;
	private final String sourceKey;
	private final long lineNumber;

	protected RecordDecodingException(String message, String sourceKey, long lineNumber, Throwable cause) {
		super(message, cause);
		this.sourceKey = sourceKey;
		this.lineNumber = lineNumber;
	}

	public String getSourceKey() {
		return sourceKey;
	}

	/**
	 * 1-based line number of the record, or 0 when the caller did not supply one.
	 */
	public long getLineNumber() {
		return lineNumber;
	}

	protected static String location(String sourceKey, long lineNumber) {
		StringBuilder sb = new StringBuilder();
		if (sourceKey != null) {
			sb.append(sourceKey);
		}
		if (lineNumber > 0) {
			sb.append(sb.length() > 0 ? " " : "").append("line ").append(lineNumber);
		}
		return sb.length() > 0 ? sb.append(": ").toString() : "";
	}
}
