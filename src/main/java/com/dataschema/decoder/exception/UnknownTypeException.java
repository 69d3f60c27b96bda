package com.dataschema.decoder.exception;

import java.util.List;

/**
 * A {@code format} tag that has no decoder.
 */
public class UnknownTypeException extends SchemaException {

	private static final long serialVersionUID = 1L;
	private final String typeTag;
	private final List<String> supportedTags;

	public UnknownTypeException(String typeTag, List<String> supportedTags) {
		super("Unknown field format '" + typeTag + "'. Supported formats: " + String.join(", ", supportedTags));
		this.typeTag = typeTag;
		this.supportedTags = List.copyOf(supportedTags);
	}

	public String getTypeTag() {
		return typeTag;
	}

	public List<String> getSupportedTags() {
		return supportedTags;
	}
}
