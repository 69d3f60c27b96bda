package com.dataschema.decoder.exception;

import java.util.List;

/**
 * Lookup of a field label the source does not define. Carries the valid labels.
 */
public class UnknownFieldException extends SchemaDecoderException {

	private static final long serialVersionUID = 1L;
	private final String sourceKey;
	private final String label;
	private final List<String> availableFields;

	public UnknownFieldException(String sourceKey, String label, List<String> availableFields) {
		super("Source '" + sourceKey + "' has no field '" + label + "'. Fields: " + String.join(", ", availableFields));
		this.sourceKey = sourceKey;
		this.label = label;
		this.availableFields = List.copyOf(availableFields);
	}

	public String getSourceKey() {
		return sourceKey;
	}

	public String getLabel() {
		return label;
	}

	public List<String> getAvailableFields() {
		return availableFields;
	}
}
