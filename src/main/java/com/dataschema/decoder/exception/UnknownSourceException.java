package com.dataschema.decoder.exception;

import java.util.List;

/**
 * Lookup of a data source the catalog does not define. Carries the valid names.
 */
public class UnknownSourceException extends SchemaDecoderException {

	private static final long serialVersionUID = 1L;
	private final String sourceKey;
	private final List<String> availableSources;

	public UnknownSourceException(String sourceKey, List<String> availableSources) {
		super("'" + sourceKey + "' is not a source of this schema. Sources present in schema: "
				+ String.join(", ", availableSources));
		this.sourceKey = sourceKey;
		this.availableSources = List.copyOf(availableSources);
	}

	public String getSourceKey() {
		return sourceKey;
	}

	public List<String> getAvailableSources() {
		return availableSources;
	}
}
