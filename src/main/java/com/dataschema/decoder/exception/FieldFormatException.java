package com.dataschema.decoder.exception;

import com.dataschema.decoder.model.FieldType;

/**
 * A token that cannot be decoded as its declared type.
 *
 * Raised bare by the value decoders; {@link #withField} adds the field and line
 * once the record decoder knows them.
 */
public class FieldFormatException extends RecordDecodingException {

	private static final long serialVersionUID = 1L;
	private final FieldType fieldType;
	private final String rawValue;
	private final String label;
	private final int position;

	public FieldFormatException(FieldType fieldType, String rawValue, Throwable cause) {
		this(null, 0, null, -1, fieldType, rawValue, cause);
	}

	private FieldFormatException(String sourceKey, long lineNumber, String label, int position,
			FieldType fieldType, String rawValue, Throwable cause) {
		super(location(sourceKey, lineNumber) + describe(label, position) + "cannot decode '" + rawValue + "' as "
				+ fieldType, sourceKey, lineNumber, cause);
		this.fieldType = fieldType;
		this.rawValue = rawValue;
		this.label = label;
		this.position = position;
	}

	public FieldFormatException withField(String sourceKey, long lineNumber, String label, int position) {
		return new FieldFormatException(sourceKey, lineNumber, label, position, fieldType, rawValue, getCause());
	}

	public FieldType getFieldType() {
		return fieldType;
	}

	public String getRawValue() {
		return rawValue;
	}

	/**
	 * Label of the offending field, or {@code null} when raised outside a record.
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * Zero-based position of the offending field, or -1 when raised outside a record.
	 */
	public int getPosition() {
		return position;
	}

	private static String describe(String label, int position) {
		if (label == null) {
			return "";
		}
		return "field '" + label + "' (position " + position + ") ";
	}
}
