package com.dataschema.decoder.decoder;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.dataschema.decoder.exception.FieldFormatException;
import com.dataschema.decoder.exception.UnknownTypeException;
import com.dataschema.decoder.model.FieldType;
import com.dataschema.decoder.model.TypedValue;

/**
 * Maps declared field types to their value decoders.
 *
 * Every decoder returns {@code null} (absent) for the empty string. The table
 * is built once from an exhaustive switch, so adding a {@link FieldType}
 * without a decoder does not compile.
 */
public class TypeDecoderRegistry {

    private static final Pattern INTEGER_PATTERN = Pattern.compile("^[+-]?\\d+$");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");
    private static final Pattern SPECIAL_FLOAT_PATTERN = Pattern.compile("^([+-]?)(inf|infinity|nan)$",
            Pattern.CASE_INSENSITIVE);

    private static final TypeDecoderRegistry STANDARD = new TypeDecoderRegistry();

    private final Map<FieldType, ValueDecoder> decoders = new EnumMap<>(FieldType.class);

    public TypeDecoderRegistry() {
        for (FieldType type : FieldType.values()) {
            decoders.put(type, createDecoder(type));
        }
    }

    /**
     * Shared registry. Safe to reuse: decoders hold no state.
     */
    public static TypeDecoderRegistry standard() {
        return STANDARD;
    }

    public ValueDecoder decoderFor(String typeTag) {
        FieldType type = FieldType.fromTag(typeTag)
                .orElseThrow(() -> new UnknownTypeException(typeTag, supportedTags()));
        return decoderFor(type);
    }

    public ValueDecoder decoderFor(FieldType type) {
        return decoders.get(type);
    }

    public List<String> supportedTags() {
        return Arrays.stream(FieldType.values()).map(Enum::name).toList();
    }

    private static ValueDecoder createDecoder(FieldType type) {
        return switch (type) {
            case STRING_HASH -> raw -> raw.isEmpty() ? null : TypedValue.ofString(raw);
            case INTEGER -> raw -> raw.isEmpty() ? null : parseInteger(raw, type);
            case FLOAT -> raw -> raw.isEmpty() ? null : TypedValue.ofFloat(parseFloat(raw, type));
            case BOOLEAN -> raw -> raw.isEmpty() ? null : TypedValue.ofBoolean(parseFlag(raw, type));
            case STRING_HASH_OR_INTEGER -> TypeDecoderRegistry::decodeHashOrInteger;
        };
    }

    private static TypedValue decodeHashOrInteger(String raw) {
        if (raw.isEmpty()) {
            return null;
        }
        String trimmed = raw.trim();
        if (INTEGER_PATTERN.matcher(trimmed).matches()) {
            return integerOf(trimmed);
        }
        return TypedValue.ofString(raw);
    }

    private static TypedValue parseInteger(String raw, FieldType type) {
        String trimmed = raw.trim();
        if (!INTEGER_PATTERN.matcher(trimmed).matches()) {
            throw new FieldFormatException(type, raw, null);
        }
        return integerOf(trimmed);
    }

    /**
     * Expects text matching {@link #INTEGER_PATTERN}.
     */
    private static TypedValue integerOf(String digits) {
        // at most 18 digits always fits a long
        if (digits.length() <= 18) {
            return TypedValue.ofInteger(Long.parseLong(digits));
        }
        return TypedValue.ofInteger(new BigInteger(digits));
    }

    private static double parseFloat(String raw, FieldType type) {
        String trimmed = raw.trim();
        Matcher special = SPECIAL_FLOAT_PATTERN.matcher(trimmed);
        if (special.matches()) {
            boolean negative = "-".equals(special.group(1));
            if (special.group(2).toLowerCase(Locale.ROOT).startsWith("inf")) {
                return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            }
            return Double.NaN;
        }
        if (!FLOAT_PATTERN.matcher(trimmed).matches()) {
            throw new FieldFormatException(type, raw, null);
        }
        return Double.parseDouble(trimmed);
    }

    private static boolean parseFlag(String raw, FieldType type) {
        String trimmed = raw.trim();
        if (!INTEGER_PATTERN.matcher(trimmed).matches()) {
            throw new FieldFormatException(type, raw, null);
        }
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c >= '1' && c <= '9') {
                return true;
            }
        }
        return false;
    }
}
