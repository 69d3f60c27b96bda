package com.dataschema.decoder.model;

import java.math.BigInteger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * A decoded field value tagged with its kind.
 *
 * Absent values are never represented by an instance of this class; callers
 * see them as {@code Optional.empty()}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TypedValue {

    @NonNull
    ValueKind kind;

    @NonNull
    Object value;

    public static TypedValue ofString(String value) {
        return new TypedValue(ValueKind.STRING, value);
    }

    public static TypedValue ofInteger(long value) {
        return new TypedValue(ValueKind.INTEGER, value);
    }

    /**
     * Integer of any width. Values within the {@code long} range are stored as
     * a {@code Long}, so equal integers compare equal whichever factory made them.
     */
    public static TypedValue ofInteger(@NonNull BigInteger value) {
        if (value.bitLength() < Long.SIZE) {
            return ofInteger(value.longValue());
        }
        return new TypedValue(ValueKind.INTEGER, value);
    }

    public static TypedValue ofFloat(double value) {
        return new TypedValue(ValueKind.FLOAT, value);
    }

    public static TypedValue ofBoolean(boolean value) {
        return new TypedValue(ValueKind.BOOLEAN, value);
    }

    public String asString() {
        return (String) require(ValueKind.STRING);
    }

    /**
     * @throws ArithmeticException when the integer does not fit in a {@code long}
     */
    public long asLong() {
        Object integer = require(ValueKind.INTEGER);
        if (integer instanceof BigInteger) {
            return ((BigInteger) integer).longValueExact();
        }
        return (Long) integer;
    }

    public BigInteger asBigInteger() {
        Object integer = require(ValueKind.INTEGER);
        if (integer instanceof BigInteger) {
            return (BigInteger) integer;
        }
        return BigInteger.valueOf((Long) integer);
    }

    public double asDouble() {
        return (Double) require(ValueKind.FLOAT);
    }

    public boolean asBoolean() {
        return (Boolean) require(ValueKind.BOOLEAN);
    }

    /**
     * Text form that decodes back to an equal value under the matching field type.
     * Booleans are written as {@code 1} / {@code 0}.
     */
    public String toText() {
        return switch (kind) {
            case STRING -> (String) value;
            case INTEGER -> value.toString();
            case FLOAT -> Double.toString((Double) value);
            case BOOLEAN -> ((Boolean) value) ? "1" : "0";
        };
    }

    private Object require(ValueKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Value is " + kind + ", not " + expected + ": " + value);
        }
        return value;
    }
}
