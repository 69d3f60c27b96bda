package com.dataschema.decoder.model;

/**
 * Runtime kind of a decoded value.
 */
public enum ValueKind {
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN
}
