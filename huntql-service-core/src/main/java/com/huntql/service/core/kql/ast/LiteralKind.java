package com.huntql.service.core.kql.ast;

/** Literal categories; the Java type carried by each is noted alongside. */
public enum LiteralKind {
    STRING, // String
    LONG, // Long
    REAL, // Double
    BOOL, // Boolean
    DATETIME, // Instant
    TIMESPAN, // Duration
    GUID, // UUID
    NULL
}
