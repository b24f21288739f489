package com.huntql.service.core.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Value kinds a template parameter can take; each renders as the matching KQL literal. */
public enum ParameterType {
    STRING,
    NUMBER,
    TIMESPAN,
    DATETIME,
    BOOLEAN;

    @JsonCreator
    public static ParameterType fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "string" -> STRING;
            case "number", "long", "real" -> NUMBER;
            case "timespan" -> TIMESPAN;
            case "datetime" -> DATETIME;
            case "boolean", "bool" -> BOOLEAN;
            default -> throw new IllegalArgumentException("Unknown parameter type: " + name);
        };
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
