package com.huntql.service.core.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** KQL scalar types as far as this engine distinguishes them. */
public enum ColumnType {
    STRING,
    LONG,
    REAL,
    BOOL,
    DATETIME,
    TIMESPAN,
    GUID,
    DYNAMIC,
    /** Unknown or polymorphic; for function return types it means "same as the first argument". */
    ANY;

    @JsonCreator
    public static ColumnType fromName(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "string" -> STRING;
            case "int", "long", "integer" -> LONG;
            case "real", "double", "decimal", "numeric" -> REAL;
            case "bool", "boolean" -> BOOL;
            case "datetime", "date" -> DATETIME;
            case "timespan", "time" -> TIMESPAN;
            case "guid", "uuid" -> GUID;
            case "dynamic", "json" -> DYNAMIC;
            case "any" -> ANY;
            default -> throw new IllegalArgumentException("Unknown column type: " + name);
        };
    }

    @JsonValue
    public String kqlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isNumeric() {
        return this == LONG || this == REAL;
    }
}
