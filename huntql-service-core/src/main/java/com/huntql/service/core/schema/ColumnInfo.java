package com.huntql.service.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Catalog column.
 *
 * @param name KQL-facing name
 * @param sqlName physical column in the backing store; defaults to {@code name}
 */
public record ColumnInfo(
        @JsonProperty("name") String name,
        @JsonProperty("sql") String sqlName,
        @JsonProperty("type") ColumnType type,
        @JsonProperty("description") String description) {

    public ColumnInfo {
        Objects.requireNonNull(name, "column name");
        if (sqlName == null || sqlName.isBlank()) sqlName = name;
        if (type == null) type = ColumnType.STRING;
    }

    public static ColumnInfo of(String name, String sqlName, ColumnType type) {
        return new ColumnInfo(name, sqlName, type, null);
    }
}
