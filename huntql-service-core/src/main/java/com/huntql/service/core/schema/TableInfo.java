package com.huntql.service.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Catalog table. {@code estimatedRows} seeds the optimizer's cardinality estimates; it is never used for
 * correctness.
 *
 * @param timeColumn KQL name of the column a caller's time range filters on; defaults to the first datetime column
 */
public record TableInfo(
        @JsonProperty("name") String name,
        @JsonProperty("sql") String sqlName,
        @JsonProperty("description") String description,
        @JsonProperty("estimatedRows") long estimatedRows,
        @JsonProperty("columns") List<ColumnInfo> columns,
        @JsonProperty("timeColumn") String timeColumn) {

    public static final long DEFAULT_ESTIMATED_ROWS = 1_000_000L;

    public TableInfo {
        Objects.requireNonNull(name, "table name");
        if (sqlName == null || sqlName.isBlank()) sqlName = name;
        if (estimatedRows <= 0) estimatedRows = DEFAULT_ESTIMATED_ROWS;
        columns = columns == null ? List.of() : List.copyOf(columns);
        if (timeColumn == null || timeColumn.isBlank()) {
            timeColumn = columns.stream()
                    .filter(c -> c.type() == ColumnType.DATETIME)
                    .map(ColumnInfo::name)
                    .findFirst()
                    .orElse(null);
        }
    }

    public Optional<ColumnInfo> findColumn(String column) {
        return columns.stream().filter(c -> c.name().equalsIgnoreCase(column)).findFirst();
    }

    /** The column a time range applies to, when the table has one. */
    public Optional<ColumnInfo> findTimeColumn() {
        return timeColumn == null ? Optional.empty() : findColumn(timeColumn);
    }
}
