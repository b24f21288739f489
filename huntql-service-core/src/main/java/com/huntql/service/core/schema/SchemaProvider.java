package com.huntql.service.core.schema;

import java.util.List;
import java.util.Optional;

/**
 * Read-only table, column and function catalog. Lookups are case-insensitive. Implementations must be safe for
 * concurrent readers.
 */
public interface SchemaProvider {

    List<TableInfo> listTables();

    /** Columns of {@code table}, empty when the table is unknown. */
    List<ColumnInfo> listColumns(String table);

    List<FunctionInfo> listFunctions();

    default Optional<TableInfo> findTable(String name) {
        return listTables().stream().filter(t -> t.name().equalsIgnoreCase(name)).findFirst();
    }

    default Optional<FunctionInfo> findFunction(String name) {
        return listFunctions().stream().filter(f -> f.name().equalsIgnoreCase(name)).findFirst();
    }
}
