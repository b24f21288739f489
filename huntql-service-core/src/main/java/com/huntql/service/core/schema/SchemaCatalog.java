package com.huntql.service.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Root of a catalog resource document. */
public record SchemaCatalog(
        @JsonProperty("tables") List<TableInfo> tables, @JsonProperty("functions") List<FunctionInfo> functions) {

    public SchemaCatalog {
        tables = tables == null ? List.of() : List.copyOf(tables);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }
}
