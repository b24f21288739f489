package com.huntql.service.core.schema;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Immutable catalog held in memory. */
public class InMemorySchemaProvider implements SchemaProvider {

    private final List<TableInfo> tables;
    private final List<FunctionInfo> functions;
    private final Map<String, TableInfo> tablesByName;
    private final Map<String, FunctionInfo> functionsByName;

    public InMemorySchemaProvider(SchemaCatalog catalog) {
        this.tables = catalog.tables();
        this.functions = catalog.functions();
        Map<String, TableInfo> t = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        tables.forEach(table -> t.putIfAbsent(table.name(), table));
        Map<String, FunctionInfo> f = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        functions.forEach(fn -> f.putIfAbsent(fn.name(), fn));
        this.tablesByName = Collections.unmodifiableMap(t);
        this.functionsByName = Collections.unmodifiableMap(f);
    }

    public InMemorySchemaProvider(List<TableInfo> tables, List<FunctionInfo> functions) {
        this(new SchemaCatalog(tables, functions));
    }

    @Override
    public List<TableInfo> listTables() {
        return tables;
    }

    @Override
    public List<ColumnInfo> listColumns(String table) {
        return findTable(table).map(TableInfo::columns).orElse(List.of());
    }

    @Override
    public List<FunctionInfo> listFunctions() {
        return functions;
    }

    @Override
    public Optional<TableInfo> findTable(String name) {
        return Optional.ofNullable(name).map(tablesByName::get);
    }

    @Override
    public Optional<FunctionInfo> findFunction(String name) {
        return Optional.ofNullable(name).map(functionsByName::get);
    }
}
