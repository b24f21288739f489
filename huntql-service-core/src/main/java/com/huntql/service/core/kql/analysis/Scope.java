package com.huntql.service.core.kql.analysis;

import com.huntql.service.core.schema.ColumnType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Ordered, case-insensitive set of columns visible at one point of a pipeline. An <em>unknown</em> scope
 * (unresolvable source) answers every lookup with an {@link ColumnType#ANY} column so that one bad table name
 * does not cascade into a column error per reference.
 */
public final class Scope {

    public record Column(String name, ColumnType type) {}

    private static final Scope UNKNOWN = new Scope(List.of(), false);

    private final List<Column> columns;
    private final Map<String, Column> byName;
    private final boolean known;

    private Scope(List<Column> columns, boolean known) {
        this.columns = List.copyOf(columns);
        Map<String, Column> index = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Column c : this.columns) index.putIfAbsent(c.name(), c);
        this.byName = Collections.unmodifiableMap(index);
        this.known = known;
    }

    public static Scope of(List<Column> columns) {
        return new Scope(columns, true);
    }

    public static Scope unknown() {
        return UNKNOWN;
    }

    public boolean known() {
        return known;
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> names() {
        return columns.stream().map(Column::name).toList();
    }

    public Optional<Column> find(String name) {
        if (!known) return Optional.of(new Column(name, ColumnType.ANY));
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /** Adds {@code column}, replacing in place an existing column of the same name. */
    public Scope with(Column column) {
        if (!known) return this;
        List<Column> next = new ArrayList<>(columns);
        for (int i = 0; i < next.size(); i++) {
            if (next.get(i).name().equalsIgnoreCase(column.name())) {
                next.set(i, column);
                return new Scope(next, true);
            }
        }
        next.add(column);
        return new Scope(next, true);
    }

    @Override
    public String toString() {
        return known ? names().toString() : "<unknown>";
    }
}
