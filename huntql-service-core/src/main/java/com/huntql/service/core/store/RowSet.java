package com.huntql.service.core.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Column names plus rows of values in column order. Values may be {@code null}. */
public record RowSet(List<String> columns, List<List<Object>> rows) {

    public RowSet {
        columns = List.copyOf(columns);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "row has " + row.size() + " values but there are " + columns.size() + " columns");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public static RowSet empty(List<String> columns) {
        return new RowSet(columns, List.of());
    }

    public int size() {
        return rows.size();
    }

    /** First {@code max} rows. */
    public RowSet limit(int max) {
        return rows.size() <= max ? this : new RowSet(columns, rows.subList(0, max));
    }
}
