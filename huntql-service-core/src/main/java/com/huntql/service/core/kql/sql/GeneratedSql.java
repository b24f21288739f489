package com.huntql.service.core.kql.sql;

import java.util.List;
import java.util.Objects;

/**
 * Parameterized SQL. Placeholders are {@code $1..$n}, numbered in textual order; {@code params.get(i)} binds
 * {@code $(i + 1)}.
 */
public record GeneratedSql(String sql, List<Object> params) {

    public GeneratedSql {
        Objects.requireNonNull(sql, "sql");
        params = List.copyOf(params);
    }
}
