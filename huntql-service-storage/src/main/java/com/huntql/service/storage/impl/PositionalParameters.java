package com.huntql.service.storage.impl;

import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Rewrites PostgreSQL-style {@code $1..$n} placeholders into named {@code :p1..:pn} parameters understood by
 * {@link org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate}. Placeholders inside quoted text are
 * left alone.
 */
final class PositionalParameters {

    private PositionalParameters() {}

    record Rewritten(String sql, MapSqlParameterSource params) {}

    static Rewritten rewrite(String sql, List<Object> values, ValueBinder binder) {
        StringBuilder out = new StringBuilder(sql.length() + 16);
        MapSqlParameterSource params = new MapSqlParameterSource();
        int i = 0;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = closingQuote(sql, i, c);
                out.append(sql, i, end);
                i = end;
                continue;
            }
            if (c == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
                int end = i + 1;
                while (end < sql.length() && Character.isDigit(sql.charAt(end))) end++;
                int index = Integer.parseInt(sql.substring(i + 1, end));
                if (index < 1 || index > values.size()) {
                    throw new IllegalArgumentException(
                            "Placeholder $" + index + " has no value (" + values.size() + " supplied)");
                }
                String name = "p" + index;
                if (!params.hasValue(name)) {
                    params.addValue(name, binder.bind(values.get(index - 1)));
                }
                out.append(':').append(name);
                i = end;
                continue;
            }
            out.append(c);
            i++;
        }
        return new Rewritten(out.toString(), params);
    }

    /** Index just past the quote closing the one at {@code start}; doubled quotes are escapes. */
    private static int closingQuote(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }

    @FunctionalInterface
    interface ValueBinder {
        Object bind(Object value);
    }
}
