package com.huntql.service.core.kql.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Immutable SQL fragment made of raw text and bound values. Values only get their {@code $n} number when the
 * outermost statement is rendered, so fragments can be built in any order and composed freely; a fragment used
 * twice binds its values twice.
 */
public final class SqlText {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    public static final SqlText EMPTY = new SqlText(List.of());

    private record Param(Object value) {}

    private final List<Object> parts;

    private SqlText(List<Object> parts) {
        this.parts = parts;
    }

    public static SqlText raw(String sql) {
        return new SqlText(List.of(sql));
    }

    public static SqlText param(Object value) {
        return new SqlText(List.of(new Param(value)));
    }

    /** A bound value followed by a PostgreSQL cast, {@code $n::type}. */
    public static SqlText param(Object value, String cast) {
        return concat(param(value), "::" + cast);
    }

    /** Concatenates {@link String} (raw) and {@link SqlText} pieces. */
    public static SqlText concat(Object... pieces) {
        List<Object> out = new ArrayList<>();
        for (Object piece : pieces) {
            if (piece instanceof SqlText text) {
                out.addAll(text.parts);
            } else if (piece instanceof String s) {
                if (!s.isEmpty()) out.add(s);
            } else {
                throw new IllegalArgumentException("Unsupported SQL piece: " + piece);
            }
        }
        return new SqlText(Collections.unmodifiableList(out));
    }

    public static SqlText join(String separator, List<SqlText> items) {
        List<Object> pieces = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) pieces.add(separator);
            pieces.add(items.get(i));
        }
        return concat(pieces.toArray());
    }

    /**
     * Identifier as it should appear in SQL. Plain lower-case names are emitted as is; anything else is
     * double-quoted. Dotted names ({@code schema.table}) are handled part by part.
     */
    public static String identifier(String name) {
        String[] parts = name.split("\\.", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append('.');
            sb.append(PLAIN_IDENTIFIER.matcher(parts[i]).matches() ? parts[i] : quoted(parts[i]));
        }
        return sb.toString();
    }

    /** Always-quoted identifier; used for output column aliases, which keep their KQL case. */
    public static String quoted(String name) {
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    public SqlText parenthesized() {
        return concat("(", this, ")");
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    public boolean hasParams() {
        return parts.stream().anyMatch(p -> p instanceof Param);
    }

    /** Numbers the bound values in textual order. */
    public GeneratedSql render() {
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof Param p) {
                params.add(p.value());
                sql.append('$').append(params.size());
            } else {
                sql.append((String) part);
            }
        }
        return new GeneratedSql(sql.toString(), params);
    }

    @Override
    public String toString() {
        return render().sql();
    }
}
