package com.huntql.service.core.kql.ast;

import java.util.Locale;
import java.util.Optional;

public enum JoinKind {
    INNER("inner", "JOIN"),
    LEFT("leftouter", "LEFT JOIN"),
    RIGHT("rightouter", "RIGHT JOIN"),
    FULL("fullouter", "FULL JOIN");

    private final String kql;
    private final String sql;

    JoinKind(String kql, String sql) {
        this.kql = kql;
        this.sql = sql;
    }

    public String kql() {
        return kql;
    }

    public String sql() {
        return sql;
    }

    /** Accepts the short and the Kusto spellings; {@code innerunique} is treated as {@code inner}. */
    public static Optional<JoinKind> fromKql(String text) {
        return switch (text.toLowerCase(Locale.ROOT)) {
            case "inner", "innerunique" -> Optional.of(INNER);
            case "left", "leftouter" -> Optional.of(LEFT);
            case "right", "rightouter" -> Optional.of(RIGHT);
            case "full", "fullouter", "outer" -> Optional.of(FULL);
            default -> Optional.empty();
        };
    }
}
