package com.huntql.service.core.kql.ast;

public record SortKey(Expr expr, boolean descending) {

    public static SortKey asc(Expr expr) {
        return new SortKey(expr, false);
    }

    public static SortKey desc(Expr expr) {
        return new SortKey(expr, true);
    }
}
