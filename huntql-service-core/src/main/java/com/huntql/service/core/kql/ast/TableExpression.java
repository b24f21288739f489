package com.huntql.service.core.kql.ast;

/**
 * Source of rows: a catalog table by name, or a parenthesised sub-query. Either may carry an alias used to
 * qualify column references ({@code T.Column}).
 */
public record TableExpression(String name, String alias, Query subquery) {

    public TableExpression {
        if ((name == null) == (subquery == null)) {
            throw new IllegalArgumentException("exactly one of table name or sub-query is required");
        }
    }

    public static TableExpression table(String name) {
        return new TableExpression(name, null, null);
    }

    public static TableExpression table(String name, String alias) {
        return new TableExpression(name, alias, null);
    }

    public static TableExpression of(Query subquery) {
        return new TableExpression(null, null, subquery);
    }

    public boolean isSubquery() {
        return subquery != null;
    }

    public TableExpression withSubquery(Query replacement) {
        return new TableExpression(null, alias, replacement);
    }
}
