package com.huntql.service.core.kql.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One {@code SELECT} under construction. Pipeline stages are folded into the current block while the result stays
 * equivalent; otherwise the generator wraps the block into a sub-query and starts a new one on top of it.
 *
 * Column expressions are in terms of the {@code FROM} clause, so a stage that reads a column simply inlines the
 * expression bound to that name.
 */
final class SelectBlock {

    record Column(String name, SqlText expr) {}

    private final SqlText from;
    private final SqlText scopePredicate;
    private List<Column> columns;
    private final List<SqlText> where = new ArrayList<>();
    private List<SqlText> groupBy;
    private List<SqlText> orderBy = List.of();
    private Long limit;
    private boolean distinct;

    private SelectBlock(SqlText from, List<Column> columns, SqlText scopePredicate) {
        this.from = from;
        this.columns = List.copyOf(columns);
        this.scopePredicate = scopePredicate;
    }

    /** Scan of a catalog table, scoped by {@code scopePredicate} (organization, optionally a time window first). */
    static SelectBlock table(SqlText table, List<Column> columns, SqlText scopePredicate) {
        return new SelectBlock(table, columns, scopePredicate);
    }

    /** Block reading from a derived table; the scoping lives inside it. */
    static SelectBlock derived(SqlText from, List<Column> columns) {
        return new SelectBlock(from, columns, null);
    }

    List<Column> columns() {
        return columns;
    }

    List<String> names() {
        return columns.stream().map(Column::name).toList();
    }

    Optional<Column> find(String name) {
        return columns.stream().filter(c -> c.name().equalsIgnoreCase(name)).findFirst();
    }

    void columns(List<Column> next) {
        this.columns = List.copyOf(next);
    }

    void where(SqlText condition) {
        where.add(condition);
    }

    void groupBy(List<SqlText> keys) {
        this.groupBy = List.copyOf(keys);
    }

    void orderBy(List<SqlText> keys) {
        this.orderBy = List.copyOf(keys);
    }

    void limit(long count) {
        this.limit = limit == null ? count : Math.min(limit, count);
    }

    void distinct() {
        this.distinct = true;
    }

    boolean isGrouped() {
        return groupBy != null;
    }

    boolean isOrdered() {
        return !orderBy.isEmpty();
    }

    boolean isLimited() {
        return limit != null;
    }

    boolean isDistinct() {
        return distinct;
    }

    /** The full statement; the scope predicate closes {@code WHERE}, so the organization is its last conjunct. */
    SqlText render() {
        List<Object> sql = new ArrayList<>();
        sql.add(distinct ? "SELECT DISTINCT " : "SELECT ");
        List<SqlText> select = new ArrayList<>();
        for (Column c : columns) {
            select.add(SqlText.concat(c.expr(), " AS ", SqlText.quoted(c.name())));
        }
        sql.add(SqlText.join(", ", select));
        sql.add(" FROM ");
        sql.add(from);
        List<SqlText> conditions = new ArrayList<>(where);
        if (scopePredicate != null) {
            conditions.add(scopePredicate);
        }
        if (!conditions.isEmpty()) {
            sql.add(" WHERE ");
            sql.add(SqlText.join(" AND ", conditions));
        }
        if (groupBy != null && !groupBy.isEmpty()) {
            sql.add(" GROUP BY ");
            sql.add(SqlText.join(", ", groupBy));
        }
        if (!orderBy.isEmpty()) {
            sql.add(" ORDER BY ");
            sql.add(SqlText.join(", ", orderBy));
        }
        if (limit != null) {
            sql.add(" LIMIT ");
            sql.add(SqlText.param(limit));
        }
        return SqlText.concat(sql.toArray());
    }
}
