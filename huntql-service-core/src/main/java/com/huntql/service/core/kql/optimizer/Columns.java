package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.ast.Expr;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

final class Columns {

    private Columns() {}

    static Set<String> newSet() {
        return new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
    }

    /** Input columns {@code expr} reads; a dynamic property access reads its base column. */
    static Set<String> referenced(Expr expr) {
        Set<String> out = newSet();
        for (Expr.ColumnRef ref : Expr.columnRefs(expr)) {
            out.add(ref.isQualified() ? ref.qualifier() : ref.name());
        }
        return out;
    }

    static Set<String> referenced(Collection<? extends Expr> exprs) {
        Set<String> out = newSet();
        exprs.forEach(e -> out.addAll(referenced(e)));
        return out;
    }

    static boolean hasJoinQualifier(Expr expr) {
        return Expr.columnRefs(expr).stream()
                .anyMatch(r -> r.isQualified() && r.qualifier().startsWith("$"));
    }
}
