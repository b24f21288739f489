package com.huntql.service.core.kql.ast;

import java.util.Objects;

/** {@code [name =] expr}; used by project, extend and both halves of summarize. */
public record ProjectItem(String name, Expr expr) {

    public ProjectItem {
        Objects.requireNonNull(expr, "expr");
    }

    public static ProjectItem of(Expr expr) {
        return new ProjectItem(null, expr);
    }

    public static ProjectItem named(String name, Expr expr) {
        return new ProjectItem(name, expr);
    }

    public boolean hasExplicitName() {
        return name != null;
    }
}
