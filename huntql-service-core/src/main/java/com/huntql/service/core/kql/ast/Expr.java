package com.huntql.service.core.kql.ast;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/** Expression sub-tree. Closed set of node kinds; every consumer handles all of them. */
public sealed interface Expr
        permits Expr.Literal,
                Expr.ColumnRef,
                Expr.BinaryOp,
                Expr.UnaryOp,
                Expr.FunctionCall,
                Expr.Case,
                Expr.ListExpr {

    record Literal(LiteralKind kind, Object value) implements Expr {
        public static final Literal NULL = new Literal(LiteralKind.NULL, null);
        public static final Literal TRUE = new Literal(LiteralKind.BOOL, Boolean.TRUE);
        public static final Literal FALSE = new Literal(LiteralKind.BOOL, Boolean.FALSE);

        public Literal {
            Objects.requireNonNull(kind, "kind");
            if (kind == LiteralKind.NULL && value != null) {
                throw new IllegalArgumentException("null literal carries no value");
            }
            if (kind != LiteralKind.NULL && value == null) {
                throw new IllegalArgumentException(kind + " literal requires a value");
            }
        }

        public static Literal of(String value) {
            return new Literal(LiteralKind.STRING, value);
        }

        public static Literal of(long value) {
            return new Literal(LiteralKind.LONG, value);
        }

        public static Literal of(double value) {
            return new Literal(LiteralKind.REAL, value);
        }

        public static Literal of(boolean value) {
            return value ? TRUE : FALSE;
        }

        public static Literal of(Instant value) {
            return new Literal(LiteralKind.DATETIME, value);
        }

        public static Literal of(Duration value) {
            return new Literal(LiteralKind.TIMESPAN, value);
        }

        public static Literal of(UUID value) {
            return new Literal(LiteralKind.GUID, value);
        }

        public boolean isNull() {
            return kind == LiteralKind.NULL;
        }

        public boolean isTrue() {
            return kind == LiteralKind.BOOL && Boolean.TRUE.equals(value);
        }
    }

    /**
     * Column reference. {@code qualifier} is {@code $left}/{@code $right} inside join conditions, a table alias,
     * or the dynamic column a property is read from ({@code AdditionalFields.LogonType}).
     */
    record ColumnRef(String name, String qualifier) implements Expr {
        public ColumnRef {
            Objects.requireNonNull(name, "name");
        }

        public static ColumnRef of(String name) {
            return new ColumnRef(name, null);
        }

        public boolean isQualified() {
            return qualifier != null;
        }
    }

    record BinaryOp(BinaryOperator op, Expr left, Expr right) implements Expr {
        public BinaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record UnaryOp(UnaryOperator op, Expr operand) implements Expr {
        public UnaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }
    }

    record FunctionCall(String name, List<Expr> args) implements Expr {
        public FunctionCall {
            Objects.requireNonNull(name, "name");
            args = args == null ? List.of() : List.copyOf(args);
        }

        public static FunctionCall of(String name, Expr... args) {
            return new FunctionCall(name, List.of(args));
        }
    }

    record CaseBranch(Expr when, Expr then) {
        public CaseBranch {
            Objects.requireNonNull(when, "when");
            Objects.requireNonNull(then, "then");
        }
    }

    record Case(List<CaseBranch> branches, Expr otherwise) implements Expr {
        public Case {
            branches = List.copyOf(branches);
            if (branches.isEmpty()) {
                throw new IllegalArgumentException("case requires at least one branch");
            }
            Objects.requireNonNull(otherwise, "otherwise");
        }
    }

    /** Right-hand side of {@code in} / {@code !in}. */
    record ListExpr(List<Expr> items) implements Expr {
        public ListExpr {
            items = List.copyOf(items);
        }
    }

    static Expr and(Expr left, Expr right) {
        return new BinaryOp(BinaryOperator.AND, left, right);
    }

    /** Rebuilds the tree bottom-up, applying {@code fn} to every node after its children. */
    static Expr rewrite(Expr expr, Function<Expr, Expr> fn) {
        Expr rebuilt;
        if (expr instanceof BinaryOp b) {
            rebuilt = new BinaryOp(b.op(), rewrite(b.left(), fn), rewrite(b.right(), fn));
        } else if (expr instanceof UnaryOp u) {
            rebuilt = new UnaryOp(u.op(), rewrite(u.operand(), fn));
        } else if (expr instanceof FunctionCall f) {
            rebuilt = new FunctionCall(f.name(), f.args().stream().map(a -> rewrite(a, fn)).toList());
        } else if (expr instanceof Case c) {
            rebuilt = new Case(
                    c.branches().stream()
                            .map(br -> new CaseBranch(rewrite(br.when(), fn), rewrite(br.then(), fn)))
                            .toList(),
                    rewrite(c.otherwise(), fn));
        } else if (expr instanceof ListExpr l) {
            rebuilt = new ListExpr(l.items().stream().map(i -> rewrite(i, fn)).toList());
        } else {
            rebuilt = expr;
        }
        return fn.apply(rebuilt);
    }

    /** Every column reference below {@code expr}, in visiting order. */
    static List<ColumnRef> columnRefs(Expr expr) {
        Set<ColumnRef> out = new LinkedHashSet<>();
        collect(expr, out);
        return List.copyOf(out);
    }

    private static void collect(Expr expr, Set<ColumnRef> out) {
        if (expr instanceof ColumnRef c) {
            out.add(c);
        } else if (expr instanceof BinaryOp b) {
            collect(b.left(), out);
            collect(b.right(), out);
        } else if (expr instanceof UnaryOp u) {
            collect(u.operand(), out);
        } else if (expr instanceof FunctionCall f) {
            f.args().forEach(a -> collect(a, out));
        } else if (expr instanceof Case c) {
            c.branches().forEach(br -> {
                collect(br.when(), out);
                collect(br.then(), out);
            });
            collect(c.otherwise(), out);
        } else if (expr instanceof ListExpr l) {
            l.items().forEach(i -> collect(i, out));
        }
    }
}
