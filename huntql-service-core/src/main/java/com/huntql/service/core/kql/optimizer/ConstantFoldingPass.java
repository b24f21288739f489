package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.ast.BinaryOperator;
import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.LiteralKind;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.ProjectItem;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.ast.SortKey;
import com.huntql.service.core.kql.ast.UnaryOperator;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Evaluates sub-expressions whose operands are all literals: {@code 1 + 1} becomes {@code 2},
 * {@code datetime(2024-01-02) - 1d} becomes {@code datetime(2024-01-01)}.
 *
 * Left untouched: anything involving a null literal, integer overflow, division or modulo by zero, non-finite
 * doubles, ordering comparisons of strings (collation belongs to the store) and every function call.
 */
public class ConstantFoldingPass implements OptimizerPass {

    public static final String NAME = "constant-folding";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Query apply(Query query, OptimizationContext context) {
        List<Operation> out = new ArrayList<>(query.pipeline().size());
        for (Operation op : query.pipeline()) {
            out.add(mapExpressions(op, e -> Expr.rewrite(e, ConstantFoldingPass::fold)));
        }
        return query.withPipeline(out);
    }

    static Operation mapExpressions(Operation op, Function<Expr, Expr> fn) {
        if (op instanceof Operation.Where w) {
            return new Operation.Where(fn.apply(w.predicate()));
        }
        if (op instanceof Operation.Project p) {
            return new Operation.Project(mapItems(p.columns(), fn));
        }
        if (op instanceof Operation.Extend e) {
            return new Operation.Extend(mapItems(e.columns(), fn));
        }
        if (op instanceof Operation.Summarize s) {
            return new Operation.Summarize(mapItems(s.aggregations(), fn), mapItems(s.groupBy(), fn));
        }
        if (op instanceof Operation.OrderBy o) {
            return new Operation.OrderBy(mapKeys(o.keys(), fn));
        }
        if (op instanceof Operation.Top t) {
            return new Operation.Top(t.count(), mapKeys(t.keys(), fn));
        }
        if (op instanceof Operation.Distinct d) {
            return new Operation.Distinct(d.columns().stream().map(fn).toList());
        }
        if (op instanceof Operation.Join j) {
            return new Operation.Join(j.kind(), j.right(), fn.apply(j.on()));
        }
        return op;
    }

    private static List<ProjectItem> mapItems(List<ProjectItem> items, Function<Expr, Expr> fn) {
        return items.stream().map(i -> new ProjectItem(i.name(), fn.apply(i.expr()))).toList();
    }

    private static List<SortKey> mapKeys(List<SortKey> keys, Function<Expr, Expr> fn) {
        return keys.stream().map(k -> new SortKey(fn.apply(k.expr()), k.descending())).toList();
    }

    /** Folds a single node whose children have already been folded. */
    static Expr fold(Expr expr) {
        if (expr instanceof Expr.BinaryOp b
                && b.left() instanceof Expr.Literal l
                && b.right() instanceof Expr.Literal r) {
            Expr.Literal folded = binary(b.op(), l, r);
            return folded != null ? folded : expr;
        }
        if (expr instanceof Expr.BinaryOp b
                && b.left() instanceof Expr.Literal l
                && b.right() instanceof Expr.ListExpr list
                && (b.op() == BinaryOperator.IN || b.op() == BinaryOperator.NOT_IN)) {
            Expr.Literal folded = membership(b.op(), l, list);
            return folded != null ? folded : expr;
        }
        if (expr instanceof Expr.UnaryOp u && u.operand() instanceof Expr.Literal lit) {
            Expr.Literal folded = unary(u.op(), lit);
            return folded != null ? folded : expr;
        }
        if (expr instanceof Expr.Case c) {
            return foldCase(c);
        }
        return expr;
    }

    private static Expr foldCase(Expr.Case c) {
        List<Expr.CaseBranch> remaining = new ArrayList<>();
        for (Expr.CaseBranch branch : c.branches()) {
            if (branch.when() instanceof Expr.Literal lit && lit.kind() == LiteralKind.BOOL) {
                if (lit.isTrue()) {
                    if (remaining.isEmpty()) return branch.then();
                    return new Expr.Case(remaining, branch.then());
                }
                continue;
            }
            if (branch.when() instanceof Expr.Literal lit && lit.isNull()) {
                continue;
            }
            remaining.add(branch);
        }
        if (remaining.isEmpty()) return c.otherwise();
        if (remaining.size() == c.branches().size()) return c;
        return new Expr.Case(remaining, c.otherwise());
    }

    private static Expr.Literal unary(UnaryOperator op, Expr.Literal lit) {
        if (lit.isNull()) return null;
        try {
            return switch (op) {
                case NOT -> lit.kind() == LiteralKind.BOOL ? Expr.Literal.of(!(Boolean) lit.value()) : null;
                case NEGATE -> switch (lit.kind()) {
                    case LONG -> Expr.Literal.of(Math.negateExact((Long) lit.value()));
                    case REAL -> Expr.Literal.of(-(Double) lit.value());
                    case TIMESPAN -> Expr.Literal.of(((Duration) lit.value()).negated());
                    default -> null;
                };
            };
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static Expr.Literal binary(BinaryOperator op, Expr.Literal l, Expr.Literal r) {
        if (l.isNull() || r.isNull()) return null;
        try {
            return switch (op.category()) {
                case LOGICAL -> logical(op, l, r);
                case ARITHMETIC -> arithmetic(op, l, r);
                case COMPARISON -> comparison(op, l, r);
                default -> null;
            };
        } catch (ArithmeticException | DateTimeException e) {
            return null;
        }
    }

    private static Expr.Literal logical(BinaryOperator op, Expr.Literal l, Expr.Literal r) {
        if (l.kind() != LiteralKind.BOOL || r.kind() != LiteralKind.BOOL) return null;
        boolean a = (Boolean) l.value();
        boolean b = (Boolean) r.value();
        return Expr.Literal.of(op == BinaryOperator.AND ? a && b : a || b);
    }

    private static Expr.Literal arithmetic(BinaryOperator op, Expr.Literal l, Expr.Literal r) {
        LiteralKind lk = l.kind();
        LiteralKind rk = r.kind();
        if (lk == LiteralKind.LONG && rk == LiteralKind.LONG) {
            long a = (Long) l.value();
            long b = (Long) r.value();
            return switch (op) {
                case ADD -> Expr.Literal.of(Math.addExact(a, b));
                case SUBTRACT -> Expr.Literal.of(Math.subtractExact(a, b));
                case MULTIPLY -> Expr.Literal.of(Math.multiplyExact(a, b));
                case DIVIDE -> b == 0 || (a == Long.MIN_VALUE && b == -1) ? null : Expr.Literal.of(a / b);
                case MODULO -> b == 0 ? null : Expr.Literal.of(a % b);
                default -> null;
            };
        }
        if (isNumeric(lk) && isNumeric(rk)) {
            double a = ((Number) l.value()).doubleValue();
            double b = ((Number) r.value()).doubleValue();
            Double result = switch (op) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> b == 0.0 ? null : a / b;
                case MODULO -> b == 0.0 ? null : a % b;
                default -> null;
            };
            return result == null || !Double.isFinite(result) ? null : Expr.Literal.of(result.doubleValue());
        }
        if (lk == LiteralKind.DATETIME && rk == LiteralKind.TIMESPAN) {
            Instant t = (Instant) l.value();
            Duration d = (Duration) r.value();
            return switch (op) {
                case ADD -> Expr.Literal.of(t.plus(d));
                case SUBTRACT -> Expr.Literal.of(t.minus(d));
                default -> null;
            };
        }
        if (lk == LiteralKind.TIMESPAN && rk == LiteralKind.DATETIME && op == BinaryOperator.ADD) {
            return Expr.Literal.of(((Instant) r.value()).plus((Duration) l.value()));
        }
        if (lk == LiteralKind.DATETIME && rk == LiteralKind.DATETIME && op == BinaryOperator.SUBTRACT) {
            return Expr.Literal.of(Duration.between((Instant) r.value(), (Instant) l.value()));
        }
        if (lk == LiteralKind.TIMESPAN && rk == LiteralKind.TIMESPAN) {
            Duration a = (Duration) l.value();
            Duration b = (Duration) r.value();
            return switch (op) {
                case ADD -> Expr.Literal.of(a.plus(b));
                case SUBTRACT -> Expr.Literal.of(a.minus(b));
                default -> null;
            };
        }
        return null;
    }

    private static Expr.Literal comparison(BinaryOperator op, Expr.Literal l, Expr.Literal r) {
        Integer cmp = compare(l, r);
        boolean stringOperands = l.kind() == LiteralKind.STRING && r.kind() == LiteralKind.STRING;
        switch (op) {
            case EQ_IGNORE_CASE, NE_IGNORE_CASE -> {
                if (!stringOperands) return null;
                boolean equal = ((String) l.value()).equalsIgnoreCase((String) r.value());
                return Expr.Literal.of(op == BinaryOperator.EQ_IGNORE_CASE ? equal : !equal);
            }
            case EQ, NE -> {
                if (cmp == null) return null;
                return Expr.Literal.of(op == BinaryOperator.EQ ? cmp == 0 : cmp != 0);
            }
            default -> {
                if (cmp == null || stringOperands || l.kind() == LiteralKind.BOOL || l.kind() == LiteralKind.GUID) {
                    return null;
                }
                boolean result = switch (op) {
                    case LT -> cmp < 0;
                    case LE -> cmp <= 0;
                    case GT -> cmp > 0;
                    default -> cmp >= 0;
                };
                return Expr.Literal.of(result);
            }
        }
    }

    private static Expr.Literal membership(BinaryOperator op, Expr.Literal needle, Expr.ListExpr list) {
        if (needle.isNull()) return null;
        boolean found = false;
        for (Expr item : list.items()) {
            if (!(item instanceof Expr.Literal lit) || lit.isNull()) return null;
            Integer cmp = compare(needle, lit);
            if (cmp == null) return null;
            if (cmp == 0) found = true;
        }
        return Expr.Literal.of(op == BinaryOperator.IN ? found : !found);
    }

    /** Total order within comparable literal kinds; {@code null} when the kinds are not comparable. */
    @SuppressWarnings("unchecked")
    private static Integer compare(Expr.Literal l, Expr.Literal r) {
        if (isNumeric(l.kind()) && isNumeric(r.kind())) {
            if (l.kind() == LiteralKind.LONG && r.kind() == LiteralKind.LONG) {
                return Long.compare((Long) l.value(), (Long) r.value());
            }
            // + 0.0 turns -0.0 into 0.0; SQL has no signed zero
            return Double.compare(
                    ((Number) l.value()).doubleValue() + 0.0, ((Number) r.value()).doubleValue() + 0.0);
        }
        if (l.kind() != r.kind()) return null;
        return switch (l.kind()) {
            case STRING, BOOL, DATETIME, TIMESPAN, GUID ->
                    ((Comparable<Object>) l.value()).compareTo(Objects.requireNonNull(r.value()));
            default -> null;
        };
    }

    private static boolean isNumeric(LiteralKind kind) {
        return kind == LiteralKind.LONG || kind == LiteralKind.REAL;
    }
}
