package com.huntql.service.core.kql.analysis;

import com.huntql.service.core.kql.ast.BinaryOperator;
import com.huntql.service.core.kql.ast.ColumnNaming;
import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.ProjectItem;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.ast.SortKey;
import com.huntql.service.core.kql.ast.TableExpression;
import com.huntql.service.core.kql.ast.UnaryOperator;
import com.huntql.service.core.schema.ColumnInfo;
import com.huntql.service.core.schema.ColumnType;
import com.huntql.service.core.schema.FunctionInfo;
import com.huntql.service.core.schema.SchemaProvider;
import com.huntql.service.core.schema.TableInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves a parsed query against the catalog. Walks the pipeline in order, threading the cumulative column
 * scope through each stage, and reports every problem found rather than only the first.
 */
public class SemanticAnalyzer {

    private final SchemaProvider schema;

    public SemanticAnalyzer(SchemaProvider schema) {
        this.schema = schema;
    }

    /**
     * Validates {@code query}.
     *
     * @return the column scope before each stage
     * @throws SemanticException listing every error found
     */
    public PipelineScopes analyze(Query query) {
        Run run = new Run(true);
        PipelineScopes scopes = run.query(query);
        if (!run.errors.isEmpty()) {
            throw new SemanticException(run.errors);
        }
        return scopes;
    }

    /** Same walk as {@link #analyze} but never fails; unresolvable parts yield unknown scopes. */
    public PipelineScopes scopes(Query query) {
        return new Run(false).query(query);
    }

    public Scope sourceScope(TableExpression table) {
        return new Run(false).source(table);
    }

    /** Type of {@code expr} evaluated against {@code scope}; {@link ColumnType#ANY} when it cannot be inferred. */
    public ColumnType typeOf(Expr expr, Scope scope) {
        return new Run(false).expr(expr, new Context(scope, null, null, null, null, Mode.SCALAR));
    }

    private enum Mode {
        SCALAR,
        AGGREGATION,
        INSIDE_AGGREGATE
    }

    private record Context(
            Scope scope, Scope left, Scope right, String leftAlias, String rightAlias, Mode mode) {

        Context inMode(Mode next) {
            return new Context(scope, left, right, leftAlias, rightAlias, next);
        }

        Context withScope(Scope next) {
            return new Context(next, left, right, leftAlias, rightAlias, mode);
        }

        boolean inJoin() {
            return left != null;
        }
    }

    private final class Run {
        private final boolean reporting;
        private final List<SemanticError> errors = new ArrayList<>();

        Run(boolean reporting) {
            this.reporting = reporting;
        }

        PipelineScopes query(Query query) {
            List<Scope> stages = new ArrayList<>();
            Scope scope = source(query.source());
            stages.add(scope);
            for (Operation op : query.pipeline()) {
                scope = operation(op, scope, query.source().alias());
                stages.add(scope);
            }
            return new PipelineScopes(stages);
        }

        Scope source(TableExpression table) {
            if (table.isSubquery()) {
                return query(table.subquery()).output();
            }
            Optional<TableInfo> info = schema.findTable(table.name());
            if (info.isEmpty()) {
                error(SemanticError.Kind.UNKNOWN_TABLE, table.name(), "Unknown table '" + table.name() + "'");
                return Scope.unknown();
            }
            List<Scope.Column> columns = new ArrayList<>();
            for (ColumnInfo c : info.get().columns()) {
                columns.add(new Scope.Column(c.name(), c.type()));
            }
            return Scope.of(columns);
        }

        Scope operation(Operation op, Scope in, String sourceAlias) {
            Context scalar = new Context(in, null, null, null, null, Mode.SCALAR);
            if (op instanceof Operation.Where w) {
                expr(w.predicate(), scalar);
                return in;
            }
            if (op instanceof Operation.Project p) {
                List<String> names = ColumnNaming.names(p.columns());
                List<Scope.Column> out = new ArrayList<>();
                for (int i = 0; i < p.columns().size(); i++) {
                    out.add(new Scope.Column(names.get(i), expr(p.columns().get(i).expr(), scalar)));
                }
                return unique(out, in.known());
            }
            if (op instanceof Operation.Extend e) {
                List<String> names = ColumnNaming.names(e.columns());
                checkDuplicates(names);
                Scope scope = in;
                for (int i = 0; i < e.columns().size(); i++) {
                    ColumnType type = expr(e.columns().get(i).expr(), scalar.withScope(scope));
                    scope = scope.with(new Scope.Column(names.get(i), type));
                }
                return scope;
            }
            if (op instanceof Operation.Summarize s) {
                List<String> names = ColumnNaming.names(s);
                List<Scope.Column> out = new ArrayList<>();
                int i = 0;
                for (ProjectItem key : s.groupBy()) {
                    out.add(new Scope.Column(names.get(i++), expr(key.expr(), scalar)));
                }
                Context aggregation = scalar.inMode(Mode.AGGREGATION);
                for (ProjectItem agg : s.aggregations()) {
                    if (!containsAggregate(agg.expr())) {
                        error(SemanticError.Kind.NOT_AN_AGGREGATE, names.get(i),
                                "Summarize expression '" + names.get(i) + "' is not an aggregation");
                    }
                    out.add(new Scope.Column(names.get(i++), expr(agg.expr(), aggregation)));
                }
                return unique(out, in.known());
            }
            if (op instanceof Operation.OrderBy o) {
                sortKeys(o.keys(), scalar);
                return in;
            }
            if (op instanceof Operation.Top t) {
                sortKeys(t.keys(), scalar);
                return in;
            }
            if (op instanceof Operation.Limit) {
                return in;
            }
            if (op instanceof Operation.Distinct d) {
                if (d.allColumns()) return in;
                List<String> names = ColumnNaming.distinctNames(d.columns());
                List<Scope.Column> out = new ArrayList<>();
                for (int i = 0; i < d.columns().size(); i++) {
                    out.add(new Scope.Column(names.get(i), expr(d.columns().get(i), scalar)));
                }
                return unique(out, in.known());
            }
            if (op instanceof Operation.Join j) {
                Scope right = source(j.right());
                Context join = new Context(in, in, right, sourceAlias, j.right().alias(), Mode.SCALAR);
                expr(j.on(), join);
                return JoinLayout.of(in, right).scope(in.known() && right.known());
            }
            if (op instanceof Operation.Union u) {
                List<Scope> branches = new ArrayList<>();
                branches.add(in);
                for (TableExpression other : u.others()) {
                    branches.add(source(other));
                }
                return merge(branches);
            }
            throw new IllegalArgumentException("Unsupported operation: " + op);
        }

        private void sortKeys(List<SortKey> keys, Context ctx) {
            keys.forEach(k -> expr(k.expr(), ctx));
        }

        private Scope unique(List<Scope.Column> columns, boolean known) {
            checkDuplicates(columns.stream().map(Scope.Column::name).toList());
            return known ? Scope.of(columns) : Scope.unknown();
        }

        private void checkDuplicates(List<String> names) {
            Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            for (String name : names) {
                if (!seen.add(name)) {
                    error(SemanticError.Kind.DUPLICATE_COLUMN, name, "Duplicate column name '" + name + "'");
                }
            }
        }

        private Scope merge(List<Scope> branches) {
            if (branches.stream().anyMatch(b -> !b.known())) return Scope.unknown();
            List<Scope.Column> merged = new ArrayList<>();
            for (Scope branch : branches) {
                for (Scope.Column c : branch.columns()) {
                    int existing = indexOf(merged, c.name());
                    if (existing < 0) {
                        merged.add(c);
                    } else if (merged.get(existing).type() != c.type()) {
                        merged.set(existing, new Scope.Column(merged.get(existing).name(), ColumnType.ANY));
                    }
                }
            }
            return Scope.of(merged);
        }

        private int indexOf(List<Scope.Column> columns, String name) {
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).name().equalsIgnoreCase(name)) return i;
            }
            return -1;
        }

        // ------------------------------------------------------------------ expressions

        ColumnType expr(Expr expr, Context ctx) {
            if (expr instanceof Expr.Literal lit) {
                return literalType(lit);
            }
            if (expr instanceof Expr.ColumnRef ref) {
                return column(ref, ctx);
            }
            if (expr instanceof Expr.BinaryOp b) {
                ColumnType left = expr(b.left(), ctx);
                ColumnType right = expr(b.right(), ctx);
                return binaryType(b.op(), left, right);
            }
            if (expr instanceof Expr.UnaryOp u) {
                ColumnType operand = expr(u.operand(), ctx);
                return u.op() == UnaryOperator.NOT ? ColumnType.BOOL : operand;
            }
            if (expr instanceof Expr.FunctionCall f) {
                return function(f, ctx);
            }
            if (expr instanceof Expr.Case c) {
                ColumnType result = null;
                for (Expr.CaseBranch branch : c.branches()) {
                    expr(branch.when(), ctx);
                    ColumnType t = expr(branch.then(), ctx);
                    if (result == null) result = t;
                }
                expr(c.otherwise(), ctx);
                return result;
            }
            if (expr instanceof Expr.ListExpr l) {
                l.items().forEach(i -> expr(i, ctx));
                return ColumnType.ANY;
            }
            throw new IllegalArgumentException("Unsupported expression: " + expr);
        }

        private ColumnType column(Expr.ColumnRef ref, Context ctx) {
            if (ctx.mode() == Mode.AGGREGATION) {
                error(SemanticError.Kind.NOT_AN_AGGREGATE, ref.name(),
                        "Column '" + ref.name() + "' must be used inside an aggregation function");
            }
            if (ref.isQualified() && ctx.inJoin()) {
                JoinLayout.Side side = JoinLayout.sideOf(ref.qualifier(), ctx.leftAlias(), ctx.rightAlias());
                if (side != null) {
                    Scope target = side == JoinLayout.Side.LEFT ? ctx.left() : ctx.right();
                    return lookup(target, ref.name(), ref.qualifier() + "." + ref.name());
                }
            }
            if (ref.isQualified()) {
                if (ref.qualifier().startsWith("$")) {
                    return unknownColumn(ref.qualifier() + "." + ref.name());
                }
                Optional<Scope.Column> base = ctx.scope().find(ref.qualifier());
                if (base.isEmpty()) {
                    return unknownColumn(ref.qualifier());
                }
                ColumnType type = base.get().type();
                if (type != ColumnType.DYNAMIC && type != ColumnType.ANY) {
                    error(SemanticError.Kind.UNKNOWN_COLUMN, ref.qualifier() + "." + ref.name(),
                            "Column '" + ref.qualifier() + "' is not dynamic; property '" + ref.name()
                                    + "' cannot be read");
                }
                return ColumnType.DYNAMIC;
            }
            if (ctx.inJoin()) {
                // unqualified names in a join condition resolve against the left side first
                Optional<Scope.Column> left = ctx.left().find(ref.name());
                if (left.isPresent()) return left.get().type();
                return lookup(ctx.right(), ref.name(), ref.name());
            }
            return lookup(ctx.scope(), ref.name(), ref.name());
        }

        private ColumnType lookup(Scope scope, String name, String displayName) {
            return scope.find(name).map(Scope.Column::type).orElseGet(() -> unknownColumn(displayName));
        }

        private ColumnType unknownColumn(String name) {
            error(SemanticError.Kind.UNKNOWN_COLUMN, name, "Unknown column '" + name + "'");
            return ColumnType.ANY;
        }

        private ColumnType function(Expr.FunctionCall f, Context ctx) {
            Optional<FunctionInfo> info = schema.findFunction(f.name());
            if (info.isEmpty()) {
                error(SemanticError.Kind.UNKNOWN_FUNCTION, f.name(), "Unknown function '" + f.name() + "'");
                f.args().forEach(a -> expr(a, ctx.inMode(ctx.mode() == Mode.AGGREGATION ? Mode.SCALAR : ctx.mode())));
                return ColumnType.ANY;
            }
            FunctionInfo fn = info.get();
            if (!fn.accepts(f.args().size())) {
                error(SemanticError.Kind.ARITY_MISMATCH, f.name(),
                        "Function '" + f.name() + "' expects " + fn.arityText() + " argument(s) but got "
                                + f.args().size());
            }
            Context argContext = ctx;
            if (fn.isAggregate()) {
                if (ctx.mode() != Mode.AGGREGATION) {
                    error(SemanticError.Kind.AGGREGATE_NOT_ALLOWED, f.name(),
                            "Aggregation '" + f.name() + "' is only allowed at the top of a summarize expression");
                }
                argContext = ctx.inMode(Mode.INSIDE_AGGREGATE);
            }
            List<ColumnType> argTypes = new ArrayList<>();
            for (Expr arg : f.args()) {
                argTypes.add(expr(arg, argContext));
            }
            return returnType(fn, argTypes);
        }

        private ColumnType returnType(FunctionInfo fn, List<ColumnType> args) {
            if (fn.returnType() != ColumnType.ANY) return fn.returnType();
            String name = fn.name().toLowerCase(Locale.ROOT);
            int source = name.equals("iif") || name.equals("iff") ? 1 : 0;
            return args.size() > source ? args.get(source) : ColumnType.ANY;
        }

        private void error(SemanticError.Kind kind, String name, String message) {
            if (reporting) errors.add(new SemanticError(kind, name, message));
        }
    }

    private static boolean containsAggregateCall(Expr expr, SchemaProvider schema) {
        if (expr instanceof Expr.FunctionCall f) {
            if (schema.findFunction(f.name()).map(FunctionInfo::isAggregate).orElse(false)) return true;
            return f.args().stream().anyMatch(a -> containsAggregateCall(a, schema));
        }
        if (expr instanceof Expr.BinaryOp b) {
            return containsAggregateCall(b.left(), schema) || containsAggregateCall(b.right(), schema);
        }
        if (expr instanceof Expr.UnaryOp u) {
            return containsAggregateCall(u.operand(), schema);
        }
        if (expr instanceof Expr.Case c) {
            return c.branches().stream()
                            .anyMatch(br -> containsAggregateCall(br.when(), schema)
                                    || containsAggregateCall(br.then(), schema))
                    || containsAggregateCall(c.otherwise(), schema);
        }
        return false;
    }

    /** True when {@code expr} calls a catalog aggregation anywhere. */
    public boolean containsAggregate(Expr expr) {
        return containsAggregateCall(expr, schema);
    }

    static ColumnType literalType(Expr.Literal lit) {
        return switch (lit.kind()) {
            case STRING -> ColumnType.STRING;
            case LONG -> ColumnType.LONG;
            case REAL -> ColumnType.REAL;
            case BOOL -> ColumnType.BOOL;
            case DATETIME -> ColumnType.DATETIME;
            case TIMESPAN -> ColumnType.TIMESPAN;
            case GUID -> ColumnType.GUID;
            case NULL -> ColumnType.ANY;
        };
    }

    static ColumnType binaryType(BinaryOperator op, ColumnType left, ColumnType right) {
        if (op.category() != BinaryOperator.Category.ARITHMETIC) {
            return ColumnType.BOOL;
        }
        if (left == ColumnType.DATETIME && right == ColumnType.DATETIME && op == BinaryOperator.SUBTRACT) {
            return ColumnType.TIMESPAN;
        }
        if (left == ColumnType.DATETIME || right == ColumnType.DATETIME) {
            return ColumnType.DATETIME;
        }
        if (left == ColumnType.TIMESPAN || right == ColumnType.TIMESPAN) {
            return ColumnType.TIMESPAN;
        }
        if (left == ColumnType.REAL || right == ColumnType.REAL) {
            return ColumnType.REAL;
        }
        if (left == ColumnType.LONG && right == ColumnType.LONG) {
            return ColumnType.LONG;
        }
        return ColumnType.ANY;
    }
}
