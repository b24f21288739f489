package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.ast.AstPrinter;
import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.LiteralKind;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.ast.TableExpression;
import com.huntql.service.core.kql.ast.UnaryOperator;
import com.huntql.service.core.schema.SchemaProvider;
import com.huntql.service.core.schema.TableInfo;
import java.util.ArrayList;
import java.util.List;

/**
 * Row-count and cost estimator. Source cardinality comes from the catalog's {@code estimatedRows}; each
 * {@code where} scales it by a predicate selectivity built from simple equality/range heuristics.
 */
public class CostEstimator {

    private final SchemaProvider schema;
    private final CostModel model;

    public CostEstimator(SchemaProvider schema, CostModel model) {
        this.schema = schema;
        this.model = model;
    }

    public CostModel model() {
        return model;
    }

    public CostEstimate estimate(Query query) {
        List<CostEstimate.Step> steps = new ArrayList<>();
        double rows = sourceRows(query.source());
        double cost = rows;
        steps.add(new CostEstimate.Step("scan " + sourceLabel(query.source()), rows, rows, rows));
        for (Operation op : query.pipeline()) {
            double in = rows;
            double stageCost;
            if (op instanceof Operation.Where w) {
                rows = in * selectivity(w.predicate());
                stageCost = in;
            } else if (op instanceof Operation.Project) {
                stageCost = in * 0.1;
            } else if (op instanceof Operation.Extend e) {
                stageCost = in * 0.5 * e.columns().size();
            } else if (op instanceof Operation.Summarize s) {
                rows = s.groupBy().isEmpty() ? 1 : Math.max(1, in * model.summarizeReduction());
                stageCost = in;
            } else if (op instanceof Operation.OrderBy) {
                stageCost = in * log2(in);
            } else if (op instanceof Operation.Top t) {
                rows = Math.min(t.count(), in);
                stageCost = in * log2(t.count());
            } else if (op instanceof Operation.Limit l) {
                rows = Math.min(l.count(), in);
                stageCost = rows;
            } else if (op instanceof Operation.Distinct) {
                rows = in * model.distinctReduction();
                stageCost = in;
            } else if (op instanceof Operation.Join j) {
                double right = estimate(asQuery(j.right())).rows();
                rows = Math.max(in, right);
                stageCost = in + right;
            } else if (op instanceof Operation.Union u) {
                double total = in;
                for (TableExpression other : u.others()) {
                    total += estimate(asQuery(other)).rows();
                }
                rows = total;
                stageCost = total;
            } else {
                throw new IllegalArgumentException("Unsupported operation: " + op);
            }
            cost += stageCost;
            steps.add(new CostEstimate.Step(AstPrinter.print(op), in, rows, stageCost));
        }
        return new CostEstimate(rows, cost, steps);
    }

    /** Fraction of rows expected to satisfy {@code predicate}, in [0, 1]. */
    public double selectivity(Expr predicate) {
        if (predicate instanceof Expr.Literal lit) {
            if (lit.isTrue()) return 1.0;
            if (lit.kind() == LiteralKind.BOOL || lit.isNull()) return 0.0;
            return model.defaultSelectivity();
        }
        if (predicate instanceof Expr.UnaryOp u && u.op() == UnaryOperator.NOT) {
            return 1.0 - selectivity(u.operand());
        }
        if (!(predicate instanceof Expr.BinaryOp b)) {
            return model.defaultSelectivity();
        }
        return switch (b.op()) {
            case AND -> selectivity(b.left()) * selectivity(b.right());
            case OR -> {
                double l = selectivity(b.left());
                double r = selectivity(b.right());
                yield l + r - l * r;
            }
            case EQ, EQ_IGNORE_CASE -> model.equalitySelectivity();
            case NE, NE_IGNORE_CASE -> 1.0 - model.equalitySelectivity();
            case LT, LE, GT, GE -> model.rangeSelectivity();
            case CONTAINS, HAS, STARTS_WITH, ENDS_WITH -> model.stringMatchSelectivity();
            case NOT_CONTAINS, NOT_HAS, NOT_STARTS_WITH, NOT_ENDS_WITH -> 1.0 - model.stringMatchSelectivity();
            case MATCHES_REGEX -> model.regexSelectivity();
            case IN -> inSelectivity(b.right());
            case NOT_IN -> 1.0 - inSelectivity(b.right());
            default -> model.defaultSelectivity();
        };
    }

    private double inSelectivity(Expr list) {
        int size = list instanceof Expr.ListExpr l ? l.items().size() : 1;
        return Math.min(1.0, model.equalitySelectivity() * size);
    }

    private double sourceRows(TableExpression source) {
        if (source.isSubquery()) {
            return estimate(source.subquery()).rows();
        }
        return schema.findTable(source.name())
                .map(TableInfo::estimatedRows)
                .orElse(TableInfo.DEFAULT_ESTIMATED_ROWS);
    }

    private static String sourceLabel(TableExpression source) {
        return source.isSubquery() ? "(subquery)" : source.name();
    }

    private static Query asQuery(TableExpression table) {
        return table.isSubquery() ? table.subquery() : new Query(table, List.of());
    }

    private static double log2(double n) {
        return Math.log(Math.max(n, 2.0)) / Math.log(2.0);
    }
}
