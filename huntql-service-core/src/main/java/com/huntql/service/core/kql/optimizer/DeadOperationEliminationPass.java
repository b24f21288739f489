package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.analysis.Scope;
import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.ProjectItem;
import com.huntql.service.core.kql.ast.Query;
import java.util.ArrayList;
import java.util.List;

/**
 * Removes stages with no observable effect and merges redundant neighbours:
 * <ul>
 *   <li>{@code where true}</li>
 *   <li>a {@code project} that lists exactly its input columns, in order, unchanged</li>
 *   <li>{@code distinct *} right after {@code summarize} or {@code distinct}</li>
 *   <li>{@code limit a | limit b} into {@code limit min(a, b)}; {@code top n | limit m} into {@code top min(n, m)}</li>
 *   <li>an {@code order by} immediately followed by another {@code order by} or by {@code summarize}</li>
 * </ul>
 */
public class DeadOperationEliminationPass implements OptimizerPass {

    public static final String NAME = "dead-operation-elimination";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Query apply(Query query, OptimizationContext context) {
        List<Operation> result = new ArrayList<>();
        for (Operation op : query.pipeline()) {
            if (op instanceof Operation.Where w && w.predicate() instanceof Expr.Literal lit && lit.isTrue()) {
                continue;
            }
            if (op instanceof Operation.Project p && isIdentity(p, context.scopeAfter(query, result, result.size()))) {
                continue;
            }
            Operation last = result.isEmpty() ? null : result.get(result.size() - 1);
            if (op instanceof Operation.Distinct d
                    && d.allColumns()
                    && (last instanceof Operation.Summarize || last instanceof Operation.Distinct)) {
                continue;
            }
            if (op instanceof Operation.Limit limit && last instanceof Operation.Limit previous) {
                result.set(result.size() - 1, new Operation.Limit(Math.min(previous.count(), limit.count())));
                continue;
            }
            if (op instanceof Operation.Limit limit && last instanceof Operation.Top top) {
                if (limit.count() < top.count()) {
                    result.set(result.size() - 1, new Operation.Top(limit.count(), top.keys()));
                }
                continue;
            }
            if (op instanceof Operation.OrderBy || op instanceof Operation.Summarize) {
                while (!result.isEmpty() && result.get(result.size() - 1) instanceof Operation.OrderBy) {
                    result.remove(result.size() - 1);
                }
            }
            result.add(op);
        }
        return query.withPipeline(result);
    }

    private static boolean isIdentity(Operation.Project project, Scope input) {
        if (!input.known() || project.columns().size() != input.columns().size()) return false;
        for (int i = 0; i < project.columns().size(); i++) {
            ProjectItem item = project.columns().get(i);
            String column = input.columns().get(i).name();
            boolean same = item.expr() instanceof Expr.ColumnRef ref
                    && !ref.isQualified()
                    && ref.name().equals(column)
                    && (!item.hasExplicitName() || item.name().equals(column));
            if (!same) return false;
        }
        return true;
    }
}
