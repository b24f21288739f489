package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.analysis.JoinLayout;
import com.huntql.service.core.kql.analysis.Scope;
import com.huntql.service.core.kql.ast.ColumnNaming;
import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.JoinKind;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.ProjectItem;
import com.huntql.service.core.kql.ast.Query;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Moves each {@code where} as early as it can go. A filter passes
 * <ul>
 *   <li>a {@code project} that passes every column it reads through unchanged</li>
 *   <li>an {@code extend} that defines none of the columns it reads</li>
 *   <li>{@code order by} and {@code distinct *}</li>
 *   <li>an inner or left-outer {@code join} when it reads only left-side columns that kept their names</li>
 * </ul>
 * It never passes {@code summarize}, {@code union}, {@code top}, {@code limit} or another {@code where}.
 */
public class PredicatePushdownPass implements OptimizerPass {

    public static final String NAME = "predicate-pushdown";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Query apply(Query query, OptimizationContext context) {
        List<Operation> result = new ArrayList<>();
        for (Operation op : query.pipeline()) {
            if (!(op instanceof Operation.Where where)) {
                result.add(op);
                continue;
            }
            int position = result.size();
            while (position > 0 && canPass(where, result, position - 1, query, context)) {
                position--;
            }
            result.add(position, where);
        }
        return query.withPipeline(result);
    }

    private boolean canPass(
            Operation.Where where, List<Operation> pipeline, int index, Query query, OptimizationContext context) {
        Operation previous = pipeline.get(index);
        Set<String> reads = Columns.referenced(where.predicate());
        if (previous instanceof Operation.Project p) {
            return reads.stream().allMatch(column -> passesThrough(p, column));
        }
        if (previous instanceof Operation.Extend e) {
            Set<String> defined = Columns.newSet();
            defined.addAll(ColumnNaming.names(e.columns()));
            return reads.stream().noneMatch(defined::contains);
        }
        if (previous instanceof Operation.OrderBy) {
            return true;
        }
        if (previous instanceof Operation.Distinct d) {
            return d.allColumns();
        }
        if (previous instanceof Operation.Join j) {
            return canPassJoin(where, reads, j, pipeline, index, query, context);
        }
        return false;
    }

    private static boolean passesThrough(Operation.Project project, String column) {
        for (ProjectItem item : project.columns()) {
            if (item.expr() instanceof Expr.ColumnRef ref
                    && !ref.isQualified()
                    && ref.name().equalsIgnoreCase(column)
                    && (!item.hasExplicitName() || item.name().equalsIgnoreCase(column))) {
                return true;
            }
        }
        return false;
    }

    private boolean canPassJoin(
            Operation.Where where,
            Set<String> reads,
            Operation.Join join,
            List<Operation> pipeline,
            int index,
            Query query,
            OptimizationContext context) {
        if (join.kind() != JoinKind.INNER && join.kind() != JoinKind.LEFT) return false;
        if (Columns.hasJoinQualifier(where.predicate())) return false;
        Scope left = context.scopeAfter(query, pipeline, index);
        Scope right = context.analyzer().sourceScope(join.right());
        if (!left.known() || !right.known()) return false;
        JoinLayout layout = JoinLayout.of(left, right);
        return reads.stream().allMatch(layout::isUnrenamedLeft);
    }
}
