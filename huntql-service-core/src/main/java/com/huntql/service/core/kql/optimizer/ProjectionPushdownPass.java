package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.analysis.Scope;
import com.huntql.service.core.kql.ast.ColumnNaming;
import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.ProjectItem;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.ast.SortKey;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Backward required-column analysis. Walking the pipeline from the end, it drops {@code extend},
 * {@code project} and {@code summarize} items nobody downstream reads, and, when the result width is bounded by a
 * later {@code project}/{@code summarize}/{@code distinct} and the pipeline has no join or union, narrows the
 * source right after its leading filters.
 *
 * Items that lose a neighbour first get their implicit names ({@code Column1}, ...) written out so dropping a
 * sibling never renames them.
 */
public class ProjectionPushdownPass implements OptimizerPass {

    public static final String NAME = "projection-pushdown";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Query apply(Query query, OptimizationContext context) {
        List<Operation> pipeline = query.pipeline();
        List<Operation> result = new ArrayList<>();
        // required-before of each kept stage, aligned with result; null means every column is required
        List<Set<String>> requiredBefore = new ArrayList<>();
        Set<String> required = null;
        for (int i = pipeline.size() - 1; i >= 0; i--) {
            Step step = step(pipeline.get(i), required);
            required = step.requiredBefore();
            if (step.operation() != null) {
                result.add(0, step.operation());
                requiredBefore.add(0, required);
            }
        }
        if (noJoinOrUnion(result)) {
            narrowSource(query, result, requiredBefore, context);
        }
        return query.withPipeline(result);
    }

    private record Step(Operation operation, Set<String> requiredBefore) {}

    private Step step(Operation op, Set<String> required) {
        if (op instanceof Operation.Where w) {
            return new Step(op, union(required, Columns.referenced(w.predicate())));
        }
        if (op instanceof Operation.Project p) {
            return project(p, required);
        }
        if (op instanceof Operation.Extend e) {
            return extend(e, required);
        }
        if (op instanceof Operation.Summarize s) {
            return summarize(s, required);
        }
        if (op instanceof Operation.OrderBy o) {
            return new Step(op, union(required, keyColumns(o.keys())));
        }
        if (op instanceof Operation.Top t) {
            return new Step(op, union(required, keyColumns(t.keys())));
        }
        if (op instanceof Operation.Limit) {
            return new Step(op, required);
        }
        if (op instanceof Operation.Distinct d) {
            return new Step(op, d.allColumns() ? null : Columns.referenced(d.columns()));
        }
        // join and union: every input column may matter
        return new Step(op, null);
    }

    private Step project(Operation.Project p, Set<String> required) {
        List<ProjectItem> items = p.columns();
        if (required != null) {
            List<String> names = ColumnNaming.names(items);
            List<ProjectItem> kept = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                if (required.contains(names.get(i))) {
                    kept.add(new ProjectItem(names.get(i), items.get(i).expr()));
                }
            }
            if (!kept.isEmpty() && kept.size() < items.size()) {
                items = kept;
            }
        }
        Operation.Project out = items == p.columns() ? p : new Operation.Project(items);
        return new Step(out, Columns.referenced(items.stream().map(ProjectItem::expr).toList()));
    }

    private Step extend(Operation.Extend e, Set<String> required) {
        if (required == null) {
            return new Step(e, null);
        }
        List<ProjectItem> materialized = ColumnNaming.materialize(e.columns());
        Set<String> needed = Columns.newSet();
        needed.addAll(required);
        List<ProjectItem> kept = new ArrayList<>();
        for (int i = materialized.size() - 1; i >= 0; i--) {
            ProjectItem item = materialized.get(i);
            if (needed.contains(item.name())) {
                kept.add(0, item);
                needed.remove(item.name());
                needed.addAll(Columns.referenced(item.expr()));
            }
        }
        if (kept.isEmpty()) {
            return new Step(null, needed);
        }
        Operation.Extend out = kept.size() == e.columns().size() ? e : new Operation.Extend(kept);
        return new Step(out, needed);
    }

    private Step summarize(Operation.Summarize s, Set<String> required) {
        Operation.Summarize out = s;
        if (required != null) {
            Operation.Summarize named = ColumnNaming.materialize(s);
            List<ProjectItem> aggs = named.aggregations().stream()
                    .filter(a -> required.contains(a.name()))
                    .toList();
            boolean keepOne = aggs.isEmpty() && s.groupBy().isEmpty();
            if (!keepOne && aggs.size() < s.aggregations().size()) {
                out = new Operation.Summarize(aggs, named.groupBy());
            }
        }
        List<Expr> reads = new ArrayList<>();
        out.groupBy().forEach(k -> reads.add(k.expr()));
        out.aggregations().forEach(a -> reads.add(a.expr()));
        return new Step(out, Columns.referenced(reads));
    }

    private void narrowSource(
            Query query, List<Operation> pipeline, List<Set<String>> requiredBefore, OptimizationContext context) {
        int position = 0;
        while (position < pipeline.size() && pipeline.get(position) instanceof Operation.Where) {
            position++;
        }
        if (position == pipeline.size() || pipeline.get(position) instanceof Operation.Project) {
            return;
        }
        Set<String> required = requiredBefore.get(position);
        if (required == null || required.isEmpty()) return;
        Scope source = context.analyzer().sourceScope(query.source());
        if (!source.known()) return;
        List<ProjectItem> narrowed = new ArrayList<>();
        for (Scope.Column column : source.columns()) {
            if (required.contains(column.name())) {
                narrowed.add(ProjectItem.of(Expr.ColumnRef.of(column.name())));
            }
        }
        if (narrowed.isEmpty() || narrowed.size() >= source.columns().size()) return;
        pipeline.add(position, new Operation.Project(narrowed));
    }

    private static boolean noJoinOrUnion(List<Operation> pipeline) {
        return pipeline.stream().noneMatch(op -> op instanceof Operation.Join || op instanceof Operation.Union);
    }

    private static Set<String> keyColumns(List<SortKey> keys) {
        return Columns.referenced(keys.stream().map(SortKey::expr).toList());
    }

    private static Set<String> union(Set<String> required, Set<String> more) {
        if (required == null) return null;
        Set<String> out = Columns.newSet();
        out.addAll(required);
        out.addAll(more);
        return out;
    }
}
