package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.Query;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reorders runs of adjacent {@code where} stages so the most selective filter, by the cost model, runs first.
 * Filters never depend on each other's output, so any order within a run yields the same rows. The sort is
 * stable: equally selective filters keep their written order.
 */
public class StageReorderingPass implements OptimizerPass {

    public static final String NAME = "stage-reordering";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Query apply(Query query, OptimizationContext context) {
        CostEstimator estimator = context.costEstimator();
        List<Operation> result = new ArrayList<>();
        List<Operation.Where> run = new ArrayList<>();
        for (Operation op : query.pipeline()) {
            if (op instanceof Operation.Where w) {
                run.add(w);
                continue;
            }
            flush(run, result, estimator);
            result.add(op);
        }
        flush(run, result, estimator);
        return query.withPipeline(result);
    }

    private static void flush(List<Operation.Where> run, List<Operation> result, CostEstimator estimator) {
        if (run.size() > 1) {
            run.sort(Comparator.comparingDouble(w -> estimator.selectivity(w.predicate())));
        }
        result.addAll(run);
        run.clear();
    }
}
