package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.ast.Query;

/**
 * One semantics-preserving rewrite over a query's top-level pipeline. Nested sub-queries are handled by
 * {@link QueryOptimizer}. A pass returns its input unchanged whenever it cannot prove a rewrite safe.
 */
public interface OptimizerPass {

    /** Stable identifier, used for configuration toggles and explain output. */
    String name();

    Query apply(Query query, OptimizationContext context);
}
