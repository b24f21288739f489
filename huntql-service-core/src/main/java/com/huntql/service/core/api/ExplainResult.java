package com.huntql.service.core.api;

import com.huntql.service.core.kql.optimizer.CostEstimate;
import java.util.List;

/**
 * @param originalPlan the parsed query, printed one stage per line
 * @param optimizedPlan the optimized query, printed one stage per line
 * @param appliedPasses optimizer passes that changed the query
 */
public record ExplainResult(
        String originalPlan,
        String optimizedPlan,
        double estimatedCost,
        double estimatedRows,
        List<String> appliedPasses,
        List<CostEstimate.Step> steps) {

    public ExplainResult {
        appliedPasses = List.copyOf(appliedPasses);
        steps = List.copyOf(steps);
    }
}
