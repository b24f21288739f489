package com.huntql.service.core.kql.optimizer;

import com.huntql.service.core.kql.analysis.PipelineScopes;
import com.huntql.service.core.kql.analysis.Scope;
import com.huntql.service.core.kql.analysis.SemanticAnalyzer;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.Query;
import java.util.List;

/** Shared services for optimizer passes. */
public record OptimizationContext(SemanticAnalyzer analyzer, CostEstimator costEstimator) {

    /** Columns visible after the first {@code length} operations of {@code pipeline}. */
    public Scope scopeAfter(Query query, List<Operation> pipeline, int length) {
        PipelineScopes scopes = analyzer.scopes(query.withPipeline(pipeline.subList(0, length)));
        return scopes.output();
    }
}
