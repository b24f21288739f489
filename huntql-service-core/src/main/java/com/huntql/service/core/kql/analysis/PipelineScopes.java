package com.huntql.service.core.kql.analysis;

import java.util.List;

/** Column scope before each pipeline stage; the last entry is the query's output. */
public record PipelineScopes(List<Scope> stages) {

    public PipelineScopes {
        stages = List.copyOf(stages);
        if (stages.isEmpty()) throw new IllegalArgumentException("at least the source scope is required");
    }

    /** Columns visible to operation {@code index} of the pipeline. */
    public Scope input(int index) {
        return stages.get(index);
    }

    public Scope output() {
        return stages.get(stages.size() - 1);
    }

    public Scope source() {
        return stages.get(0);
    }
}
