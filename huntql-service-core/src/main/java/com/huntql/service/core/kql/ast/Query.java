package com.huntql.service.core.kql.ast;

import java.util.List;
import java.util.Objects;

/**
 * A KQL query: a source table (or nested query) followed by an ordered pipeline of operations.
 *
 * <pre>
 *   SecurityEvent
 *   | where EventID == 4625
 *   | summarize count() by Account
 * </pre>
 */
public record Query(TableExpression source, List<Operation> pipeline) {

    public Query {
        Objects.requireNonNull(source, "source");
        pipeline = pipeline == null ? List.of() : List.copyOf(pipeline);
    }

    public static Query of(TableExpression source, Operation... operations) {
        return new Query(source, List.of(operations));
    }

    public Query withPipeline(List<Operation> operations) {
        return new Query(source, operations);
    }

    public Query withSource(TableExpression newSource) {
        return new Query(newSource, pipeline);
    }
}
