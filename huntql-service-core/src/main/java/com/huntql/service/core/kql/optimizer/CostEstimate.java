package com.huntql.service.core.kql.optimizer;

import java.util.List;

/**
 * Estimated output cardinality and abstract cost of a query.
 *
 * @param rows estimated rows produced by the last stage
 * @param cost accumulated work units over every stage, source scan included
 * @param steps one entry per stage, source first
 */
public record CostEstimate(double rows, double cost, List<Step> steps) {

    public CostEstimate {
        steps = List.copyOf(steps);
    }

    public record Step(String operation, double inputRows, double outputRows, double cost) {}
}
