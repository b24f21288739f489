package com.huntql.service.core.kql.optimizer;

/**
 * Heuristic selectivity and reduction factors. Estimates only steer rewrites between equivalent plans; they never
 * affect results.
 */
public record CostModel(
        double equalitySelectivity,
        double rangeSelectivity,
        double stringMatchSelectivity,
        double regexSelectivity,
        double defaultSelectivity,
        double summarizeReduction,
        double distinctReduction) {

    public static final CostModel DEFAULT = new CostModel(0.1, 0.3, 0.25, 0.3, 0.5, 0.01, 0.8);

    public CostModel {
        check("equalitySelectivity", equalitySelectivity);
        check("rangeSelectivity", rangeSelectivity);
        check("stringMatchSelectivity", stringMatchSelectivity);
        check("regexSelectivity", regexSelectivity);
        check("defaultSelectivity", defaultSelectivity);
        check("summarizeReduction", summarizeReduction);
        check("distinctReduction", distinctReduction);
    }

    private static void check(String name, double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in (0, 1] but was " + value);
        }
    }
}
