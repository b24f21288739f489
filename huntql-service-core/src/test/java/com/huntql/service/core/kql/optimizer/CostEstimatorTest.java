package com.huntql.service.core.kql.optimizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.huntql.service.core.kql.parser.KqlParser;
import com.huntql.service.core.schema.TestSchemas;
import org.junit.jupiter.api.Test;

class CostEstimatorTest {

    private final KqlParser parser = new KqlParser();
    private final CostEstimator estimator = new CostEstimator(TestSchemas.security(), CostModel.DEFAULT);

    @Test
    void sourceCardinalityComesFromTheCatalog() {
        CostEstimate estimate = estimator.estimate(parser.parse("SecurityEvent"));

        assertThat(estimate.rows()).isEqualTo(5_000_000.0);
        assertThat(estimate.steps()).singleElement()
                .extracting(CostEstimate.Step::operation).isEqualTo("scan SecurityEvent");
        assertThat(estimator.estimate(parser.parse("NotInCatalog")).rows()).isEqualTo(1_000_000.0);
    }

    @Test
    void filtersScaleRowsBySelectivity() {
        CostEstimate estimate = estimator.estimate(parser.parse("SecurityEvent | where EventID == 4625"));

        assertThat(estimate.rows()).isCloseTo(500_000.0, within(1e-6));
        assertThat(estimate.cost()).isCloseTo(10_000_000.0, within(1e-6));
        assertThat(estimate.steps()).extracting(CostEstimate.Step::operation)
                .containsExactly("scan SecurityEvent", "where EventID == 4625");
    }

    @Test
    void predicateSelectivityHeuristics() {
        assertThat(selectivity("EventID == 1")).isCloseTo(0.1, within(1e-9));
        assertThat(selectivity("EventID != 1")).isCloseTo(0.9, within(1e-9));
        assertThat(selectivity("EventID > 1")).isCloseTo(0.3, within(1e-9));
        assertThat(selectivity("Account contains 'a'")).isCloseTo(0.25, within(1e-9));
        assertThat(selectivity("EventID == 1 and EventID > 1")).isCloseTo(0.03, within(1e-9));
        assertThat(selectivity("EventID == 1 or EventID > 1")).isCloseTo(0.37, within(1e-9));
        assertThat(selectivity("not (EventID == 1)")).isCloseTo(0.9, within(1e-9));
        assertThat(selectivity("EventID in (1, 2, 3)")).isCloseTo(0.3, within(1e-9));
        assertThat(selectivity("true")).isEqualTo(1.0);
        assertThat(selectivity("false")).isEqualTo(0.0);
        assertThat(selectivity("isnotempty(Account)")).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void rowShapingStages() {
        assertThat(rows("SecurityEvent | summarize count()")).isEqualTo(1.0);
        assertThat(rows("SecurityEvent | summarize count() by Account")).isCloseTo(50_000.0, within(1e-6));
        assertThat(rows("SecurityEvent | take 10")).isEqualTo(10.0);
        assertThat(rows("SecurityEvent | top 20 by EventID")).isEqualTo(20.0);
        assertThat(rows("SecurityEvent | distinct Account")).isCloseTo(4_000_000.0, within(1e-6));
        assertThat(rows("SecurityEvent | union SigninLogs")).isEqualTo(7_000_000.0);
        assertThat(rows("(SecurityEvent | take 5) | where EventID == 1")).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void filteringEarlierIsCheaper() {
        double late = estimator.estimate(parser.parse(
                "SecurityEvent | extend n = strlen(Account) | where EventID == 4625")).cost();
        double early = estimator.estimate(parser.parse(
                "SecurityEvent | where EventID == 4625 | extend n = strlen(Account)")).cost();

        assertThat(early).isLessThan(late);
    }

    @Test
    void customModelChangesEstimates() {
        CostEstimator tuned = new CostEstimator(TestSchemas.security(), new CostModel(0.5, 0.3, 0.25, 0.3, 0.5, 0.01, 0.8));

        assertThat(tuned.selectivity(parser.parseExpression("EventID == 1"))).isEqualTo(0.5);
    }

    @Test
    void costModelRejectsOutOfRangeFactors() {
        assertThatThrownBy(() -> new CostModel(0.0, 0.3, 0.25, 0.3, 0.5, 0.01, 0.8))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("equalitySelectivity");
        assertThatThrownBy(() -> new CostModel(0.1, 0.3, 0.25, 0.3, 0.5, 0.01, 1.5))
                .hasMessageContaining("distinctReduction");
    }

    private double selectivity(String predicate) {
        return estimator.selectivity(parser.parseExpression(predicate));
    }

    private double rows(String query) {
        return estimator.estimate(parser.parse(query)).rows();
    }
}
