package com.huntql.service.core.kql.optimizer;

import static org.assertj.core.api.Assertions.assertThat;

import com.huntql.service.core.kql.analysis.SemanticAnalyzer;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.parser.KqlParser;
import com.huntql.service.core.schema.TestSchemas;
import org.junit.jupiter.api.Test;

class DeadOperationEliminationPassTest {

    private final KqlParser parser = new KqlParser();
    private final OptimizationContext context = new OptimizationContext(
            new SemanticAnalyzer(TestSchemas.security()), new CostEstimator(TestSchemas.security(), CostModel.DEFAULT));
    private final DeadOperationEliminationPass pass = new DeadOperationEliminationPass();

    @Test
    void removesTautologicalFilters() {
        assertRewrites("SecurityEvent | where true | take 10", "SecurityEvent | take 10");
    }

    @Test
    void mergesConsecutiveLimits() {
        assertRewrites("SecurityEvent | take 10 | take 5", "SecurityEvent | take 5");
        assertRewrites("SecurityEvent | take 5 | limit 10", "SecurityEvent | take 5");
        assertRewrites("SecurityEvent | top 10 by EventID | take 3", "SecurityEvent | top 3 by EventID");
        assertRewrites("SecurityEvent | top 3 by EventID | take 10", "SecurityEvent | top 3 by EventID");
    }

    @Test
    void removesIdentityProjection() {
        assertRewrites(
                "SecurityEvent | project Account, Computer | project Account, Computer",
                "SecurityEvent | project Account, Computer");
        assertUnchanged("SecurityEvent | project Account, Computer | project Computer, Account");
        assertUnchanged("SecurityEvent | project Account, Computer | project Account, Host = Computer");
    }

    @Test
    void removesRedundantDistinct() {
        assertRewrites(
                "SecurityEvent | summarize count() by Account | distinct *",
                "SecurityEvent | summarize count() by Account");
        assertRewrites("SecurityEvent | distinct Account | distinct *", "SecurityEvent | distinct Account");
        assertUnchanged("SecurityEvent | where EventID == 1 | distinct *");
    }

    @Test
    void dropsSortsWhoseOrderIsDiscarded() {
        assertRewrites(
                "SecurityEvent | order by Account | order by EventID desc",
                "SecurityEvent | order by EventID desc");
        assertRewrites(
                "SecurityEvent | sort by Account | summarize count() by Account",
                "SecurityEvent | summarize count() by Account");
        assertUnchanged("SecurityEvent | order by EventID desc | take 5");
    }

    private void assertRewrites(String input, String expected) {
        assertThat(pass.apply(parser.parse(input), context)).isEqualTo(parser.parse(expected));
    }

    private void assertUnchanged(String input) {
        Query query = parser.parse(input);
        assertThat(pass.apply(query, context)).isEqualTo(query);
    }
}
