package com.huntql.service.core.kql.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.huntql.service.core.error.QueryStage;
import com.huntql.service.core.kql.parser.KqlParser;
import com.huntql.service.core.schema.ColumnType;
import com.huntql.service.core.schema.TestSchemas;
import java.util.List;
import org.junit.jupiter.api.Test;

class SemanticAnalyzerTest {

    private final KqlParser parser = new KqlParser();
    private final SemanticAnalyzer analyzer = new SemanticAnalyzer(TestSchemas.security());

    @Test
    void unknownTableIsTheOnlyError() {
        List<SemanticError> errors = errorsOf("UnknownTable | project X");

        assertThat(errors).extracting(SemanticError::kind, SemanticError::name)
                .containsExactly(tuple(SemanticError.Kind.UNKNOWN_TABLE, "UnknownTable"));
    }

    @Test
    void reportsEveryUnknownColumn() {
        List<SemanticError> errors = errorsOf("SecurityEvent | where NoSuch == 1 | project Account, Missing");

        assertThat(errors).extracting(SemanticError::kind, SemanticError::name).containsExactly(
                tuple(SemanticError.Kind.UNKNOWN_COLUMN, "NoSuch"),
                tuple(SemanticError.Kind.UNKNOWN_COLUMN, "Missing"));
    }

    @Test
    void exceptionCarriesValidateStageAndJoinedMessage() {
        assertThatThrownBy(() -> analyzer.analyze(parser.parse("SecurityEvent | where a == 1 and b == 2")))
                .isInstanceOfSatisfying(SemanticException.class, e -> {
                    assertThat(e.stage()).isEqualTo(QueryStage.VALIDATE);
                    assertThat(e.errors()).hasSize(2);
                    assertThat(e.getMessage()).isEqualTo("Unknown column 'a'; Unknown column 'b'");
                });
    }

    @Test
    void columnsDroppedByProjectAreNoLongerVisible() {
        assertThat(errorsOf("SecurityEvent | project Account | where EventID == 4625"))
                .extracting(SemanticError::name).containsExactly("EventID");
    }

    @Test
    void functionChecks() {
        assertThat(errorsOf("SecurityEvent | extend x = frob(Account)"))
                .extracting(SemanticError::kind, SemanticError::name)
                .containsExactly(tuple(SemanticError.Kind.UNKNOWN_FUNCTION, "frob"));

        List<SemanticError> arity = errorsOf("SecurityEvent | extend x = strlen(Account, 1)");
        assertThat(arity).extracting(SemanticError::kind).containsExactly(SemanticError.Kind.ARITY_MISMATCH);
        assertThat(arity.get(0).message()).isEqualTo("Function 'strlen' expects 1 argument(s) but got 2");
    }

    @Test
    void aggregationsOnlyAtTheTopOfSummarize() {
        assertThat(errorsOf("SecurityEvent | where count() > 1"))
                .extracting(SemanticError::kind).containsExactly(SemanticError.Kind.AGGREGATE_NOT_ALLOWED);
        assertThat(errorsOf("SecurityEvent | summarize Account"))
                .extracting(SemanticError::kind).containsOnly(SemanticError.Kind.NOT_AN_AGGREGATE);
        assertThat(errorsOf("SecurityEvent | summarize n = count() + Account"))
                .extracting(SemanticError::kind, SemanticError::name)
                .containsExactly(tuple(SemanticError.Kind.NOT_AN_AGGREGATE, "Account"));
    }

    @Test
    void aggregateExpressionsAndGroupKeysAreAccepted() {
        PipelineScopes scopes = analyzer.analyze(parser.parse(
                "SecurityEvent | summarize n = count() * 2, dcount(Computer), avg(EventID)"
                        + " by Account, bin(TimeGenerated, 1h)"));

        Scope out = scopes.output();
        assertThat(out.names()).containsExactly("Account", "TimeGenerated", "n", "dcount_Computer", "avg_EventID");
        assertThat(out.find("n")).get().extracting(Scope.Column::type).isEqualTo(ColumnType.LONG);
        assertThat(out.find("avg_EventID")).get().extracting(Scope.Column::type).isEqualTo(ColumnType.REAL);
    }

    @Test
    void duplicateOutputNamesAreRejected() {
        assertThat(errorsOf("SecurityEvent | project a = Account, A = Computer"))
                .extracting(SemanticError::kind, SemanticError::name)
                .containsExactly(tuple(SemanticError.Kind.DUPLICATE_COLUMN, "A"));
    }

    @Test
    void threadsScopeThroughThePipeline() {
        PipelineScopes scopes = analyzer.analyze(parser.parse(
                "SecurityEvent | project Account, EventID | extend next = EventID + 1"
                        + " | summarize c = count() by Account"));

        assertThat(scopes.stages()).hasSize(4);
        assertThat(scopes.input(1).names()).containsExactly("Account", "EventID");
        assertThat(scopes.input(2).names()).containsExactly("Account", "EventID", "next");
        assertThat(scopes.input(2).find("next")).get().extracting(Scope.Column::type).isEqualTo(ColumnType.LONG);
        assertThat(scopes.output().names()).containsExactly("Account", "c");
    }

    @Test
    void extendReplacesAnExistingColumnInPlace() {
        Scope out = analyzer.analyze(parser.parse("SecurityEvent | project Account, EventID | extend Account = 1"))
                .output();

        assertThat(out.names()).containsExactly("Account", "EventID");
        assertThat(out.find("account")).get().extracting(Scope.Column::type).isEqualTo(ColumnType.LONG);
    }

    @Test
    void columnLookupIgnoresCase() {
        assertThat(errorsOf("securityevent | where eventid == 4625 | project account")).isEmpty();
    }

    @Test
    void joinOutputRenamesCollidingRightColumns() {
        Scope out = analyzer.analyze(parser.parse(
                "SecurityEvent | project Account, Computer"
                        + " | join kind=inner (SigninLogs | project Account, IPAddress) on Account"))
                .output();

        assertThat(out.names()).containsExactly("Account", "Computer", "Account1", "IPAddress");
    }

    @Test
    void joinConditionsResolveEachSide() {
        assertThat(errorsOf("SecurityEvent | join SigninLogs on $left.Account == $right.UserPrincipalName")).isEmpty();
        assertThat(errorsOf("SecurityEvent as s | join SigninLogs as l on s.Account == l.Account")).isEmpty();
        assertThat(errorsOf("SecurityEvent | join SigninLogs on $left.Account == $right.Computer"))
                .extracting(SemanticError::name).containsExactly("$right.Computer");
    }

    @Test
    void dynamicPropertiesNeedADynamicColumn() {
        assertThat(errorsOf("SecurityEvent | where EventData.LogonType == 2")).isEmpty();
        assertThat(errorsOf("SecurityEvent | where Account.Domain == 'corp'"))
                .extracting(SemanticError::kind, SemanticError::name)
                .containsExactly(tuple(SemanticError.Kind.UNKNOWN_COLUMN, "Account.Domain"));
    }

    @Test
    void unionMergesColumnsByName() {
        Scope out = analyzer.analyze(parser.parse(
                "SecurityEvent | project Account, EventID | union (SigninLogs | project Account, ResultType)"))
                .output();

        assertThat(out.names()).containsExactly("Account", "EventID", "ResultType");
    }

    @Test
    void scopesNeverFail() {
        PipelineScopes scopes = analyzer.scopes(parser.parse("Nope | where x == 1 | project y"));

        assertThat(scopes.output().known()).isFalse();
        assertThat(scopes.output().find("anything")).get().extracting(Scope.Column::type).isEqualTo(ColumnType.ANY);
    }

    @Test
    void infersExpressionTypes() {
        Scope scope = analyzer.analyze(parser.parse("SecurityEvent")).output();

        assertThat(analyzer.typeOf(parser.parseExpression("now() - TimeGenerated"), scope))
                .isEqualTo(ColumnType.TIMESPAN);
        assertThat(analyzer.typeOf(parser.parseExpression("TimeGenerated + 1h"), scope))
                .isEqualTo(ColumnType.DATETIME);
        assertThat(analyzer.typeOf(parser.parseExpression("iif(EventID > 1, 1.5, 2.0)"), scope))
                .isEqualTo(ColumnType.REAL);
        assertThat(analyzer.typeOf(parser.parseExpression("Account contains 'x'"), scope))
                .isEqualTo(ColumnType.BOOL);
        assertThat(analyzer.containsAggregate(parser.parseExpression("1 + max(EventID)"))).isTrue();
        assertThat(analyzer.containsAggregate(parser.parseExpression("strlen(Account)"))).isFalse();
    }

    private List<SemanticError> errorsOf(String text) {
        try {
            analyzer.analyze(parser.parse(text));
            return List.of();
        } catch (SemanticException e) {
            return e.errors();
        }
    }
}
