package com.huntql.service.core.kql.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.huntql.service.core.error.QueryStage;
import com.huntql.service.core.kql.ast.AstPrinter;
import com.huntql.service.core.kql.ast.BinaryOperator;
import com.huntql.service.core.kql.ast.Expr;
import com.huntql.service.core.kql.ast.JoinKind;
import com.huntql.service.core.kql.ast.Operation;
import com.huntql.service.core.kql.ast.ProjectItem;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.ast.SortKey;
import com.huntql.service.core.kql.ast.TableExpression;
import com.huntql.service.core.kql.ast.UnaryOperator;
import com.huntql.service.core.kql.ast.UnionKind;
import com.huntql.service.core.kql.lexer.TokenKind;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class KqlParserTest {

    private final KqlParser parser = new KqlParser();

    @Test
    void parsesFilterAndGroupedCount() {
        Query query = parser.parse("SecurityEvent | where EventID == 4625 | summarize count() by Account");

        assertThat(query).isEqualTo(Query.of(
                TableExpression.table("SecurityEvent"),
                new Operation.Where(new Expr.BinaryOp(
                        BinaryOperator.EQ, Expr.ColumnRef.of("EventID"), Expr.Literal.of(4625L))),
                new Operation.Summarize(
                        List.of(ProjectItem.of(Expr.FunctionCall.of("count"))),
                        List.of(ProjectItem.of(Expr.ColumnRef.of("Account"))))));
    }

    @Test
    void missingOperandAtEndOfInputIsReported() {
        assertThatThrownBy(() -> parser.parse("SecurityEvent | where EventID == 4625 and"))
                .isInstanceOfSatisfying(ParseException.class, e -> {
                    assertThat(e.stage()).isEqualTo(QueryStage.PARSE);
                    assertThat(e.expectedKinds()).contains(TokenKind.IDENTIFIER, TokenKind.NUMERIC_LITERAL);
                    assertThat(e.expectedSymbols()).contains("(");
                    assertThat(e.found().kind()).isEqualTo(TokenKind.END_OF_INPUT);
                    assertThat(e.getMessage()).contains("but found end of input");
                });
    }

    @Test
    void unknownOperationListsTheOperators() {
        assertThatThrownBy(() -> parser.parse("SecurityEvent | frobnicate x"))
                .isInstanceOfSatisfying(ParseException.class, e -> {
                    assertThat(e.expectedSymbols()).contains("where", "summarize", "join");
                    assertThat(e.found().text()).isEqualTo("frobnicate");
                    assertThat(e.found().column()).isEqualTo(17);
                });
    }

    @Test
    void trailingTokensAreRejected() {
        assertThatThrownBy(() -> parser.parse("SecurityEvent where x == 1"))
                .isInstanceOfSatisfying(ParseException.class, e -> assertThat(e.expectedSymbols()).contains("|"));
    }

    @Test
    void arithmeticBindsTighterThanComparisonAndAndTighterThanOr() {
        Expr expr = parser.parseExpression("a == 1 or b > 2 + 3 * 4 and c");

        Expr expected = new Expr.BinaryOp(
                BinaryOperator.OR,
                new Expr.BinaryOp(BinaryOperator.EQ, Expr.ColumnRef.of("a"), Expr.Literal.of(1L)),
                new Expr.BinaryOp(
                        BinaryOperator.AND,
                        new Expr.BinaryOp(
                                BinaryOperator.GT,
                                Expr.ColumnRef.of("b"),
                                new Expr.BinaryOp(
                                        BinaryOperator.ADD,
                                        Expr.Literal.of(2L),
                                        new Expr.BinaryOp(
                                                BinaryOperator.MULTIPLY, Expr.Literal.of(3L), Expr.Literal.of(4L)))),
                        Expr.ColumnRef.of("c")));
        assertThat(expr).isEqualTo(expected);
    }

    @Test
    void subtractionIsLeftAssociative() {
        assertThat(parser.parseExpression("10 - 4 - 3")).isEqualTo(new Expr.BinaryOp(
                BinaryOperator.SUBTRACT,
                new Expr.BinaryOp(BinaryOperator.SUBTRACT, Expr.Literal.of(10L), Expr.Literal.of(4L)),
                Expr.Literal.of(3L)));
    }

    @Test
    void parsesUnaryForms() {
        assertThat(parser.parseExpression("-5")).isEqualTo(Expr.Literal.of(-5L));
        assertThat(parser.parseExpression("-1h")).isEqualTo(Expr.Literal.of(Duration.ofHours(-1)));
        assertThat(parser.parseExpression("-x"))
                .isEqualTo(new Expr.UnaryOp(UnaryOperator.NEGATE, Expr.ColumnRef.of("x")));
        assertThat(parser.parseExpression("not (x == 1)")).isEqualTo(new Expr.UnaryOp(
                UnaryOperator.NOT,
                new Expr.BinaryOp(BinaryOperator.EQ, Expr.ColumnRef.of("x"), Expr.Literal.of(1L))));
    }

    @Test
    void parsesMembershipAndStringOperators() {
        assertThat(parser.parseExpression("EventID in (4624, 4625)")).isEqualTo(new Expr.BinaryOp(
                BinaryOperator.IN,
                Expr.ColumnRef.of("EventID"),
                new Expr.ListExpr(List.of(Expr.Literal.of(4624L), Expr.Literal.of(4625L)))));
        assertThat(parser.parseExpression("Account !contains 'svc'"))
                .isEqualTo(new Expr.BinaryOp(
                        BinaryOperator.NOT_CONTAINS, Expr.ColumnRef.of("Account"), Expr.Literal.of("svc")));
        Expr.BinaryOp regex = (Expr.BinaryOp) parser.parseExpression("Process matches regex 'cmd.*'");
        assertThat(regex.op()).isEqualTo(BinaryOperator.MATCHES_REGEX);
    }

    @Test
    void literalWordsBecomeLiterals() {
        assertThat(parser.parseExpression("true")).isEqualTo(Expr.Literal.TRUE);
        assertThat(parser.parseExpression("null")).isEqualTo(Expr.Literal.NULL);
        assertThat(parser.parseExpression("['true']")).isEqualTo(Expr.ColumnRef.of("true"));
    }

    @Test
    void keywordsReadAsColumnNamesInOperandPosition() {
        Query query = parser.parse("T | project kind, on = 1");

        Operation.Project project = (Operation.Project) query.pipeline().get(0);
        assertThat(project.columns()).containsExactly(
                ProjectItem.of(Expr.ColumnRef.of("kind")), ProjectItem.named("on", Expr.Literal.of(1L)));
    }

    @Test
    void parsesDottedPropertyPathsAndQualifiers() {
        assertThat(parser.parseExpression("EventData.LogonType"))
                .isEqualTo(new Expr.ColumnRef("LogonType", "EventData"));
        assertThat(parser.parseExpression("DeviceDetail.os.name"))
                .isEqualTo(new Expr.ColumnRef("os.name", "DeviceDetail"));
    }

    @Test
    void parsesSortTopTakeAndDistinct() {
        Query query = parser.parse("T | sort by a desc, b | top 10 by c | take 5 | distinct * | distinct a, b");

        assertThat(query.pipeline()).containsExactly(
                new Operation.OrderBy(List.of(
                        SortKey.desc(Expr.ColumnRef.of("a")), SortKey.asc(Expr.ColumnRef.of("b")))),
                new Operation.Top(10, List.of(SortKey.asc(Expr.ColumnRef.of("c")))),
                new Operation.Limit(5),
                new Operation.Distinct(List.of()),
                new Operation.Distinct(List.of(Expr.ColumnRef.of("a"), Expr.ColumnRef.of("b"))));
    }

    @Test
    void topWithoutKeysAndNegativeCountsAreHandled() {
        assertThat(parser.parse("T | top 3").pipeline()).containsExactly(new Operation.Top(3, List.of()));
        assertThatThrownBy(() -> parser.parse("T | take -1")).isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> parser.parse("T | take 1.5")).isInstanceOf(ParseException.class);
    }

    @Test
    void summarizeNeedsAggregationsOrGroups() {
        assertThat(parser.parse("T | summarize by a").pipeline())
                .containsExactly(new Operation.Summarize(List.of(), List.of(ProjectItem.of(Expr.ColumnRef.of("a")))));
        assertThatThrownBy(() -> parser.parse("T | summarize")).isInstanceOf(ParseException.class);
    }

    @Test
    void byFollowedByAssignmentIsAnAggregateAlias() {
        assertThat(parser.parse("T | summarize by = count()").pipeline()).containsExactly(new Operation.Summarize(
                List.of(ProjectItem.named("by", Expr.FunctionCall.of("count"))), List.of()));
        assertThat(parser.parse("T | summarize by = count() by a").pipeline()).containsExactly(new Operation.Summarize(
                List.of(ProjectItem.named("by", Expr.FunctionCall.of("count"))),
                List.of(ProjectItem.of(Expr.ColumnRef.of("a")))));
    }

    @Test
    void joinShorthandExpandsToQualifiedEquality() {
        Query query = parser.parse("SecurityEvent | join kind=leftouter (SigninLogs | take 10) on Account");

        Operation.Join join = (Operation.Join) query.pipeline().get(0);
        assertThat(join.kind()).isEqualTo(JoinKind.LEFT);
        assertThat(join.right().isSubquery()).isTrue();
        assertThat(join.on()).isEqualTo(new Expr.BinaryOp(
                BinaryOperator.EQ,
                new Expr.ColumnRef("Account", "$left"),
                new Expr.ColumnRef("Account", "$right")));
    }

    @Test
    void joinWithExplicitConditionAndDefaultKind() {
        Query query = parser.parse("A | join B on $left.x == $right.y");

        Operation.Join join = (Operation.Join) query.pipeline().get(0);
        assertThat(join.kind()).isEqualTo(JoinKind.INNER);
        assertThat(join.right()).isEqualTo(TableExpression.table("B"));
        assertThat(join.on()).isEqualTo(new Expr.BinaryOp(
                BinaryOperator.EQ, new Expr.ColumnRef("x", "$left"), new Expr.ColumnRef("y", "$right")));
    }

    @Test
    void unsupportedJoinKindIsRejected() {
        assertThatThrownBy(() -> parser.parse("A | join kind=leftanti B on x"))
                .isInstanceOfSatisfying(ParseException.class, e -> assertThat(e.expectedSymbols()).contains("inner"));
    }

    @Test
    void parsesUnionWithKindAndAliases() {
        Query query = parser.parse("SecurityEvent as s | union kind=distinct SigninLogs, (logs | take 1)");

        assertThat(query.source()).isEqualTo(TableExpression.table("SecurityEvent", "s"));
        Operation.Union union = (Operation.Union) query.pipeline().get(0);
        assertThat(union.kind()).isEqualTo(UnionKind.DISTINCT);
        assertThat(union.others()).hasSize(2);
        assertThat(union.others().get(1).isSubquery()).isTrue();
    }

    @Test
    void bothCaseSpellingsProduceTheSameTree() {
        Expr functional = parser.parseExpression("case(x > 1, 'big', 'small')");
        Expr sql = parser.parseExpression("case when x > 1 then 'big' else 'small'");

        assertThat(functional).isInstanceOf(Expr.Case.class).isEqualTo(sql);
        assertThatThrownBy(() -> parser.parseExpression("case(x, 1)")).isInstanceOf(ParseException.class);
    }

    @Test
    void unclosedParenthesisReportsTheExpectedSymbol() {
        assertThatThrownBy(() -> parser.parse("T | where (a == 1"))
                .isInstanceOfSatisfying(ParseException.class, e -> {
                    assertThat(e.expectedSymbols()).containsExactly(")");
                    assertThat(e.found().kind()).isEqualTo(TokenKind.END_OF_INPUT);
                });
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "SecurityEvent | where EventID == 4625 | summarize count() by Account",
        "SecurityEvent | where Account contains \"adm\" and (EventID == 4624 or EventID == 4625) | take 10",
        "SecurityEvent | extend hour = bin(TimeGenerated, 1h) | summarize n = count(), dcount(Account) by hour",
        "SecurityEvent | project ['by'] = Account, e = -EventID | order by e desc",
        "SecurityEvent | where TimeGenerated > ago(2h30m) | top 5 by TimeGenerated",
        "A | join kind=leftouter (B | where x != 1) on $left.k == $right.k | distinct *",
        "A | union kind=all B, C | where not (x in (1, 2, 3))",
        "T | extend c = case(a > 1, \"x\\\"y\", a < 0, null, 2.5) | where d == datetime(2024-01-01T00:00:00Z)"
    })
    void printedQueriesParseBackToTheSameTree(String text) {
        Query original = parser.parse(text);

        String printed = AstPrinter.print(original);

        assertThat(parser.parse(printed)).isEqualTo(original);
    }
}
