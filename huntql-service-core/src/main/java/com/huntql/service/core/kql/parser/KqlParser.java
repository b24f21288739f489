package com.huntql.service.core.kql.parser;

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
import com.huntql.service.core.kql.lexer.KqlLexer;
import com.huntql.service.core.kql.lexer.Token;
import com.huntql.service.core.kql.lexer.TokenKind;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Recursive-descent KQL parser.
 *
 * <pre>
 *   Query     := Table ('|' Operation)*
 *   Table     := Name ['as' Name] | '(' Query ')' ['as' Name]
 *   Operation := where Expr
 *              | project Item (',' Item)*            Item := [Name '='] Expr
 *              | extend Item (',' Item)*
 *              | summarize [Item (',' Item)*] [by Item (',' Item)*]
 *              | (order | sort) by Key (',' Key)*     Key := Expr [asc | desc]
 *              | top N [by Key (',' Key)*]
 *              | (limit | take) N
 *              | distinct ('*' | Expr (',' Expr)*)
 *              | join [kind '=' Kind] Table on (Expr | Name (',' Name)*)
 *              | union [kind '=' (all | distinct)] Table (',' Table)*
 * </pre>
 *
 * Expressions use precedence climbing: {@code or < and < comparison < additive < multiplicative < unary}.
 * Keywords are not reserved; a keyword is read as an identifier wherever an operand is expected.
 * Parsing stops at the first error.
 */
public final class KqlParser {

    static final List<String> OPERATION_WORDS = List.of(
            "where", "project", "extend", "summarize", "order", "sort", "top", "limit", "take", "distinct", "join",
            "union");

    private static final List<TokenKind> OPERAND_KINDS = List.of(
            TokenKind.IDENTIFIER,
            TokenKind.NUMERIC_LITERAL,
            TokenKind.STRING_LITERAL,
            TokenKind.DATETIME_LITERAL,
            TokenKind.TIMESPAN_LITERAL,
            TokenKind.GUID_LITERAL);

    private static final List<String> OPERAND_SYMBOLS = List.of("(", "-", "not");

    private final KqlLexer lexer = new KqlLexer();

    public Query parse(String text) {
        return parse(lexer.tokenize(text));
    }

    public Query parse(List<Token> tokens) {
        State state = new State(tokens);
        Query query = state.query();
        if (!state.peek().is(TokenKind.END_OF_INPUT)) {
            throw new ParseException(List.of(TokenKind.END_OF_INPUT), List.of("|"), state.peek());
        }
        return query;
    }

    /** Parses a standalone expression; used by tooling and tests. */
    public Expr parseExpression(String text) {
        State state = new State(lexer.tokenize(text));
        Expr expr = state.expression();
        state.expectKind(TokenKind.END_OF_INPUT);
        return expr;
    }

    private static final class State {
        private final List<Token> tokens;
        private int index;

        State(List<Token> tokens) {
            if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.END_OF_INPUT)) {
                List<Token> terminated = new ArrayList<>(tokens);
                int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).endOffset();
                terminated.add(new Token(TokenKind.END_OF_INPUT, "", null, end, end, 1, end + 1));
                tokens = terminated;
            }
            this.tokens = tokens;
        }

        // ------------------------------------------------------------------ query / tables

        Query query() {
            TableExpression source = table();
            List<Operation> pipeline = new ArrayList<>();
            while (peek().isSymbol("|")) {
                advance();
                pipeline.add(operation());
            }
            return new Query(source, pipeline);
        }

        TableExpression table() {
            TableExpression table;
            if (peek().isSymbol("(")) {
                advance();
                Query sub = query();
                expectSymbol(")");
                table = TableExpression.of(sub);
            } else if (peek().isWordLike()) {
                table = TableExpression.table(name(advance()));
            } else {
                throw error(List.of(TokenKind.IDENTIFIER), List.of("("));
            }
            if (peek().isWord("as") && peek(1).isWordLike()) {
                advance();
                String alias = name(advance());
                table = new TableExpression(table.name(), alias, table.subquery());
            }
            return table;
        }

        // ------------------------------------------------------------------ operations

        Operation operation() {
            Token head = peek();
            if (!head.isWordLike()) {
                throw error(List.of(TokenKind.KEYWORD), OPERATION_WORDS);
            }
            String word = head.text().toLowerCase(Locale.ROOT);
            switch (word) {
                case "where" -> {
                    advance();
                    return new Operation.Where(expression());
                }
                case "project" -> {
                    advance();
                    return new Operation.Project(items());
                }
                case "extend" -> {
                    advance();
                    return new Operation.Extend(items());
                }
                case "summarize" -> {
                    advance();
                    return summarize();
                }
                case "order", "sort" -> {
                    advance();
                    expectWord("by");
                    return new Operation.OrderBy(sortKeys());
                }
                case "top" -> {
                    advance();
                    long n = count();
                    List<SortKey> keys = List.of();
                    if (peek().isWord("by") && peek().is(TokenKind.KEYWORD)) {
                        advance();
                        keys = sortKeys();
                    }
                    return new Operation.Top(n, keys);
                }
                case "limit", "take" -> {
                    advance();
                    return new Operation.Limit(count());
                }
                case "distinct" -> {
                    advance();
                    if (peek().isSymbol("*")) {
                        advance();
                        return new Operation.Distinct(List.of());
                    }
                    return new Operation.Distinct(expressionList());
                }
                case "join" -> {
                    advance();
                    return join();
                }
                case "union" -> {
                    advance();
                    return union();
                }
                default -> throw error(List.of(TokenKind.KEYWORD), OPERATION_WORDS);
            }
        }

        private Operation summarize() {
            List<ProjectItem> aggregations = List.of();
            if (!atByKeyword()) {
                aggregations = items();
            }
            List<ProjectItem> groupBy = List.of();
            if (atByKeyword()) {
                advance();
                groupBy = items();
            } else if (aggregations.isEmpty()) {
                throw error(OPERAND_KINDS, List.of("by"));
            }
            return new Operation.Summarize(aggregations, groupBy);
        }

        /** {@code by} followed by {@code =} names an aggregate, it does not open the group-by list. */
        private boolean atByKeyword() {
            return peek().is(TokenKind.KEYWORD) && peek().isWord("by") && !peek(1).isSymbol("=");
        }

        private Operation join() {
            JoinKind kind = JoinKind.INNER;
            if (peek().isWord("kind") && peek(1).isSymbol("=")) {
                advance();
                advance();
                Token kindToken = peek();
                Optional<JoinKind> parsed = kindToken.isWordLike() ? JoinKind.fromKql(kindToken.text()) : Optional.empty();
                if (parsed.isEmpty()) {
                    throw error(List.of(), List.of("inner", "innerunique", "left", "leftouter", "right", "rightouter",
                            "full", "fullouter"));
                }
                advance();
                kind = parsed.get();
            }
            TableExpression right = table();
            expectWord("on");
            List<Expr> conditions = expressionList();
            return new Operation.Join(kind, right, joinCondition(conditions));
        }

        /** {@code on A, B} is shorthand for {@code $left.A == $right.A and $left.B == $right.B}. */
        private Expr joinCondition(List<Expr> conditions) {
            boolean shorthand = conditions.stream()
                    .allMatch(c -> c instanceof Expr.ColumnRef ref && !ref.isQualified());
            if (!shorthand) {
                if (conditions.size() == 1) return conditions.get(0);
                throw error(List.of(), List.of("|"));
            }
            Expr combined = null;
            for (Expr c : conditions) {
                String column = ((Expr.ColumnRef) c).name();
                Expr eq = new Expr.BinaryOp(
                        BinaryOperator.EQ,
                        new Expr.ColumnRef(column, "$left"),
                        new Expr.ColumnRef(column, "$right"));
                combined = combined == null ? eq : Expr.and(combined, eq);
            }
            return combined;
        }

        private Operation union() {
            UnionKind kind = UnionKind.ALL;
            if (peek().isWord("kind") && peek(1).isSymbol("=")) {
                advance();
                advance();
                if (peek().isWord("all")) {
                    kind = UnionKind.ALL;
                } else if (peek().isWord("distinct")) {
                    kind = UnionKind.DISTINCT;
                } else {
                    throw error(List.of(), List.of("all", "distinct"));
                }
                advance();
            }
            List<TableExpression> others = new ArrayList<>();
            others.add(table());
            while (peek().isSymbol(",")) {
                advance();
                others.add(table());
            }
            return new Operation.Union(kind, others);
        }

        private List<ProjectItem> items() {
            List<ProjectItem> items = new ArrayList<>();
            do {
                if (!items.isEmpty()) advance();
                if (peek().isWordLike() && peek(1).isSymbol("=")) {
                    String name = name(advance());
                    advance();
                    items.add(ProjectItem.named(name, expression()));
                } else {
                    items.add(ProjectItem.of(expression()));
                }
            } while (peek().isSymbol(","));
            return items;
        }

        private List<SortKey> sortKeys() {
            List<SortKey> keys = new ArrayList<>();
            do {
                if (!keys.isEmpty()) advance();
                Expr expr = expression();
                boolean desc = false;
                if (peek().is(TokenKind.KEYWORD) && peek().isWord("desc")) {
                    advance();
                    desc = true;
                } else if (peek().is(TokenKind.KEYWORD) && peek().isWord("asc")) {
                    advance();
                }
                keys.add(new SortKey(expr, desc));
            } while (peek().isSymbol(","));
            return keys;
        }

        private long count() {
            Token t = peek();
            if (t.is(TokenKind.NUMERIC_LITERAL) && t.value() instanceof Long n && n >= 0) {
                advance();
                return n;
            }
            throw error(List.of(TokenKind.NUMERIC_LITERAL), List.of());
        }

        private List<Expr> expressionList() {
            List<Expr> out = new ArrayList<>();
            out.add(expression());
            while (peek().isSymbol(",")) {
                advance();
                out.add(expression());
            }
            return out;
        }

        // ------------------------------------------------------------------ expressions

        Expr expression() {
            return binary(1);
        }

        private Expr binary(int minPrecedence) {
            Expr left = unary();
            while (true) {
                Optional<BinaryOperator> op = binaryOperator(peek());
                if (op.isEmpty() || op.get().precedence() < minPrecedence) {
                    return left;
                }
                advance();
                BinaryOperator operator = op.get();
                Expr right = operator.category() == BinaryOperator.Category.MEMBERSHIP
                        ? list()
                        : binary(operator.precedence() + 1);
                left = new Expr.BinaryOp(operator, left, right);
            }
        }

        private Optional<BinaryOperator> binaryOperator(Token t) {
            if (t.is(TokenKind.OPERATOR) || t.is(TokenKind.KEYWORD)) {
                return BinaryOperator.fromSymbol(t.text());
            }
            return Optional.empty();
        }

        private Expr list() {
            expectSymbol("(");
            List<Expr> items = expressionList();
            expectSymbol(")");
            return new Expr.ListExpr(items);
        }

        private Expr unary() {
            Token t = peek();
            if (t.isSymbol("-")) {
                advance();
                Token next = peek();
                if (next.is(TokenKind.NUMERIC_LITERAL) || next.is(TokenKind.TIMESPAN_LITERAL)) {
                    advance();
                    return negatedLiteral(next);
                }
                return new Expr.UnaryOp(UnaryOperator.NEGATE, unary());
            }
            if (t.is(TokenKind.KEYWORD) && t.isWord("not") && canStartOperand(peek(1))) {
                advance();
                return new Expr.UnaryOp(UnaryOperator.NOT, unary());
            }
            return primary();
        }

        private Expr negatedLiteral(Token t) {
            Object v = t.value();
            if (v instanceof Long l) return Expr.Literal.of(-l);
            if (v instanceof Double d) return Expr.Literal.of(-d);
            return Expr.Literal.of(((Duration) v).negated());
        }

        private boolean canStartOperand(Token t) {
            return t.kind().isLiteral()
                    || t.isWordLike()
                    || t.isSymbol("(")
                    || t.isSymbol("-");
        }

        private Expr primary() {
            Token t = peek();
            switch (t.kind()) {
                case NUMERIC_LITERAL -> {
                    advance();
                    return t.value() instanceof Long l ? Expr.Literal.of(l) : Expr.Literal.of((Double) t.value());
                }
                case STRING_LITERAL -> {
                    advance();
                    return Expr.Literal.of((String) t.value());
                }
                case DATETIME_LITERAL -> {
                    advance();
                    return Expr.Literal.of((Instant) t.value());
                }
                case TIMESPAN_LITERAL -> {
                    advance();
                    return Expr.Literal.of((Duration) t.value());
                }
                case GUID_LITERAL -> {
                    advance();
                    return Expr.Literal.of((UUID) t.value());
                }
                case KEYWORD, IDENTIFIER -> {
                    return wordOperand();
                }
                default -> {
                    if (t.isSymbol("(")) {
                        advance();
                        Expr inner = expression();
                        expectSymbol(")");
                        return inner;
                    }
                    throw error(OPERAND_KINDS, OPERAND_SYMBOLS);
                }
            }
        }

        private Expr wordOperand() {
            Token t = advance();
            boolean bracketed = t.is(TokenKind.IDENTIFIER) && t.value() != null;
            String lower = t.text().toLowerCase(Locale.ROOT);
            if (!bracketed && t.is(TokenKind.IDENTIFIER)) {
                switch (lower) {
                    case "true" -> {
                        return Expr.Literal.TRUE;
                    }
                    case "false" -> {
                        return Expr.Literal.FALSE;
                    }
                    case "null" -> {
                        return Expr.Literal.NULL;
                    }
                    default -> {
                        // column or function
                    }
                }
            }
            if (!bracketed && t.is(TokenKind.KEYWORD) && lower.equals("case")) {
                if (peek().isSymbol("(")) return caseFunction();
                if (peek().isWord("when")) return caseWhen();
            }
            if (!bracketed && peek().isSymbol("(")) {
                advance();
                List<Expr> args = peek().isSymbol(")") ? List.of() : expressionList();
                expectSymbol(")");
                return new Expr.FunctionCall(t.text(), args);
            }
            return columnPath(t);
        }

        /** {@code Name}, {@code Qualifier.Name} or {@code Column.Path.To.Property}. */
        private Expr columnPath(Token first) {
            String head = name(first);
            if (!(peek().isSymbol(".") && peek(1).isWordLike())) {
                return Expr.ColumnRef.of(head);
            }
            StringBuilder path = new StringBuilder();
            while (peek().isSymbol(".") && peek(1).isWordLike()) {
                advance();
                if (!path.isEmpty()) path.append('.');
                path.append(name(advance()));
            }
            return new Expr.ColumnRef(path.toString(), head);
        }

        private Expr caseWhen() {
            List<Expr.CaseBranch> branches = new ArrayList<>();
            while (peek().isWord("when")) {
                advance();
                Expr when = expression();
                expectWord("then");
                branches.add(new Expr.CaseBranch(when, expression()));
            }
            if (branches.isEmpty()) throw error(List.of(), List.of("when"));
            expectWord("else");
            return new Expr.Case(branches, expression());
        }

        private Expr caseFunction() {
            expectSymbol("(");
            List<Expr> args = expressionList();
            if (args.size() < 3 || args.size() % 2 == 0) {
                throw error(List.of(), List.of(","));
            }
            expectSymbol(")");
            List<Expr.CaseBranch> branches = new ArrayList<>();
            for (int i = 0; i + 1 < args.size(); i += 2) {
                branches.add(new Expr.CaseBranch(args.get(i), args.get(i + 1)));
            }
            return new Expr.Case(branches, args.get(args.size() - 1));
        }

        // ------------------------------------------------------------------ token helpers

        private String name(Token t) {
            return t.value() instanceof String bracketed ? bracketed : t.text();
        }

        Token peek() {
            return peek(0);
        }

        private Token peek(int ahead) {
            int i = Math.min(index + ahead, tokens.size() - 1);
            return tokens.get(i);
        }

        private Token advance() {
            Token t = tokens.get(index);
            if (index < tokens.size() - 1) index++;
            return t;
        }

        private void expectSymbol(String symbol) {
            if (!peek().isSymbol(symbol)) throw error(List.of(), List.of(symbol));
            advance();
        }

        private void expectWord(String word) {
            if (!peek().isWord(word)) throw error(List.of(), List.of(word));
            advance();
        }

        void expectKind(TokenKind kind) {
            if (!peek().is(kind)) throw error(List.of(kind), List.of());
        }

        private ParseException error(List<TokenKind> kinds, List<String> symbols) {
            return new ParseException(kinds, symbols, peek());
        }
    }
}
