package com.huntql.service.core.kql.completion;

import com.huntql.service.core.error.QueryException;
import com.huntql.service.core.kql.analysis.Scope;
import com.huntql.service.core.kql.analysis.SemanticAnalyzer;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.ast.TableExpression;
import com.huntql.service.core.kql.lexer.KqlLexer;
import com.huntql.service.core.kql.lexer.Token;
import com.huntql.service.core.kql.lexer.TokenKind;
import com.huntql.service.core.kql.parser.KqlParser;
import com.huntql.service.core.schema.FunctionInfo;
import com.huntql.service.core.schema.SchemaProvider;
import com.huntql.service.core.schema.TableInfo;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Context-aware completions for a partially typed query. Reads only the text before the cursor: tokens are taken
 * up to the first lexical error, and the pipeline before the last top-level {@code |} is parsed to find the
 * columns in scope.
 */
public class CompletionProvider {

    static final List<String> OPERATIONS = List.of(
            "where", "project", "extend", "summarize", "order by", "sort by", "top", "limit", "take", "distinct",
            "join", "union");

    private static final List<String> INFIX_OPERATORS = List.of(
            "==", "!=", "<", "<=", ">", ">=", "=~", "!~", "contains", "!contains", "has", "!has", "startswith",
            "endswith", "matches regex", "in", "!in", "and", "or");

    private final SchemaProvider schema;
    private final SemanticAnalyzer analyzer;
    private final KqlLexer lexer = new KqlLexer();
    private final KqlParser parser = new KqlParser();

    public CompletionProvider(SchemaProvider schema, SemanticAnalyzer analyzer) {
        this.schema = schema;
        this.analyzer = analyzer;
    }

    public List<CompletionItem> complete(String queryText, int cursorOffset) {
        String text = queryText == null ? "" : queryText;
        int cursor = Math.max(0, Math.min(cursorOffset, text.length()));
        List<Token> tokens = new ArrayList<>(lexer.tokenizePartial(text.substring(0, cursor)));
        tokens.remove(tokens.size() - 1); // end of input

        String prefix = "";
        if (!tokens.isEmpty()) {
            Token last = tokens.get(tokens.size() - 1);
            if (last.isWordLike() && last.endOffset() == cursor) {
                prefix = last.text();
                tokens.remove(tokens.size() - 1);
            }
        }

        List<CompletionItem> items = new ArrayList<>();
        propose(tokens, items);
        String lowered = prefix.toLowerCase(Locale.ROOT);
        return items.stream()
                .filter(i -> i.label().toLowerCase(Locale.ROOT).startsWith(lowered))
                .distinct()
                .sorted(Comparator.comparing(CompletionItem::sortText).thenComparing(CompletionItem::label))
                .toList();
    }

    private void propose(List<Token> tokens, List<CompletionItem> out) {
        if (tokens.isEmpty()) {
            tables(out);
            return;
        }
        Token last = tokens.get(tokens.size() - 1);
        if (last.isSymbol("|")) {
            OPERATIONS.forEach(op -> out.add(new CompletionItem(op, CompletionKind.OPERATION, null, "0")));
            return;
        }
        int pipe = lastTopLevelPipe(tokens);
        if (pipe < 0 || pipe + 1 >= tokens.size()) {
            return;
        }
        Token operation = tokens.get(pipe + 1);
        List<Token> clause = tokens.subList(pipe + 2, tokens.size());
        if (operation.isWord("join") || operation.isWord("union")) {
            if (clause.isEmpty() || last.isSymbol(",") || isKindValue(clause)) {
                tables(out);
                return;
            }
            if (operation.isWord("join") && containsWord(clause, "on")) {
                columns(scopeBefore(tokens, pipe), out, "1");
            }
            return;
        }
        Scope scope = scopeBefore(tokens, pipe);
        boolean afterOperand = isOperandEnd(last) && last != operation;
        if (operation.isWord("summarize")) {
            if (containsWord(clause, "by")) {
                columns(scope, out, afterOperand ? "2" : "0");
                functions(out, false, "1");
            } else {
                functions(out, true, "0");
                functions(out, false, "2");
                if (afterOperand) out.add(new CompletionItem("by", CompletionKind.KEYWORD, null, "0"));
            }
            return;
        }
        if (operation.isWord("order") || operation.isWord("sort") || operation.isWord("top")) {
            if (!containsWord(clause, "by")) {
                // "order" wants "by" straight away, "top" after its count
                if (!operation.isWord("top") || afterOperand) {
                    out.add(new CompletionItem("by", CompletionKind.KEYWORD, null, "0"));
                }
                return;
            }
            if (afterOperand) {
                out.add(new CompletionItem("asc", CompletionKind.KEYWORD, null, "0"));
                out.add(new CompletionItem("desc", CompletionKind.KEYWORD, null, "0"));
            }
            columns(scope, out, "1");
            return;
        }
        if (operation.isWord("limit") || operation.isWord("take")) {
            return;
        }
        if (afterOperand && !operation.isWord("project") && !operation.isWord("distinct")) {
            INFIX_OPERATORS.forEach(op -> out.add(new CompletionItem(op, CompletionKind.OPERATOR, null, "0")));
        }
        columns(scope, out, "1");
        functions(out, false, "2");
    }

    private void tables(List<CompletionItem> out) {
        for (TableInfo table : schema.listTables()) {
            out.add(new CompletionItem(table.name(), CompletionKind.TABLE, table.description(), "1"));
        }
    }

    private void columns(Scope scope, List<CompletionItem> out, String sortText) {
        for (Scope.Column column : scope.columns()) {
            out.add(new CompletionItem(column.name(), CompletionKind.COLUMN, column.type().kqlName(), sortText));
        }
    }

    private void functions(List<CompletionItem> out, boolean aggregates, String sortText) {
        for (FunctionInfo fn : schema.listFunctions()) {
            if (fn.isAggregate() == aggregates) {
                out.add(new CompletionItem(
                        fn.name(),
                        aggregates ? CompletionKind.AGGREGATE : CompletionKind.FUNCTION,
                        fn.name() + "(" + fn.arityText() + ")",
                        sortText));
            }
        }
    }

    /** Columns visible to the operation after {@code tokens[pipe]}. */
    private Scope scopeBefore(List<Token> tokens, int pipe) {
        List<Token> head = new ArrayList<>(tokens.subList(0, pipe));
        Token bar = tokens.get(pipe);
        head.add(new Token(TokenKind.END_OF_INPUT, "", null, bar.startOffset(), bar.startOffset(), bar.line(),
                bar.column()));
        try {
            Query query = parser.parse(head);
            return analyzer.scopes(query).output();
        } catch (QueryException e) {
            Token first = tokens.get(0);
            return first.isWordLike()
                    ? analyzer.sourceScope(TableExpression.table(first.text()))
                    : Scope.of(List.of());
        }
    }

    private static int lastTopLevelPipe(List<Token> tokens) {
        int depth = 0;
        int pipe = -1;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isSymbol("(")) depth++;
            else if (t.isSymbol(")")) depth = Math.max(0, depth - 1);
            else if (t.isSymbol("|") && depth == 0) pipe = i;
        }
        return pipe;
    }

    private static boolean containsWord(List<Token> tokens, String word) {
        return tokens.stream().anyMatch(t -> t.is(TokenKind.KEYWORD) && t.isWord(word));
    }

    /** {@code join kind=inner } or {@code union kind=all }: the table comes next. */
    private static boolean isKindValue(List<Token> clause) {
        int n = clause.size();
        return n == 3 && clause.get(0).isWord("kind") && clause.get(1).isSymbol("=") && clause.get(2).isWordLike();
    }

    private static boolean isOperandEnd(Token token) {
        return token.is(TokenKind.IDENTIFIER)
                || token.kind().isLiteral()
                || token.isSymbol(")")
                || token.isSymbol("]");
    }
}
