package com.huntql.service.core.api;

import com.huntql.service.core.error.QueryException;
import com.huntql.service.core.error.QueryStage;
import com.huntql.service.core.executor.ExecutionOptions;
import com.huntql.service.core.executor.ExecutionResult;
import com.huntql.service.core.executor.QueryExecutor;
import com.huntql.service.core.kql.analysis.SemanticAnalyzer;
import com.huntql.service.core.kql.analysis.SemanticError;
import com.huntql.service.core.kql.analysis.SemanticException;
import com.huntql.service.core.kql.ast.AstPrinter;
import com.huntql.service.core.kql.ast.Query;
import com.huntql.service.core.kql.completion.CompletionItem;
import com.huntql.service.core.kql.completion.CompletionProvider;
import com.huntql.service.core.kql.lexer.LexException;
import com.huntql.service.core.kql.optimizer.CostEstimate;
import com.huntql.service.core.kql.optimizer.QueryOptimizer;
import com.huntql.service.core.kql.parser.KqlParser;
import com.huntql.service.core.kql.parser.ParseException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class KqlQueryService implements QueryService {

    private final KqlParser parser = new KqlParser();
    private final QueryExecutor executor;
    private final SemanticAnalyzer analyzer;
    private final QueryOptimizer optimizer;
    private final CompletionProvider completionProvider;

    @Override
    public ExecutionResult execute(String queryText, String orgId, ExecutionOptions options) {
        return executor.execute(queryText, orgId, options);
    }

    @Override
    public ValidationResult validate(String queryText) {
        try {
            analyzer.analyze(parser.parse(queryText));
            return ValidationResult.ok();
        } catch (LexException e) {
            return ValidationResult.failed(List.of(
                    Diagnostic.at(QueryStage.LEX, "LEX_ERROR", e.getMessage(), e.line(), e.column())));
        } catch (ParseException e) {
            return ValidationResult.failed(List.of(Diagnostic.at(
                    QueryStage.PARSE, "UNEXPECTED_TOKEN", e.getMessage(), e.found().line(), e.found().column())));
        } catch (SemanticException e) {
            List<Diagnostic> diagnostics = new ArrayList<>();
            for (SemanticError error : e.errors()) {
                diagnostics.add(Diagnostic.named(QueryStage.VALIDATE, error.kind().name(), error.message(), error.name()));
            }
            return ValidationResult.failed(diagnostics);
        } catch (QueryException e) {
            return ValidationResult.failed(
                    List.of(Diagnostic.named(e.stage(), "INVALID_QUERY", e.getMessage(), null)));
        }
    }

    @Override
    public ExplainResult explain(String queryText) {
        Query query = parser.parse(queryText);
        analyzer.analyze(query);
        QueryOptimizer.Result optimized = optimizer.optimizeWithReport(query);
        CostEstimate estimate = optimizer.costEstimator().estimate(optimized.query());
        log.debug("Explained query passes={} cost={}", optimized.appliedPasses(), estimate.cost());
        return new ExplainResult(
                AstPrinter.printMultiline(query),
                AstPrinter.printMultiline(optimized.query()),
                estimate.cost(),
                estimate.rows(),
                optimized.appliedPasses(),
                estimate.steps());
    }

    @Override
    public List<CompletionItem> complete(String queryText, int cursorOffset) {
        return completionProvider.complete(queryText, cursorOffset);
    }
}
