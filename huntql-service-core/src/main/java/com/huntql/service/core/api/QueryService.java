package com.huntql.service.core.api;

import com.huntql.service.core.executor.ExecutionOptions;
import com.huntql.service.core.executor.ExecutionResult;
import com.huntql.service.core.kql.completion.CompletionItem;
import java.util.List;

/** Entry points the surrounding service exposes. */
public interface QueryService {

    ExecutionResult execute(String queryText, String orgId, ExecutionOptions options);

    /** Lex, parse and validate only; never throws for a bad query. */
    ValidationResult validate(String queryText);

    ExplainResult explain(String queryText);

    List<CompletionItem> complete(String queryText, int cursorOffset);
}
