package com.huntql.service.core.kql.sql;

import com.huntql.service.core.error.QueryException;
import com.huntql.service.core.error.QueryStage;

/**
 * The AST contains a construct with no relational lowering: a function the generator does not know, an operator
 * shape it cannot express, or a reference it cannot bind. Either a gap in supported KQL or a generator defect.
 */
public class GenerationException extends QueryException {

    private final String unsupportedConstruct;

    public GenerationException(String unsupportedConstruct, String message) {
        super(QueryStage.GENERATE, message);
        this.unsupportedConstruct = unsupportedConstruct;
    }

    public String unsupportedConstruct() {
        return unsupportedConstruct;
    }
}
