package com.huntql.service.core.kql.analysis;

import com.huntql.service.core.error.QueryException;
import com.huntql.service.core.error.QueryStage;
import java.util.List;
import java.util.stream.Collectors;

public class SemanticException extends QueryException {

    private final List<SemanticError> errors;

    public SemanticException(List<SemanticError> errors) {
        super(QueryStage.VALIDATE, errors.stream().map(SemanticError::message).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<SemanticError> errors() {
        return errors;
    }
}
