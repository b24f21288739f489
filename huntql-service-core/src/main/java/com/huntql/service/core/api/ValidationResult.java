package com.huntql.service.core.api;

import java.util.List;

public record ValidationResult(boolean valid, List<Diagnostic> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult failed(List<Diagnostic> errors) {
        return new ValidationResult(false, errors);
    }
}
