package com.huntql.service.core.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Locale;

public enum FunctionKind {
    SCALAR,
    AGGREGATE;

    @JsonCreator
    public static FunctionKind fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
