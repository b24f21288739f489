package com.huntql.service.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Catalog function signature.
 *
 * @param maxArgs upper bound on arguments, {@code -1} for variadic
 * @param returnType result type; {@link ColumnType#ANY} means the type of the first argument
 */
public record FunctionInfo(
        @JsonProperty("name") String name,
        @JsonProperty("kind") FunctionKind kind,
        @JsonProperty("minArgs") int minArgs,
        @JsonProperty("maxArgs") int maxArgs,
        @JsonProperty("returns") ColumnType returnType,
        @JsonProperty("description") String description) {

    public FunctionInfo {
        Objects.requireNonNull(name, "function name");
        if (kind == null) kind = FunctionKind.SCALAR;
        if (returnType == null) returnType = ColumnType.ANY;
    }

    public boolean isAggregate() {
        return kind == FunctionKind.AGGREGATE;
    }

    public boolean accepts(int arity) {
        return arity >= minArgs && (maxArgs < 0 || arity <= maxArgs);
    }

    /** {@code "1"}, {@code "1..3"} or {@code "2+"}, for diagnostics. */
    public String arityText() {
        if (maxArgs < 0) return minArgs + "+";
        return minArgs == maxArgs ? String.valueOf(minArgs) : minArgs + ".." + maxArgs;
    }
}
