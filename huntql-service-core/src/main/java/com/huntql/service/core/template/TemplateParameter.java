package com.huntql.service.core.template;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

/**
 * A {@code {name}} placeholder of a template.
 *
 * @param defaultValue used when the caller leaves the parameter out
 * @param options suggested values for pickers; not enforced
 */
public record TemplateParameter(
        @JsonProperty("name") String name,
        @JsonProperty("type") ParameterType type,
        @JsonProperty("description") String description,
        @JsonProperty("default") Object defaultValue,
        @JsonProperty("required") boolean required,
        @JsonProperty("options") List<Object> options) {

    public TemplateParameter {
        Objects.requireNonNull(name, "parameter name");
        if (type == null) type = ParameterType.STRING;
        options = options == null ? List.of() : List.copyOf(options);
    }
}
