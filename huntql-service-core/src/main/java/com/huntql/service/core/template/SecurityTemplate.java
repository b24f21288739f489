package com.huntql.service.core.template;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/** A parameterized hunting query with its catalog metadata. */
public record SecurityTemplate(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("category") SecurityCategory category,
        @JsonProperty("query") String query,
        @JsonProperty("parameters") List<TemplateParameter> parameters,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("mitreTactics") List<String> mitreTactics,
        @JsonProperty("mitreAttackIds") List<String> mitreAttackIds,
        @JsonProperty("difficulty") TemplateDifficulty difficulty,
        @JsonProperty("useCase") String useCase) {

    public SecurityTemplate {
        Objects.requireNonNull(id, "template id");
        Objects.requireNonNull(query, "template query");
        if (name == null) name = id;
        if (description == null) description = "";
        if (useCase == null) useCase = "";
        if (difficulty == null) difficulty = TemplateDifficulty.INTERMEDIATE;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        tags = tags == null ? List.of() : List.copyOf(tags);
        mitreTactics = mitreTactics == null ? List.of() : List.copyOf(mitreTactics);
        mitreAttackIds = mitreAttackIds == null ? List.of() : List.copyOf(mitreAttackIds);
    }

    public Optional<TemplateParameter> findParameter(String parameter) {
        return parameters.stream().filter(p -> p.name().equals(parameter)).findFirst();
    }

    /** Case-insensitive match on name, description, tags and use case. */
    boolean matches(String lowerCaseTerm) {
        return name.toLowerCase(Locale.ROOT).contains(lowerCaseTerm)
                || description.toLowerCase(Locale.ROOT).contains(lowerCaseTerm)
                || useCase.toLowerCase(Locale.ROOT).contains(lowerCaseTerm)
                || tags.stream().anyMatch(t -> t.toLowerCase(Locale.ROOT).contains(lowerCaseTerm));
    }
}
