package com.huntql.service.core.template;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Root of a template resource document. */
public record TemplateCatalog(@JsonProperty("templates") List<SecurityTemplate> templates) {

    public TemplateCatalog {
        templates = templates == null ? List.of() : List.copyOf(templates);
    }
}
