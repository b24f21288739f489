package com.huntql.service.core.template;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum TemplateDifficulty {
    BEGINNER,
    INTERMEDIATE,
    ADVANCED;

    @JsonCreator
    public static TemplateDifficulty fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
