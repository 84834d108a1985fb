package com.edugen.core.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Skill {
    VOCABULARY,
    GRAMMAR,
    READING,
    LISTENING,
    WRITING,
    MIX;
    
    @JsonValue
    public String slug() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    public static Skill fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
