package com.edugen.core.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ActivityFormat {
    QUIZ,
    MULTIPLE_CHOICE,
    FILL_BLANK,
    SENTENCE_BUILDER,
    WORD_BUILDER,
    COMPREHENSION,
    MIX;
    
    @JsonValue
    public String slug() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    public static ActivityFormat fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().replace('-', '_').toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
