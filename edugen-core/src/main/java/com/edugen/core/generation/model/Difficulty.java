package com.edugen.core.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Difficulty {
    AUTO(null),
    EASY("A1"),
    MEDIUM("A2"),
    HARD("B1");
    
    public static final String DEFAULT_LEVEL = "A2";
    
    private final String cefrLevel;
    
    Difficulty(String cefrLevel) {
        this.cefrLevel = cefrLevel;
    }
    
    @JsonValue
    public String slug() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    /** Level label used in prompts for an explicit difficulty. */
    public String cefrLevel() {
        return cefrLevel;
    }
    
    public static Difficulty fromString(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
    
    /** A1 is easy, A2 and B1 are medium, anything above is hard. */
    public static Difficulty fromCefr(String level) {
        String normalized = level == null ? DEFAULT_LEVEL : level.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "A1":
                return EASY;
            case "A2":
            case "B1":
                return MEDIUM;
            default:
                return HARD;
        }
    }
    
    /**
     * Resolves the requested difficulty against the level the content reports.
     */
    public static DifficultySelection select(Difficulty requested, String contextLevel) {
        if (requested == null || requested == AUTO) {
            String level = contextLevel == null || contextLevel.isBlank()
                ? DEFAULT_LEVEL
                : contextLevel.trim().toUpperCase(Locale.ROOT);
            return new DifficultySelection(fromCefr(level), level);
        }
        return new DifficultySelection(requested, requested.cefrLevel());
    }
}
