package com.edugen.core.generation.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AudioStatus {
    PENDING,
    READY,
    FAILED;
    
    @JsonValue
    public String slug() {
        return name().toLowerCase(Locale.ROOT);
    }
}
