package com.edugen.core.generation.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One generation call. Exactly one content source is set: a book with its
 * modules, or free text.
 */
@Value
@Builder(toBuilder = true)
public class GenerationRequest {
    Skill skill;
    ActivityFormat format;
    Long bookId;
    @Builder.Default
    List<Long> moduleIds = List.of();
    String sourceText;
    int count;
    @Builder.Default
    Difficulty difficulty = Difficulty.AUTO;
    String language;
    @Builder.Default
    boolean includeExplanations = true;
    /** Reading comprehension only: mcq, true_false, short_answer. */
    @Builder.Default
    List<String> questionTypes = List.of();
    String teacherId;
    
    public boolean hasBookSource() {
        return bookId != null;
    }
    
    public boolean hasTextSource() {
        return sourceText != null && !sourceText.isBlank();
    }
}
