package com.edugen.core.generation.model;

/**
 * Difficulty bucket and the CEFR label the prompt is written for.
 */
public record DifficultySelection(Difficulty difficulty, String cefrLevel) {
}
