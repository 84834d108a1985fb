package com.edugen.core.generation.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class DifficultyTest {
    
    @ParameterizedTest
    @CsvSource({"A1, EASY", "a2, MEDIUM", "B1, MEDIUM", "B2, HARD", "C1, HARD"})
    void should_MapContentLevel_When_DifficultyIsAuto(String level, Difficulty expected) {
        DifficultySelection selection = Difficulty.select(Difficulty.AUTO, level);
        
        assertThat(selection.difficulty()).isEqualTo(expected);
        assertThat(selection.cefrLevel()).isEqualTo(level.toUpperCase());
    }
    
    @Test
    void should_AssumeA2_When_ContentHasNoLevel() {
        DifficultySelection selection = Difficulty.select(Difficulty.AUTO, null);
        
        assertThat(selection.difficulty()).isEqualTo(Difficulty.MEDIUM);
        assertThat(selection.cefrLevel()).isEqualTo("A2");
    }
    
    @ParameterizedTest
    @CsvSource({"EASY, A1", "MEDIUM, A2", "HARD, B1"})
    void should_IgnoreContentLevel_When_DifficultyIsExplicit(Difficulty requested, String level) {
        DifficultySelection selection = Difficulty.select(requested, "C1");
        
        assertThat(selection.difficulty()).isEqualTo(requested);
        assertThat(selection.cefrLevel()).isEqualTo(level);
    }
    
    @Test
    void should_ParseLeniently_When_ReadingRequests() {
        assertThat(Difficulty.fromString(null)).isEqualTo(Difficulty.AUTO);
        assertThat(Difficulty.fromString(" Hard ")).isEqualTo(Difficulty.HARD);
        assertThat(Difficulty.fromString("extreme")).isNull();
    }
}
