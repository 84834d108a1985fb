package com.edugen.core.generation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * Students hear the full sentence and fill the blanks of the displayed one.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ListeningGapItem extends ActivityItem implements AudioItem {
    private String fullSentence;
    private String displaySentence;
    private List<String> missingWords;
    /** Accepted spellings per blank, in blank order. */
    private List<List<String>> acceptableAnswers;
    private List<String> wordBank;
    private String difficulty;
    private AudioStatus audioStatus;
    private String audioUrl;
    
    @Override
    public String spokenText() {
        return fullSentence;
    }
}
