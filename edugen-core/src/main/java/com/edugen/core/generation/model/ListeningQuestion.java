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

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ListeningQuestion extends ActivityItem implements AudioItem {
    private String audioText;
    private String question;
    private List<String> options;
    private int correctIndex;
    private String correctAnswer;
    private String explanation;
    /** gist, detail or discrimination */
    private String subSkill;
    private String difficulty;
    private AudioStatus audioStatus;
    private String audioUrl;
    
    @Override
    public String spokenText() {
        return audioText;
    }
}
