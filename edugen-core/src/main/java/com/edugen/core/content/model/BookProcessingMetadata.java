package com.edugen.core.content.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BookProcessingMetadata {
    private Long bookId;
    private String processingStatus;
    private String primaryLanguage;
    private List<String> difficultyRange;
    private Integer totalModules;
    private Integer totalVocabulary;
    
    public boolean isCompleted() {
        return "completed".equalsIgnoreCase(processingStatus);
    }
}
