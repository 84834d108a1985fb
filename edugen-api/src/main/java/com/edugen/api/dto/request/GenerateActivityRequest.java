package com.edugen.api.dto.request;

import com.edugen.core.generation.model.ActivityFormat;
import com.edugen.core.generation.model.Difficulty;
import com.edugen.core.generation.model.GenerationRequest;
import com.edugen.core.generation.model.Skill;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GenerateActivityRequest {
    
    @NotBlank(message = "Skill is required")
    private String skill;
    
    @NotBlank(message = "Format is required")
    private String format;
    
    private Long bookId;
    
    private List<@NotNull(message = "Module ids must not be null") Long> moduleIds;
    
    @Size(max = 20000, message = "Source text must be at most 20000 characters")
    private String sourceText;
    
    @NotNull(message = "Count is required")
    @Min(value = 1, message = "Count must be at least 1")
    private Integer count;
    
    private String difficulty;
    
    private String language;
    
    private Boolean includeExplanations;
    
    private List<String> questionTypes;
    
    /**
     * Unknown skill, format or difficulty values become nulls and are rejected by the orchestrator
     * with the offending field named.
     */
    public GenerationRequest toGenerationRequest(String teacherId) {
        return GenerationRequest.builder()
            .teacherId(teacherId)
            .skill(Skill.fromString(skill))
            .format(ActivityFormat.fromString(format))
            .bookId(bookId)
            .moduleIds(moduleIds != null ? moduleIds : List.of())
            .sourceText(sourceText)
            .count(count)
            .difficulty(Difficulty.fromString(difficulty))
            .language(language)
            .includeExplanations(includeExplanations == null || includeExplanations)
            .questionTypes(questionTypes != null ? questionTypes : List.of())
            .build();
    }
}
