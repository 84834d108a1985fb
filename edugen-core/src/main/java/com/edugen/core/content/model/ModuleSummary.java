package com.edugen.core.content.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ModuleSummary {
    private long moduleId;
    private String title;
    private Integer startPage;
    private Integer endPage;
    private Integer pageCount;
    private Integer wordCount;
    @Builder.Default
    private List<String> topics = new ArrayList<>();
    @Builder.Default
    private String difficultyLevel = "A1";
    private String summary;
    private Integer vocabularyCount;
}
