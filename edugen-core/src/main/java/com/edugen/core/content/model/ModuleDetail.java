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
public class ModuleDetail {
    private long moduleId;
    private String title;
    @Builder.Default
    private List<Integer> pages = new ArrayList<>();
    private String text;
    @Builder.Default
    private List<String> topics = new ArrayList<>();
    @Builder.Default
    private List<String> grammarPoints = new ArrayList<>();
    @Builder.Default
    private List<String> vocabularyIds = new ArrayList<>();
    private String language;
    private String summary;
    private String difficulty;
    private Integer wordCount;
}
