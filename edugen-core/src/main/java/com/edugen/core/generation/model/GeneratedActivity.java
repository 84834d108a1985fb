package com.edugen.core.generation.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Authoring view of a generated activity: every item with its answers. Students
 * only ever see the projection produced by {@code ActivityRedactor}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"activity_id", "skill", "format", "title"})
public class GeneratedActivity {
    private String activityId;
    @JsonIgnore
    private ActivityType type;
    private Skill skill;
    private ActivityFormat format;
    private String title;
    private Long bookId;
    private List<Long> moduleIds;
    private Difficulty difficulty;
    private String cefrLevel;
    private String language;
    private int requestedItems;
    private int totalItems;
    /** Reading comprehension passage. */
    private String passage;
    private String passageTitle;
    /** Mix activities: items per contributing skill. */
    private Map<String, SkillAllocation> skillDistribution;
    private String provider;
    private String model;
    private Instant createdAt;
    @JsonIgnore
    @Builder.Default
    private List<ActivityItem> items = new ArrayList<>();
    
    /** Items are written under the key the activity type names, e.g. {@code questions}. */
    @JsonAnyGetter
    public Map<String, Object> itemsByRootKey() {
        return Map.of(type.getRootKey(), items);
    }
    
    @JsonIgnore
    public List<AudioItem> getAudioItems() {
        return items.stream()
            .filter(AudioItem.class::isInstance)
            .map(AudioItem.class::cast)
            .collect(Collectors.toList());
    }
}
