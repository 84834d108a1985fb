package com.edugen.core.generation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * One generated item. {@code skill} and {@code format} are only filled in when
 * the item is part of a mix activity.
 */
@Data
@SuperBuilder
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public abstract class ActivityItem {
    private String itemId;
    private Skill skill;
    private ActivityFormat format;
    @JsonIgnore
    private ActivityType type;
    
    public void tagWith(ActivityType source) {
        this.skill = source.getSkill();
        this.format = source.getFormat();
    }
}
