package com.edugen.api.dto.response;

import com.edugen.core.generation.GenerationOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a generation call. {@code activity} is the public view; teachers fetch
 * answers through the authoring endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class GenerateActivityResponse {
    private String activityId;
    private int totalItems;
    private int requestedItems;
    private ObjectNode activity;
    private QuotaResponse quota;
    
    public static GenerateActivityResponse from(GenerationOutcome outcome) {
        return GenerateActivityResponse.builder()
            .activityId(outcome.activityId())
            .totalItems(outcome.activity().getTotalItems())
            .requestedItems(outcome.activity().getRequestedItems())
            .activity(outcome.publicView())
            .quota(QuotaResponse.from(outcome.quota()))
            .build();
    }
}
