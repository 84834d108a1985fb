package com.edugen.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UsageSummaryResponse {
    private Instant since;
    private int days;
    private long totalCalls;
    private double totalEstimatedCost;
    private List<ProviderUsage> providers;
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ProviderUsage {
        private String provider;
        private String operationType;
        private long calls;
        private long successes;
        private double estimatedCost;
    }
}
