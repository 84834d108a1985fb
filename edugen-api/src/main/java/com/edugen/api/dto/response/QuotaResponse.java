package com.edugen.api.dto.response;

import com.edugen.ai.ratelimit.QuotaInfo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class QuotaResponse {
    private String teacherId;
    private int used;
    private int dailyLimit;
    private int remaining;
    private Instant resetAt;
    private int maxItemsPerRequest;
    
    public static QuotaResponse from(QuotaInfo quota) {
        return QuotaResponse.builder()
            .teacherId(quota.teacherId())
            .used(quota.used())
            .dailyLimit(quota.dailyLimit())
            .remaining(quota.remaining())
            .resetAt(quota.resetAt())
            .maxItemsPerRequest(quota.maxItemsPerRequest())
            .build();
    }
}
