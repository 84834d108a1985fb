package com.edugen.ai.ratelimit;

import java.time.Instant;

public record QuotaInfo(
    String teacherId,
    int used,
    int dailyLimit,
    int remaining,
    Instant resetAt,
    int maxItemsPerRequest
) {
}
