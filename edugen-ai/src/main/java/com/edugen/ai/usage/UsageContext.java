package com.edugen.ai.usage;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Who is generating what, carried from the orchestrator down to every provider attempt.
 */
@Value
@Builder(toBuilder = true)
public class UsageContext {
    String requestId;
    String teacherId;
    String activityType;
    
    public static UsageContext of(String teacherId, String activityType) {
        return UsageContext.builder()
            .requestId("gen-" + UUID.randomUUID().toString().substring(0, 12))
            .teacherId(teacherId)
            .activityType(activityType)
            .build();
    }
    
    public UsageContext forActivity(String activity) {
        return toBuilder().activityType(activity).build();
    }
}
