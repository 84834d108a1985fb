package com.edugen.core.generation;

import com.edugen.ai.ratelimit.QuotaInfo;
import com.edugen.core.generation.model.GeneratedActivity;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * A stored activity together with its student-facing view and the teacher's remaining quota.
 */
public record GenerationOutcome(GeneratedActivity activity, ObjectNode publicView, QuotaInfo quota) {
    
    public String activityId() {
        return activity.getActivityId();
    }
}
