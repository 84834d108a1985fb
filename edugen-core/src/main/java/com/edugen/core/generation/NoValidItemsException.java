package com.edugen.core.generation;

import com.edugen.core.generation.model.ActivityType;
import lombok.Getter;

@Getter
public class NoValidItemsException extends RuntimeException {
    
    private final ActivityType activityType;
    private final int candidateCount;
    
    public NoValidItemsException(ActivityType activityType, int candidateCount) {
        super("No valid " + activityType.slug() + " items in provider output (" + candidateCount + " candidates)");
        this.activityType = activityType;
        this.candidateCount = candidateCount;
    }
}
