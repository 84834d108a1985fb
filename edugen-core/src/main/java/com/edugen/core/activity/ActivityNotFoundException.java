package com.edugen.core.activity;

import lombok.Getter;

@Getter
public class ActivityNotFoundException extends RuntimeException {
    
    private final String activityId;
    
    public ActivityNotFoundException(String activityId) {
        super("Activity not found: " + activityId);
        this.activityId = activityId;
    }
    
    public ActivityNotFoundException(String activityId, String message) {
        super(message);
        this.activityId = activityId;
    }
}
