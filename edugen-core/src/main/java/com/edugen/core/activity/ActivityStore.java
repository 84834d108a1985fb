package com.edugen.core.activity;

import com.edugen.core.generation.model.GeneratedActivity;

import java.util.Optional;

/**
 * Hand-off point for generated activities. Long-term persistence lives outside
 * this service; implementations only need to keep activities long enough to be
 * reviewed, published and voiced.
 */
public interface ActivityStore {
    
    void save(GeneratedActivity activity);
    
    Optional<GeneratedActivity> find(String activityId);
    
    default GeneratedActivity require(String activityId) {
        return find(activityId).orElseThrow(() -> new ActivityNotFoundException(activityId));
    }
}
