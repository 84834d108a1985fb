package com.edugen.core.activity;

import com.edugen.common.cache.ResponseCache;
import com.edugen.core.generation.GenerationProperties;
import com.edugen.core.generation.model.GeneratedActivity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Keeps activities in a TTL cache. Entries disappear after
 * {@code ai.generation.activity-ttl-hours}.
 */
@Component
@Slf4j
public class InMemoryActivityStore implements ActivityStore {
    
    private static final int MAX_ACTIVITIES = 10_000;
    
    private final ResponseCache<GeneratedActivity> cache;
    
    @Autowired
    public InMemoryActivityStore(GenerationProperties properties) {
        this(properties, Clock.systemUTC());
    }
    
    InMemoryActivityStore(GenerationProperties properties, Clock clock) {
        this.cache = new ResponseCache<>("activities", Duration.ofHours(properties.getActivityTtlHours()),
            MAX_ACTIVITIES, clock);
    }
    
    @Override
    public void save(GeneratedActivity activity) {
        cache.put(activity.getActivityId(), activity);
        log.debug("[ACTIVITY_STORE] Stored | activityId={} | type={} | items={}", 
            activity.getActivityId(), activity.getType().slug(), activity.getTotalItems());
    }
    
    @Override
    public Optional<GeneratedActivity> find(String activityId) {
        return cache.get(activityId);
    }
    
    public ResponseCache.Stats stats() {
        return cache.stats();
    }
}
