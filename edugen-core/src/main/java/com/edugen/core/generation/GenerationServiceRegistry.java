package com.edugen.core.generation;

import com.edugen.core.generation.model.ActivityType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Looks up the generation service responsible for an activity type.
 */
@Component
@Slf4j
public class GenerationServiceRegistry {
    
    private final Map<ActivityType, AbstractGenerationService> services = new EnumMap<>(ActivityType.class);
    
    public GenerationServiceRegistry(List<AbstractGenerationService> generationServices) {
        for (AbstractGenerationService service : generationServices) {
            AbstractGenerationService previous = services.put(service.getActivityType(), service);
            if (previous != null) {
                throw new IllegalStateException("Two generation services registered for "
                    + service.getActivityType().slug());
            }
        }
        log.info("Generation services registered: {}", services.keySet());
    }
    
    public Optional<AbstractGenerationService> find(ActivityType type) {
        return Optional.ofNullable(services.get(type));
    }
    
    public Set<ActivityType> supportedTypes() {
        return Collections.unmodifiableSet(services.keySet());
    }
}
