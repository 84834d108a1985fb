package com.edugen.core.generation;

import com.edugen.ai.provider.AllProvidersFailedException;
import com.edugen.core.generation.model.ActivityType;
import lombok.Getter;

import java.util.List;

/**
 * A generation service could not get usable output from any provider.
 */
@Getter
public class GenerationException extends RuntimeException {
    
    private final ActivityType activityType;
    
    public GenerationException(ActivityType activityType, String message, Throwable cause) {
        super(message, cause);
        this.activityType = activityType;
    }
    
    public List<String> getAttemptedProviders() {
        if (getCause() instanceof AllProvidersFailedException) {
            return ((AllProvidersFailedException) getCause()).getAttemptedProviders();
        }
        return List.of();
    }
    
    public int getTotalAttempts() {
        if (getCause() instanceof AllProvidersFailedException) {
            return ((AllProvidersFailedException) getCause()).getTotalAttempts();
        }
        return 0;
    }
}
