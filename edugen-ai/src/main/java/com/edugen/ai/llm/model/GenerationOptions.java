package com.edugen.ai.llm.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-call generation settings. Null fields fall back to configured defaults.
 */
@Value
@Builder(toBuilder = true)
public class GenerationOptions {
    String systemPrompt;
    Double temperature;
    Integer maxTokens;
    Duration timeout;
    Integer maxRetries;
    String model;
    boolean jsonMode;
    
    public static GenerationOptions defaults() {
        return GenerationOptions.builder().build();
    }
    
    public double temperatureOr(double fallback) {
        return temperature != null ? temperature : fallback;
    }
    
    public int maxTokensOr(int fallback) {
        return maxTokens != null ? maxTokens : fallback;
    }
}
