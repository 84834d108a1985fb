package com.edugen.ai.provider;

import lombok.Getter;

/**
 * Outcome of one provider attempt: either a value or a classified error.
 */
@Getter
public final class AttemptResult<T> {
    
    private final String provider;
    private final int attemptNumber;
    private final T value;
    private final ProviderException error;
    private final long durationMs;
    
    private AttemptResult(String provider, int attemptNumber, T value, ProviderException error, long durationMs) {
        this.provider = provider;
        this.attemptNumber = attemptNumber;
        this.value = value;
        this.error = error;
        this.durationMs = durationMs;
    }
    
    public static <T> AttemptResult<T> ok(String provider, int attemptNumber, T value, long durationMs) {
        return new AttemptResult<>(provider, attemptNumber, value, null, durationMs);
    }
    
    public static <T> AttemptResult<T> err(String provider, int attemptNumber, ProviderException error, long durationMs) {
        return new AttemptResult<>(provider, attemptNumber, null, error, durationMs);
    }
    
    public boolean isOk() {
        return error == null;
    }
}
