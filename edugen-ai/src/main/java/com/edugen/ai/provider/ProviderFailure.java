package com.edugen.ai.provider;

/**
 * Final failure of one provider in a fallback chain, after its retries.
 */
public record ProviderFailure(String provider, ProviderErrorKind kind, String message, int attempts) {
    
    static ProviderFailure from(AttemptResult<?> last) {
        ProviderException error = last.getError();
        return new ProviderFailure(last.getProvider(), error.getKind(), error.getMessage(), last.getAttemptNumber());
    }
}
