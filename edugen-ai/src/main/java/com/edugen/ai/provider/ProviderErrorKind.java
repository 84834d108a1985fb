package com.edugen.ai.provider;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Shared failure taxonomy every provider translates its vendor errors into.
 */
@Getter
@RequiredArgsConstructor
public enum ProviderErrorKind {
    
    CONNECTION(true),
    AUTHENTICATION(false),
    RATE_LIMIT(false),
    TIMEOUT(true),
    RESPONSE(false),
    CONTENT_FILTER(false),
    QUOTA_EXCEEDED(false),
    MODEL_NOT_FOUND(false);
    
    // Retried on the same provider with exponential backoff
    private final boolean transientError;
    
    public static ProviderErrorKind fromHttpStatus(int status) {
        if (status == 401 || status == 403) return AUTHENTICATION;
        if (status == 402) return QUOTA_EXCEEDED;
        if (status == 404) return MODEL_NOT_FOUND;
        if (status == 408) return TIMEOUT;
        if (status == 429) return RATE_LIMIT;
        if (status >= 500) return CONNECTION;
        return RESPONSE;
    }
}
