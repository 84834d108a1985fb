package com.edugen.ai.provider;

import java.time.Duration;

/**
 * Per-provider retry settings for a failover chain.
 *
 * @param maxRetries            retries after the first attempt on the same provider
 * @param baseDelayMs           backoff base, doubled per retry
 * @param maxRetryAfterSeconds  longest vendor retry-after hint honoured before falling back
 * @param attemptTimeout        upper bound for a single attempt
 */
public record RetryPolicy(int maxRetries, long baseDelayMs, long maxRetryAfterSeconds, Duration attemptTimeout) {
    
    public static final long NO_RETRY = -1L;
    
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (attemptTimeout == null || attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("attemptTimeout must be positive");
        }
    }
    
    public RetryPolicy withAttemptTimeout(Duration timeout) {
        return new RetryPolicy(maxRetries, baseDelayMs, maxRetryAfterSeconds, timeout);
    }
    
    public RetryPolicy withMaxRetries(int retries) {
        return new RetryPolicy(retries, baseDelayMs, maxRetryAfterSeconds, attemptTimeout);
    }
    
    /**
     * Delay before retrying after a failed attempt (0-based), or {@link #NO_RETRY}
     * when the error should go straight to the next provider.
     */
    public long delayBefore(int attempt, ProviderException error) {
        if (attempt >= maxRetries) {
            return NO_RETRY;
        }
        if (error.isRateLimited()) {
            Integer retryAfter = error.getRetryAfterSeconds();
            if (retryAfter == null || retryAfter > maxRetryAfterSeconds) {
                return NO_RETRY;
            }
            return retryAfter * 1000L;
        }
        if (!error.isTransient()) {
            return NO_RETRY;
        }
        return baseDelayMs * (1L << attempt);
    }
}
