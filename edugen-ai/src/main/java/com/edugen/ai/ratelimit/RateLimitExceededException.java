package com.edugen.ai.ratelimit;

import lombok.Getter;

import java.time.Instant;

/**
 * Internal generation quota breached. Raised before any provider is contacted.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {
    
    public enum LimitType { PER_REQUEST, DAILY }
    
    private final LimitType limitType;
    private final String teacherId;
    private final int currentUsage;
    private final int maxAllowed;
    // Null for per-request breaches, which do not reset
    private final Instant resetAt;
    
    public RateLimitExceededException(String message, LimitType limitType, String teacherId,
                                      int currentUsage, int maxAllowed, Instant resetAt) {
        super(message);
        this.limitType = limitType;
        this.teacherId = teacherId;
        this.currentUsage = currentUsage;
        this.maxAllowed = maxAllowed;
        this.resetAt = resetAt;
    }
}
