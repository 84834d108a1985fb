package com.edugen.ai.usage;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable audit record of one provider attempt.
 */
@Value
@Builder
public class UsageLogEntry {
    Instant timestamp;
    String requestId;
    String teacherId;
    OperationType operationType;
    String activityType;
    String provider;
    String model;
    String promptHash;
    int promptLength;
    int inputTokens;
    int outputTokens;
    int audioCharacters;
    double estimatedCost;
    boolean success;
    String errorType;
    String errorMessage;
    long durationMs;
}
