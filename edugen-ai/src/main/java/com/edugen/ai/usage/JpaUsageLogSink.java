package com.edugen.ai.usage;

import com.edugen.data.entity.AiUsageLog;
import com.edugen.data.repository.AiUsageLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Writes usage records to the {@code ai_usage_log} table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaUsageLogSink implements UsageLogSink {
    
    private final AiUsageLogRepository repository;
    
    @Value("${ai.usage.retention-days:90}")
    private int retentionDays;
    
    @Override
    public void record(UsageLogEntry entry) {
        AiUsageLog row = AiUsageLog.builder()
            .requestId(entry.getRequestId())
            .teacherId(entry.getTeacherId())
            .operationType(entry.getOperationType().name())
            .activityType(entry.getActivityType())
            .provider(entry.getProvider())
            .model(entry.getModel())
            .promptHash(entry.getPromptHash())
            .promptLength(entry.getPromptLength())
            .inputTokens(entry.getInputTokens())
            .outputTokens(entry.getOutputTokens())
            .audioCharacters(entry.getAudioCharacters())
            .estimatedCost(entry.getEstimatedCost())
            .success(entry.isSuccess())
            .errorType(entry.getErrorType())
            .errorMessage(entry.getErrorMessage())
            .durationMs(entry.getDurationMs())
            .build();
        repository.save(row);
    }
    
    @Scheduled(cron = "${ai.usage.purge-cron:0 30 3 * * *}")
    public void purgeExpired() {
        Instant cutoff = Instant.now().minus(retentionDays, ChronoUnit.DAYS);
        int removed = repository.deleteOlderThan(cutoff);
        log.info("[USAGE] Purged audit rows past retention | retentionDays={} | removed={}", retentionDays, removed);
    }
}
