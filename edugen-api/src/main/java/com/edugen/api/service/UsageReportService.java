package com.edugen.api.service;

import com.edugen.api.dto.response.UsageSummaryResponse;
import com.edugen.data.repository.AiUsageLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Provider usage and cost over a trailing window, read from the usage audit table.
 */
@Service
@Slf4j
public class UsageReportService {
    
    static final int MAX_DAYS = 365;
    
    private final AiUsageLogRepository repository;
    private final Clock clock;
    
    @Autowired
    public UsageReportService(AiUsageLogRepository repository) {
        this(repository, Clock.systemUTC());
    }
    
    UsageReportService(AiUsageLogRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }
    
    @Transactional(readOnly = true)
    public UsageSummaryResponse summarize(int days) {
        int window = Math.max(1, Math.min(days, MAX_DAYS));
        Instant since = clock.instant().minus(window, ChronoUnit.DAYS);
        long startTime = System.currentTimeMillis();
        
        List<UsageSummaryResponse.ProviderUsage> providers = new ArrayList<>();
        long totalCalls = 0;
        double totalCost = 0.0;
        for (Object[] row : repository.summarizeByProviderSince(since)) {
            UsageSummaryResponse.ProviderUsage usage = UsageSummaryResponse.ProviderUsage.builder()
                .provider((String) row[0])
                .operationType((String) row[1])
                .calls(toLong(row[2]))
                .successes(toLong(row[3]))
                .estimatedCost(toDouble(row[4]))
                .build();
            providers.add(usage);
            totalCalls += usage.getCalls();
            totalCost += usage.getEstimatedCost();
        }
        
        log.info("[USAGE] Summary built | days={} | rows={} | totalCalls={} | durationMs={}", 
            window, providers.size(), totalCalls, System.currentTimeMillis() - startTime);
        return UsageSummaryResponse.builder()
            .since(since)
            .days(window)
            .totalCalls(totalCalls)
            .totalEstimatedCost(totalCost)
            .providers(providers)
            .build();
    }
    
    private static long toLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
    
    private static double toDouble(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }
}
