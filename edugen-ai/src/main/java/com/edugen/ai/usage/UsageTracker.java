package com.edugen.ai.usage;

import com.edugen.ai.provider.ProviderException;
import com.edugen.common.util.TextHashing;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

/**
 * Turns provider attempts into {@link UsageLogEntry} records, prices them and
 * hands them to every registered sink.
 */
@Service
@Slf4j
public class UsageTracker {
    
    private static final int PROMPT_HASH_LENGTH = 16;
    private static final int MAX_ERROR_MESSAGE = 500;
    
    private final List<UsageLogSink> sinks;
    private final Clock clock;
    private final Map<String, ProviderTotals> totals = new ConcurrentHashMap<>();
    
    public UsageTracker(List<UsageLogSink> sinks) {
        this(sinks, Clock.systemUTC());
    }
    
    public UsageTracker(List<UsageLogSink> sinks, Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.clock = clock;
    }
    
    public UsageLogEntry recordGeneration(UsageContext context, String provider, String model, String prompt,
                                          int inputTokens, int outputTokens, ProviderException error, long durationMs) {
        UsageLogEntry entry = baseEntry(context, OperationType.LLM_GENERATION, provider, model, error, durationMs)
            .promptHash(TextHashing.shortHash(prompt, PROMPT_HASH_LENGTH))
            .promptLength(prompt != null ? prompt.length() : 0)
            .inputTokens(inputTokens)
            .outputTokens(outputTokens)
            .estimatedCost(CostCalculator.cost(provider, inputTokens, outputTokens))
            .build();
        publish(entry);
        return entry;
    }
    
    public UsageLogEntry recordSynthesis(UsageContext context, String provider, String voice, int characters,
                                         ProviderException error, long durationMs) {
        // Vendors bill synthesis only when audio is produced
        int billed = error == null ? characters : 0;
        UsageLogEntry entry = baseEntry(context, OperationType.TTS_SYNTHESIS, provider, voice, error, durationMs)
            .audioCharacters(characters)
            .estimatedCost(CostCalculator.synthesisCost(provider, billed))
            .build();
        publish(entry);
        return entry;
    }
    
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        double totalCost = 0.0;
        Map<String, Object> perProvider = new LinkedHashMap<>();
        for (Map.Entry<String, ProviderTotals> e : totals.entrySet()) {
            ProviderTotals t = e.getValue();
            totalCost += t.cost.sum();
            perProvider.put(e.getKey(), Map.of(
                "attempts", t.attempts.get(),
                "successes", t.successes.get(),
                "estimatedCost", t.cost.sum()
            ));
        }
        stats.put("totalEstimatedCost", totalCost);
        stats.put("providers", perProvider);
        return stats;
    }
    
    private UsageLogEntry.UsageLogEntryBuilder baseEntry(UsageContext context, OperationType type, String provider,
                                                         String model, ProviderException error, long durationMs) {
        UsageContext ctx = context != null ? context : UsageContext.of(null, "unknown");
        return UsageLogEntry.builder()
            .timestamp(Instant.now(clock))
            .requestId(ctx.getRequestId())
            .teacherId(ctx.getTeacherId())
            .operationType(type)
            .activityType(ctx.getActivityType())
            .provider(provider)
            .model(model)
            .success(error == null)
            .errorType(error != null ? error.getKind().name() : null)
            .errorMessage(error != null ? truncate(error.getMessage()) : null)
            .durationMs(durationMs);
    }
    
    private void publish(UsageLogEntry entry) {
        ProviderTotals t = totals.computeIfAbsent(entry.getProvider(), k -> new ProviderTotals());
        t.attempts.incrementAndGet();
        if (entry.isSuccess()) {
            t.successes.incrementAndGet();
        }
        t.cost.add(entry.getEstimatedCost());
        
        log.info("[USAGE] Attempt recorded | requestId={} | teacherId={} | operation={} | activity={} | provider={} | model={} | success={} | errorType={} | inputTokens={} | outputTokens={} | audioChars={} | cost={} | durationMs={}", 
            entry.getRequestId(), entry.getTeacherId(), entry.getOperationType(), entry.getActivityType(),
            entry.getProvider(), entry.getModel(), entry.isSuccess(), entry.getErrorType(),
            entry.getInputTokens(), entry.getOutputTokens(), entry.getAudioCharacters(),
            String.format("%.6f", entry.getEstimatedCost()), entry.getDurationMs());
        
        for (UsageLogSink sink : sinks) {
            try {
                sink.record(entry);
            } catch (RuntimeException e) {
                // Audit hand-off must not fail the generation that produced it
                log.error("[USAGE] Sink rejected entry | sink={} | requestId={} | error={}", 
                    sink.getClass().getSimpleName(), entry.getRequestId(), e.getMessage(), e);
            }
        }
    }
    
    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_MESSAGE) {
            return message;
        }
        return message.substring(0, MAX_ERROR_MESSAGE);
    }
    
    private static final class ProviderTotals {
        private final AtomicLong attempts = new AtomicLong(0);
        private final AtomicLong successes = new AtomicLong(0);
        private final DoubleAdder cost = new DoubleAdder();
    }
}
