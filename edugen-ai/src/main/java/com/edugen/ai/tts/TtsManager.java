package com.edugen.ai.tts;

import com.edugen.ai.config.TtsProperties;
import com.edugen.ai.provider.AttemptResult;
import com.edugen.ai.provider.FailoverExecutor;
import com.edugen.ai.provider.ProviderUnavailableException;
import com.edugen.ai.provider.RetryPolicy;
import com.edugen.ai.tts.model.AudioOptions;
import com.edugen.ai.tts.model.AudioResult;
import com.edugen.ai.tts.model.BatchAudioResult;
import com.edugen.ai.tts.model.Voice;
import com.edugen.ai.usage.UsageContext;
import com.edugen.ai.usage.UsageTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Speech synthesis with caching and primary/fallback failover.
 */
@Service
@Slf4j
public class TtsManager {
    
    private final Map<TtsProvider, TtsProviderClient> clients = new EnumMap<>(TtsProvider.class);
    private final TtsProperties properties;
    private final AudioCache audioCache;
    private final UsageTracker usageTracker;
    private final FailoverExecutor failover;
    private final ExecutorService batchExecutor;
    
    public TtsManager(List<TtsProviderClient> providerClients, TtsProperties properties, AudioCache audioCache,
                      UsageTracker usageTracker,
                      @Qualifier("providerExecutor") ExecutorService providerExecutor,
                      @Qualifier("generationExecutor") ExecutorService batchExecutor) {
        providerClients.forEach(client -> clients.put(client.getProvider(), client));
        this.properties = properties;
        this.audioCache = audioCache;
        this.usageTracker = usageTracker;
        this.batchExecutor = batchExecutor;
        this.failover = new FailoverExecutor(providerExecutor, new RetryPolicy(
            properties.getMaxRetries(),
            properties.getRetryDelayMs(),
            0,
            Duration.ofSeconds(properties.getTimeoutSeconds())
        ), "tts");
    }
    
    public AudioResult synthesize(String text, AudioOptions options, UsageContext context) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text to synthesize must not be blank");
        }
        AudioOptions effective = options != null ? options : AudioOptions.builder().build();
        Voice voice = VoiceCatalog.resolve(effective);
        String cacheKey = AudioCache.key(text, voice.locale(), voice.id(), effective.getFormat());
        
        var cached = audioCache.get(cacheKey);
        if (cached.isPresent()) {
            log.info("[TTS_MANAGER] Served from cache | voice={} | textLength={}", voice.id(), text.length());
            return cached.get();
        }
        
        UsageContext ctx = context != null ? context : UsageContext.of(null, "tts");
        AudioResult result = failover.execute(ctx.getRequestId(), providerChain(),
            client -> client.synthesize(text, voice, effective),
            (client, attempt) -> recordAttempt(ctx, client, voice, text, attempt));
        
        audioCache.put(cacheKey, result);
        return result;
    }
    
    /**
     * Synthesizes every text, at most {@code batchConcurrency} at a time. A failed item is
     * reported in the result and never fails the batch.
     */
    public BatchAudioResult synthesizeBatch(List<String> texts, AudioOptions options, UsageContext context) {
        long startTime = System.currentTimeMillis();
        Semaphore permits = new Semaphore(Math.max(1, properties.getBatchConcurrency()));
        
        List<CompletableFuture<BatchAudioResult.Item>> futures = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            final int index = i;
            final String text = texts.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> {
                permits.acquireUninterruptibly();
                try {
                    return new BatchAudioResult.Item(index, text, synthesize(text, options, context), null);
                } catch (RuntimeException e) {
                    log.warn("[TTS_MANAGER] Batch item failed | index={} | error={}", index, e.getMessage());
                    return new BatchAudioResult.Item(index, text, null, e.getMessage());
                } finally {
                    permits.release();
                }
            }, batchExecutor));
        }
        
        List<BatchAudioResult.Item> items = new ArrayList<>(texts.size());
        futures.forEach(future -> items.add(future.join()));
        
        BatchAudioResult result = new BatchAudioResult(items, System.currentTimeMillis() - startTime);
        log.info("[TTS_MANAGER] Batch completed | items={} | succeeded={} | failed={} | durationMs={}", 
            items.size(), result.successCount(), result.failureCount(), result.totalDurationMs());
        return result;
    }
    
    List<TtsProviderClient> providerChain() {
        if (!properties.isEnabled()) {
            throw new ProviderUnavailableException("Speech synthesis is disabled");
        }
        List<TtsProviderClient> chain = new ArrayList<>(2);
        for (String name : List.of(properties.getPrimaryProvider(), properties.getFallbackProvider())) {
            if (name == null || name.isBlank()) {
                continue;
            }
            TtsProviderClient client = clients.get(TtsProvider.fromString(name));
            if (client != null && client.isAvailable() && !chain.contains(client)) {
                chain.add(client);
            }
        }
        if (chain.isEmpty()) {
            throw new ProviderUnavailableException("No TTS provider is available");
        }
        return chain;
    }
    
    private void recordAttempt(UsageContext ctx, TtsProviderClient client, Voice voice, String text,
                               AttemptResult<AudioResult> attempt) {
        usageTracker.recordSynthesis(ctx, client.getName(), voice.id(), text.length(), 
            attempt.getError(), attempt.getDurationMs());
    }
    
    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("enabled", properties.isEnabled());
        stats.put("primaryProvider", properties.getPrimaryProvider());
        stats.put("fallbackProvider", properties.getFallbackProvider());
        Map<String, Object> providerStats = new LinkedHashMap<>();
        clients.values().forEach(client -> providerStats.put(client.getName(), Map.of("available", client.isAvailable())));
        stats.put("providers", providerStats);
        stats.put("cache", audioCache.stats());
        return stats;
    }
}
