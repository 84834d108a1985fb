package com.edugen.ai.ratelimit;

import com.edugen.ai.config.RateLimitProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-teacher generation quota.
 *
 * Two ceilings: items per request, and generations per UTC day. A request counts once
 * toward the daily cap regardless of its item count. Check and increment happen inside
 * one {@link ConcurrentHashMap#compute} call, so concurrent requests of the same teacher
 * are serialized on that key and can never jointly exceed the cap. The counter resets
 * lazily on the first check after midnight UTC. A slot taken by a generation that
 * then failed is handed back through {@link #release}.
 */
@Service
@Slf4j
public class GenerationRateLimiter {
    
    private final RateLimitProperties properties;
    private final Clock clock;
    private final Map<String, DailyCounter> counters = new ConcurrentHashMap<>();
    
    @Autowired
    public GenerationRateLimiter(RateLimitProperties properties) {
        this(properties, Clock.systemUTC());
    }
    
    public GenerationRateLimiter(RateLimitProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }
    
    /**
     * Admits one generation of {@code itemCount} items or throws without consuming anything.
     *
     * @return quota after this request was counted
     */
    public QuotaInfo checkAndConsume(String teacherId, int itemCount) {
        int maxItems = properties.getMaxItemsPerRequest();
        if (itemCount > maxItems) {
            log.warn("[RATE_LIMIT] Per-request limit exceeded | teacherId={} | requested={} | max={}", 
                teacherId, itemCount, maxItems);
            throw new RateLimitExceededException(
                "Requested " + itemCount + " items, at most " + maxItems + " allowed per request",
                RateLimitExceededException.LimitType.PER_REQUEST, teacherId, itemCount, maxItems, null);
        }
        
        int dailyLimit = properties.getDailyLimitPerTeacher();
        Instant now = clock.instant();
        
        DailyCounter updated = counters.compute(teacherId, (key, current) -> {
            DailyCounter counter = current == null || current.isExpired(now) ? DailyCounter.start(now) : current;
            if (counter.used() >= dailyLimit) {
                throw new RateLimitExceededException(
                    "Daily generation limit of " + dailyLimit + " reached",
                    RateLimitExceededException.LimitType.DAILY, teacherId, counter.used(), dailyLimit, counter.resetAt());
            }
            return counter.increment();
        });
        
        log.info("[RATE_LIMIT] Generation admitted | teacherId={} | items={} | used={}/{} | resetAt={}", 
            teacherId, itemCount, updated.used(), dailyLimit, updated.resetAt());
        return toQuotaInfo(teacherId, updated);
    }
    
    /**
     * Returns one slot taken by {@link #checkAndConsume}. Ignored when the counter has
     * rolled over since, so a failure straddling midnight cannot credit the new day.
     *
     * @param resetAt reset instant of the quota the slot was taken from
     */
    public void release(String teacherId, Instant resetAt) {
        DailyCounter updated = counters.computeIfPresent(teacherId, (key, current) ->
            current.resetAt().equals(resetAt) && current.used() > 0 ? current.decrement() : current);
        if (updated != null && updated.resetAt().equals(resetAt)) {
            log.info("[RATE_LIMIT] Quota released | teacherId={} | used={}/{}", 
                teacherId, updated.used(), properties.getDailyLimitPerTeacher());
        }
    }
    
    public QuotaInfo getQuotaInfo(String teacherId) {
        Instant now = clock.instant();
        DailyCounter counter = counters.get(teacherId);
        if (counter == null || counter.isExpired(now)) {
            counter = DailyCounter.start(now);
        }
        return toQuotaInfo(teacherId, counter);
    }
    
    public int getRemaining(String teacherId) {
        return getQuotaInfo(teacherId).remaining();
    }
    
    public void resetTeacher(String teacherId) {
        counters.remove(teacherId);
        log.info("[RATE_LIMIT] Counter reset | teacherId={}", teacherId);
    }
    
    @Scheduled(fixedDelayString = "${ai.rate-limit.cleanup-interval-ms:3600000}")
    public void cleanupExpired() {
        Instant now = clock.instant();
        int before = counters.size();
        counters.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        int removed = before - counters.size();
        if (removed > 0) {
            log.info("[RATE_LIMIT] Expired counters removed | count={} | remaining={}", removed, counters.size());
        }
    }
    
    private QuotaInfo toQuotaInfo(String teacherId, DailyCounter counter) {
        int limit = properties.getDailyLimitPerTeacher();
        return new QuotaInfo(teacherId, counter.used(), limit, Math.max(0, limit - counter.used()),
            counter.resetAt(), properties.getMaxItemsPerRequest());
    }
    
    private record DailyCounter(int used, Instant resetAt) {
        
        static DailyCounter start(Instant now) {
            LocalDate tomorrow = now.atZone(ZoneOffset.UTC).toLocalDate().plusDays(1);
            return new DailyCounter(0, tomorrow.atStartOfDay(ZoneOffset.UTC).toInstant());
        }
        
        boolean isExpired(Instant now) {
            return !now.isBefore(resetAt);
        }
        
        DailyCounter increment() {
            return new DailyCounter(used + 1, resetAt);
        }
        
        DailyCounter decrement() {
            return new DailyCounter(used - 1, resetAt);
        }
    }
}
