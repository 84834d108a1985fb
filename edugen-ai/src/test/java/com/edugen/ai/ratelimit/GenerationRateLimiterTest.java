package com.edugen.ai.ratelimit;

import com.edugen.ai.config.RateLimitProperties;
import com.edugen.ai.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenerationRateLimiterTest {
    
    private MutableClock clock;
    private RateLimitProperties properties;
    private GenerationRateLimiter limiter;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-10T15:30:00Z"));
        properties = new RateLimitProperties();
        properties.setDailyLimitPerTeacher(10);
        properties.setMaxItemsPerRequest(50);
        limiter = new GenerationRateLimiter(properties, clock);
    }
    
    @Test
    @DisplayName("9/10 used: a 5-item request takes the 10th slot, the next one is refused")
    void should_AdmitTenthAndRejectEleventh() {
        for (int i = 0; i < 9; i++) {
            limiter.checkAndConsume("t1", 3);
        }
        
        QuotaInfo quota = limiter.checkAndConsume("t1", 5);
        
        assertThat(quota.used()).isEqualTo(10);
        assertThat(quota.remaining()).isZero();
        assertThatThrownBy(() -> limiter.checkAndConsume("t1", 1))
            .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
                assertThat(e.getLimitType()).isEqualTo(RateLimitExceededException.LimitType.DAILY);
                assertThat(e.getCurrentUsage()).isEqualTo(10);
                assertThat(e.getMaxAllowed()).isEqualTo(10);
                assertThat(e.getResetAt()).isEqualTo(Instant.parse("2026-02-11T00:00:00Z"));
            });
        assertThat(limiter.getQuotaInfo("t1").used()).isEqualTo(10);
    }
    
    @Test
    void should_RejectOversizedRequestWithoutConsuming() {
        assertThatThrownBy(() -> limiter.checkAndConsume("t1", 51))
            .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
                assertThat(e.getLimitType()).isEqualTo(RateLimitExceededException.LimitType.PER_REQUEST);
                assertThat(e.getResetAt()).isNull();
            });
        assertThat(limiter.getRemaining("t1")).isEqualTo(10);
    }
    
    @Test
    void should_ResetLazilyAfterMidnightUtc() {
        for (int i = 0; i < 10; i++) {
            limiter.checkAndConsume("t1", 1);
        }
        
        clock.set(Instant.parse("2026-02-11T00:00:01Z"));
        
        assertThat(limiter.getRemaining("t1")).isEqualTo(10);
        assertThat(limiter.checkAndConsume("t1", 1).used()).isEqualTo(1);
    }
    
    @Test
    void should_KeepTeachersIndependent() {
        for (int i = 0; i < 10; i++) {
            limiter.checkAndConsume("t1", 1);
        }
        
        assertThat(limiter.checkAndConsume("t2", 1).used()).isEqualTo(1);
    }
    
    @Test
    @DisplayName("Concurrent requests of one teacher never exceed the cap")
    void should_AdmitExactlyCap_When_RequestsRace() throws Exception {
        int requests = 50;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < requests; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        limiter.checkAndConsume("racer", 2);
                        admitted.incrementAndGet();
                    } catch (RateLimitExceededException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }
        
        assertThat(admitted).hasValue(10);
        assertThat(rejected).hasValue(requests - 10);
        assertThat(limiter.getQuotaInfo("racer").used()).isEqualTo(10);
    }
    
    @Test
    void should_DropExpiredCountersOnCleanup() {
        limiter.checkAndConsume("t1", 1);
        clock.advance(Duration.ofDays(1));
        
        limiter.cleanupExpired();
        
        assertThat(limiter.getQuotaInfo("t1").used()).isZero();
    }
    
    @Test
    void should_ClearUsage_When_TeacherReset() {
        limiter.checkAndConsume("t1", 1);
        
        limiter.resetTeacher("t1");
        
        assertThat(limiter.getRemaining("t1")).isEqualTo(10);
    }
    
    @Test
    void should_ReturnSlot_When_Released() {
        limiter.checkAndConsume("t1", 1);
        QuotaInfo reserved = limiter.checkAndConsume("t1", 1);
        
        limiter.release("t1", reserved.resetAt());
        
        assertThat(limiter.getQuotaInfo("t1").used()).isEqualTo(1);
    }
    
    @Test
    @DisplayName("A slot taken yesterday is not credited to today's counter")
    void should_IgnoreRelease_When_CounterRolledOver() {
        QuotaInfo yesterday = limiter.checkAndConsume("t1", 1);
        clock.advance(Duration.ofDays(1));
        limiter.checkAndConsume("t1", 1);
        
        limiter.release("t1", yesterday.resetAt());
        
        assertThat(limiter.getQuotaInfo("t1").used()).isEqualTo(1);
    }
    
    @Test
    void should_NotGoNegative_When_ReleasedTwice() {
        QuotaInfo reserved = limiter.checkAndConsume("t1", 1);
        
        limiter.release("t1", reserved.resetAt());
        limiter.release("t1", reserved.resetAt());
        limiter.release("unknown", reserved.resetAt());
        
        assertThat(limiter.getQuotaInfo("t1").used()).isZero();
        assertThat(limiter.getRemaining("unknown")).isEqualTo(10);
    }
}
