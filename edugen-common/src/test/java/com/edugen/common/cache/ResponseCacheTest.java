package com.edugen.common.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseCacheTest {

    private MutableClock clock;
    private ResponseCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        cache = new ResponseCache<>("test", Duration.ofSeconds(60), 0, clock);
    }

    @Test
    @DisplayName("getOrFetch runs the fetcher once while the entry is fresh")
    void should_FetchOnce_When_CalledTwiceWithinTtl() {
        AtomicInteger fetches = new AtomicInteger();

        String first = cache.getOrFetch("k", () -> "v" + fetches.incrementAndGet());
        clock.advance(Duration.ofSeconds(59));
        String second = cache.getOrFetch("k", () -> "v" + fetches.incrementAndGet());

        assertThat(first).isEqualTo("v1");
        assertThat(second).isEqualTo("v1");
        assertThat(fetches).hasValue(1);
    }

    @Test
    void should_Refetch_When_TtlElapsed() {
        AtomicInteger fetches = new AtomicInteger();
        cache.getOrFetch("k", () -> "v" + fetches.incrementAndGet());

        clock.advance(Duration.ofSeconds(60));

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.getOrFetch("k", () -> "v" + fetches.incrementAndGet())).isEqualTo("v2");
    }

    @Test
    @DisplayName("A failed fetch propagates unchanged and stores nothing")
    void should_NotCacheFailure_When_FetcherThrows() {
        IllegalStateException boom = new IllegalStateException("content store down");

        assertThatThrownBy(() -> cache.getOrFetch("k", () -> { throw boom; }))
            .isSameAs(boom);

        assertThat(cache.get("k")).isEmpty();
        assertThat(cache.getOrFetch("k", () -> "recovered")).isEqualTo("recovered");
    }

    @Test
    void should_NotStoreNull_When_FetcherReturnsNull() {
        assertThat(cache.getOrFetch("k", () -> null)).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    void should_RemoveOnlyMatchingKeys_When_InvalidatingByPrefix() {
        cache.put("ctx:42:1", "a");
        cache.put("ctx:42:2", "b");
        cache.put("ctx:7:1", "c");

        int removed = cache.invalidatePrefix("ctx:42:");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.get("ctx:7:1")).contains("c");
        assertThat(cache.get("ctx:42:1")).isEmpty();
    }

    @Test
    void should_TrackHitsAndMisses() {
        cache.get("missing");
        cache.put("k", "v");
        cache.get("k");
        cache.get("k");

        ResponseCache.Stats stats = cache.stats();

        assertThat(stats.hits()).isEqualTo(2);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.hitRate()).isCloseTo(0.666, org.assertj.core.data.Offset.offset(0.01));
    }

    @Test
    void should_StayWithinBound_When_CapacityExceeded() {
        ResponseCache<String> bounded = new ResponseCache<>("bounded", Duration.ofMinutes(5), 2, clock);
        bounded.put("a", "1");
        bounded.put("b", "2");
        bounded.put("c", "3");

        assertThat(bounded.size()).isEqualTo(2);
    }

    @Test
    void should_HonourPerEntryTtl_When_PutWithShorterTtl() {
        cache.put("short", "s", Duration.ofSeconds(5));
        cache.put("long", "l");

        clock.advance(Duration.ofSeconds(10));

        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("long")).contains("l");
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Concurrent callers for one key share a single fetch")
    void should_ShareInFlightFetch_When_CalledConcurrently() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> cache.getOrFetch("shared", () -> {
                    fetches.incrementAndGet();
                    try {
                        release.await(2, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "value";
                })));
            }
            Thread.sleep(100);
            release.countDown();

            for (Future<String> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo("value");
            }
            assertThat(fetches).hasValue(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void should_RejectNonPositiveTtl() {
        assertThatThrownBy(() -> new ResponseCache<String>("bad", Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
