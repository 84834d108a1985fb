package com.edugen.common.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Named get-or-fetch cache over Caffeine with per-entry TTL.
 *
 * Expired entries are never served. A failed fetch stores nothing and the
 * failure reaches the caller unchanged. Concurrent callers of
 * {@link #getOrFetch} for the same key share a single fetch.
 */
@Slf4j
public class ResponseCache<V> {

    private final String name;
    private final Duration defaultTtl;
    private final Cache<String, Timed<V>> cache;

    public ResponseCache(String name, Duration defaultTtl) {
        this(name, defaultTtl, 0, Clock.systemUTC());
    }

    /**
     * @param maxEntries upper bound on stored entries, 0 for unbounded
     * @param clock drives expiry; tests pass a movable clock
     */
    public ResponseCache(String name, Duration defaultTtl, int maxEntries, Clock clock) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + defaultTtl);
        }
        this.name = name;
        this.defaultTtl = defaultTtl;

        // Maintenance on the calling thread keeps eviction in step with the clock
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .recordStats();
        if (maxEntries > 0) {
            builder.maximumSize(maxEntries);
        }
        this.cache = builder.expireAfter(new TtlExpiry<V>()).build();
    }

    public Optional<V> get(String key) {
        Timed<V> entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    public void put(String key, V value) {
        put(key, value, defaultTtl);
    }

    public void put(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        cache.put(key, new Timed<>(value, ttl));
    }

    public V getOrFetch(String key, Supplier<V> fetcher) {
        return getOrFetch(key, defaultTtl, fetcher);
    }

    /**
     * Returns the unexpired cached value or runs {@code fetcher}, stores its
     * non-null result for {@code ttl} and returns it.
     */
    public V getOrFetch(String key, Duration ttl, Supplier<V> fetcher) {
        Timed<V> entry = cache.get(key, k -> {
            long startTime = System.currentTimeMillis();
            V value = fetcher.get();
            if (value == null) {
                return null;
            }
            log.debug("[CACHE] Fetched and stored | cache={} | key={} | ttlSeconds={} | durationMs={}",
                name, k, ttl.toSeconds(), System.currentTimeMillis() - startTime);
            return new Timed<>(value, ttl);
        });
        return entry == null ? null : entry.value();
    }

    /**
     * Drops every entry whose key starts with {@code prefix}.
     *
     * @return number of entries removed
     */
    public int invalidatePrefix(String prefix) {
        List<String> keys = cache.asMap().keySet().stream()
            .filter(key -> key.startsWith(prefix))
            .collect(Collectors.toList());
        cache.invalidateAll(keys);
        if (!keys.isEmpty()) {
            log.info("[CACHE] Invalidated by prefix | cache={} | prefix={} | removed={}", name, prefix, keys.size());
        }
        return keys.size();
    }

    public int size() {
        cache.cleanUp();
        return (int) cache.estimatedSize();
    }

    public Stats stats() {
        CacheStats stats = cache.stats();
        return new Stats(name, size(), stats.hitCount(), stats.missCount());
    }

    private record Timed<V>(V value, Duration ttl) {
    }

    private static final class TtlExpiry<V> implements Expiry<String, Timed<V>> {

        @Override
        public long expireAfterCreate(String key, Timed<V> entry, long currentTime) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Timed<V> entry, long currentTime, long currentDuration) {
            return entry.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Timed<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    public record Stats(String name, int size, long hits, long misses) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
    }
}
