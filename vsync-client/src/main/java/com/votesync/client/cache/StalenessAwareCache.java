package com.votesync.client.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.votesync.common.constant.VoteSyncConstants;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory TTL store for ledger reads, backed by Caffeine.
 * Every entry carries its own ttl; a read at or past insertedAt + ttl misses. Expired entries are
 * evicted during cache maintenance whether or not they are read again. Time comes from the
 * injected {@link Clock}.
 * Concurrent misses for the same key are not deduplicated; the last writer wins.
 */
@Slf4j
public class StalenessAwareCache {

    private final Cache<String, CacheEntry<?>> entries;
    private final Clock clock;
    private final Duration defaultTtl;

    public StalenessAwareCache(Clock clock, Duration defaultTtl) {
        this(clock, defaultTtl, VoteSyncConstants.CACHE_MAXIMUM_SIZE);
    }

    public StalenessAwareCache(Clock clock, Duration defaultTtl, long maximumSize) {
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.entries = Caffeine.newBuilder()
                .ticker(clockTicker(clock))
                .executor(Runnable::run)
                .maximumSize(maximumSize)
                .expireAfter(new PerEntryExpiry())
                .build();
    }

    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String key) {
        CacheEntry<?> entry = entries.getIfPresent(key);
        if (entry == null) {
            log.debug("Cache miss: {}", key);
            return Optional.empty();
        }
        log.debug("Cache hit: {}", key);
        return Optional.ofNullable((T) entry.getValue());
    }

    public <T> void set(String key, T value) {
        set(key, value, defaultTtl);
    }

    public <T> void set(String key, T value, Duration ttl) {
        entries.put(key, new CacheEntry<>(value, ttl));
    }

    public void delete(String key) {
        if (entries.asMap().remove(key) != null) {
            log.debug("Cache entry deleted: {}", key);
        }
    }

    /**
     * Remove every entry whose key starts with the prefix
     */
    public void clear(String prefix) {
        entries.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        log.debug("Cleared cache entries with prefix '{}'", prefix);
    }

    public void clear() {
        entries.invalidateAll();
        log.debug("Cache cleared");
    }

    /**
     * Read-through with a fixed ttl. Producer exceptions propagate and nothing is cached.
     */
    public <T> T getOrCompute(String key, Duration ttl, Supplier<T> producer) {
        return getOrCompute(key, value -> ttl, producer);
    }

    /**
     * Read-through where the ttl depends on the produced value. Null values are not cached.
     *
     * The producer runs outside Caffeine's compute, since producers read other keys of this cache.
     */
    public <T> T getOrCompute(String key, Function<T, Duration> ttlOf, Supplier<T> producer) {
        Optional<T> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = producer.get();
        if (value != null) {
            set(key, value, ttlOf.apply(value));
        }
        return value;
    }

    /**
     * Number of live entries, after expired and over-capacity entries are evicted
     */
    public int size() {
        entries.cleanUp();
        int live = 0;
        for (String ignored : entries.asMap().keySet()) {
            live++;
        }
        return live;
    }

    public Clock getClock() {
        return clock;
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    /**
     * Expires each entry after its own ttl, counted from its last write
     */
    private static class PerEntryExpiry implements Expiry<String, CacheEntry<?>> {

        @Override
        public long expireAfterCreate(String key, CacheEntry<?> entry, long currentTime) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return entry.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry<?> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
