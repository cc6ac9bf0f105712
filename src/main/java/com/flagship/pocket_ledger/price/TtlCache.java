package com.flagship.pocket_ledger.price;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Time-boxed cache with an injected clock, backed by Caffeine.
 *
 * An entry written at {@code t} is visible while {@code now < t + ttl}. Expired entries are
 * evicted during cache maintenance, whether or not they are read again.
 */
public class TtlCache<K, V> {

    public static final long DEFAULT_MAXIMUM_SIZE = 1_000;

    private final Clock clock;
    private final Duration ttl;
    private final Cache<K, Entry<V>> cache;

    public TtlCache(Clock clock, Duration ttl) {
        this(clock, ttl, DEFAULT_MAXIMUM_SIZE);
    }

    public TtlCache(Clock clock, Duration ttl, long maximumSize) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive");
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("Cache maximum size must be positive");
        }
        this.clock = clock;
        this.ttl = ttl;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(() -> toNanos(clock.instant()))
                .executor(Runnable::run)
                .expireAfter(new WriteTimeExpiry<K, V>())
                .build();
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key)).map(Entry::value);
    }

    public void put(K key, V value, Instant now) {
        cache.put(key, new Entry<>(value, now.plus(ttl)));
    }

    public void put(K key, V value) {
        put(key, value, clock.instant());
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    /**
     * Live entry count after pending maintenance has run.
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static long toNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    private record Entry<V>(V value, Instant expiresAt) {
    }

    /**
     * Expiry measured from the entry's own write time rather than from insertion.
     */
    private static final class WriteTimeExpiry<K, V> implements Expiry<K, Entry<V>> {

        @Override
        public long expireAfterCreate(K key, Entry<V> entry, long currentTime) {
            return Math.max(0L, toNanos(entry.expiresAt()) - currentTime);
        }

        @Override
        public long expireAfterUpdate(K key, Entry<V> entry, long currentTime, long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(K key, Entry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
