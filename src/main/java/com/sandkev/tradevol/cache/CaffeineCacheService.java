package com.sandkev.tradevol.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/** In-process {@link CacheService}; each entry expires after the TTL it was written with. */
public class CaffeineCacheService implements CacheService {

    private record Entry(byte[] value, long ttlNanos) {}

    private final Cache<String, Entry> cache;

    public CaffeineCacheService(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    public CaffeineCacheService(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry e, long currentTime) {
                        return e.ttlNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry e, long currentTime, long currentDuration) {
                        return e.ttlNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry e, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<byte[]> get(String key) {
        Entry e = cache.getIfPresent(key);
        return e == null ? Optional.empty() : Optional.of(e.value().clone());
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, new Entry(value.clone(), ttl.toNanos()));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }
}
