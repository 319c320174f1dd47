package com.kyc.platform.infrastructure.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.kyc.platform.domain.port.out.CacheStore;

import java.io.IOException;
import java.time.Duration;

/**
 * In-process cache store for single-node deployments and local runs.
 * Each entry expires after the timeout it was written with.
 * <p>
 * Values are held as JSON written with the cache mapper, the same form the Redis
 * store keeps, so every read returns a fresh copy and callers never share state
 * with the cache.
 */
public class LocalCacheStore implements CacheStore {

    private final Cache<String, CachedValue> cache;
    private final ObjectMapper objectMapper;

    public LocalCacheStore(long maximumSize, ObjectMapper objectMapper) {
        this(maximumSize, objectMapper, Ticker.systemTicker());
    }

    LocalCacheStore(long maximumSize, ObjectMapper objectMapper, Ticker ticker) {
        this.objectMapper = objectMapper;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new PerEntryExpiry())
                .build();
    }

    @Override
    public Object get(String key) {
        CachedValue cached = cache.getIfPresent(key);
        return cached != null ? read(key, cached) : null;
    }

    @Override
    public void set(String key, Object value, Duration timeout) {
        cache.put(key, write(key, value, timeout));
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public Object getOrSet(String key, Object value, Duration timeout) {
        CachedValue candidate = write(key, value, timeout);
        return read(key, cache.get(key, k -> candidate));
    }

    @Override
    public void evictFamily(String key) {
        cache.asMap().keySet().removeIf(candidate -> candidate.equals(key)
                || candidate.startsWith(key + ".")
                || candidate.startsWith(key + "_"));
    }

    private CachedValue write(String key, Object value, Duration timeout) {
        try {
            return new CachedValue(objectMapper.writeValueAsBytes(value), timeout.toNanos());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize cache value for key " + key + ": " + e.getMessage(), e);
        }
    }

    private Object read(String key, CachedValue cached) {
        try {
            return objectMapper.readValue(cached.json(), Object.class);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot deserialize cache value for key " + key + ": " + e.getMessage(), e);
        }
    }

    private record CachedValue(byte[] json, long ttlNanos) {}

    private static class PerEntryExpiry implements Expiry<String, CachedValue> {

        @Override
        public long expireAfterCreate(String key, CachedValue value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CachedValue value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, CachedValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
