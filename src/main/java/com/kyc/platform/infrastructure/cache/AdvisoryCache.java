package com.kyc.platform.infrastructure.cache;

import com.kyc.platform.domain.port.out.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Best-effort view of a {@link CacheStore}.
 * Store failures are logged and turned into a miss or a no-op; when disabled the store is never touched.
 */
public class AdvisoryCache {

    private static final Logger logger = LoggerFactory.getLogger(AdvisoryCache.class);

    private final CacheStore store;
    private final boolean enabled;

    public AdvisoryCache(CacheStore store, boolean enabled) {
        this.store = store;
        this.enabled = enabled && store != null;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Optional<Object> get(String key) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(store.get(key));
        } catch (Exception e) {
            logger.warn("Cache get operation failed for key '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean set(String key, Object value, Duration timeout) {
        if (!enabled) {
            return false;
        }
        try {
            store.set(key, value, timeout);
            return true;
        } catch (Exception e) {
            logger.warn("Cache set operation failed for key '{}': {}", key, e.getMessage());
            return false;
        }
    }

    public boolean delete(String key) {
        if (!enabled) {
            return false;
        }
        try {
            store.delete(key);
            return true;
        } catch (Exception e) {
            logger.warn("Cache delete operation failed for key '{}': {}", key, e.getMessage());
            return false;
        }
    }

    public Optional<Object> getOrSet(String key, Object value, Duration timeout) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(store.getOrSet(key, value, timeout));
        } catch (Exception e) {
            logger.warn("Cache get_or_set operation failed for key '{}': {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean evictFamily(String key) {
        if (!enabled) {
            return false;
        }
        try {
            store.evictFamily(key);
            return true;
        } catch (Exception e) {
            logger.warn("Cache evict operation failed for key family '{}': {}", key, e.getMessage());
            return false;
        }
    }
}
