package com.kyc.platform.domain.port.out;

import java.time.Duration;

/**
 * Key/value store backing the repository cache.
 * Any method may fail; callers treat the store as advisory.
 */
public interface CacheStore {

    /**
     * @return the cached value, or {@code null} on a miss
     */
    Object get(String key);

    void set(String key, Object value, Duration timeout);

    void delete(String key);

    /**
     * Store {@code value} unless the key is already present.
     *
     * @return the value now held under the key
     */
    Object getOrSet(String key, Object value, Duration timeout);

    /**
     * Delete the key and every key extending it with '.' or '_'
     * (e.g. {@code app.model.count} also drops {@code app.model.count_all}).
     */
    void evictFamily(String key);
}
