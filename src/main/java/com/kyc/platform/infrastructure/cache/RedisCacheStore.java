package com.kyc.platform.infrastructure.cache;

import com.kyc.platform.domain.port.out.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Redis-backed cache store. Values are written as JSON carrying their type,
 * so entities and lists of entities read back as the same classes.
 */
public class RedisCacheStore implements CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisCacheStore.class);

    private final RedisTemplate<String, Object> redisTemplate;

    public RedisCacheStore(RedisTemplate<String, Object> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Object get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public void set(String key, Object value, Duration timeout) {
        redisTemplate.opsForValue().set(key, value, timeout);
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    @Override
    public Object getOrSet(String key, Object value, Duration timeout) {
        Boolean stored = redisTemplate.opsForValue().setIfAbsent(key, value, timeout);
        if (Boolean.TRUE.equals(stored)) {
            return value;
        }
        Object existing = redisTemplate.opsForValue().get(key);
        return existing != null ? existing : value;
    }

    @Override
    public void evictFamily(String key) {
        Set<String> keys = new HashSet<>();
        keys.add(key);
        addMatching(keys, key + ".*");
        addMatching(keys, key + "_*");

        Long deleted = redisTemplate.delete(keys);
        logger.debug("Evicted {} keys in family {}", deleted, key);
    }

    private void addMatching(Set<String> keys, String pattern) {
        Set<String> matching = redisTemplate.keys(pattern);
        if (matching != null) {
            keys.addAll(matching);
        }
    }
}
