package com.kyc.platform.infrastructure.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kyc.platform.domain.port.out.CacheStore;
import com.kyc.platform.infrastructure.cache.LocalCacheStore;
import com.kyc.platform.infrastructure.cache.RedisCacheStore;
import com.kyc.platform.infrastructure.cache.RepositoryCacheConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Selects the store behind the repository cache with {@code kyc.repository.cache.store}.
 */
@Configuration
public class CacheStoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheStoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "kyc.repository.cache", name = "store", havingValue = "redis", matchIfMissing = true)
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory connectionFactory) {
        GenericJackson2JsonRedisSerializer serializer = new GenericJackson2JsonRedisSerializer(cacheObjectMapper());

        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(serializer);
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(serializer);
        return template;
    }

    @Bean
    @ConditionalOnProperty(prefix = "kyc.repository.cache", name = "store", havingValue = "redis", matchIfMissing = true)
    public CacheStore redisCacheStore(RedisTemplate<String, Object> redisTemplate, RepositoryCacheConfig config) {
        logger.info("Repository cache backed by Redis (enabled={})", config.isEnabled());
        return new RedisCacheStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kyc.repository.cache", name = "store", havingValue = "local")
    public CacheStore localCacheStore(RepositoryCacheConfig config) {
        logger.info("Repository cache backed by in-process store (enabled={}, maximumSize={})",
                config.isEnabled(), config.getLocalMaximumSize());
        return new LocalCacheStore(config.getLocalMaximumSize(), cacheObjectMapper());
    }

    /**
     * Cached values carry their type so entities and entity lists read back as themselves.
     * Kept separate from the application's ObjectMapper.
     */
    public static ObjectMapper cacheObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        objectMapper.activateDefaultTyping(
                BasicPolymorphicTypeValidator.builder()
                        .allowIfSubType("com.kyc.platform.")
                        .allowIfSubType("java.util.")
                        .allowIfSubType("java.time.")
                        .allowIfSubType("java.lang.")
                        .build(),
                ObjectMapper.DefaultTyping.NON_FINAL,
                JsonTypeInfo.As.PROPERTY);
        return objectMapper;
    }
}
