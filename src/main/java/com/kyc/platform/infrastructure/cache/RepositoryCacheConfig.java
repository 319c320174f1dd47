package com.kyc.platform.infrastructure.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration for the repository cache.
 * Caching is off unless explicitly enabled.
 */
@Component
@ConfigurationProperties(prefix = "kyc.repository.cache")
public class RepositoryCacheConfig {

    private boolean enabled = false;
    private String store = "redis";
    private long entityTtlSeconds = 900;
    private long collectionTtlSeconds = 600;
    private long countTtlSeconds = 300;
    private String defaultNamespace = "default";
    private long localMaximumSize = 10_000;

    public Duration entityTimeout() {
        return Duration.ofSeconds(entityTtlSeconds);
    }

    public Duration collectionTimeout() {
        return Duration.ofSeconds(collectionTtlSeconds);
    }

    public Duration countTimeout() {
        return Duration.ofSeconds(countTtlSeconds);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public long getEntityTtlSeconds() {
        return entityTtlSeconds;
    }

    public void setEntityTtlSeconds(long entityTtlSeconds) {
        this.entityTtlSeconds = entityTtlSeconds;
    }

    public long getCollectionTtlSeconds() {
        return collectionTtlSeconds;
    }

    public void setCollectionTtlSeconds(long collectionTtlSeconds) {
        this.collectionTtlSeconds = collectionTtlSeconds;
    }

    public long getCountTtlSeconds() {
        return countTtlSeconds;
    }

    public void setCountTtlSeconds(long countTtlSeconds) {
        this.countTtlSeconds = countTtlSeconds;
    }

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public void setDefaultNamespace(String defaultNamespace) {
        this.defaultNamespace = defaultNamespace;
    }

    public long getLocalMaximumSize() {
        return localMaximumSize;
    }

    public void setLocalMaximumSize(long localMaximumSize) {
        this.localMaximumSize = localMaximumSize;
    }
}
