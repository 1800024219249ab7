package io.github.adscache.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.adscache.core.CacheKeyGenerator;
import io.github.adscache.core.TieredCacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Spring CacheManager whose caches are namespaces of one shared {@link TieredCacheManager}.
 * Caches are created on first use; a per-cache TTL may be configured before that.
 */
public class AdsSpringCacheManager implements CacheManager {

    private static final Logger logger = LoggerFactory.getLogger(AdsSpringCacheManager.class);

    private final TieredCacheManager tieredCacheManager;
    private final CacheKeyGenerator keyGenerator;
    private final ObjectMapper objectMapper;
    private final boolean allowNullValues;
    private final ConcurrentMap<String, AdsSpringCache> cacheMap = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Duration> cacheTtls = new ConcurrentHashMap<>();

    public AdsSpringCacheManager(TieredCacheManager tieredCacheManager, CacheKeyGenerator keyGenerator,
                                 ObjectMapper objectMapper, boolean allowNullValues) {
        this.tieredCacheManager = tieredCacheManager;
        this.keyGenerator = keyGenerator;
        this.objectMapper = objectMapper;
        this.allowNullValues = allowNullValues;
    }

    @Override
    public Cache getCache(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Cache name cannot be null");
        }
        return cacheMap.computeIfAbsent(name, this::createCache);
    }

    @Override
    public Collection<String> getCacheNames() {
        return Collections.unmodifiableSet(cacheMap.keySet());
    }

    /**
     * Set the TTL for a specific cache name. An existing cache is recreated with the new TTL;
     * its entries stay in the tiered cache.
     */
    public void setCacheTtl(String cacheName, Duration ttl) {
        if (cacheName == null) {
            throw new IllegalArgumentException("Cache name cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }

        cacheTtls.put(cacheName, ttl);
        if (cacheMap.remove(cacheName) != null) {
            logger.info("Recreating cache '{}' with TTL {}", cacheName, ttl);
        }
    }

    /**
     * Clears the fast tier of every cache created so far.
     */
    public void clearAll() {
        logger.info("Clearing all {} caches", cacheMap.size());
        for (Cache cache : cacheMap.values()) {
            cache.clear();
        }
    }

    public int getCacheCount() {
        return cacheMap.size();
    }

    public TieredCacheManager getTieredCacheManager() {
        return tieredCacheManager;
    }

    private AdsSpringCache createCache(String name) {
        Duration ttl = cacheTtls.getOrDefault(name, tieredCacheManager.getDefaultTtl());
        logger.debug("Creating cache '{}' with TTL {}", name, ttl);
        return new AdsSpringCache(name, tieredCacheManager, keyGenerator, objectMapper, ttl, allowNullValues);
    }
}
