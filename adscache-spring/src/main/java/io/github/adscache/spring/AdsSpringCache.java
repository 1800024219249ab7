package io.github.adscache.spring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.adscache.core.AdsCacheException;
import io.github.adscache.core.CacheKeyGenerator;
import io.github.adscache.core.CacheLookup;
import io.github.adscache.core.TieredCacheManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.Cache;
import org.springframework.cache.interceptor.SimpleKey;
import org.springframework.cache.support.SimpleValueWrapper;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Field;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.Callable;

/**
 * Spring {@link Cache} view of one namespace of a {@link TieredCacheManager}.
 *
 * <p>The cache name is the namespace; Spring keys are fingerprinted with the
 * {@link CacheKeyGenerator}, so a {@code @Cacheable} key of {@code "abc"} in cache
 * {@code campaigns} lands under {@code campaigns:<sha256>}. Untyped reads return the
 * JSON form of the value (maps, lists, strings, numbers), as the durable store keeps no type
 * information. {@link #clear()} is a prefix clear of the fast tier.</p>
 */
public class AdsSpringCache implements Cache {

    private static final Logger logger = LoggerFactory.getLogger(AdsSpringCache.class);

    private static final Field SIMPLE_KEY_PARAMS = simpleKeyParamsField();

    private final String name;
    private final TieredCacheManager cacheManager;
    private final CacheKeyGenerator keyGenerator;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final boolean allowNullValues;

    public AdsSpringCache(String name, TieredCacheManager cacheManager, CacheKeyGenerator keyGenerator,
                          ObjectMapper objectMapper, Duration ttl, boolean allowNullValues) {
        this.name = name;
        this.cacheManager = cacheManager;
        this.keyGenerator = keyGenerator;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.allowNullValues = allowNullValues;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public TieredCacheManager getNativeCache() {
        return cacheManager;
    }

    public Duration getTtl() {
        return ttl;
    }

    @Override
    public ValueWrapper get(Object key) {
        if (key == null) {
            return null;
        }

        CacheLookup lookup = cacheManager.lookup(toKeyString(key));
        if (!lookup.isHit()) {
            return null;
        }
        return new SimpleValueWrapper(toObject(key, lookup.value().get()));
    }

    @Override
    public <T> T get(Object key, Class<T> type) {
        if (key == null) {
            return null;
        }

        try {
            return cacheManager.get(toKeyString(key), type).orElse(null);
        } catch (AdsCacheException e) {
            throw new IllegalStateException("Cached value in '" + name + "' for key '" + key
                + "' is not of required type " + type.getName(), e);
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(Object key, Callable<T> valueLoader) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key cannot be null");
        }

        String keyStr = toKeyString(key);
        CacheLookup lookup = cacheManager.lookup(keyStr);
        if (lookup.isHit()) {
            return (T) toObject(key, lookup.value().get());
        }

        T value;
        try {
            value = valueLoader.call();
        } catch (Exception e) {
            throw new ValueRetrievalException(key, valueLoader, e);
        }

        if (value != null || allowNullValues) {
            cacheManager.set(keyStr, value, ttl);
        }
        return value;
    }

    @Override
    public void put(Object key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key cannot be null");
        }
        if (value == null && !allowNullValues) {
            return;
        }

        if (!cacheManager.set(toKeyString(key), value, ttl)) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getName()
                + " cannot be cached in '" + name + "'");
        }
        logger.debug("Put value in cache '{}' for key '{}'", name, key);
    }

    /**
     * Not atomic across processes: a concurrent writer between the lookup and the write wins
     * the fast tier of its own process.
     */
    @Override
    public ValueWrapper putIfAbsent(Object key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key cannot be null");
        }

        ValueWrapper existing = get(key);
        if (existing != null) {
            return existing;
        }
        put(key, value);
        return null;
    }

    @Override
    public void evict(Object key) {
        if (key == null) {
            return;
        }
        cacheManager.evict(toKeyString(key));
        logger.debug("Evicted key '{}' from cache '{}'", key, name);
    }

    @Override
    public boolean evictIfPresent(Object key) {
        if (key == null) {
            return false;
        }
        return cacheManager.evict(toKeyString(key));
    }

    @Override
    public void clear() {
        cacheManager.clear(name);
        logger.debug("Cleared cache '{}'", name);
    }

    /**
     * Number of live fast-tier entries of this cache's namespace.
     */
    public long size() {
        return cacheManager.size(name);
    }

    String toKeyString(Object key) {
        if (key instanceof SimpleKey) {
            return keyGenerator.key(name, simpleKeyArguments((SimpleKey) key));
        }
        return keyGenerator.key(name, key);
    }

    // same fingerprint as the argument list MethodArgumentsKeyGenerator produces
    private static Object simpleKeyArguments(SimpleKey key) {
        if (SIMPLE_KEY_PARAMS == null) {
            return key.toString();
        }
        Object[] params = (Object[]) ReflectionUtils.getField(SIMPLE_KEY_PARAMS, key);
        return params != null ? Arrays.asList(params) : key.toString();
    }

    private static Field simpleKeyParamsField() {
        Field field = ReflectionUtils.findField(SimpleKey.class, "params", Object[].class);
        if (field == null) {
            logger.warn("SimpleKey arguments are not accessible, falling back to SimpleKey.toString() for cache keys");
            return null;
        }
        ReflectionUtils.makeAccessible(field);
        return field;
    }

    private Object toObject(Object key, JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cached value in '" + name + "' for key '" + key + "' cannot be read", e);
        }
    }
}
