package io.github.adscache.core;

import java.time.Duration;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-through decorator: answers a query from the {@link TieredCacheManager} when it can and
 * otherwise calls the delegate and caches its result, partitioned by the query's account and
 * date range.
 *
 * <p>Delegate failures propagate to the caller and nothing is cached for them. A durable-store
 * outage only costs a delegate call.</p>
 */
public class CachingDataProvider implements DataProvider {
    private static final Logger logger = LoggerFactory.getLogger(CachingDataProvider.class);

    private final DataProvider delegate;
    private final TieredCacheManager cacheManager;
    private final CacheKeyGenerator keyGenerator;
    private final Duration ttl;

    public CachingDataProvider(DataProvider delegate, TieredCacheManager cacheManager, CacheKeyGenerator keyGenerator) {
        this(delegate, cacheManager, keyGenerator, cacheManager.getDefaultTtl());
    }

    public CachingDataProvider(DataProvider delegate, TieredCacheManager cacheManager,
                               CacheKeyGenerator keyGenerator, Duration ttl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cacheManager = Objects.requireNonNull(cacheManager, "cacheManager");
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        this.ttl = ttl;
    }

    @Override
    public JsonNode fetch(MetricsQuery query) {
        String key = keyGenerator.key(query.getNamespace(), query.toKeyParameters());

        CacheLookup lookup = cacheManager.lookup(key);
        if (lookup.isHit()) {
            logger.debug("Serving {} from cache ({})", query.getNamespace(), lookup.getOutcome());
            return lookup.value().get();
        }

        logger.debug("Cache {} for {}, calling data provider", lookup.getOutcome(), query);
        JsonNode result = delegate.fetch(query);
        if (result != null) {
            cacheManager.set(key, result, ttl, query.toPartitionHints());
        }
        return result;
    }

    /**
     * Drops every fast-tier entry cached for a namespace.
     */
    public void invalidate(String namespace) {
        cacheManager.clear(namespace);
    }
}
